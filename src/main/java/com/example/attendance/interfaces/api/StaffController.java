package com.example.attendance.interfaces.api;

import com.example.attendance.application.exception.StaffNotFoundException;
import com.example.attendance.application.service.StaffDirectory;
import com.example.attendance.domain.model.Staff;
import com.example.attendance.domain.model.StaffRegime;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Interfaces-layer REST controller for looking up and extending the staff roster.
 */
@RestController
@RequestMapping(value = "/api/staff", produces = MediaType.APPLICATION_JSON_VALUE)
public class StaffController {

    private final StaffDirectory staffDirectory;

    public StaffController(StaffDirectory staffDirectory) {
        this.staffDirectory = staffDirectory;
    }

    @GetMapping
    public Map<String, List<Staff>> listStaff() {
        return Map.of(
                "internal", staffDirectory.internalStaff(),
                "external", staffDirectory.externalStaff());
    }

    @GetMapping("/{name}")
    public Staff findStaff(@PathVariable("name") String name) {
        return staffDirectory.find(name).orElseThrow(() -> new StaffNotFoundException(name));
    }

    /**
     * Adds a roster entry; typically called after a report failed on an unknown name.
     *
     * @param name staff name as it appears in the punch export
     * @param type roster label ({@code 內勤}/{@code 外勤} or {@code internal}/{@code external})
     */
    @PostMapping
    public ResponseEntity<Staff> addStaff(@RequestParam("name") String name,
                                          @RequestParam(value = "type", required = false) String type) {
        Staff staff = staffDirectory.append(name, StaffRegime.fromLabel(type));
        return ResponseEntity.status(HttpStatus.CREATED).body(staff);
    }
}
