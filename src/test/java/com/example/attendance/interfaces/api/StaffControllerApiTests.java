package com.example.attendance.interfaces.api;

import com.example.attendance.application.exception.UseCaseValidationException;
import com.example.attendance.application.service.StaffDirectory;
import com.example.attendance.domain.model.Staff;
import com.example.attendance.domain.model.StaffRegime;
import com.example.attendance.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = StaffController.class)
@Import(GlobalExceptionHandler.class)
class StaffControllerApiTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StaffDirectory staffDirectory;

    @Test
    void knownStaffIsReturned() throws Exception {
        BDDMockito.given(staffDirectory.find("林大華")).willReturn(Optional.of(new Staff("林大華", StaffRegime.EXTERNAL)));

        mockMvc.perform(get("/api/staff/{name}", "林大華"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("林大華"))
                .andExpect(jsonPath("$.regime").value("EXTERNAL"));
    }

    @Test
    void unknownStaffIsNotFound() throws Exception {
        BDDMockito.given(staffDirectory.find("nobody")).willReturn(Optional.empty());

        mockMvc.perform(get("/api/staff/{name}", "nobody"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("STAFF_NOT_FOUND"));
    }

    @Test
    void appendingStaffReturnsCreated() throws Exception {
        BDDMockito.given(staffDirectory.append("陳美玲", StaffRegime.EXTERNAL)).willReturn(new Staff("陳美玲", StaffRegime.EXTERNAL));

        mockMvc.perform(post("/api/staff").param("name", "陳美玲").param("type", "外勤"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.regime").value("EXTERNAL"));
    }

    @Test
    void blankNameIsBadRequest() throws Exception {
        BDDMockito.given(staffDirectory.append(" ", StaffRegime.INTERNAL))
                .willThrow(new UseCaseValidationException("Staff name is required."));

        mockMvc.perform(post("/api/staff").param("name", " "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"));
    }

    @Test
    void rosterIsListedByRegime() throws Exception {
        BDDMockito.given(staffDirectory.internalStaff()).willReturn(List.of(new Staff("王小明", StaffRegime.INTERNAL)));
        BDDMockito.given(staffDirectory.externalStaff()).willReturn(List.of());

        mockMvc.perform(get("/api/staff"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.internal[0].name").value("王小明"));
    }
}
