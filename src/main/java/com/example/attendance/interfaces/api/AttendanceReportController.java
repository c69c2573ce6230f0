package com.example.attendance.interfaces.api;

import com.example.attendance.application.config.AttendanceProperties;
import com.example.attendance.application.service.AttendanceReportService;
import com.example.attendance.application.service.AttendanceSheetExtractor;
import com.example.attendance.application.service.AttendanceSummaryCsvService;
import com.example.attendance.domain.model.AttendanceReport;
import com.example.attendance.domain.model.RowExtraction;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;

/**
 * Interfaces-layer REST controller that runs monthly reports on uploaded punch exports.
 */
@RestController
@RequestMapping("/api")
public class AttendanceReportController {

    private final AttendanceReportService reportService;
    private final AttendanceSheetExtractor sheetExtractor;
    private final AttendanceSummaryCsvService summaryCsvService;
    private final AttendanceProperties properties;

    public AttendanceReportController(AttendanceReportService reportService,
                                      AttendanceSheetExtractor sheetExtractor,
                                      AttendanceSummaryCsvService summaryCsvService,
                                      AttendanceProperties properties) {
        this.reportService = reportService;
        this.sheetExtractor = sheetExtractor;
        this.summaryCsvService = summaryCsvService;
        this.properties = properties;
    }

    /**
     * Runs the full report for one export.
     *
     * @param file uploaded .xlsx/.xls export
     * @param year optional year override for {@code MM/DD} dates
     * @return the report as JSON
     */
    @PostMapping(value = "/reports", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AttendanceReport> generateReport(@RequestParam("file") MultipartFile file,
                                                           @RequestParam(value = "year", required = false) Integer year) {
        return ResponseEntity.ok(reportService.generateReport(file, properties.toReportRequest(year)));
    }

    /**
     * Runs the report and streams its per-employee summary as a CSV download.
     */
    @PostMapping("/reports/summary")
    public ResponseEntity<byte[]> exportSummary(@RequestParam("file") MultipartFile file,
                                                @RequestParam(value = "year", required = false) Integer year) {
        AttendanceReport report = reportService.generateReport(file, properties.toReportRequest(year));
        String csv = summaryCsvService.exportSummary(report);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + summaryCsvService.fileNameFor(report) + "\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns the raw rows found in a workbook without any roster lookup. Handy for checking odd exports.
     */
    @PostMapping(value = "/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RowExtraction> extract(@RequestParam("file") MultipartFile file,
                                                 @RequestParam(value = "year", required = false) Integer year) {
        return ResponseEntity.ok(sheetExtractor.extract(file, year));
    }
}
