package com.example.attendance.interfaces.api;

import com.example.attendance.application.config.AttendanceProperties;
import com.example.attendance.application.exception.EmptyResultException;
import com.example.attendance.application.exception.UnclassifiedStaffException;
import com.example.attendance.application.service.AttendanceReportService;
import com.example.attendance.application.service.AttendanceSheetExtractor;
import com.example.attendance.application.service.AttendanceSummaryCsvService;
import com.example.attendance.domain.exception.SheetFormatException;
import com.example.attendance.domain.exception.UnsupportedWorkbookFormatException;
import com.example.attendance.domain.model.AttendanceReport;
import com.example.attendance.domain.model.RawAttendanceRow;
import com.example.attendance.domain.model.ReportRequest;
import com.example.attendance.domain.model.RowExtraction;
import com.example.attendance.domain.model.SortOrder;
import com.example.attendance.domain.model.TimeRule;
import com.example.attendance.infrastructure.exception.WorkbookProcessingException;
import com.example.attendance.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the report endpoints and their error mapping.
 */
@WebMvcTest(controllers = AttendanceReportController.class)
@Import(GlobalExceptionHandler.class)
class AttendanceReportControllerApiTests {

    private static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AttendanceReportService reportService;

    @MockBean
    private AttendanceSheetExtractor sheetExtractor;

    @MockBean
    private AttendanceSummaryCsvService summaryCsvService;

    @MockBean
    private AttendanceProperties properties;

    private final ReportRequest request = new ReportRequest(
            TimeRule.parse("09:00", "09:30", "18:00", "18:30"),
            TimeRule.parse("09:30", "10:00", "10:30", "12:00"),
            Set.of(), 80, SortOrder.ATTENDANCE_RATE, null);

    private final MockMultipartFile file = new MockMultipartFile("file", "MonRep251205.xlsx", XLSX, "data".getBytes());

    @BeforeEach
    void setUp() {
        BDDMockito.given(properties.toReportRequest(any())).willReturn(request);
    }

    @Test
    void reportIsReturnedAsJson() throws Exception {
        AttendanceReport report = new AttendanceReport("MonRep251205.xlsx", 2025, 12, Set.of(), List.of(), List.of(), null, List.of());
        BDDMockito.given(reportService.generateReport(any(MultipartFile.class), eq(request))).willReturn(report);

        mockMvc.perform(multipart("/api/reports").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.year").value(2025))
                .andExpect(jsonPath("$.month").value(12))
                .andExpect(jsonPath("$.sourceName").value("MonRep251205.xlsx"));
    }

    @Test
    void unclassifiedStaffMappedToConflictWithName() throws Exception {
        BDDMockito.given(reportService.generateReport(any(MultipartFile.class), any()))
                .willThrow(new UnclassifiedStaffException("林大華"));

        mockMvc.perform(multipart("/api/reports").file(file))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("UNCLASSIFIED_STAFF"))
                .andExpect(jsonPath("$.details.staffName").value("林大華"));
    }

    @Test
    void sheetFormatErrorMappedToBadRequest() throws Exception {
        BDDMockito.given(reportService.generateReport(any(MultipartFile.class), any()))
                .willThrow(new SheetFormatException("Sheet1", List.of("上班", "下班")));

        mockMvc.perform(multipart("/api/reports").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("SHEET_FORMAT_ERROR"))
                .andExpect(jsonPath("$.details.missingColumns[1]").value("下班"));
    }

    @Test
    void emptyResultMappedTo422() throws Exception {
        BDDMockito.given(reportService.generateReport(any(MultipartFile.class), any()))
                .willThrow(new EmptyResultException("No data to process."));

        mockMvc.perform(multipart("/api/reports").file(file))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("EMPTY_RESULT"));
    }

    @Test
    void otherDomainErrorsMappedToBadRequest() throws Exception {
        BDDMockito.given(reportService.generateReport(any(MultipartFile.class), any()))
                .willThrow(new UnsupportedWorkbookFormatException("a.txt"));

        mockMvc.perform(multipart("/api/reports").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"));
    }

    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        BDDMockito.given(reportService.generateReport(any(MultipartFile.class), any()))
                .willThrow(new WorkbookProcessingException("Unable", new RuntimeException("boom")));

        mockMvc.perform(multipart("/api/reports").file(file))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    @Test
    void summaryIsStreamedAsCsv() throws Exception {
        AttendanceReport report = new AttendanceReport("MonRep251205.xlsx", 2025, 12, Set.of(), List.of(), List.of(), null, List.of());
        BDDMockito.given(reportService.generateReport(any(MultipartFile.class), any())).willReturn(report);
        BDDMockito.given(summaryCsvService.exportSummary(report)).willReturn("Name,Type\n");
        BDDMockito.given(summaryCsvService.fileNameFor(report)).willReturn("attendance-2025-12.csv");

        mockMvc.perform(multipart("/api/reports/summary").file(file))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"attendance-2025-12.csv\""))
                .andExpect(content().string("Name,Type\n"));
    }

    @Test
    void extractReturnsRawRows() throws Exception {
        RowExtraction extraction = new RowExtraction("MonRep251205.xlsx",
                List.of(new RawAttendanceRow("王小明", LocalDate.of(2025, 12, 1), LocalTime.of(9, 0), null)),
                List.of("Skipped row 4 of sheet 'S': bad"));
        BDDMockito.given(sheetExtractor.extract(any(MultipartFile.class), isNull())).willReturn(extraction);

        mockMvc.perform(multipart("/api/extract").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows[0].employeeName").value("王小明"))
                .andExpect(jsonPath("$.rows[0].date").value("2025-12-01"))
                .andExpect(jsonPath("$.warnings[0]").value("Skipped row 4 of sheet 'S': bad"));
    }

    @Test
    void missingFileIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/reports"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }
}
