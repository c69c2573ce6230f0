package com.example.attendance.application.config;

import com.example.attendance.domain.model.ColorLogic;
import com.example.attendance.domain.model.ReportRequest;
import com.example.attendance.domain.model.SortOrder;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AttendancePropertiesTest {

    @Test
    void missingSectionsFallBackToStockRules() {
        AttendanceProperties properties = new AttendanceProperties("staff.csv", 80, "attendance_rate", null, null, null, null);

        ReportRequest request = properties.toReportRequest(null);

        assertThat(request.internalRule().inEnd()).isEqualTo(LocalTime.of(9, 30));
        assertThat(request.externalRule().outEnd()).isEqualTo(LocalTime.of(12, 0));
        assertThat(request.holidays()).isEmpty();
        assertThat(request.sortOrder()).isEqualTo(SortOrder.ATTENDANCE_RATE);
        assertThat(properties.colorLogic()).isEqualTo(ColorLogic.defaults());
    }

    @Test
    void partialRuleKeepsOtherDefaultsAndMalformedHolidaysAreIgnored() {
        AttendanceProperties properties = new AttendanceProperties("staff.csv", 75, "name-strokes",
                List.of("2025-12-25", "12/26", " ", "2025-01-01", "2025-1-2", "2025-2-30"),
                null, new AttendanceProperties.Rule("08:30", null, null, "bogus"), null);

        ReportRequest request = properties.toReportRequest(2024);

        assertThat(request.externalRule().inStart()).isEqualTo(LocalTime.of(8, 30));
        assertThat(request.externalRule().inEnd()).isEqualTo(LocalTime.of(10, 0));
        assertThat(request.externalRule().outEnd()).isEqualTo(LocalTime.MIDNIGHT);
        assertThat(request.holidays()).containsExactlyInAnyOrder(
                LocalDate.of(2025, 12, 25), LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 2));
        assertThat(request.sortOrder()).isEqualTo(SortOrder.NAME_STROKES);
        assertThat(request.rateThreshold()).isEqualTo(75);
        assertThat(request.forcedYear()).isEqualTo(2024);
    }
}
