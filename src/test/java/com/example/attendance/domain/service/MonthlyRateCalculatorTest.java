package com.example.attendance.domain.service;

import com.example.attendance.domain.model.AttendanceRecord;
import com.example.attendance.domain.model.AttendanceStatus;
import com.example.attendance.domain.model.MonthlyAttendance;
import com.example.attendance.domain.model.MonthlyStats;
import com.example.attendance.domain.model.RateTier;
import com.example.attendance.domain.model.Staff;
import com.example.attendance.domain.model.StaffRegime;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for required/actual day counting, rates and tiers. December 2025 starts on a Monday.
 */
class MonthlyRateCalculatorTest {

    private final MonthlyRateCalculator calculator = new MonthlyRateCalculator();

    private final Staff office = new Staff("王小明", StaffRegime.INTERNAL);
    private final Staff field = new Staff("林大華", StaffRegime.EXTERNAL);

    @Test
    void requiredDaysFollowRegimeWeekdays() {
        assertThat(calculator.calculateRequiredDays(office, 2025, 12, Set.of())).isEqualTo(23);
        assertThat(calculator.calculateRequiredDays(field, 2025, 12, Set.of())).isEqualTo(14);
    }

    @Test
    void holidaysOnlyReduceWorkDaysTheyFallOn() {
        Set<LocalDate> christmas = Set.of(LocalDate.of(2025, 12, 25));
        assertThat(calculator.calculateRequiredDays(office, 2025, 12, christmas)).isEqualTo(22);
        assertThat(calculator.calculateRequiredDays(field, 2025, 12, christmas)).isEqualTo(14);

        Set<LocalDate> friday = Set.of(LocalDate.of(2025, 12, 26));
        assertThat(calculator.calculateRequiredDays(field, 2025, 12, friday)).isEqualTo(13);
    }

    @Test
    void zeroRequiredDaysIsFullAttendance() {
        assertThat(calculator.calculateRate(0, 0)).isEqualTo(100.0);
        assertThat(calculator.calculateRate(3, 0)).isEqualTo(100.0);
    }

    @Test
    void rateIsNotRounded() {
        assertThat(calculator.calculateRate(20, 23)).isCloseTo(86.9565, within(0.0001));
        assertThat(calculator.calculateRate(23, 23)).isEqualTo(100.0);
    }

    @Test
    void tierBoundaries() {
        assertThat(calculator.rateTier(79.9, 80)).isEqualTo(RateTier.RED);
        assertThat(calculator.rateTier(79.99, 80)).isEqualTo(RateTier.RED);
        assertThat(calculator.rateTier(89.9, 80)).isEqualTo(RateTier.YELLOW);
        assertThat(calculator.rateTier(80.0, 80)).isEqualTo(RateTier.YELLOW);
        assertThat(calculator.rateTier(89.99, 80)).isEqualTo(RateTier.YELLOW);
        assertThat(calculator.rateTier(90.0, 80)).isEqualTo(RateTier.GREEN);
        assertThat(calculator.rateTier(100.0, 80)).isEqualTo(RateTier.GREEN);
    }

    @Test
    void thresholdAboveGreenBoundarySkipsYellow() {
        assertThat(calculator.rateTier(92.0, 95)).isEqualTo(RateTier.RED);
        assertThat(calculator.rateTier(96.0, 95)).isEqualTo(RateTier.GREEN);
    }

    @Test
    void absentDaysDoNotCount() {
        List<AttendanceRecord> records = List.of(
                record(1, AttendanceStatus.NORMAL),
                record(2, AttendanceStatus.LATE),
                record(3, AttendanceStatus.ABSENT),
                record(4, AttendanceStatus.ABNORMAL),
                record(5, AttendanceStatus.EARLY_LEAVE));

        assertThat(calculator.calculateActualDays(records)).isEqualTo(4);
    }

    @Test
    void monthlyAttendanceCombinesCounts() {
        List<AttendanceRecord> records = List.of(record(1, AttendanceStatus.NORMAL), record(3, AttendanceStatus.LATE));

        MonthlyAttendance monthly = calculator.calculateMonthlyAttendance(field, records, 2025, 12, Set.of(), 80);

        assertThat(monthly.requiredDays()).isEqualTo(14);
        assertThat(monthly.actualDays()).isEqualTo(2);
        assertThat(monthly.attendanceRate()).isCloseTo(14.2857, within(0.0001));
        assertThat(monthly.rateTier()).isEqualTo(RateTier.RED);
        assertThat(monthly.records()).hasSize(2);
    }

    @Test
    void monthlyStatsCountWeekdaysAndHolidays() {
        MonthlyStats stats = calculator.calculateMonthlyStats(2025, 12,
                Set.of(LocalDate.of(2025, 12, 25), LocalDate.of(2025, 11, 27)), 3, 2);

        assertThat(stats.requiredWorkDays()).isEqualTo(22);
        assertThat(stats.holidayCount()).isEqualTo(1);
        assertThat(stats.totalStaff()).isEqualTo(5);
        assertThat(stats.internalCount()).isEqualTo(3);
        assertThat(stats.externalCount()).isEqualTo(2);
    }

    private static AttendanceRecord record(int day, AttendanceStatus status) {
        LocalTime in = status == AttendanceStatus.ABSENT ? null : LocalTime.of(9, 0);
        return new AttendanceRecord(LocalDate.of(2025, 12, day), in, null, status, "");
    }
}
