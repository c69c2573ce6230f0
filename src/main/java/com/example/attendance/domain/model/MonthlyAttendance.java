package com.example.attendance.domain.model;

import java.util.List;

/**
 * Monthly attendance summary for one staff member. Created once by the rate calculator and
 * never changed afterwards.
 */
public record MonthlyAttendance(
        Staff staff,
        int year,
        int month,
        List<AttendanceRecord> records,
        int requiredDays,
        int actualDays,
        double attendanceRate,
        RateTier rateTier
) {

    public MonthlyAttendance {
        if (actualDays < 0) {
            throw new IllegalArgumentException("actualDays must not be negative: " + actualDays);
        }
        records = records == null ? List.of() : List.copyOf(records);
    }
}
