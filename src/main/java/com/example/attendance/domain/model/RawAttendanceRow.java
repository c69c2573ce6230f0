package com.example.attendance.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Cleaned row pulled out of the source workbook: one employee on one day.
 * Either punch may be {@code null} when the export has no value for it.
 */
public record RawAttendanceRow(
        String employeeName,
        LocalDate date,
        LocalTime checkIn,
        LocalTime checkOut
) {

    /**
     * Combines two rows of the same employee and day, keeping the earliest check-in and the latest check-out.
     */
    public RawAttendanceRow mergeWith(RawAttendanceRow other) {
        return new RawAttendanceRow(employeeName, date, earlier(checkIn, other.checkIn), later(checkOut, other.checkOut));
    }

    private static LocalTime earlier(LocalTime a, LocalTime b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isBefore(b) ? a : b;
    }

    private static LocalTime later(LocalTime a, LocalTime b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isAfter(b) ? a : b;
    }
}
