package com.example.attendance.domain.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Result of a report run handed to renderers: ordered internal and external staff
 * summaries for the resolved month plus the holidays that applied.
 */
public record AttendanceReport(
        String sourceName,
        int year,
        int month,
        Set<LocalDate> holidays,
        List<MonthlyAttendance> internal,
        List<MonthlyAttendance> external,
        MonthlyStats stats,
        List<String> warnings
) {

    public AttendanceReport {
        holidays = holidays == null ? Set.of() : Set.copyOf(holidays);
        internal = internal == null ? List.of() : List.copyOf(internal);
        external = external == null ? List.of() : List.copyOf(external);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
