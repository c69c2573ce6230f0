package com.example.attendance.domain.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Set;

/**
 * Parameters of one report run.
 *
 * @param internalRule  time windows for internal staff
 * @param externalRule  time windows for external staff
 * @param holidays      explicit holiday dates excluded from required days
 * @param rateThreshold lower boundary of the YELLOW tier, in percent
 * @param sortOrder     ordering of the finished staff lists
 * @param forcedYear    year used for short {@code MM/DD} dates, or {@code null} to infer it
 */
public record ReportRequest(
        TimeRule internalRule,
        TimeRule externalRule,
        Set<LocalDate> holidays,
        int rateThreshold,
        SortOrder sortOrder,
        Integer forcedYear
) {

    public ReportRequest {
        Objects.requireNonNull(internalRule, "internalRule");
        Objects.requireNonNull(externalRule, "externalRule");
        holidays = holidays == null ? Set.of() : Set.copyOf(holidays);
        sortOrder = sortOrder == null ? SortOrder.ATTENDANCE_RATE : sortOrder;
    }

    public TimeRule ruleFor(StaffRegime regime) {
        return regime == StaffRegime.EXTERNAL ? externalRule : internalRule;
    }
}
