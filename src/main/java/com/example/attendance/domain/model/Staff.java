package com.example.attendance.domain.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Roster entry describing one staff member and the weekdays they are expected to work.
 * The weekday set is never empty; it defaults from the regime when not supplied.
 */
public record Staff(
        String name,
        StaffRegime regime,
        Set<DayOfWeek> workWeekdays
) {

    public Staff {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(regime, "regime");
        EnumSet<DayOfWeek> weekdays = workWeekdays == null || workWeekdays.isEmpty()
                ? regime.defaultWorkWeekdays()
                : EnumSet.copyOf(workWeekdays);
        workWeekdays = Collections.unmodifiableSet(weekdays);
    }

    public Staff(String name, StaffRegime regime) {
        this(name, regime, null);
    }

    /**
     * @param day calendar day to check
     * @return {@code true} when the day's weekday is one of this staff member's work weekdays
     */
    public boolean worksOn(LocalDate day) {
        return workWeekdays.contains(day.getDayOfWeek());
    }
}
