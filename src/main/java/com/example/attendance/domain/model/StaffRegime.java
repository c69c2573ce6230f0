package com.example.attendance.domain.model;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Work-schedule class of a staff member. Internal staff work a five-day week,
 * external (field) staff only Monday, Wednesday and Friday.
 */
public enum StaffRegime {
    INTERNAL("內勤", EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY,
            DayOfWeek.THURSDAY, DayOfWeek.FRIDAY)),
    EXTERNAL("外勤", EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY));

    private static final Map<String, StaffRegime> LABELS = Map.of(
            "內勤", INTERNAL,
            "internal", INTERNAL,
            "外勤", EXTERNAL,
            "external", EXTERNAL
    );

    private final String rosterLabel;
    private final Set<DayOfWeek> defaultWorkWeekdays;

    StaffRegime(String rosterLabel, Set<DayOfWeek> defaultWorkWeekdays) {
        this.rosterLabel = rosterLabel;
        this.defaultWorkWeekdays = defaultWorkWeekdays;
    }

    /**
     * @return label written to the roster file for this regime
     */
    public String rosterLabel() {
        return rosterLabel;
    }

    /**
     * @return fresh copy of the weekdays this regime works when the roster does not say otherwise
     */
    public EnumSet<DayOfWeek> defaultWorkWeekdays() {
        return EnumSet.copyOf(defaultWorkWeekdays);
    }

    /**
     * Maps a roster type label onto a regime. Matching is case-insensitive and unknown
     * or blank labels fall back to {@link #INTERNAL}.
     *
     * @param label raw label from the roster
     * @return resolved regime, never {@code null}
     */
    public static StaffRegime fromLabel(String label) {
        if (label == null) {
            return INTERNAL;
        }
        String trimmed = label.trim();
        StaffRegime exact = LABELS.get(trimmed);
        if (exact != null) {
            return exact;
        }
        return LABELS.getOrDefault(trimmed.toLowerCase(Locale.ROOT), INTERNAL);
    }
}
