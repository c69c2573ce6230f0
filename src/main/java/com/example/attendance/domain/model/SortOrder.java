package com.example.attendance.domain.model;

import java.util.Locale;

/**
 * Ordering applied to the staff lists of a finished report.
 */
public enum SortOrder {
    ATTENDANCE_RATE,
    NAME_STROKES;

    /**
     * Parses configuration values such as {@code attendance_rate} or {@code name-strokes}.
     *
     * @param value raw value
     * @return parsed order, {@link #ATTENDANCE_RATE} when blank or unknown
     */
    public static SortOrder fromString(String value) {
        if (value == null || value.isBlank()) {
            return ATTENDANCE_RATE;
        }
        try {
            return SortOrder.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return ATTENDANCE_RATE;
        }
    }
}
