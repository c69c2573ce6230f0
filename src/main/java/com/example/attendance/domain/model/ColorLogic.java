package com.example.attendance.domain.model;

import java.util.Locale;

/**
 * Presentation preferences used by report renderers to emphasise punch cells.
 * Color names are free-form ({@code green}, {@code red}, ...); {@code none} disables a color.
 */
public record ColorLogic(
        String normalInColor,
        String normalOutColor,
        String abnormalInColor,
        String abnormalOutColor,
        String missingPunchColor,
        String missingPunchText,
        String absentColor,
        String absentText
) {

    public static final String NO_COLOR = "none";

    public static ColorLogic defaults() {
        return new ColorLogic("green", "green", "red", "red", "black", "*", NO_COLOR, "-");
    }

    /**
     * @param color configured color name
     * @return {@code true} when the value is blank or {@code none}
     */
    public static boolean isDisabled(String color) {
        return color == null || color.isBlank() || NO_COLOR.equals(color.trim().toLowerCase(Locale.ROOT));
    }
}
