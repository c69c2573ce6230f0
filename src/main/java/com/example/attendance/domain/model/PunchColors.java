package com.example.attendance.domain.model;

/**
 * Colors a renderer should apply to the check-in and check-out cells of one day.
 * Either value is {@code null} when the cell keeps its default style.
 */
public record PunchColors(String inColor, String outColor) {

    public static PunchColors none() {
        return new PunchColors(null, null);
    }
}
