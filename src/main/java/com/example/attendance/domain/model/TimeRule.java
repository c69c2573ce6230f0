package com.example.attendance.domain.model;

import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Check-in and check-out windows for one work regime.
 *
 * @param inStart  earliest expected check-in
 * @param inEnd    latest check-in that is still on time
 * @param outStart earliest check-out that is not an early leave
 * @param outEnd   latest check-out before it is noted as delayed
 */
public record TimeRule(
        LocalTime inStart,
        LocalTime inEnd,
        LocalTime outStart,
        LocalTime outEnd
) {

    private static final Pattern CLOCK_PATTERN = Pattern.compile("^\\s*(\\d{1,2}):(\\d{1,2})");

    /**
     * Builds a rule from {@code HH:MM} strings. Malformed values become midnight.
     */
    public static TimeRule parse(String inStart, String inEnd, String outStart, String outEnd) {
        return new TimeRule(parseClock(inStart), parseClock(inEnd), parseClock(outStart), parseClock(outEnd));
    }

    /**
     * Parses an {@code HH:MM} clock string.
     *
     * @param value raw configuration value
     * @return parsed time, or {@link LocalTime#MIDNIGHT} when blank or malformed
     */
    public static LocalTime parseClock(String value) {
        if (value == null || value.isBlank()) {
            return LocalTime.MIDNIGHT;
        }
        Matcher matcher = CLOCK_PATTERN.matcher(value);
        if (!matcher.find()) {
            return LocalTime.MIDNIGHT;
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        if (hour > 23 || minute > 59) {
            return LocalTime.MIDNIGHT;
        }
        return LocalTime.of(hour, minute);
    }
}
