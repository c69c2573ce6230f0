package com.example.attendance.application.service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Year;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw cell values of a punch export into dates, times and employee names.
 * Every method is lenient: values that cannot be interpreted yield {@code null} instead of an exception.
 */
public final class PunchValueParser {

    private static final Pattern WEEKDAY_ANNOTATION = Pattern.compile(
            "\\s*[(（]\\s*[一二三四五六日月火水木金土]\\s*\\**\\s*[)）][\\s*]*$");
    private static final Pattern MONTH_DAY = Pattern.compile("^(\\d{1,2})/(\\d{1,2})$");
    private static final Pattern BRACKET_GROUP = Pattern.compile("\\[.*?]");
    private static final Pattern TITLE_FILLER = Pattern.compile("(?:[\\s_\\-*.]+|[(（]\\d+[)）])+$");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("uuuu-M-d"),
            strict("uuuu/M/d"),
            strict("d/M/uuuu"),
            strict("M/d/uuuu")
    );
    private static final List<DateTimeFormatter> TIME_FORMATS = List.of(
            strict("H:mm:ss"),
            strict("H:mm"),
            strict("h:mm a"),
            strict("h:mm:ss a")
    );

    private PunchValueParser() {
    }

    /**
     * Interprets a date cell.
     *
     * @param value       cell value as produced by the workbook reader
     * @param defaultYear year used for {@code MM/DD} text, {@code null} for the current year
     * @return the date or {@code null} when the value is not a date
     */
    public static LocalDate parseDate(Object value, Integer defaultYear) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        if (!(value instanceof String text)) {
            return null;
        }
        String cleaned = WEEKDAY_ANNOTATION.matcher(text.trim()).replaceFirst("").trim();
        if (cleaned.isEmpty()) {
            return null;
        }

        Matcher monthDay = MONTH_DAY.matcher(cleaned);
        if (monthDay.matches()) {
            int year = defaultYear != null ? defaultYear : Year.now().getValue();
            try {
                return LocalDate.of(year, Integer.parseInt(monthDay.group(1)), Integer.parseInt(monthDay.group(2)));
            } catch (DateTimeException e) {
                return null;
            }
        }

        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(cleaned, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return null;
    }

    /**
     * Interprets a clock cell. Asterisks marking manual corrections are removed before parsing.
     *
     * @param value cell value as produced by the workbook reader
     * @return the time or {@code null} when the cell is blank or unreadable
     */
    public static LocalTime parseTime(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalTime();
        }
        if (value instanceof LocalTime time) {
            return time;
        }
        if (!(value instanceof String text)) {
            return null;
        }
        String cleaned = text.replace("*", "").trim();
        if (cleaned.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter format : TIME_FORMATS) {
            try {
                return LocalTime.parse(cleaned, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return null;
    }

    /**
     * Removes {@code [...]} groups (department tags, IDs) from a name cell.
     *
     * @return cleaned name, empty when nothing is left
     */
    public static String cleanName(String raw) {
        if (raw == null) {
            return "";
        }
        return BRACKET_GROUP.matcher(raw).replaceAll("").trim();
    }

    /**
     * Derives an employee name from a sheet title such as {@code 王小明__} or {@code 王小明(2)}.
     */
    public static String nameFromSheetTitle(String title) {
        if (title == null) {
            return "";
        }
        return cleanName(TITLE_FILLER.matcher(title.trim()).replaceFirst(""));
    }

    private static DateTimeFormatter strict(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.US)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
