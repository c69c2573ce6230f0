package com.example.attendance.application.service;

import java.nio.file.Path;
import java.time.YearMonth;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the reporting period from export names such as {@code MonRep251205.xlsx}.
 */
public final class ReportFileNameParser {

    private static final Pattern MONTHLY_REPORT = Pattern.compile("^MonRep(\\d{2})(\\d{2})(\\d{2})");

    private ReportFileNameParser() {
    }

    /**
     * @param fileName file name, optionally with directories
     * @return year (2000 + yy) and month encoded in the name
     * @throws IllegalArgumentException when the name does not follow the convention or the month is out of range
     */
    public static YearMonth parse(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("File name is required");
        }
        Path base = Path.of(fileName).getFileName();
        String name = base != null ? base.toString() : fileName;
        Matcher matcher = MONTHLY_REPORT.matcher(name);
        if (!matcher.find()) {
            throw new IllegalArgumentException("Not a monthly report file name: " + name);
        }
        int year = 2000 + Integer.parseInt(matcher.group(1));
        int month = Integer.parseInt(matcher.group(2));
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Invalid month " + month + " in file name: " + name);
        }
        return YearMonth.of(year, month);
    }

    public static Optional<YearMonth> tryParse(String fileName) {
        try {
            return Optional.of(parse(fileName));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
