package com.example.attendance.domain.model;

import java.util.List;

/**
 * Output of workbook extraction: the cleaned rows of every sheet in source order plus the
 * warnings recorded for rows that had to be skipped.
 */
public record RowExtraction(
        String sourceName,
        List<RawAttendanceRow> rows,
        List<String> warnings
) {

    public RowExtraction {
        rows = rows == null ? List.of() : List.copyOf(rows);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
