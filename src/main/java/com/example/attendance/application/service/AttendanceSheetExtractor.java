package com.example.attendance.application.service;

import com.example.attendance.domain.exception.SheetFormatException;
import com.example.attendance.domain.exception.SourceFileNotFoundException;
import com.example.attendance.domain.exception.SourceFileRequiredException;
import com.example.attendance.domain.exception.UnsupportedWorkbookFormatException;
import com.example.attendance.domain.model.RawAttendanceRow;
import com.example.attendance.domain.model.RowExtraction;
import com.example.attendance.infrastructure.excel.WorkbookCellReader;
import com.example.attendance.infrastructure.exception.WorkbookProcessingException;

import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Application-layer service that reads punch exports into raw attendance rows.
 * It locates the columns of every sheet by header keywords, falls back to fixed positions when the
 * export carries no name/date headers, and tolerates broken rows by turning them into warnings.
 */
@Service
public class AttendanceSheetExtractor {

    private static final Logger log = LoggerFactory.getLogger(AttendanceSheetExtractor.class);

    static final String CHECK_IN_MARKER = "上班";
    static final String CHECK_OUT_MARKER = "下班";
    static final int HEADER_SCAN_ROWS = 15;
    static final int HEADER_SCAN_COLUMNS = 15;
    static final int DEFAULT_NAME_COLUMN = 1;
    static final int DEFAULT_DATE_COLUMN = 2;

    private static final ColumnDefinition NAME_COLUMN = new ColumnDefinition("name", List.of("姓名", "name", "員工"));
    private static final ColumnDefinition DATE_COLUMN = new ColumnDefinition("date", List.of("date", "日期"));

    private final WorkbookCellReader cellReader;

    /**
     * @param cellReader infrastructure helper that opens workbooks and converts POI cells
     */
    public AttendanceSheetExtractor(WorkbookCellReader cellReader) {
        this.cellReader = cellReader;
    }

    /**
     * Extracts rows from an uploaded workbook.
     *
     * @param file       uploaded .xlsx/.xls export
     * @param forcedYear year applied to {@code MM/DD} dates, may be {@code null}
     * @return rows of every sheet plus row-level warnings
     * @throws SourceFileRequiredException         when the upload is missing or empty
     * @throws UnsupportedWorkbookFormatException  when the upload does not look like a workbook
     * @throws WorkbookProcessingException         when the bytes cannot be read
     */
    public RowExtraction extract(MultipartFile file, Integer forcedYear) {
        if (file == null || file.isEmpty()) {
            throw new SourceFileRequiredException();
        }
        if (!looksLikeWorkbook(file.getOriginalFilename(), file.getContentType())) {
            throw new UnsupportedWorkbookFormatException(file.getOriginalFilename());
        }
        String sourceName = resolveFileName(file);
        try (InputStream input = file.getInputStream()) {
            return extract(input, sourceName, forcedYear);
        } catch (IOException e) {
            throw new WorkbookProcessingException("Unable to read the uploaded workbook.", e);
        }
    }

    /**
     * Extracts rows from a workbook on disk.
     *
     * @throws SourceFileNotFoundException when the path does not exist
     */
    public RowExtraction extract(Path workbookPath, Integer forcedYear) {
        if (workbookPath == null) {
            throw new SourceFileRequiredException();
        }
        if (!Files.exists(workbookPath)) {
            throw new SourceFileNotFoundException(workbookPath.toAbsolutePath().toString());
        }
        String sourceName = workbookPath.getFileName() != null ? workbookPath.getFileName().toString() : "attendance.xlsx";
        try (InputStream input = Files.newInputStream(workbookPath)) {
            return extract(input, sourceName, forcedYear);
        } catch (IOException e) {
            throw new WorkbookProcessingException("Unable to read the workbook at " + workbookPath, e);
        }
    }

    /**
     * Shared implementation: walks every sheet and concatenates their rows.
     * The stream is not closed here; callers own it.
     *
     * @throws SheetFormatException when a sheet lacks the check-in or check-out column
     */
    public RowExtraction extract(InputStream input, String sourceName, Integer forcedYear) {
        List<RawAttendanceRow> rows = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        DataFormatter formatter = cellReader.newFormatter();
        try (Workbook workbook = cellReader.open(input, sourceName)) {
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                Sheet sheet = workbook.getSheetAt(i);
                if (sheet.getPhysicalNumberOfRows() == 0) {
                    log.debug("Skipping empty sheet '{}'", sheet.getSheetName());
                    continue;
                }
                extractSheet(sheet, formatter, forcedYear, rows, warnings);
            }
        } catch (IOException e) {
            throw new WorkbookProcessingException("Unable to close workbook " + sourceName, e);
        }
        log.info("Extracted {} rows from {} ({} warnings)", rows.size(), sourceName, warnings.size());
        return new RowExtraction(sourceName, rows, warnings);
    }

    private void extractSheet(Sheet sheet, DataFormatter formatter, Integer forcedYear,
                              List<RawAttendanceRow> rows, List<String> warnings) {
        SheetLayout layout = discoverLayout(sheet, formatter);
        String currentName = null;
        if (layout.fallback()) {
            currentName = PunchValueParser.nameFromSheetTitle(sheet.getSheetName());
            if (currentName.isEmpty()) {
                currentName = null;
            }
            log.warn("Sheet '{}' has no name/date headers; using fixed columns and sheet title '{}'",
                    sheet.getSheetName(), currentName);
        }

        int before = rows.size();
        for (int rowIndex = layout.dataStartRow(); rowIndex <= sheet.getLastRowNum(); rowIndex++) {
            try {
                Object nameValue = cellReader.value(sheet, rowIndex, layout.nameColumn());
                if (nameValue instanceof String text) {
                    String cleaned = PunchValueParser.cleanName(text);
                    if (!cleaned.isEmpty()) {
                        currentName = cleaned;
                    }
                }
                if (currentName == null) {
                    continue;
                }
                LocalDate date = PunchValueParser.parseDate(cellReader.value(sheet, rowIndex, layout.dateColumn()), forcedYear);
                if (date == null) {
                    continue;
                }
                LocalTime checkIn = PunchValueParser.parseTime(cellReader.value(sheet, rowIndex, layout.checkInColumn()));
                LocalTime checkOut = PunchValueParser.parseTime(cellReader.value(sheet, rowIndex, layout.checkOutColumn()));
                rows.add(new RawAttendanceRow(currentName, date, checkIn, checkOut));
            } catch (RuntimeException ex) {
                String warning = String.format("Skipped row %d of sheet '%s': %s", rowIndex + 1, sheet.getSheetName(), ex.getMessage());
                log.warn(warning);
                warnings.add(warning);
            }
        }
        log.debug("Sheet '{}' yielded {} rows", sheet.getSheetName(), rows.size() - before);
    }

    /**
     * Finds the name, date and punch columns within the top-left corner of the sheet.
     * Title rows and ID columns may also contain a name keyword, so among the name matches a cell on
     * the punch-marker row wins, then the stronger keyword, then the later cell.
     * The date column prefers the row of the chosen name header, then the marker row, then the first match.
     *
     * @throws SheetFormatException when either punch marker is missing
     */
    SheetLayout discoverLayout(Sheet sheet, DataFormatter formatter) {
        List<HeaderMatch> nameMatches = new ArrayList<>();
        List<HeaderMatch> dateMatches = new ArrayList<>();
        HeaderMatch checkIn = null;
        HeaderMatch checkOut = null;

        int lastRow = Math.min(sheet.getLastRowNum(), HEADER_SCAN_ROWS - 1);
        for (int r = 0; r <= lastRow; r++) {
            for (int c = 0; c < HEADER_SCAN_COLUMNS; c++) {
                String raw = cellReader.text(formatter, sheet, r, c);
                if (raw.isEmpty()) {
                    continue;
                }
                String normalized = normalizeHeaderToken(raw);
                int nameRank = NAME_COLUMN.rank(normalized);
                int dateRank = DATE_COLUMN.rank(normalized);
                if (nameRank >= 0) {
                    nameMatches.add(new HeaderMatch(r, c, nameRank));
                } else if (dateRank >= 0) {
                    dateMatches.add(new HeaderMatch(r, c, dateRank));
                } else if (checkIn == null && normalized.startsWith(CHECK_IN_MARKER)) {
                    checkIn = new HeaderMatch(r, c, 0);
                } else if (checkOut == null && normalized.startsWith(CHECK_OUT_MARKER)) {
                    checkOut = new HeaderMatch(r, c, 0);
                }
            }
        }

        List<String> missing = new ArrayList<>();
        if (checkIn == null) {
            missing.add(CHECK_IN_MARKER);
        }
        if (checkOut == null) {
            missing.add(CHECK_OUT_MARKER);
        }
        if (!missing.isEmpty()) {
            throw new SheetFormatException(sheet.getSheetName(), missing);
        }

        int markerRow = checkIn.row();
        HeaderMatch name = best(nameMatches, Comparator.<HeaderMatch, Boolean>comparing(m -> m.row() == markerRow)
                .thenComparing(Comparator.comparingInt(HeaderMatch::rank).reversed()), true);
        int nameRow = name != null ? name.row() : -1;
        HeaderMatch date = best(dateMatches, Comparator.<HeaderMatch, Boolean>comparing(m -> m.row() == nameRow)
                .thenComparing(m -> m.row() == markerRow), false);

        int headerRow = Math.max(checkIn.row(), checkOut.row());
        if (name != null) {
            headerRow = Math.max(headerRow, name.row());
        }
        if (date != null) {
            headerRow = Math.max(headerRow, date.row());
        }
        boolean fallback = name == null;
        int nameColumn = name != null ? name.column() : DEFAULT_NAME_COLUMN;
        int dateColumn = date != null ? date.column() : DEFAULT_DATE_COLUMN;
        if (date == null) {
            log.warn("Sheet '{}' has no date header; assuming column {}", sheet.getSheetName(), dateColumn + 1);
        }
        return new SheetLayout(nameColumn, dateColumn, checkIn.column(), checkOut.column(), headerRow + 1, fallback);
    }

    // Highest-ranked match in scan order; ties go to the later cell when laterWins is set.
    private static HeaderMatch best(List<HeaderMatch> matches, Comparator<HeaderMatch> preference, boolean laterWins) {
        HeaderMatch best = null;
        for (HeaderMatch match : matches) {
            int comparison = best == null ? 1 : preference.compare(match, best);
            if (comparison > 0 || (laterWins && comparison == 0)) {
                best = match;
            }
        }
        return best;
    }

    private static String normalizeHeaderToken(String token) {
        return token.replaceAll("[\\s　*:：]", "").toLowerCase(Locale.ROOT);
    }

    private boolean looksLikeWorkbook(String fileName, String contentType) {
        if (contentType != null) {
            String type = contentType.toLowerCase(Locale.ROOT);
            if (type.contains("spreadsheetml") || type.equals("application/vnd.ms-excel")) {
                return true;
            }
        }
        if (fileName == null) {
            return false;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".xlsx") || lower.endsWith(".xls");
    }

    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.xlsx";
        }
        return fileName;
    }

    /**
     * Column indices (zero-based) of one sheet plus the first data row.
     */
    record SheetLayout(int nameColumn, int dateColumn, int checkInColumn, int checkOutColumn, int dataStartRow, boolean fallback) {
    }

    private record HeaderMatch(int row, int column, int rank) {
    }

    private static final class ColumnDefinition {
        private final String name;
        private final List<String> keywords;

        ColumnDefinition(String name, List<String> keywords) {
            this.name = name;
            this.keywords = keywords;
        }

        /**
         * @return index of the first keyword the token contains, lower is stronger; -1 when none does
         */
        int rank(String normalizedToken) {
            for (int i = 0; i < keywords.size(); i++) {
                if (normalizedToken.contains(keywords.get(i))) {
                    return i;
                }
            }
            return -1;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
