package com.example.attendance.infrastructure.excel;

import com.example.attendance.infrastructure.exception.WorkbookProcessingException;

import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Infrastructure helper that opens workbooks with Apache POI and turns cells into plain Java values.
 * Keeps POI cell-type handling out of the extraction rules. Holds no state; {@link DataFormatter}
 * is not thread-safe, so each extraction asks for its own via {@link #newFormatter()}.
 */
@Component
public class WorkbookCellReader {

    /**
     * @return a formatter to be confined to one extraction run
     */
    public DataFormatter newFormatter() {
        return new DataFormatter();
    }

    /**
     * Opens a workbook of either format (.xls or .xlsx). The caller owns the returned workbook and must close it.
     *
     * @param input      workbook bytes
     * @param sourceName name used in error messages
     * @return opened workbook
     * @throws WorkbookProcessingException when the stream is not a readable workbook
     */
    public Workbook open(InputStream input, String sourceName) {
        try {
            return WorkbookFactory.create(input);
        } catch (IOException | UnsupportedFileFormatException | EncryptedDocumentException e) {
            throw new WorkbookProcessingException("Unable to open workbook " + sourceName, e);
        }
    }

    /**
     * Reads a cell as a typed value.
     * <ul>
     *     <li>date- or time-formatted numeric cells become {@link java.time.LocalDateTime}</li>
     *     <li>other numerics become {@link Double}</li>
     *     <li>text becomes a trimmed {@link String}</li>
     *     <li>formula cells are read from their cached result</li>
     *     <li>blank or missing cells become {@code null}</li>
     * </ul>
     *
     * @param sheet       sheet to read from
     * @param rowIndex    zero-based row index
     * @param columnIndex zero-based column index
     * @return cell value or {@code null}
     */
    public Object value(Sheet sheet, int rowIndex, int columnIndex) {
        Row row = sheet.getRow(rowIndex);
        if (row == null) {
            return null;
        }
        Cell cell = row.getCell(columnIndex, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? cell.getLocalDateTimeCellValue()
                    : Double.valueOf(cell.getNumericCellValue());
            case STRING -> blankToNull(cell.getStringCellValue());
            case BOOLEAN -> Boolean.valueOf(cell.getBooleanCellValue());
            default -> null;
        };
    }

    /**
     * Reads the cell as display text, the way Excel would show it. Used for header keyword matching.
     *
     * @param formatter formatter owned by the calling run
     * @return display text or an empty string
     */
    public String text(DataFormatter formatter, Sheet sheet, int rowIndex, int columnIndex) {
        Row row = sheet.getRow(rowIndex);
        if (row == null) {
            return "";
        }
        Cell cell = row.getCell(columnIndex, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
        if (cell == null) {
            return "";
        }
        return formatter.formatCellValue(cell).trim();
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
