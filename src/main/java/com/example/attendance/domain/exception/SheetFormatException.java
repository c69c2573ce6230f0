package com.example.attendance.domain.exception;

import java.util.List;

/**
 * Raised when a worksheet is structurally unusable because the check-in and/or check-out
 * marker columns cannot be located inside the header search window.
 * Attendance cannot be computed without punch columns, so this aborts the whole run.
 */
public class SheetFormatException extends DomainException {

    private final String sheetName;
    private final List<String> missingMarkers;

	/**
	 * Creates the exception and names every marker that was not found.
	 *
	 * @param sheetName      worksheet that failed header discovery
	 * @param missingMarkers marker tokens that could not be located
	 */
    public SheetFormatException(String sheetName, List<String> missingMarkers) {
        super("Sheet '" + sheetName + "' is missing required punch column(s): " + String.join(", ", missingMarkers));
        this.sheetName = sheetName;
        this.missingMarkers = List.copyOf(missingMarkers);
    }

    public String getSheetName() {
        return sheetName;
    }

    public List<String> getMissingMarkers() {
        return missingMarkers;
    }
}
