package com.example.attendance.domain.exception;

/**
 * Raised when the uploaded file does not look like an Excel workbook.
 */
public class UnsupportedWorkbookFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedWorkbookFormatException(String fileName) {
        super("Only .xlsx or .xls workbooks are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
