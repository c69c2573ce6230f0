package com.example.attendance.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals issues while opening or reading a workbook.
 */
public class WorkbookProcessingException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the root cause from Apache POI.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level IO or POI exception
	 */
    public WorkbookProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
