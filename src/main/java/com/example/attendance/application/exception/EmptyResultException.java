package com.example.attendance.application.exception;

/**
 * Raised when a report run ends with nothing to report, either because the export held no
 * usable rows or because every employee in it was rejected by the roster.
 */
public class EmptyResultException extends UseCaseValidationException {

	/**
	 * @param message explains whether there was nothing to do or everything was rejected
	 */
    public EmptyResultException(String message) {
        super(message);
    }
}
