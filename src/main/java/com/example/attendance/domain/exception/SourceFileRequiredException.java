package com.example.attendance.domain.exception;

/**
 * Raised when a report run is requested without an attendance export.
 */
public class SourceFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public SourceFileRequiredException() {
        super("Please choose an attendance export to upload.");
    }
}
