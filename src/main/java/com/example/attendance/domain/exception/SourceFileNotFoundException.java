package com.example.attendance.domain.exception;

/**
 * Raised when a referenced attendance export does not exist on disk.
 */
public class SourceFileNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the missing path as part of the message.
	 *
	 * @param path absolute or relative path that could not be resolved
	 */
    public SourceFileNotFoundException(String path) {
        super("Attendance export not found: " + path);
    }
}
