package com.example.attendance.infrastructure.exception;

/**
 * Raised when the staff roster file cannot be read or appended to.
 */
public class RosterAccessException extends InfrastructureException {

    public RosterAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
