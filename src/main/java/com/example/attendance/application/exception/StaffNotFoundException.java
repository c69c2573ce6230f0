package com.example.attendance.application.exception;

/**
 * Raised by roster lookups for a name the directory does not know.
 */
public class StaffNotFoundException extends ApplicationException {

    public StaffNotFoundException(String name) {
        super("No roster entry for: " + name);
    }
}
