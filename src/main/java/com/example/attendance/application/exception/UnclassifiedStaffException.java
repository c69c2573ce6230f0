package com.example.attendance.application.exception;

/**
 * Raised when an employee appears in the attendance export but not in the staff roster.
 * Runs use strict matching, so one unknown name blocks the whole report until the roster
 * is updated.
 */
public class UnclassifiedStaffException extends ApplicationException {

    private final String staffName;

	/**
	 * @param staffName employee name that has no roster entry
	 */
    public UnclassifiedStaffException(String staffName) {
        super("Staff member '" + staffName + "' is not in the staff roster. Add them to the roster and run the report again.");
        this.staffName = staffName;
    }

    public String getStaffName() {
        return staffName;
    }
}
