package com.example.attendance.domain.model;

/**
 * Classified status of a single attendance day.
 */
public enum AttendanceStatus {
    NORMAL,
    LATE,
    EARLY_LEAVE,
    ABSENT,
    ABNORMAL,
    LEAVE,
    HOLIDAY,
    NON_WORK_DAY;

    /**
     * Absence, holidays and non-work days do not count as attended.
     *
     * @return {@code true} when a day with this status counts towards the actual days
     */
    public boolean countsAsAttended() {
        return switch (this) {
            case NORMAL, LATE, EARLY_LEAVE, ABNORMAL, LEAVE -> true;
            case ABSENT, HOLIDAY, NON_WORK_DAY -> false;
        };
    }
}
