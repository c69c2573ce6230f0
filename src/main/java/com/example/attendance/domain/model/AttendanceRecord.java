package com.example.attendance.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Classified attendance day. Built fully populated by the classifier.
 *
 * @param date     calendar day
 * @param checkIn  first punch, or {@code null}
 * @param checkOut last punch, or {@code null}
 * @param status   classified status
 * @param remark   free-text remark, empty when there is nothing to note
 */
public record AttendanceRecord(
        LocalDate date,
        LocalTime checkIn,
        LocalTime checkOut,
        AttendanceStatus status,
        String remark
) {

    public AttendanceRecord {
        remark = remark == null ? "" : remark;
    }
}
