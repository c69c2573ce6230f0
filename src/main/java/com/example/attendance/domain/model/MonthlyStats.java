package com.example.attendance.domain.model;

/**
 * Month-level figures printed in report headers.
 *
 * @param requiredWorkDays Monday-to-Friday days of the month that are not holidays
 * @param holidayCount     configured holidays that fall inside the month
 */
public record MonthlyStats(
        int year,
        int month,
        int requiredWorkDays,
        int holidayCount,
        int totalStaff,
        int internalCount,
        int externalCount
) {
}
