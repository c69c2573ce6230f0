package com.example.attendance.domain.service;

import com.example.attendance.domain.model.AttendanceRecord;
import com.example.attendance.domain.model.MonthlyAttendance;
import com.example.attendance.domain.model.MonthlyStats;
import com.example.attendance.domain.model.RateTier;
import com.example.attendance.domain.model.Staff;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Set;

/**
 * Computes required and actual attendance days, the attendance rate and its tier for a month.
 */
public class MonthlyRateCalculator {

    /** Fixed lower boundary of the GREEN tier, independent of the configured threshold. */
    public static final double GREEN_BOUNDARY = 90.0;

    /**
     * Counts the days of the month the staff member is expected to work.
     *
     * @param staff    staff member
     * @param year     report year
     * @param month    report month (1-12)
     * @param holidays dates excluded from the count
     * @return number of work days that are not holidays
     */
    public int calculateRequiredDays(Staff staff, int year, int month, Set<LocalDate> holidays) {
        int required = 0;
        for (LocalDate day : daysOf(year, month)) {
            if (holidays.contains(day)) {
                continue;
            }
            if (staff.worksOn(day)) {
                required++;
            }
        }
        return required;
    }

    /**
     * @param records classified days
     * @return number of days whose status counts as attended
     */
    public int calculateActualDays(List<AttendanceRecord> records) {
        int actual = 0;
        for (AttendanceRecord record : records) {
            if (record.status().countsAsAttended()) {
                actual++;
            }
        }
        return actual;
    }

    /**
     * Attendance rate in percent. Nothing required counts as fully satisfied.
     *
     * @return {@code 100.0} when {@code requiredDays} is zero, otherwise {@code 100 * actual / required} unrounded
     */
    public double calculateRate(int actualDays, int requiredDays) {
        if (requiredDays == 0) {
            return 100.0;
        }
        return 100.0 * actualDays / requiredDays;
    }

    /**
     * Grades a rate. Below {@code threshold} is RED, below 90 is YELLOW, the rest GREEN.
     */
    public RateTier rateTier(double rate, int threshold) {
        if (rate < threshold) {
            return RateTier.RED;
        }
        if (rate < GREEN_BOUNDARY) {
            return RateTier.YELLOW;
        }
        return RateTier.GREEN;
    }

    public MonthlyAttendance calculateMonthlyAttendance(Staff staff,
                                                        List<AttendanceRecord> records,
                                                        int year,
                                                        int month,
                                                        Set<LocalDate> holidays,
                                                        int threshold) {
        int requiredDays = calculateRequiredDays(staff, year, month, holidays);
        int actualDays = calculateActualDays(records);
        double rate = calculateRate(actualDays, requiredDays);
        return new MonthlyAttendance(staff, year, month, records, requiredDays, actualDays, rate, rateTier(rate, threshold));
    }

    /**
     * Month-level header figures. Work days here are plain Monday to Friday, whatever the regimes.
     */
    public MonthlyStats calculateMonthlyStats(int year, int month, Set<LocalDate> holidays, int internalCount, int externalCount) {
        int workDays = 0;
        int holidayCount = 0;
        for (LocalDate day : daysOf(year, month)) {
            if (holidays.contains(day)) {
                holidayCount++;
            } else if (day.getDayOfWeek() != DayOfWeek.SATURDAY && day.getDayOfWeek() != DayOfWeek.SUNDAY) {
                workDays++;
            }
        }
        return new MonthlyStats(year, month, workDays, holidayCount, internalCount + externalCount, internalCount, externalCount);
    }

    private static List<LocalDate> daysOf(int year, int month) {
        YearMonth yearMonth = YearMonth.of(year, month);
        return yearMonth.atDay(1).datesUntil(yearMonth.atEndOfMonth().plusDays(1)).toList();
    }
}
