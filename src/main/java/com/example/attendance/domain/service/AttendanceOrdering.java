package com.example.attendance.domain.service;

import com.example.attendance.domain.model.MonthlyAttendance;
import com.example.attendance.domain.model.SortOrder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Output ordering for finished staff lists. Classification never depends on it.
 */
public class AttendanceOrdering {

    private final Comparator<String> nameComparator;

    public AttendanceOrdering() {
        this(new SurnameStrokeComparator());
    }

    /**
     * @param nameComparator comparator used for {@link SortOrder#NAME_STROKES}
     */
    public AttendanceOrdering(Comparator<String> nameComparator) {
        this.nameComparator = nameComparator;
    }

    /**
     * Returns a sorted copy; the input list is left untouched.
     * {@link SortOrder#ATTENDANCE_RATE} puts the highest rate first and keeps ties in input order.
     */
    public List<MonthlyAttendance> sort(List<MonthlyAttendance> attendance, SortOrder order) {
        List<MonthlyAttendance> sorted = new ArrayList<>(attendance);
        Comparator<MonthlyAttendance> comparator = switch (order) {
            case NAME_STROKES -> Comparator.comparing((MonthlyAttendance monthly) -> monthly.staff().name(), nameComparator);
            case ATTENDANCE_RATE -> Comparator.comparingDouble(MonthlyAttendance::attendanceRate).reversed();
        };
        sorted.sort(comparator);
        return sorted;
    }
}
