package com.example.attendance.domain.service;

import com.example.attendance.domain.model.AttendanceRecord;
import com.example.attendance.domain.model.MonthlyAttendance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the one-line remark column of a monthly summary, e.g. {@code 2日遲到, 4日下班延遲打卡}.
 */
public final class RemarkSummarizer {

    private static final String SEPARATOR = ", ";

    private RemarkSummarizer() {
    }

    public static String summarize(MonthlyAttendance monthly) {
        return summarize(monthly.records());
    }

    /**
     * @param records classified days in any order
     * @return comma separated day notes, empty when nothing needs noting
     */
    public static String summarize(List<AttendanceRecord> records) {
        List<AttendanceRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparing(AttendanceRecord::date));

        List<String> items = new ArrayList<>();
        for (AttendanceRecord record : ordered) {
            int day = record.date().getDayOfMonth();
            switch (record.status()) {
                case LATE -> items.add(day + "日遲到");
                case EARLY_LEAVE -> items.add(day + "日早退");
                case ABNORMAL -> items.add(day + "日遲到早退");
                default -> {
                }
            }
            if (record.checkOut() != null && AttendanceClassifier.DELAYED_CHECKOUT_REMARK.equals(record.remark())) {
                items.add(day + "日" + AttendanceClassifier.DELAYED_CHECKOUT_REMARK);
            }
        }
        return String.join(SEPARATOR, items);
    }
}
