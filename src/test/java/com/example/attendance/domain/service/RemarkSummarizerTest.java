package com.example.attendance.domain.service;

import com.example.attendance.domain.model.AttendanceRecord;
import com.example.attendance.domain.model.AttendanceStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RemarkSummarizerTest {

    @Test
    void listsNotableDaysInDateOrder() {
        List<AttendanceRecord> records = List.of(
                record(4, AttendanceStatus.NORMAL, LocalTime.of(19, 0), AttendanceClassifier.DELAYED_CHECKOUT_REMARK),
                record(2, AttendanceStatus.LATE, LocalTime.of(18, 0), ""),
                record(3, AttendanceStatus.EARLY_LEAVE, LocalTime.of(17, 0), ""),
                record(1, AttendanceStatus.NORMAL, LocalTime.of(18, 0), ""));

        assertThat(RemarkSummarizer.summarize(records)).isEqualTo("2日遲到, 3日早退, 4日下班延遲打卡");
    }

    @Test
    void abnormalDayIsOneItem() {
        List<AttendanceRecord> records = List.of(record(9, AttendanceStatus.ABNORMAL, LocalTime.of(17, 0), ""));

        assertThat(RemarkSummarizer.summarize(records)).isEqualTo("9日遲到早退");
    }

    @Test
    void lateAndDelayedOnSameDayGiveTwoItems() {
        List<AttendanceRecord> records = List.of(
                record(5, AttendanceStatus.LATE, LocalTime.of(19, 0), AttendanceClassifier.DELAYED_CHECKOUT_REMARK));

        assertThat(RemarkSummarizer.summarize(records)).isEqualTo("5日遲到, 5日下班延遲打卡");
    }

    @Test
    void nothingToNote() {
        assertThat(RemarkSummarizer.summarize(List.of(record(1, AttendanceStatus.NORMAL, LocalTime.of(18, 0), "")))).isEmpty();
        assertThat(RemarkSummarizer.summarize(List.of())).isEmpty();
    }

    private static AttendanceRecord record(int day, AttendanceStatus status, LocalTime out, String remark) {
        return new AttendanceRecord(LocalDate.of(2025, 12, day), LocalTime.of(9, 0), out, status, remark);
    }
}
