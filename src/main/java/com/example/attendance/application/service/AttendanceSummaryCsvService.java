package com.example.attendance.application.service;

import com.example.attendance.application.exception.UseCaseValidationException;
import com.example.attendance.domain.model.AttendanceReport;
import com.example.attendance.domain.model.MonthlyAttendance;
import com.example.attendance.domain.service.RemarkSummarizer;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Application-layer service that turns a finished report into a one-row-per-employee CSV summary.
 */
@Service
public class AttendanceSummaryCsvService {

	/**
	 * Builds the summary CSV, internal staff first.
	 *
	 * @param report finished monthly report
	 * @return CSV content ready to stream to the client
	 * @throws UseCaseValidationException when the report holds no staff
	 */
    public String exportSummary(AttendanceReport report) {
        if (report == null || (report.internal().isEmpty() && report.external().isEmpty())) {
            throw new UseCaseValidationException("No attendance data available for export.");
        }
        StringBuilder builder = new StringBuilder();
        builder.append("Name,Type,Required Days,Actual Days,Attendance Rate,Tier,Remarks\n");
        appendRows(builder, report.internal());
        appendRows(builder, report.external());
        return builder.toString();
    }

    /**
     * @return file name such as {@code attendance-2025-12.csv}
     */
    public String fileNameFor(AttendanceReport report) {
        return String.format(Locale.ROOT, "attendance-%04d-%02d.csv", report.year(), report.month());
    }

    private void appendRows(StringBuilder builder, List<MonthlyAttendance> staffRows) {
        for (MonthlyAttendance monthly : staffRows) {
            builder.append(escape(monthly.staff().name())).append(',')
                    .append(escape(monthly.staff().regime().rosterLabel())).append(',')
                    .append(monthly.requiredDays()).append(',')
                    .append(monthly.actualDays()).append(',')
                    .append(String.format(Locale.ROOT, "%.1f%%", monthly.attendanceRate())).append(',')
                    .append(monthly.rateTier()).append(',')
                    .append(escape(RemarkSummarizer.summarize(monthly)))
                    .append('\n');
        }
    }

	/**
	 * Quotes values containing commas, quotes, or newlines.
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
