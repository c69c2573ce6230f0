package com.example.attendance.application.service;

import com.example.attendance.domain.model.AttendanceReport;

/**
 * Output port for finished reports (spreadsheet, PDF, mail...). Implementations are discovered as Spring beans
 * and called once per successful run, in registration order.
 */
public interface AttendanceReportRenderer {

    void render(AttendanceReport report);
}
