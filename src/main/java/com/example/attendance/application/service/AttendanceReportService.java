package com.example.attendance.application.service;

import com.example.attendance.application.exception.EmptyResultException;
import com.example.attendance.application.exception.UnclassifiedStaffException;
import com.example.attendance.domain.model.AttendanceRecord;
import com.example.attendance.domain.model.AttendanceReport;
import com.example.attendance.domain.model.MonthlyAttendance;
import com.example.attendance.domain.model.MonthlyStats;
import com.example.attendance.domain.model.RawAttendanceRow;
import com.example.attendance.domain.model.ReportRequest;
import com.example.attendance.domain.model.RowExtraction;
import com.example.attendance.domain.model.Staff;
import com.example.attendance.domain.model.StaffRegime;
import com.example.attendance.domain.service.AttendanceClassifier;
import com.example.attendance.domain.service.AttendanceOrdering;
import com.example.attendance.domain.service.MonthlyRateCalculator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Application-layer service that runs one monthly report: extraction, roster lookup, classification,
 * aggregation and ordering. Finished reports are handed to every registered {@link AttendanceReportRenderer}.
 */
@Service
public class AttendanceReportService {

    private static final Logger log = LoggerFactory.getLogger(AttendanceReportService.class);

    private final AttendanceSheetExtractor extractor;
    private final StaffDirectory staffDirectory;
    private final List<AttendanceReportRenderer> renderers;
    private final MonthlyRateCalculator rateCalculator;
    private final AttendanceOrdering ordering;

    @Autowired
    public AttendanceReportService(AttendanceSheetExtractor extractor,
                                   StaffDirectory staffDirectory,
                                   ObjectProvider<AttendanceReportRenderer> renderers) {
        this(extractor, staffDirectory, renderers.orderedStream().toList(), new MonthlyRateCalculator(), new AttendanceOrdering());
    }

    AttendanceReportService(AttendanceSheetExtractor extractor,
                            StaffDirectory staffDirectory,
                            List<AttendanceReportRenderer> renderers,
                            MonthlyRateCalculator rateCalculator,
                            AttendanceOrdering ordering) {
        this.extractor = extractor;
        this.staffDirectory = staffDirectory;
        this.renderers = renderers == null ? List.of() : List.copyOf(renderers);
        this.rateCalculator = rateCalculator;
        this.ordering = ordering;
    }

    public AttendanceReport generateReport(MultipartFile file, ReportRequest request) {
        Integer year = seedYear(file != null ? file.getOriginalFilename() : null, request);
        return buildReport(extractor.extract(file, year), request);
    }

    public AttendanceReport generateReport(Path workbookPath, ReportRequest request) {
        String fileName = workbookPath != null && workbookPath.getFileName() != null ? workbookPath.getFileName().toString() : null;
        return buildReport(extractor.extract(workbookPath, seedYear(fileName, request)), request);
    }

    public AttendanceReport generateReport(InputStream workbook, String sourceName, ReportRequest request) {
        return buildReport(extractor.extract(workbook, sourceName, seedYear(sourceName, request)), request);
    }

    /**
     * Turns extracted rows into a report. The month of the first row is the reporting period.
     *
     * @throws EmptyResultException       when there is nothing to report
     * @throws UnclassifiedStaffException when a name is missing from a non-empty roster
     */
    public AttendanceReport buildReport(RowExtraction extraction, ReportRequest request) {
        if (extraction.isEmpty()) {
            throw new EmptyResultException("Source " + extraction.sourceName() + " contains no attendance rows.");
        }
        LocalDate first = extraction.rows().get(0).date();
        YearMonth period = YearMonth.from(first);
        log.info("Building report for {} from {} ({} rows)", period, extraction.sourceName(), extraction.rows().size());

        // One row per employee and day; the same name may appear on several sheets.
        Map<String, Map<LocalDate, RawAttendanceRow>> rowsByName = new LinkedHashMap<>();
        for (RawAttendanceRow row : extraction.rows()) {
            if (YearMonth.from(row.date()).equals(period)) {
                rowsByName.computeIfAbsent(row.employeeName(), name -> new TreeMap<>())
                        .merge(row.date(), row, RawAttendanceRow::mergeWith);
            }
        }

        Map<Staff, List<RawAttendanceRow>> classified = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        boolean rosterEmpty = staffDirectory.isEmpty();
        for (Map.Entry<String, Map<LocalDate, RawAttendanceRow>> entry : rowsByName.entrySet()) {
            Staff staff = staffDirectory.find(entry.getKey()).orElse(null);
            if (staff != null) {
                classified.put(staff, List.copyOf(entry.getValue().values()));
            } else if (rosterEmpty) {
                skipped.add(entry.getKey());
            } else {
                throw new UnclassifiedStaffException(entry.getKey());
            }
        }

        if (classified.isEmpty()) {
            if (!skipped.isEmpty()) {
                throw new EmptyResultException("All " + skipped.size() + " employees are missing from the staff roster.");
            }
            throw new EmptyResultException("No data to process.");
        }

        Set<LocalDate> holidays = request.holidays();
        List<MonthlyAttendance> internal = new ArrayList<>();
        List<MonthlyAttendance> external = new ArrayList<>();
        for (Map.Entry<Staff, List<RawAttendanceRow>> entry : classified.entrySet()) {
            Staff staff = entry.getKey();
            List<AttendanceRecord> records = entry.getValue().stream()
                    .filter(row -> staff.worksOn(row.date()) && !holidays.contains(row.date()))
                    .map(row -> AttendanceClassifier.classify(row, staff.regime(), request.ruleFor(staff.regime())))
                    .toList();
            MonthlyAttendance monthly = rateCalculator.calculateMonthlyAttendance(staff, records,
                    period.getYear(), period.getMonthValue(), holidays, request.rateThreshold());
            if (staff.regime() == StaffRegime.EXTERNAL) {
                external.add(monthly);
            } else {
                internal.add(monthly);
            }
        }

        List<MonthlyAttendance> sortedInternal = ordering.sort(internal, request.sortOrder());
        List<MonthlyAttendance> sortedExternal = ordering.sort(external, request.sortOrder());
        MonthlyStats stats = rateCalculator.calculateMonthlyStats(period.getYear(), period.getMonthValue(), holidays,
                sortedInternal.size(), sortedExternal.size());

        AttendanceReport report = new AttendanceReport(extraction.sourceName(), period.getYear(), period.getMonthValue(),
                holidays, sortedInternal, sortedExternal, stats, extraction.warnings());
        for (AttendanceReportRenderer renderer : renderers) {
            renderer.render(report);
        }
        log.info("Report {} done: {} internal, {} external, {} warnings",
                period, sortedInternal.size(), sortedExternal.size(), report.warnings().size());
        return report;
    }

    private Integer seedYear(String fileName, ReportRequest request) {
        if (request.forcedYear() != null) {
            return request.forcedYear();
        }
        Integer year = ReportFileNameParser.tryParse(fileName).map(YearMonth::getYear).orElse(null);
        log.debug("Seed year from file name '{}': {}", fileName, year);
        return year;
    }
}
