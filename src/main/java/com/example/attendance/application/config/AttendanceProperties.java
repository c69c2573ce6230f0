package com.example.attendance.application.config;

import com.example.attendance.domain.model.ColorLogic;
import com.example.attendance.domain.model.ReportRequest;
import com.example.attendance.domain.model.SortOrder;
import com.example.attendance.domain.model.TimeRule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Settings bound from {@code attendance.*}. Missing values fall back to the stock office rules.
 */
@ConfigurationProperties(prefix = "attendance")
public record AttendanceProperties(
        @DefaultValue("staff.csv") String rosterPath,
        @DefaultValue("80") int rateThreshold,
        @DefaultValue("attendance_rate") String sortBy,
        List<String> holidays,
        Rule internal,
        Rule external,
        Colors colors
) {

    private static final Logger log = LoggerFactory.getLogger(AttendanceProperties.class);
    private static final DateTimeFormatter HOLIDAY_FORMAT = DateTimeFormatter.ofPattern("uuuu-M-d")
            .withResolverStyle(ResolverStyle.STRICT);

    static final Rule INTERNAL_DEFAULTS = new Rule("09:00", "09:30", "18:00", "18:30");
    static final Rule EXTERNAL_DEFAULTS = new Rule("09:30", "10:00", "10:30", "12:00");

    public AttendanceProperties {
        holidays = holidays == null ? List.of() : List.copyOf(holidays);
        internal = Rule.merge(internal, INTERNAL_DEFAULTS);
        external = Rule.merge(external, EXTERNAL_DEFAULTS);
        colors = colors == null ? Colors.defaults() : colors.withDefaults();
    }

    /**
     * @param forcedYear year override for the run, {@code null} to infer it
     * @return request for one report run
     */
    public ReportRequest toReportRequest(Integer forcedYear) {
        return new ReportRequest(internal.toTimeRule(), external.toTimeRule(), parseHolidays(holidays),
                rateThreshold, SortOrder.fromString(sortBy), forcedYear);
    }

    public ColorLogic colorLogic() {
        return colors.toColorLogic();
    }

    static Set<LocalDate> parseHolidays(List<String> values) {
        Set<LocalDate> parsed = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null || value.isBlank()) {
                continue;
            }
            try {
                parsed.add(LocalDate.parse(value.trim(), HOLIDAY_FORMAT));
            } catch (DateTimeParseException e) {
                log.debug("Ignoring malformed holiday '{}'", value);
            }
        }
        return parsed;
    }

    /**
     * Clock bounds as {@code HH:MM} strings.
     */
    public record Rule(String inStart, String inEnd, String outStart, String outEnd) {

        static Rule merge(Rule configured, Rule defaults) {
            if (configured == null) {
                return defaults;
            }
            return new Rule(
                    orDefault(configured.inStart, defaults.inStart),
                    orDefault(configured.inEnd, defaults.inEnd),
                    orDefault(configured.outStart, defaults.outStart),
                    orDefault(configured.outEnd, defaults.outEnd));
        }

        public TimeRule toTimeRule() {
            return TimeRule.parse(inStart, inEnd, outStart, outEnd);
        }
    }

    public record Colors(
            String normalIn,
            String normalOut,
            String abnormalIn,
            String abnormalOut,
            String missingPunch,
            String missingPunchText,
            String absent,
            String absentText
    ) {

        static Colors defaults() {
            return new Colors(null, null, null, null, null, null, null, null).withDefaults();
        }

        Colors withDefaults() {
            ColorLogic d = ColorLogic.defaults();
            return new Colors(
                    orDefault(normalIn, d.normalInColor()),
                    orDefault(normalOut, d.normalOutColor()),
                    orDefault(abnormalIn, d.abnormalInColor()),
                    orDefault(abnormalOut, d.abnormalOutColor()),
                    orDefault(missingPunch, d.missingPunchColor()),
                    orDefault(missingPunchText, d.missingPunchText()),
                    orDefault(absent, d.absentColor()),
                    orDefault(absentText, d.absentText()));
        }

        ColorLogic toColorLogic() {
            return new ColorLogic(normalIn, normalOut, abnormalIn, abnormalOut, missingPunch, missingPunchText, absent, absentText);
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
