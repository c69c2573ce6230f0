package com.example.attendance.domain.service;

import com.example.attendance.domain.model.AttendanceRecord;
import com.example.attendance.domain.model.AttendanceStatus;
import com.example.attendance.domain.model.ColorLogic;
import com.example.attendance.domain.model.PunchColors;
import com.example.attendance.domain.model.RawAttendanceRow;
import com.example.attendance.domain.model.StaffRegime;
import com.example.attendance.domain.model.TimeRule;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Turns a day's punches into an attendance status and remark.
 * Each regime has its own pair of rule functions; {@link #determineStatus} and {@link #punchColors}
 * select them with a switch over {@link StaffRegime} so the two rule sets can be read side by side.
 */
public final class AttendanceClassifier {

    public static final String DELAYED_CHECKOUT_REMARK = "下班延遲打卡";

    private AttendanceClassifier() {
    }

    /**
     * Classifies one raw row into a fully populated record.
     *
     * @param row    cleaned source row
     * @param regime regime of the employee the row belongs to
     * @param rule   time windows for that regime
     * @return immutable record carrying status and remark
     */
    public static AttendanceRecord classify(RawAttendanceRow row, StaffRegime regime, TimeRule rule) {
        Objects.requireNonNull(row, "row");
        AttendanceStatus status = determineStatus(regime, row.checkIn(), row.checkOut(), rule);
        String remark = remark(row.checkIn(), row.checkOut(), rule);
        return new AttendanceRecord(row.date(), row.checkIn(), row.checkOut(), status, remark);
    }

    /**
     * Decides the status of a day. A day with no punches at all is {@link AttendanceStatus#ABSENT}
     * under every regime.
     */
    public static AttendanceStatus determineStatus(StaffRegime regime, LocalTime checkIn, LocalTime checkOut, TimeRule rule) {
        if (checkIn == null && checkOut == null) {
            return AttendanceStatus.ABSENT;
        }
        return switch (regime) {
            case INTERNAL -> internalStatus(checkIn, checkOut, rule);
            case EXTERNAL -> externalStatus(checkIn, rule);
        };
    }

    /**
     * Remark shared by both regimes: a check-out after {@code outEnd} is noted as delayed,
     * whatever the status.
     *
     * @return remark text or an empty string
     */
    public static String remark(LocalTime checkIn, LocalTime checkOut, TimeRule rule) {
        if (checkOut != null && checkOut.isAfter(rule.outEnd())) {
            return DELAYED_CHECKOUT_REMARK;
        }
        return "";
    }

    /**
     * Works out which colors a renderer should put on the punch cells. Nothing is mutated.
     *
     * @param record classified day
     * @param regime regime of the employee
     * @param rule   time windows for that regime
     * @param colors configured color names
     * @return colors for the in and out cells; {@code null} entries keep the default style
     */
    public static PunchColors punchColors(AttendanceRecord record, StaffRegime regime, TimeRule rule, ColorLogic colors) {
        if (record.checkIn() == null && record.checkOut() == null) {
            return PunchColors.none();
        }
        String inColor = null;
        if (record.checkIn() != null) {
            inColor = isLate(record.checkIn(), rule) ? colors.abnormalInColor() : colors.normalInColor();
        }
        String outColor = null;
        if (record.checkOut() != null) {
            outColor = switch (regime) {
                case INTERNAL -> isEarly(record.checkOut(), rule) ? colors.abnormalOutColor() : colors.normalOutColor();
                case EXTERNAL -> colors.normalOutColor();
            };
        }
        return new PunchColors(enabledOrNull(inColor), enabledOrNull(outColor));
    }

    private static AttendanceStatus internalStatus(LocalTime checkIn, LocalTime checkOut, TimeRule rule) {
        boolean late = checkIn != null && isLate(checkIn, rule);
        boolean early = checkOut != null && isEarly(checkOut, rule);
        if (late && early) {
            return AttendanceStatus.ABNORMAL;
        }
        if (late) {
            return AttendanceStatus.LATE;
        }
        if (early) {
            return AttendanceStatus.EARLY_LEAVE;
        }
        return AttendanceStatus.NORMAL;
    }

    // Check-out time is never penalised for field staff.
    private static AttendanceStatus externalStatus(LocalTime checkIn, TimeRule rule) {
        boolean late = checkIn != null && isLate(checkIn, rule);
        return late ? AttendanceStatus.LATE : AttendanceStatus.NORMAL;
    }

    private static boolean isLate(LocalTime checkIn, TimeRule rule) {
        return checkIn.isAfter(rule.inEnd());
    }

    private static boolean isEarly(LocalTime checkOut, TimeRule rule) {
        return checkOut.isBefore(rule.outStart());
    }

    private static String enabledOrNull(String color) {
        return ColorLogic.isDisabled(color) ? null : color;
    }
}
