package com.payroll.calculator.time;

import com.payroll.calculator.model.AttendanceRecord;
import com.payroll.calculator.model.HourValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Derives one day's hour figures from its clock-in, clock-out and break times under the Labor
 * Standards Act: statutory minimum breaks, overtime past 8 hours, the 22:00-05:00 night band and
 * work on Sundays or national holidays.
 *
 * <p>Everything is counted in whole minutes and converted to hours at two decimals at the end.
 */
public final class WorkTimeCalculator {

    static final long STANDARD_DAILY_MINUTES = 8 * 60;

    private static final long LONG_DAY_MINUTES = 8 * 60;
    private static final long LONG_DAY_BREAK_MINUTES = 60;
    private static final long MEDIUM_DAY_MINUTES = 6 * 60;
    private static final long MEDIUM_DAY_BREAK_MINUTES = 45;

    private static final int NIGHT_START_HOUR = 22;
    private static final int NIGHT_END_HOUR = 5;

    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    private WorkTimeCalculator() {}

    /**
     * Builds the attendance record for a finished day. Break times are optional and only count when
     * both are present.
     */
    public static AttendanceRecord dailyRecord(LocalDate date, LocalDateTime clockIn, LocalDateTime clockOut,
                                               LocalDateTime breakStart, LocalDateTime breakEnd) {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(clockIn, "clockIn");
        Objects.requireNonNull(clockOut, "clockOut");

        long workMinutes = workMinutes(clockIn, clockOut, breakStart, breakEnd);
        long overtimeMinutes = Math.max(0, workMinutes - STANDARD_DAILY_MINUTES);
        long nightMinutes = nightMinutes(clockIn, clockOut);
        long holidayMinutes = JapaneseHolidayCalendar.isHoliday(date) ? workMinutes(clockIn, clockOut, null, null) : 0;

        return new AttendanceRecord(date,
            HourValue.of(toHours(workMinutes)),
            HourValue.of(toHours(overtimeMinutes)),
            HourValue.of(toHours(nightMinutes)),
            HourValue.of(toHours(holidayMinutes)));
    }

    public static BigDecimal workHours(LocalDateTime clockIn, LocalDateTime clockOut,
                                       LocalDateTime breakStart, LocalDateTime breakEnd) {
        return toHours(workMinutes(clockIn, clockOut, breakStart, breakEnd));
    }

    public static BigDecimal overtimeHours(BigDecimal workHours) {
        BigDecimal standard = toHours(STANDARD_DAILY_MINUTES);
        return workHours.subtract(standard).max(BigDecimal.ZERO);
    }

    public static BigDecimal nightHours(LocalDateTime clockIn, LocalDateTime clockOut) {
        return toHours(nightMinutes(clockIn, clockOut));
    }

    /**
     * The whole working time of a day on a Sunday or national holiday, zero on other days.
     * Recorded breaks are ignored; statutory ones still apply.
     */
    public static BigDecimal holidayHours(LocalDateTime clockIn, LocalDateTime clockOut, LocalDate date) {
        if (!JapaneseHolidayCalendar.isHoliday(date)) return BigDecimal.ZERO.setScale(2);
        return toHours(workMinutes(clockIn, clockOut, null, null));
    }

    /**
     * Worked minutes after breaks. When the recorded break falls short of the statutory minimum for
     * the day's length (45 minutes past 6 hours, 60 minutes past 8 hours) the minimum is deducted
     * instead.
     */
    static long workMinutes(LocalDateTime clockIn, LocalDateTime clockOut,
                            LocalDateTime breakStart, LocalDateTime breakEnd) {
        long totalMinutes = Duration.between(clockIn, clockOut).toMinutes();
        long breakMinutes = 0;
        if (breakStart != null && breakEnd != null) {
            breakMinutes = Duration.between(breakStart, breakEnd).toMinutes();
        }

        long worked = totalMinutes - breakMinutes;
        if (worked > LONG_DAY_MINUTES && breakMinutes < LONG_DAY_BREAK_MINUTES) {
            return Math.max(0, totalMinutes - LONG_DAY_BREAK_MINUTES);
        }
        if (worked > MEDIUM_DAY_MINUTES && breakMinutes < MEDIUM_DAY_BREAK_MINUTES) {
            return Math.max(0, totalMinutes - MEDIUM_DAY_BREAK_MINUTES);
        }
        return Math.max(0, worked);
    }

    /** Minutes between clock-in and clock-out that fall in 22:00-05:00, across midnight if needed. */
    static long nightMinutes(LocalDateTime clockIn, LocalDateTime clockOut) {
        long minutes = 0;
        LocalDateTime current = clockIn;
        while (current.isBefore(clockOut)) {
            LocalDateTime nextHour = current.truncatedTo(ChronoUnit.HOURS).plusHours(1);
            LocalDateTime segmentEnd = nextHour.isAfter(clockOut) ? clockOut : nextHour;
            if (isNightHour(current.toLocalTime())) {
                minutes += Duration.between(current, segmentEnd).toMinutes();
            }
            current = segmentEnd;
        }
        return minutes;
    }

    /** {@code HH:mm}, minutes rounded half up. */
    public static String formatHours(BigDecimal hours) {
        long totalMinutes = hours.multiply(MINUTES_PER_HOUR).setScale(0, RoundingMode.HALF_UP).longValue();
        return String.format("%02d:%02d", totalMinutes / 60, totalMinutes % 60);
    }

    private static boolean isNightHour(LocalTime time) {
        int hour = time.getHour();
        return hour >= NIGHT_START_HOUR || hour < NIGHT_END_HOUR;
    }

    private static BigDecimal toHours(long minutes) {
        return BigDecimal.valueOf(minutes).divide(MINUTES_PER_HOUR, 2, RoundingMode.HALF_UP);
    }
}
