package com.payroll.calculator.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One day of attendance. Any of the hour fields may be absent.
 */
public final class AttendanceRecord {

    private final LocalDate date;
    private final HourValue workHours;
    private final HourValue overtimeHours;
    private final HourValue nightHours;
    private final HourValue holidayHours;

    public AttendanceRecord(LocalDate date, HourValue workHours, HourValue overtimeHours,
                            HourValue nightHours, HourValue holidayHours) {
        this.date = date;
        this.workHours = orAbsent(workHours);
        this.overtimeHours = orAbsent(overtimeHours);
        this.nightHours = orAbsent(nightHours);
        this.holidayHours = orAbsent(holidayHours);
    }

    /**
     * Builds a record from untyped column values, see {@link HourValue#parse(Object)}.
     */
    public static AttendanceRecord fromRaw(LocalDate date, Object workHours, Object overtimeHours,
                                           Object nightHours, Object holidayHours) {
        return new AttendanceRecord(date,
            HourValue.parse(workHours),
            HourValue.parse(overtimeHours),
            HourValue.parse(nightHours),
            HourValue.parse(holidayHours));
    }

    /**
     * Checks the figures that are present; absent ones read as zero and always pass.
     *
     * @return this record
     * @throws IllegalArgumentException if a present hour figure is negative
     */
    public AttendanceRecord validate() {
        workHours.value().ifPresent(v -> Amounts.requireNonNegative(v, "workHours"));
        overtimeHours.value().ifPresent(v -> Amounts.requireNonNegative(v, "overtimeHours"));
        nightHours.value().ifPresent(v -> Amounts.requireNonNegative(v, "nightHours"));
        holidayHours.value().ifPresent(v -> Amounts.requireNonNegative(v, "holidayHours"));
        return this;
    }

    private static HourValue orAbsent(HourValue value) {
        return value != null ? value : HourValue.absent();
    }

    /** May be null when the source row carries no date. */
    public LocalDate getDate() { return date; }

    public HourValue getWorkHours() { return workHours; }

    public HourValue getOvertimeHours() { return overtimeHours; }

    public HourValue getNightHours() { return nightHours; }

    public HourValue getHolidayHours() { return holidayHours; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttendanceRecord)) return false;
        AttendanceRecord that = (AttendanceRecord) o;
        return Objects.equals(date, that.date)
            && workHours.equals(that.workHours)
            && overtimeHours.equals(that.overtimeHours)
            && nightHours.equals(that.nightHours)
            && holidayHours.equals(that.holidayHours);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, workHours, overtimeHours, nightHours, holidayHours);
    }

    @Override
    public String toString() {
        return "AttendanceRecord{date=" + date + ", work=" + workHours + ", overtime=" + overtimeHours
            + ", night=" + nightHours + ", holiday=" + holidayHours + '}';
    }
}
