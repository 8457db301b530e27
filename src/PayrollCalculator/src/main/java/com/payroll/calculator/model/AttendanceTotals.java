package com.payroll.calculator.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Hour totals over a date range, usually one calendar month. Every field is zero or positive.
 */
public final class AttendanceTotals {

    public static final AttendanceTotals ZERO =
        new AttendanceTotals(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    private final BigDecimal workHours;
    private final BigDecimal overtimeHours;
    private final BigDecimal nightHours;
    private final BigDecimal holidayHours;

    public AttendanceTotals(BigDecimal workHours, BigDecimal overtimeHours,
                            BigDecimal nightHours, BigDecimal holidayHours) {
        this.workHours = Amounts.requireNonNegative(workHours, "workHours");
        this.overtimeHours = Amounts.requireNonNegative(overtimeHours, "overtimeHours");
        this.nightHours = Amounts.requireNonNegative(nightHours, "nightHours");
        this.holidayHours = Amounts.requireNonNegative(holidayHours, "holidayHours");
    }

    public static AttendanceTotals of(double workHours, double overtimeHours,
                                      double nightHours, double holidayHours) {
        return new AttendanceTotals(BigDecimal.valueOf(workHours), BigDecimal.valueOf(overtimeHours),
            BigDecimal.valueOf(nightHours), BigDecimal.valueOf(holidayHours));
    }

    public BigDecimal getWorkHours() { return workHours; }

    public BigDecimal getOvertimeHours() { return overtimeHours; }

    public BigDecimal getNightHours() { return nightHours; }

    public BigDecimal getHolidayHours() { return holidayHours; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttendanceTotals)) return false;
        AttendanceTotals that = (AttendanceTotals) o;
        return workHours.compareTo(that.workHours) == 0
            && overtimeHours.compareTo(that.overtimeHours) == 0
            && nightHours.compareTo(that.nightHours) == 0
            && holidayHours.compareTo(that.holidayHours) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(workHours.stripTrailingZeros(), overtimeHours.stripTrailingZeros(),
            nightHours.stripTrailingZeros(), holidayHours.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return "AttendanceTotals{work=" + workHours.toPlainString()
            + ", overtime=" + overtimeHours.toPlainString()
            + ", night=" + nightHours.toPlainString()
            + ", holiday=" + holidayHours.toPlainString() + '}';
    }
}
