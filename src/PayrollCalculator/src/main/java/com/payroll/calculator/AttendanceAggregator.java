package com.payroll.calculator;

import com.payroll.calculator.model.AttendanceRecord;
import com.payroll.calculator.model.AttendanceTotals;

import java.time.YearMonth;
import java.util.Collection;
import java.util.Objects;

/**
 * Sums daily attendance into the totals a payroll calculation runs on.
 *
 * <p>Hour fields that are missing or unreadable on a record count as zero hours. That is a
 * deliberate default for open days and partially keyed rows, applied through
 * {@link com.payroll.calculator.model.HourValue#orZero()}, not a silent drop of the record.
 * Negative hours are not coerced and fail construction of the totals.
 */
public final class AttendanceAggregator {

    private AttendanceAggregator() {}

    public static AttendanceTotals aggregate(Collection<AttendanceRecord> records) {
        Objects.requireNonNull(records, "records");
        return records.stream()
            .filter(Objects::nonNull)
            .map(AttendanceAggregator::toTotals)
            .reduce(AttendanceTotals.ZERO, AttendanceAggregator::add);
    }

    /**
     * Sums only the records dated within {@code month}. Undated records are left out.
     */
    public static AttendanceTotals aggregate(Collection<AttendanceRecord> records, YearMonth month) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(month, "month");
        return records.stream()
            .filter(Objects::nonNull)
            .filter(r -> r.getDate() != null && YearMonth.from(r.getDate()).equals(month))
            .map(AttendanceAggregator::toTotals)
            .reduce(AttendanceTotals.ZERO, AttendanceAggregator::add);
    }

    private static AttendanceTotals toTotals(AttendanceRecord record) {
        return new AttendanceTotals(
            record.getWorkHours().orZero(),
            record.getOvertimeHours().orZero(),
            record.getNightHours().orZero(),
            record.getHolidayHours().orZero());
    }

    private static AttendanceTotals add(AttendanceTotals a, AttendanceTotals b) {
        return new AttendanceTotals(
            a.getWorkHours().add(b.getWorkHours()),
            a.getOvertimeHours().add(b.getOvertimeHours()),
            a.getNightHours().add(b.getNightHours()),
            a.getHolidayHours().add(b.getHolidayHours()));
    }
}
