package com.payroll.calculator;

import com.payroll.calculator.model.AttendanceRecord;
import com.payroll.calculator.model.AttendanceTotals;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class AttendanceAggregatorTest {

    @Test
    void aggregate_emptyInputIsAllZero() {
        AttendanceTotals totals = AttendanceAggregator.aggregate(Collections.emptyList());

        assertThat(totals).isEqualTo(AttendanceTotals.ZERO);
    }

    @Test
    void aggregate_identicalDaysMultiply() {
        List<AttendanceRecord> records = new ArrayList<>();
        LocalDate day = LocalDate.of(2024, 4, 1);
        for (int i = 0; i < 20; i++) {
            records.add(AttendanceRecord.fromRaw(day.plusDays(i), 8, null, null, null));
        }

        AttendanceTotals totals = AttendanceAggregator.aggregate(records);

        assertThat(totals.getWorkHours()).isEqualByComparingTo("160");
        assertThat(totals.getOvertimeHours()).isEqualByComparingTo("0");
    }

    @Test
    void aggregate_sumsEveryHourField() {
        List<AttendanceRecord> records = Arrays.asList(
            AttendanceRecord.fromRaw(LocalDate.of(2024, 4, 1), "9.5", "1.5", "0", "0"),
            AttendanceRecord.fromRaw(LocalDate.of(2024, 4, 2), 10, 2, 1.25, null),
            AttendanceRecord.fromRaw(LocalDate.of(2024, 4, 7), 6, 0, 0, 6));

        AttendanceTotals totals = AttendanceAggregator.aggregate(records);

        assertThat(totals.getWorkHours()).isEqualByComparingTo("25.5");
        assertThat(totals.getOvertimeHours()).isEqualByComparingTo("3.5");
        assertThat(totals.getNightHours()).isEqualByComparingTo("1.25");
        assertThat(totals.getHolidayHours()).isEqualByComparingTo("6");
    }

    @Test
    void aggregate_coercesMissingAndUnreadableHoursToZero() {
        List<AttendanceRecord> records = Arrays.asList(
            AttendanceRecord.fromRaw(LocalDate.of(2024, 4, 1), null, null, null, null),
            AttendanceRecord.fromRaw(LocalDate.of(2024, 4, 2), "abc", "", "NaN", new Object()),
            AttendanceRecord.fromRaw(LocalDate.of(2024, 4, 3), "8", "1", null, null),
            null);

        AttendanceTotals totals = AttendanceAggregator.aggregate(records);

        assertThat(totals).isEqualTo(AttendanceTotals.of(8, 1, 0, 0));
    }

    @Test
    void aggregate_doesNotChangeItsInput() {
        List<AttendanceRecord> records = List.of(
            AttendanceRecord.fromRaw(LocalDate.of(2024, 4, 1), 8, 1, 0, 0));

        AttendanceAggregator.aggregate(records);
        AttendanceTotals again = AttendanceAggregator.aggregate(records);

        assertThat(again).isEqualTo(AttendanceTotals.of(8, 1, 0, 0));
    }

    @Test
    void aggregate_byMonthSkipsOtherMonthsAndUndatedRecords() {
        List<AttendanceRecord> records = Arrays.asList(
            AttendanceRecord.fromRaw(LocalDate.of(2024, 3, 31), 8, 0, 0, 0),
            AttendanceRecord.fromRaw(LocalDate.of(2024, 4, 1), 8, 2, 0, 0),
            AttendanceRecord.fromRaw(LocalDate.of(2024, 4, 30), 8, 0, 3, 0),
            AttendanceRecord.fromRaw(null, 8, 0, 0, 0));

        AttendanceTotals april = AttendanceAggregator.aggregate(records, YearMonth.of(2024, 4));

        assertThat(april).isEqualTo(AttendanceTotals.of(16, 2, 3, 0));
    }

    @Test
    void aggregate_rejectsNegativeHours() {
        List<AttendanceRecord> records = List.of(
            AttendanceRecord.fromRaw(LocalDate.of(2024, 4, 1), -8, 0, 0, 0));

        assertThatThrownBy(() -> AttendanceAggregator.aggregate(records))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void aggregate_extremeExponentsCountAsZeroAndReturnPromptly() {
        LocalDate day = LocalDate.of(2024, 4, 1);
        List<AttendanceRecord> records = Arrays.asList(
            AttendanceRecord.fromRaw(day, "1e30000000", 0, 0, 0),
            AttendanceRecord.fromRaw(day.plusDays(1), 8, "1e-30000000", 0, 0),
            AttendanceRecord.fromRaw(day.plusDays(2), "1e999999999", 0, 0, 0));

        AttendanceTotals totals = assertTimeoutPreemptively(Duration.ofSeconds(5),
            () -> AttendanceAggregator.aggregate(records));

        assertThat(totals).isEqualTo(AttendanceTotals.of(8, 0, 0, 0));
    }
}
