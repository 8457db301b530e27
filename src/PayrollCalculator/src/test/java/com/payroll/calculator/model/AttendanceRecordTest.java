package com.payroll.calculator.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttendanceRecordTest {

    private static final LocalDate DAY = LocalDate.of(2024, 4, 1);

    @Test
    void validate_passesAbsentAndNonNegativeFigures() {
        AttendanceRecord record = AttendanceRecord.fromRaw(DAY, 8, "n/a", null, 0);

        assertThat(record.validate()).isSameAs(record);
    }

    @Test
    void validate_namesTheNegativeField() {
        assertThatThrownBy(() -> AttendanceRecord.fromRaw(DAY, 8, 0, "-0.5", 0).validate())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nightHours");
        assertThatThrownBy(() -> AttendanceRecord.fromRaw(DAY, -8, 0, 0, 0).validate())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("workHours");
    }
}
