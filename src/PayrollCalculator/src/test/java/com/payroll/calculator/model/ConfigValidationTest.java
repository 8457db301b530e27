package com.payroll.calculator.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigValidationTest {

    @Test
    void salaryConfig_defaultsAllowancesToZeroAndOverridesToAbsent() {
        SalaryConfig salary = SalaryConfig.ofBaseSalary(300000);

        assertThat(salary.getBaseSalary()).isEqualByComparingTo("300000");
        assertThat(salary.getTransportAllowance()).isEqualByComparingTo("0");
        assertThat(salary.getFamilyAllowance()).isEqualByComparingTo("0");
        assertThat(salary.getHousingAllowance()).isEqualByComparingTo("0");
        assertThat(salary.getPositionAllowance()).isEqualByComparingTo("0");
        assertThat(salary.getSkillAllowance()).isEqualByComparingTo("0");
        assertThat(salary.getOtherAllowances()).isEqualByComparingTo("0");
        assertThat(salary.getHourlyRate()).isEmpty();
        assertThat(salary.getOvertimeRate()).isEmpty();
        assertThat(salary.getNightRate()).isEmpty();
        assertThat(salary.getHolidayRate()).isEmpty();
    }

    @Test
    void salaryConfig_rejectsNegativeAmounts() {
        assertThatThrownBy(() -> SalaryConfig.ofBaseSalary(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseSalary");
        assertThatThrownBy(() -> SalaryConfig.builder(300000).housingAllowance(-500).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("housingAllowance");
        assertThatThrownBy(() -> SalaryConfig.builder(300000).nightRate(new BigDecimal("-1.25")).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nightRate");
    }

    @Test
    void salaryConfig_requiresBaseSalary() {
        assertThatThrownBy(() -> SalaryConfig.builder((BigDecimal) null).build())
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void attendanceTotals_rejectsNegativeHours() {
        assertThatThrownBy(() -> AttendanceTotals.of(160, -1, 0, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("overtimeHours");
    }

    @Test
    void attendanceTotals_equalityIgnoresScale() {
        assertThat(AttendanceTotals.of(8, 0, 0, 0))
            .isEqualTo(new AttendanceTotals(new BigDecimal("8.00"), BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO));
    }

    @Test
    void salaryConfig_equalityIgnoresScale() {
        SalaryConfig plain = SalaryConfig.builder(300000).hourlyRate(new BigDecimal("2000")).build();
        SalaryConfig scaled = SalaryConfig.builder(new BigDecimal("300000.00"))
            .transportAllowance(new BigDecimal("0.0"))
            .hourlyRate(new BigDecimal("2000.000"))
            .build();

        assertThat(scaled).isEqualTo(plain);
        assertThat(scaled.hashCode()).isEqualTo(plain.hashCode());
        assertThat(scaled).isNotEqualTo(SalaryConfig.ofBaseSalary(300000));
    }

    @Test
    void taxConfig_rejectsNegativeDependentsAndAge() {
        assertThatThrownBy(() -> new TaxConfig(-1, false, 30)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TaxConfig(0, false, -30)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void taxConfig_ageIsDifferenceOfCalendarYears() {
        assertThat(TaxConfig.ageInYear(LocalDate.of(1985, 12, 31), 2025)).isEqualTo(40);
        assertThat(TaxConfig.ageInYear(LocalDate.of(1985, 1, 1), 2025)).isEqualTo(40);
        assertThat(TaxConfig.ageInYear(LocalDate.of(2030, 1, 1), 2025)).isZero();
    }
}
