package com.payroll.calculator;

import com.payroll.calculator.model.AttendanceTotals;
import com.payroll.calculator.model.PayrollResult;
import com.payroll.calculator.model.SalaryConfig;
import com.payroll.calculator.model.TaxConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PayslipFormatterTest {

    private final PayrollResult result = new PayrollEngine().calculate(
        AttendanceTotals.of(170, 10, 0, 0), SalaryConfig.ofBaseSalary(300000), new TaxConfig(0, false, 30));

    @Test
    void format_groupsYenAmounts() {
        String text = PayslipFormatter.format(result);

        assertThat(text).startsWith("=== 給与明細 ===");
        assertThat(text).contains("基本給: 300,000円");
        assertThat(text).contains("総支給額: 323,438円");
        assertThat(text).contains("総控除額: 42,722円");
        assertThat(text).contains("手取り額: 280,716円");
        assertThat(text).contains("住民税: 0円");
    }

    @Test
    void format_listsSectionsInOrder() {
        String text = PayslipFormatter.format(result);

        assertThat(text).containsSubsequence("【支給項目】", "【控除項目】", "【差引支給額】", "【労働時間】");
    }

    @Test
    void format_printsHoursWithoutTrailingZeros() {
        PayrollResult fractional = new PayrollEngine().calculate(
            AttendanceTotals.of(162.50, 2.25, 0, 0), SalaryConfig.ofBaseSalary(300000), new TaxConfig(0, false, 30));

        String text = PayslipFormatter.format(fractional);

        assertThat(text).contains("労働時間: 162.5時間");
        assertThat(text).contains("残業時間: 2.25時間");
        assertThat(text).contains("深夜時間: 0時間");
        assertThat(text).doesNotEndWith("\n");
    }
}
