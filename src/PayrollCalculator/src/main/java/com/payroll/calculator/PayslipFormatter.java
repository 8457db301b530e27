package com.payroll.calculator;

import com.payroll.calculator.model.PayrollResult;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * Plain-text payslip in Japanese, as printed on the payslip sheet.
 */
public final class PayslipFormatter {

    private static final String RULE = "────────────────";

    private PayslipFormatter() {}

    public static String format(PayrollResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== 給与明細 ===\n");

        sb.append("【支給項目】\n");
        yen(sb, "基本給", result.getBaseSalary());
        yen(sb, "残業手当", result.getOvertimePay());
        yen(sb, "深夜手当", result.getNightPay());
        yen(sb, "休日手当", result.getHolidayPay());
        yen(sb, "通勤手当", result.getTransportAllowance());
        yen(sb, "家族手当", result.getFamilyAllowance());
        yen(sb, "住宅手当", result.getHousingAllowance());
        yen(sb, "職位手当", result.getPositionAllowance());
        yen(sb, "技能手当", result.getSkillAllowance());
        yen(sb, "その他手当", result.getOtherAllowances());
        sb.append(RULE).append('\n');
        yen(sb, "総支給額", result.getGrossSalary());

        sb.append("\n【控除項目】\n");
        yen(sb, "健康保険料", result.getHealthInsurance());
        yen(sb, "厚生年金保険料", result.getPensionInsurance());
        yen(sb, "雇用保険料", result.getEmploymentInsurance());
        yen(sb, "介護保険料", result.getLongCareInsurance());
        yen(sb, "所得税", result.getIncomeTax());
        yen(sb, "住民税", result.getResidenceTax());
        yen(sb, "その他控除", result.getOtherDeductions());
        sb.append(RULE).append('\n');
        yen(sb, "総控除額", result.getTotalDeductions());

        sb.append("\n【差引支給額】\n");
        yen(sb, "手取り額", result.getNetSalary());

        sb.append("\n【労働時間】\n");
        hours(sb, "労働時間", result.getWorkHours());
        hours(sb, "残業時間", result.getOvertimeHours());
        hours(sb, "深夜時間", result.getNightHours());
        hours(sb, "休日時間", result.getHolidayHours());

        return sb.toString().trim();
    }

    private static void yen(StringBuilder sb, String label, BigDecimal amount) {
        // NumberFormat is not thread-safe
        NumberFormat grouped = NumberFormat.getNumberInstance(Locale.JAPAN);
        sb.append(label).append(": ").append(grouped.format(amount)).append("円\n");
    }

    private static void hours(StringBuilder sb, String label, BigDecimal value) {
        sb.append(label).append(": ").append(value.stripTrailingZeros().toPlainString()).append("時間\n");
    }
}
