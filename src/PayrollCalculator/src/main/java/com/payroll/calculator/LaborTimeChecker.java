package com.payroll.calculator;

import com.payroll.calculator.LaborTimeViolation.Severity;
import com.payroll.calculator.LaborTimeViolation.Type;
import com.payroll.calculator.model.AttendanceTotals;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags monthly totals over the Article 36 agreement limits. Informational only: a violation
 * never changes what is paid.
 */
public final class LaborTimeChecker {

    static final BigDecimal OVERTIME_LIMIT = new BigDecimal("45");
    static final BigDecimal OVERTIME_HARD_LIMIT = new BigDecimal("80");
    static final BigDecimal TOTAL_LIMIT = new BigDecimal("100");

    private LaborTimeChecker() {}

    public static List<LaborTimeViolation> check(AttendanceTotals totals) {
        List<LaborTimeViolation> violations = new ArrayList<>();

        BigDecimal overtime = totals.getOvertimeHours();
        if (overtime.compareTo(OVERTIME_LIMIT) > 0) {
            Severity severity = overtime.compareTo(OVERTIME_HARD_LIMIT) > 0 ? Severity.ERROR : Severity.WARNING;
            violations.add(new LaborTimeViolation(Type.MONTHLY_OVERTIME_LIMIT, severity, overtime, OVERTIME_LIMIT));
        }

        // Compared against total work hours, the way attendance reports have always flagged it
        BigDecimal work = totals.getWorkHours();
        if (work.compareTo(TOTAL_LIMIT) > 0) {
            violations.add(new LaborTimeViolation(Type.MONTHLY_TOTAL_LIMIT, Severity.ERROR, work, TOTAL_LIMIT));
        }

        return violations;
    }
}
