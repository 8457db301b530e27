package com.payroll.calculator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

public final class SalaryConversions {

    /** Ordinary monthly payments in a year, no bonus months. */
    public static final int MONTHS_PER_YEAR = 12;

    private SalaryConversions() {}

    public static BigDecimal monthlyFromAnnual(BigDecimal annualSalary) {
        return monthlyFromAnnual(annualSalary, MONTHS_PER_YEAR);
    }

    /**
     * Monthly salary from an annual figure spread over {@code months} payments. Contracts that
     * include bonuses use 14 to 16 payments.
     */
    public static BigDecimal monthlyFromAnnual(BigDecimal annualSalary, int months) {
        Objects.requireNonNull(annualSalary, "annualSalary");
        if (months <= 0) {
            throw new IllegalArgumentException("months must be positive: " + months);
        }
        return annualSalary.divide(BigDecimal.valueOf(months), 0, RoundingMode.HALF_UP);
    }
}
