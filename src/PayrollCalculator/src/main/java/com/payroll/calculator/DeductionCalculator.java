package com.payroll.calculator;

import com.payroll.calculator.RateTable.TaxBracket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Statutory deductions withheld from a monthly salary.
 *
 * <p>Insurance is charged on gross salary directly; the standard monthly remuneration grades are
 * not applied. Income tax uses the simplified bracket table rather than the full withholding table.
 */
public class DeductionCalculator {

    private static final Logger log = LoggerFactory.getLogger(DeductionCalculator.class);

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final RateTable rates;

    public DeductionCalculator(RateTable rates) {
        this.rates = Objects.requireNonNull(rates, "rates");
    }

    /** Employee half of health insurance. */
    public BigDecimal healthInsurance(BigDecimal grossSalary) {
        return employeeHalf(grossSalary, rates.getInsuranceRates().getHealth());
    }

    /** Employee half of employees' pension insurance. */
    public BigDecimal pensionInsurance(BigDecimal grossSalary) {
        return employeeHalf(grossSalary, rates.getInsuranceRates().getPension());
    }

    /** The listed employment insurance rate is the employee's share, so it is not halved. */
    public BigDecimal employmentInsurance(BigDecimal grossSalary) {
        return Yen.round(grossSalary.multiply(rates.getInsuranceRates().getEmployment()));
    }

    /** Long-term care insurance, charged from the table's minimum age on. */
    public BigDecimal longCareInsurance(BigDecimal grossSalary, int age) {
        if (age < rates.getLongCareMinimumAge()) return BigDecimal.ZERO;
        return employeeHalf(grossSalary, rates.getInsuranceRates().getLongCare());
    }

    /**
     * Withholding on {@code taxableIncome} after the per-dependent deduction, from the first
     * bracket whose {@code [min, max)} range holds the adjusted income.
     */
    public BigDecimal incomeTax(BigDecimal taxableIncome, int dependents) {
        BigDecimal dependentDeduction = rates.getDependentDeduction().multiply(BigDecimal.valueOf(dependents));
        BigDecimal adjustedIncome = taxableIncome.subtract(dependentDeduction).max(BigDecimal.ZERO);

        for (TaxBracket bracket : rates.getIncomeTaxBrackets()) {
            if (bracket.contains(adjustedIncome)) {
                return Yen.round(adjustedIncome.multiply(bracket.getRate()).subtract(bracket.getDeduction()));
            }
        }

        // Only reachable with a table whose first bracket starts above zero
        log.warn("No income tax bracket in table {} covers {}; withholding 0",
            rates.getVersion(), adjustedIncome.toPlainString());
        return BigDecimal.ZERO;
    }

    private static BigDecimal employeeHalf(BigDecimal grossSalary, BigDecimal rate) {
        return Yen.round(grossSalary.multiply(rate).divide(TWO));
    }
}
