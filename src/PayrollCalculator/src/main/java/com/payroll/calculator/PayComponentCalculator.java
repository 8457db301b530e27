package com.payroll.calculator;

import com.payroll.calculator.model.AttendanceTotals;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * Earnings line items that depend on hours worked. Each item is rounded to a whole yen once,
 * after its parts are summed.
 */
public class PayComponentCalculator {

    private final RateTable rates;

    public PayComponentCalculator(RateTable rates) {
        this.rates = Objects.requireNonNull(rates, "rates");
    }

    /** Hourly rate over the table's standard monthly hours (20 days of 8 hours). */
    public BigDecimal hourlyRate(BigDecimal baseSalary) {
        return hourlyRate(baseSalary, rates.getStandardMonthlyHours());
    }

    /**
     * Not rounded; the premiums computed from it are.
     */
    public BigDecimal hourlyRate(BigDecimal baseSalary, BigDecimal standardMonthlyHours) {
        if (standardMonthlyHours.signum() <= 0) {
            throw new IllegalArgumentException("standardMonthlyHours must be positive: " + standardMonthlyHours);
        }
        return baseSalary.divide(standardMonthlyHours, MathContext.DECIMAL64);
    }

    public BigDecimal overtimePay(AttendanceTotals totals, BigDecimal hourlyRate) {
        return overtimePay(totals, hourlyRate, rates.getOvertimeRates().getNormal());
    }

    /**
     * Hours up to the monthly threshold are paid at {@code normalRate}; hours beyond it at the
     * table's extended rate, whatever {@code normalRate} is.
     */
    public BigDecimal overtimePay(AttendanceTotals totals, BigDecimal hourlyRate, BigDecimal normalRate) {
        BigDecimal threshold = rates.getExtendedOvertimeThresholdHours();
        BigDecimal overtime = totals.getOvertimeHours();

        BigDecimal normalHours = overtime.min(threshold);
        BigDecimal extendedHours = overtime.subtract(threshold).max(BigDecimal.ZERO);

        BigDecimal normalPay = normalHours.multiply(hourlyRate).multiply(normalRate);
        BigDecimal extendedPay = extendedHours.multiply(hourlyRate).multiply(rates.getOvertimeRates().getExtended());

        return Yen.round(normalPay.add(extendedPay));
    }

    public BigDecimal nightPay(AttendanceTotals totals, BigDecimal hourlyRate) {
        return nightPay(totals, hourlyRate, rates.getOvertimeRates().getNight());
    }

    /**
     * Only the premium part of {@code nightRate} is paid here; the hour itself is already covered
     * by base or overtime pay.
     */
    public BigDecimal nightPay(AttendanceTotals totals, BigDecimal hourlyRate, BigDecimal nightRate) {
        BigDecimal premium = nightRate.subtract(BigDecimal.ONE);
        return Yen.round(totals.getNightHours().multiply(hourlyRate).multiply(premium));
    }

    public BigDecimal holidayPay(AttendanceTotals totals, BigDecimal hourlyRate) {
        return holidayPay(totals, hourlyRate, rates.getOvertimeRates().getHoliday());
    }

    public BigDecimal holidayPay(AttendanceTotals totals, BigDecimal hourlyRate, BigDecimal holidayRate) {
        return Yen.round(totals.getHolidayHours().multiply(hourlyRate).multiply(holidayRate));
    }
}
