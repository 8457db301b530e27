package com.payroll.calculator;

import com.payroll.calculator.model.AttendanceTotals;
import com.payroll.calculator.model.PayrollResult;
import com.payroll.calculator.model.SalaryConfig;
import com.payroll.calculator.model.TaxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a month's attendance totals and an employee's salary and tax settings into an itemized
 * paycheck.
 *
 * <p>The engine holds nothing but its rate table, so one instance can serve any number of
 * threads. Residence tax depends on the previous year's income, which is not modeled here, and is
 * always withheld as zero, as are other deductions.
 */
public class PayrollEngine {

    private static final Logger log = LoggerFactory.getLogger(PayrollEngine.class);

    private final RateTable rates;
    private final PayComponentCalculator payComponents;
    private final DeductionCalculator deductions;

    public PayrollEngine() {
        this(RateTable.standard());
    }

    public PayrollEngine(RateTable rates) {
        this.rates = Objects.requireNonNull(rates, "rates");
        this.payComponents = new PayComponentCalculator(rates);
        this.deductions = new DeductionCalculator(rates);
    }

    public RateTable getRateTable() { return rates; }

    public PayrollResult calculate(AttendanceTotals totals, SalaryConfig salary, TaxConfig tax) {
        Objects.requireNonNull(totals, "totals");
        Objects.requireNonNull(salary, "salary");
        Objects.requireNonNull(tax, "tax");

        BigDecimal hourlyRate = override(salary.getHourlyRate())
            .orElseGet(() -> payComponents.hourlyRate(salary.getBaseSalary()));

        // Earnings
        BigDecimal baseSalary = salary.getBaseSalary();
        BigDecimal overtimePay = payComponents.overtimePay(totals, hourlyRate,
            override(salary.getOvertimeRate()).orElse(rates.getOvertimeRates().getNormal()));
        BigDecimal nightPay = payComponents.nightPay(totals, hourlyRate,
            override(salary.getNightRate()).orElse(rates.getOvertimeRates().getNight()));
        BigDecimal holidayPay = payComponents.holidayPay(totals, hourlyRate,
            override(salary.getHolidayRate()).orElse(rates.getOvertimeRates().getHoliday()));

        BigDecimal grossSalary = baseSalary
            .add(overtimePay)
            .add(nightPay)
            .add(holidayPay)
            .add(salary.getTransportAllowance())
            .add(salary.getFamilyAllowance())
            .add(salary.getHousingAllowance())
            .add(salary.getPositionAllowance())
            .add(salary.getSkillAllowance())
            .add(salary.getOtherAllowances());

        // Social insurance
        BigDecimal healthInsurance = deductions.healthInsurance(grossSalary);
        BigDecimal pensionInsurance = deductions.pensionInsurance(grossSalary);
        BigDecimal employmentInsurance = deductions.employmentInsurance(grossSalary);
        BigDecimal longCareInsurance = deductions.longCareInsurance(grossSalary, tax.getAge());
        BigDecimal socialInsurance = healthInsurance
            .add(pensionInsurance)
            .add(employmentInsurance)
            .add(longCareInsurance);

        BigDecimal taxableIncome = grossSalary.subtract(socialInsurance);
        BigDecimal incomeTax = deductions.incomeTax(taxableIncome, tax.getDependents());

        BigDecimal residenceTax = BigDecimal.ZERO;
        BigDecimal otherDeductions = BigDecimal.ZERO;

        BigDecimal totalDeductions = socialInsurance
            .add(incomeTax)
            .add(residenceTax)
            .add(otherDeductions);
        BigDecimal netSalary = grossSalary.subtract(totalDeductions);

        log.debug("Payroll calculated: rates={}, hourlyRate={}, gross={}, deductions={}, net={}",
            rates.getVersion(), hourlyRate, grossSalary, totalDeductions, netSalary);

        return PayrollResult.builder()
            .baseSalary(baseSalary)
            .overtimePay(overtimePay)
            .nightPay(nightPay)
            .holidayPay(holidayPay)
            .transportAllowance(salary.getTransportAllowance())
            .familyAllowance(salary.getFamilyAllowance())
            .housingAllowance(salary.getHousingAllowance())
            .positionAllowance(salary.getPositionAllowance())
            .skillAllowance(salary.getSkillAllowance())
            .otherAllowances(salary.getOtherAllowances())
            .grossSalary(grossSalary)
            .healthInsurance(healthInsurance)
            .pensionInsurance(pensionInsurance)
            .employmentInsurance(employmentInsurance)
            .longCareInsurance(longCareInsurance)
            .incomeTax(incomeTax)
            .residenceTax(residenceTax)
            .otherDeductions(otherDeductions)
            .totalDeductions(totalDeductions)
            .netSalary(netSalary)
            .totals(totals)
            .build();
    }

    // A zero override means "not set", as it always has for settings saved with empty rate fields.
    private static Optional<BigDecimal> override(Optional<BigDecimal> value) {
        return value.filter(v -> v.signum() > 0);
    }
}
