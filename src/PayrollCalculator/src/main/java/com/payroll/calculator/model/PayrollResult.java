package com.payroll.calculator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Itemized paycheck for one employee and one period. Money fields are whole yen.
 */
@JsonPropertyOrder({
    "baseSalary", "overtimePay", "nightPay", "holidayPay",
    "transportAllowance", "familyAllowance", "housingAllowance", "positionAllowance", "skillAllowance",
    "otherAllowances", "grossSalary",
    "healthInsurance", "pensionInsurance", "employmentInsurance", "longCareInsurance",
    "incomeTax", "residenceTax", "otherDeductions", "totalDeductions",
    "netSalary",
    "workHours", "overtimeHours", "nightHours", "holidayHours"
})
public final class PayrollResult {

    // Earnings
    @JsonProperty("baseSalary")
    private final BigDecimal baseSalary;

    @JsonProperty("overtimePay")
    private final BigDecimal overtimePay;

    @JsonProperty("nightPay")
    private final BigDecimal nightPay;

    @JsonProperty("holidayPay")
    private final BigDecimal holidayPay;

    @JsonProperty("transportAllowance")
    private final BigDecimal transportAllowance;

    @JsonProperty("familyAllowance")
    private final BigDecimal familyAllowance;

    @JsonProperty("housingAllowance")
    private final BigDecimal housingAllowance;

    @JsonProperty("positionAllowance")
    private final BigDecimal positionAllowance;

    @JsonProperty("skillAllowance")
    private final BigDecimal skillAllowance;

    @JsonProperty("otherAllowances")
    private final BigDecimal otherAllowances;

    @JsonProperty("grossSalary")
    private final BigDecimal grossSalary;

    // Deductions
    @JsonProperty("healthInsurance")
    private final BigDecimal healthInsurance;

    @JsonProperty("pensionInsurance")
    private final BigDecimal pensionInsurance;

    @JsonProperty("employmentInsurance")
    private final BigDecimal employmentInsurance;

    @JsonProperty("longCareInsurance")
    private final BigDecimal longCareInsurance;

    @JsonProperty("incomeTax")
    private final BigDecimal incomeTax;

    @JsonProperty("residenceTax")
    private final BigDecimal residenceTax;

    @JsonProperty("otherDeductions")
    private final BigDecimal otherDeductions;

    @JsonProperty("totalDeductions")
    private final BigDecimal totalDeductions;

    @JsonProperty("netSalary")
    private final BigDecimal netSalary;

    // Hours the result was computed from
    @JsonProperty("workHours")
    private final BigDecimal workHours;

    @JsonProperty("overtimeHours")
    private final BigDecimal overtimeHours;

    @JsonProperty("nightHours")
    private final BigDecimal nightHours;

    @JsonProperty("holidayHours")
    private final BigDecimal holidayHours;

    private PayrollResult(Builder b) {
        this.baseSalary = b.baseSalary;
        this.overtimePay = b.overtimePay;
        this.nightPay = b.nightPay;
        this.holidayPay = b.holidayPay;
        this.transportAllowance = b.transportAllowance;
        this.familyAllowance = b.familyAllowance;
        this.housingAllowance = b.housingAllowance;
        this.positionAllowance = b.positionAllowance;
        this.skillAllowance = b.skillAllowance;
        this.otherAllowances = b.otherAllowances;
        this.grossSalary = b.grossSalary;
        this.healthInsurance = b.healthInsurance;
        this.pensionInsurance = b.pensionInsurance;
        this.employmentInsurance = b.employmentInsurance;
        this.longCareInsurance = b.longCareInsurance;
        this.incomeTax = b.incomeTax;
        this.residenceTax = b.residenceTax;
        this.otherDeductions = b.otherDeductions;
        this.totalDeductions = b.totalDeductions;
        this.netSalary = b.netSalary;
        this.workHours = b.totals.getWorkHours();
        this.overtimeHours = b.totals.getOvertimeHours();
        this.nightHours = b.totals.getNightHours();
        this.holidayHours = b.totals.getHolidayHours();
    }

    public static Builder builder() {
        return new Builder();
    }

    public BigDecimal getBaseSalary() { return baseSalary; }
    public BigDecimal getOvertimePay() { return overtimePay; }
    public BigDecimal getNightPay() { return nightPay; }
    public BigDecimal getHolidayPay() { return holidayPay; }
    public BigDecimal getTransportAllowance() { return transportAllowance; }
    public BigDecimal getFamilyAllowance() { return familyAllowance; }
    public BigDecimal getHousingAllowance() { return housingAllowance; }
    public BigDecimal getPositionAllowance() { return positionAllowance; }
    public BigDecimal getSkillAllowance() { return skillAllowance; }
    public BigDecimal getOtherAllowances() { return otherAllowances; }
    public BigDecimal getGrossSalary() { return grossSalary; }

    public BigDecimal getHealthInsurance() { return healthInsurance; }
    public BigDecimal getPensionInsurance() { return pensionInsurance; }
    public BigDecimal getEmploymentInsurance() { return employmentInsurance; }
    public BigDecimal getLongCareInsurance() { return longCareInsurance; }
    public BigDecimal getIncomeTax() { return incomeTax; }
    public BigDecimal getResidenceTax() { return residenceTax; }
    public BigDecimal getOtherDeductions() { return otherDeductions; }
    public BigDecimal getTotalDeductions() { return totalDeductions; }

    public BigDecimal getNetSalary() { return netSalary; }

    public BigDecimal getWorkHours() { return workHours; }
    public BigDecimal getOvertimeHours() { return overtimeHours; }
    public BigDecimal getNightHours() { return nightHours; }
    public BigDecimal getHolidayHours() { return holidayHours; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PayrollResult)) return false;
        PayrollResult that = (PayrollResult) o;
        return Amounts.same(baseSalary, that.baseSalary)
            && Amounts.same(overtimePay, that.overtimePay)
            && Amounts.same(nightPay, that.nightPay)
            && Amounts.same(holidayPay, that.holidayPay)
            && Amounts.same(transportAllowance, that.transportAllowance)
            && Amounts.same(familyAllowance, that.familyAllowance)
            && Amounts.same(housingAllowance, that.housingAllowance)
            && Amounts.same(positionAllowance, that.positionAllowance)
            && Amounts.same(skillAllowance, that.skillAllowance)
            && Amounts.same(otherAllowances, that.otherAllowances)
            && Amounts.same(grossSalary, that.grossSalary)
            && Amounts.same(healthInsurance, that.healthInsurance)
            && Amounts.same(pensionInsurance, that.pensionInsurance)
            && Amounts.same(employmentInsurance, that.employmentInsurance)
            && Amounts.same(longCareInsurance, that.longCareInsurance)
            && Amounts.same(incomeTax, that.incomeTax)
            && Amounts.same(residenceTax, that.residenceTax)
            && Amounts.same(otherDeductions, that.otherDeductions)
            && Amounts.same(totalDeductions, that.totalDeductions)
            && Amounts.same(netSalary, that.netSalary)
            && Amounts.same(workHours, that.workHours)
            && Amounts.same(overtimeHours, that.overtimeHours)
            && Amounts.same(nightHours, that.nightHours)
            && Amounts.same(holidayHours, that.holidayHours);
    }

    @Override
    public int hashCode() {
        return Amounts.hash(grossSalary, totalDeductions, netSalary, workHours, overtimeHours);
    }

    @Override
    public String toString() {
        return "PayrollResult{gross=" + grossSalary.toPlainString()
            + ", deductions=" + totalDeductions.toPlainString()
            + ", net=" + netSalary.toPlainString() + '}';
    }

    /**
     * Filled in by the engine; sums are computed by the caller of {@link #build()}.
     */
    public static final class Builder {
        private BigDecimal baseSalary;
        private BigDecimal overtimePay;
        private BigDecimal nightPay;
        private BigDecimal holidayPay;
        private BigDecimal transportAllowance;
        private BigDecimal familyAllowance;
        private BigDecimal housingAllowance;
        private BigDecimal positionAllowance;
        private BigDecimal skillAllowance;
        private BigDecimal otherAllowances;
        private BigDecimal grossSalary;
        private BigDecimal healthInsurance;
        private BigDecimal pensionInsurance;
        private BigDecimal employmentInsurance;
        private BigDecimal longCareInsurance;
        private BigDecimal incomeTax;
        private BigDecimal residenceTax;
        private BigDecimal otherDeductions;
        private BigDecimal totalDeductions;
        private BigDecimal netSalary;
        private AttendanceTotals totals;

        public Builder baseSalary(BigDecimal v) { this.baseSalary = v; return this; }
        public Builder overtimePay(BigDecimal v) { this.overtimePay = v; return this; }
        public Builder nightPay(BigDecimal v) { this.nightPay = v; return this; }
        public Builder holidayPay(BigDecimal v) { this.holidayPay = v; return this; }
        public Builder transportAllowance(BigDecimal v) { this.transportAllowance = v; return this; }
        public Builder familyAllowance(BigDecimal v) { this.familyAllowance = v; return this; }
        public Builder housingAllowance(BigDecimal v) { this.housingAllowance = v; return this; }
        public Builder positionAllowance(BigDecimal v) { this.positionAllowance = v; return this; }
        public Builder skillAllowance(BigDecimal v) { this.skillAllowance = v; return this; }
        public Builder otherAllowances(BigDecimal v) { this.otherAllowances = v; return this; }
        public Builder grossSalary(BigDecimal v) { this.grossSalary = v; return this; }
        public Builder healthInsurance(BigDecimal v) { this.healthInsurance = v; return this; }
        public Builder pensionInsurance(BigDecimal v) { this.pensionInsurance = v; return this; }
        public Builder employmentInsurance(BigDecimal v) { this.employmentInsurance = v; return this; }
        public Builder longCareInsurance(BigDecimal v) { this.longCareInsurance = v; return this; }
        public Builder incomeTax(BigDecimal v) { this.incomeTax = v; return this; }
        public Builder residenceTax(BigDecimal v) { this.residenceTax = v; return this; }
        public Builder otherDeductions(BigDecimal v) { this.otherDeductions = v; return this; }
        public Builder totalDeductions(BigDecimal v) { this.totalDeductions = v; return this; }
        public Builder netSalary(BigDecimal v) { this.netSalary = v; return this; }
        public Builder totals(AttendanceTotals v) { this.totals = v; return this; }

        public PayrollResult build() {
            Objects.requireNonNull(totals, "totals");
            return new PayrollResult(this);
        }
    }
}
