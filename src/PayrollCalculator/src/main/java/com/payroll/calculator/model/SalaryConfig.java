package com.payroll.calculator.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * An employee's salary settings for one pay period. Allowances default to zero; the rate
 * overrides are optional and fall back to the rate table when absent.
 */
public final class SalaryConfig {

    private final BigDecimal baseSalary;

    private final BigDecimal transportAllowance;
    private final BigDecimal familyAllowance;
    private final BigDecimal housingAllowance;
    private final BigDecimal positionAllowance;
    private final BigDecimal skillAllowance;
    private final BigDecimal otherAllowances;

    private final BigDecimal hourlyRate;
    private final BigDecimal overtimeRate;
    private final BigDecimal nightRate;
    private final BigDecimal holidayRate;

    private SalaryConfig(Builder b) {
        this.baseSalary = Amounts.requireNonNegative(b.baseSalary, "baseSalary");
        this.transportAllowance = Amounts.nonNegativeOrZero(b.transportAllowance, "transportAllowance");
        this.familyAllowance = Amounts.nonNegativeOrZero(b.familyAllowance, "familyAllowance");
        this.housingAllowance = Amounts.nonNegativeOrZero(b.housingAllowance, "housingAllowance");
        this.positionAllowance = Amounts.nonNegativeOrZero(b.positionAllowance, "positionAllowance");
        this.skillAllowance = Amounts.nonNegativeOrZero(b.skillAllowance, "skillAllowance");
        this.otherAllowances = Amounts.nonNegativeOrZero(b.otherAllowances, "otherAllowances");
        this.hourlyRate = b.hourlyRate == null ? null : Amounts.requireNonNegative(b.hourlyRate, "hourlyRate");
        this.overtimeRate = b.overtimeRate == null ? null : Amounts.requireNonNegative(b.overtimeRate, "overtimeRate");
        this.nightRate = b.nightRate == null ? null : Amounts.requireNonNegative(b.nightRate, "nightRate");
        this.holidayRate = b.holidayRate == null ? null : Amounts.requireNonNegative(b.holidayRate, "holidayRate");
    }

    public static Builder builder(BigDecimal baseSalary) {
        return new Builder(baseSalary);
    }

    public static Builder builder(long baseSalary) {
        return new Builder(BigDecimal.valueOf(baseSalary));
    }

    public static SalaryConfig ofBaseSalary(long baseSalary) {
        return builder(baseSalary).build();
    }

    public BigDecimal getBaseSalary() { return baseSalary; }

    public BigDecimal getTransportAllowance() { return transportAllowance; }
    public BigDecimal getFamilyAllowance() { return familyAllowance; }
    public BigDecimal getHousingAllowance() { return housingAllowance; }
    public BigDecimal getPositionAllowance() { return positionAllowance; }
    public BigDecimal getSkillAllowance() { return skillAllowance; }
    public BigDecimal getOtherAllowances() { return otherAllowances; }

    public Optional<BigDecimal> getHourlyRate() { return Optional.ofNullable(hourlyRate); }
    public Optional<BigDecimal> getOvertimeRate() { return Optional.ofNullable(overtimeRate); }
    public Optional<BigDecimal> getNightRate() { return Optional.ofNullable(nightRate); }
    public Optional<BigDecimal> getHolidayRate() { return Optional.ofNullable(holidayRate); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SalaryConfig)) return false;
        SalaryConfig that = (SalaryConfig) o;
        return Amounts.same(baseSalary, that.baseSalary)
            && Amounts.same(transportAllowance, that.transportAllowance)
            && Amounts.same(familyAllowance, that.familyAllowance)
            && Amounts.same(housingAllowance, that.housingAllowance)
            && Amounts.same(positionAllowance, that.positionAllowance)
            && Amounts.same(skillAllowance, that.skillAllowance)
            && Amounts.same(otherAllowances, that.otherAllowances)
            && Amounts.same(hourlyRate, that.hourlyRate)
            && Amounts.same(overtimeRate, that.overtimeRate)
            && Amounts.same(nightRate, that.nightRate)
            && Amounts.same(holidayRate, that.holidayRate);
    }

    @Override
    public int hashCode() {
        return Amounts.hash(baseSalary, transportAllowance, familyAllowance, housingAllowance,
            positionAllowance, skillAllowance, otherAllowances, hourlyRate, overtimeRate, nightRate, holidayRate);
    }

    @Override
    public String toString() {
        return "SalaryConfig{baseSalary=" + baseSalary.toPlainString()
            + ", hourlyRate=" + hourlyRate + ", overtimeRate=" + overtimeRate
            + ", nightRate=" + nightRate + ", holidayRate=" + holidayRate + '}';
    }

    public static final class Builder {
        private final BigDecimal baseSalary;
        private BigDecimal transportAllowance;
        private BigDecimal familyAllowance;
        private BigDecimal housingAllowance;
        private BigDecimal positionAllowance;
        private BigDecimal skillAllowance;
        private BigDecimal otherAllowances;
        private BigDecimal hourlyRate;
        private BigDecimal overtimeRate;
        private BigDecimal nightRate;
        private BigDecimal holidayRate;

        private Builder(BigDecimal baseSalary) {
            this.baseSalary = baseSalary;
        }

        public Builder transportAllowance(BigDecimal v) { this.transportAllowance = v; return this; }
        public Builder familyAllowance(BigDecimal v) { this.familyAllowance = v; return this; }
        public Builder housingAllowance(BigDecimal v) { this.housingAllowance = v; return this; }
        public Builder positionAllowance(BigDecimal v) { this.positionAllowance = v; return this; }
        public Builder skillAllowance(BigDecimal v) { this.skillAllowance = v; return this; }
        public Builder otherAllowances(BigDecimal v) { this.otherAllowances = v; return this; }

        public Builder transportAllowance(long v) { return transportAllowance(BigDecimal.valueOf(v)); }
        public Builder familyAllowance(long v) { return familyAllowance(BigDecimal.valueOf(v)); }
        public Builder housingAllowance(long v) { return housingAllowance(BigDecimal.valueOf(v)); }
        public Builder positionAllowance(long v) { return positionAllowance(BigDecimal.valueOf(v)); }
        public Builder skillAllowance(long v) { return skillAllowance(BigDecimal.valueOf(v)); }
        public Builder otherAllowances(long v) { return otherAllowances(BigDecimal.valueOf(v)); }

        public Builder hourlyRate(BigDecimal v) { this.hourlyRate = v; return this; }
        public Builder overtimeRate(BigDecimal v) { this.overtimeRate = v; return this; }
        public Builder nightRate(BigDecimal v) { this.nightRate = v; return this; }
        public Builder holidayRate(BigDecimal v) { this.holidayRate = v; return this; }

        public SalaryConfig build() {
            return new SalaryConfig(this);
        }
    }
}
