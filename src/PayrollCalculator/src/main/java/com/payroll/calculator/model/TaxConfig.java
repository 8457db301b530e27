package com.payroll.calculator.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Employee demographics that drive withholding.
 */
public final class TaxConfig {

    private final int dependents;
    // Accepted and carried through to callers; the calculation does not consult it.
    private final boolean socialInsuranceExemption;
    private final int age;

    public TaxConfig(int dependents, boolean socialInsuranceExemption, int age) {
        if (dependents < 0) throw new IllegalArgumentException("dependents must not be negative: " + dependents);
        if (age < 0) throw new IllegalArgumentException("age must not be negative: " + age);
        this.dependents = dependents;
        this.socialInsuranceExemption = socialInsuranceExemption;
        this.age = age;
    }

    /**
     * Age as the difference of calendar years, the way the payroll run has always derived it.
     * Birthdays later in the year are not taken into account.
     */
    public static int ageInYear(LocalDate birthDate, int year) {
        Objects.requireNonNull(birthDate, "birthDate");
        return Math.max(0, year - birthDate.getYear());
    }

    public int getDependents() { return dependents; }

    public boolean isSocialInsuranceExemption() { return socialInsuranceExemption; }

    public int getAge() { return age; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaxConfig)) return false;
        TaxConfig that = (TaxConfig) o;
        return dependents == that.dependents
            && socialInsuranceExemption == that.socialInsuranceExemption
            && age == that.age;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dependents, socialInsuranceExemption, age);
    }

    @Override
    public String toString() {
        return "TaxConfig{dependents=" + dependents + ", socialInsuranceExemption=" + socialInsuranceExemption
            + ", age=" + age + '}';
    }
}
