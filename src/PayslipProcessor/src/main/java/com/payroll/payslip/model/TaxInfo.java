package com.payroll.payslip.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.payroll.calculator.model.TaxConfig;

import java.time.LocalDate;

/**
 * Payload of a {@code taxinfo.*} event. Age is derived per payroll year from the birth date when
 * one is given, otherwise the stated age is used as is.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaxInfo {

    static final LocalDate DEFAULT_BIRTH_DATE = LocalDate.of(1980, 1, 1);

    @JsonProperty("EmployeeId")
    private String employeeId;

    @JsonProperty("Dependents")
    private int dependents;

    @JsonProperty("SocialInsuranceExemption")
    private boolean socialInsuranceExemption;

    @JsonProperty("BirthDate")
    private LocalDate birthDate;

    @JsonProperty("Age")
    private Integer age;

    public TaxInfo() {}

    public TaxInfo(String employeeId, int dependents, boolean socialInsuranceExemption, LocalDate birthDate, Integer age) {
        this.employeeId = employeeId;
        this.dependents = dependents;
        this.socialInsuranceExemption = socialInsuranceExemption;
        this.birthDate = birthDate;
        this.age = age;
    }

    /** Settings used until an employee's first tax event arrives. */
    public static TaxInfo defaults(String employeeId) {
        return new TaxInfo(employeeId, 0, false, DEFAULT_BIRTH_DATE, null);
    }

    /**
     * @return this payload
     * @throws IllegalArgumentException if dependents or the stated age is negative
     */
    public TaxInfo validate() {
        if (dependents < 0) throw new IllegalArgumentException("dependents must not be negative: " + dependents);
        if (age != null && age < 0) throw new IllegalArgumentException("age must not be negative: " + age);
        return this;
    }

    public TaxConfig toTaxConfig(int payrollYear) {
        int effectiveAge;
        if (birthDate != null) {
            effectiveAge = TaxConfig.ageInYear(birthDate, payrollYear);
        } else if (age != null) {
            effectiveAge = age;
        } else {
            effectiveAge = TaxConfig.ageInYear(DEFAULT_BIRTH_DATE, payrollYear);
        }
        return new TaxConfig(dependents, socialInsuranceExemption, effectiveAge);
    }

    public String getEmployeeId() { return employeeId; }
    public void setEmployeeId(String employeeId) { this.employeeId = employeeId; }

    public int getDependents() { return dependents; }
    public void setDependents(int dependents) { this.dependents = dependents; }

    public boolean isSocialInsuranceExemption() { return socialInsuranceExemption; }
    public void setSocialInsuranceExemption(boolean socialInsuranceExemption) { this.socialInsuranceExemption = socialInsuranceExemption; }

    public LocalDate getBirthDate() { return birthDate; }
    public void setBirthDate(LocalDate birthDate) { this.birthDate = birthDate; }

    public Integer getAge() { return age; }
    public void setAge(Integer age) { this.age = age; }
}
