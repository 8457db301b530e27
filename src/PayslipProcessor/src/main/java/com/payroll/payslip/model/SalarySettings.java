package com.payroll.payslip.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.payroll.calculator.model.SalaryConfig;

import java.math.BigDecimal;

/**
 * Payload of a {@code salary.*} event.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SalarySettings {
    @JsonProperty("EmployeeId")
    private String employeeId;

    @JsonProperty("BaseSalary")
    private BigDecimal baseSalary;

    @JsonProperty("TransportAllowance")
    private BigDecimal transportAllowance;

    @JsonProperty("FamilyAllowance")
    private BigDecimal familyAllowance;

    @JsonProperty("HousingAllowance")
    private BigDecimal housingAllowance;

    @JsonProperty("PositionAllowance")
    private BigDecimal positionAllowance;

    @JsonProperty("SkillAllowance")
    private BigDecimal skillAllowance;

    @JsonProperty("OtherAllowances")
    private BigDecimal otherAllowances;

    @JsonProperty("HourlyRate")
    private BigDecimal hourlyRate;

    @JsonProperty("OvertimeRate")
    private BigDecimal overtimeRate;

    @JsonProperty("NightRate")
    private BigDecimal nightRate;

    @JsonProperty("HolidayRate")
    private BigDecimal holidayRate;

    public SalarySettings() {}

    /**
     * Missing allowances default to zero and missing rates to the rate table.
     *
     * @throws NullPointerException if the event has no base salary
     * @throws IllegalArgumentException if an amount or rate is negative
     */
    public SalaryConfig toSalaryConfig() {
        return SalaryConfig.builder(baseSalary)
            .transportAllowance(transportAllowance)
            .familyAllowance(familyAllowance)
            .housingAllowance(housingAllowance)
            .positionAllowance(positionAllowance)
            .skillAllowance(skillAllowance)
            .otherAllowances(otherAllowances)
            .hourlyRate(hourlyRate)
            .overtimeRate(overtimeRate)
            .nightRate(nightRate)
            .holidayRate(holidayRate)
            .build();
    }

    public String getEmployeeId() { return employeeId; }
    public void setEmployeeId(String employeeId) { this.employeeId = employeeId; }

    public BigDecimal getBaseSalary() { return baseSalary; }
    public void setBaseSalary(BigDecimal baseSalary) { this.baseSalary = baseSalary; }

    public BigDecimal getTransportAllowance() { return transportAllowance; }
    public void setTransportAllowance(BigDecimal transportAllowance) { this.transportAllowance = transportAllowance; }

    public BigDecimal getFamilyAllowance() { return familyAllowance; }
    public void setFamilyAllowance(BigDecimal familyAllowance) { this.familyAllowance = familyAllowance; }

    public BigDecimal getHousingAllowance() { return housingAllowance; }
    public void setHousingAllowance(BigDecimal housingAllowance) { this.housingAllowance = housingAllowance; }

    public BigDecimal getPositionAllowance() { return positionAllowance; }
    public void setPositionAllowance(BigDecimal positionAllowance) { this.positionAllowance = positionAllowance; }

    public BigDecimal getSkillAllowance() { return skillAllowance; }
    public void setSkillAllowance(BigDecimal skillAllowance) { this.skillAllowance = skillAllowance; }

    public BigDecimal getOtherAllowances() { return otherAllowances; }
    public void setOtherAllowances(BigDecimal otherAllowances) { this.otherAllowances = otherAllowances; }

    public BigDecimal getHourlyRate() { return hourlyRate; }
    public void setHourlyRate(BigDecimal hourlyRate) { this.hourlyRate = hourlyRate; }

    public BigDecimal getOvertimeRate() { return overtimeRate; }
    public void setOvertimeRate(BigDecimal overtimeRate) { this.overtimeRate = overtimeRate; }

    public BigDecimal getNightRate() { return nightRate; }
    public void setNightRate(BigDecimal nightRate) { this.nightRate = nightRate; }

    public BigDecimal getHolidayRate() { return holidayRate; }
    public void setHolidayRate(BigDecimal holidayRate) { this.holidayRate = holidayRate; }
}
