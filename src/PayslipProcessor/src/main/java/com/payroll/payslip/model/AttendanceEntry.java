package com.payroll.payslip.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.payroll.calculator.model.AttendanceRecord;

import java.time.LocalDate;

/**
 * One day of attendance as published on the attendance topic. Hour fields are bound untyped and
 * coerced when converted to an {@link AttendanceRecord}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AttendanceEntry {
    @JsonProperty("EmployeeId")
    private String employeeId;

    @JsonProperty("Date")
    private LocalDate date;

    @JsonProperty("WorkHours")
    private Object workHours;

    @JsonProperty("OvertimeHours")
    private Object overtimeHours;

    @JsonProperty("NightHours")
    private Object nightHours;

    @JsonProperty("HolidayHours")
    private Object holidayHours;

    public AttendanceEntry() {}

    /**
     * @throws IllegalArgumentException if an hour field holds a negative number
     */
    public AttendanceRecord toRecord() {
        return AttendanceRecord.fromRaw(date, workHours, overtimeHours, nightHours, holidayHours).validate();
    }

    public String getEmployeeId() { return employeeId; }
    public void setEmployeeId(String employeeId) { this.employeeId = employeeId; }

    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }

    public Object getWorkHours() { return workHours; }
    public void setWorkHours(Object workHours) { this.workHours = workHours; }

    public Object getOvertimeHours() { return overtimeHours; }
    public void setOvertimeHours(Object overtimeHours) { this.overtimeHours = overtimeHours; }

    public Object getNightHours() { return nightHours; }
    public void setNightHours(Object nightHours) { this.nightHours = nightHours; }

    public Object getHolidayHours() { return holidayHours; }
    public void setHolidayHours(Object holidayHours) { this.holidayHours = holidayHours; }
}
