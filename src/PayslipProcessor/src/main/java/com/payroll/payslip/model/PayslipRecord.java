package com.payroll.payslip.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.payroll.calculator.model.PayrollResult;

import java.time.YearMonth;

/**
 * Value written to the payroll topic: one employee's calculated month with the itemized result
 * inlined.
 */
@JsonPropertyOrder({"employeeId", "payrollMonth", "status", "rateTableVersion", "socialInsuranceExemption"})
public class PayslipRecord {

    public static final String STATUS_CALCULATED = "CALCULATED";

    @JsonProperty("employeeId")
    private String employeeId;

    @JsonProperty("payrollMonth")
    private YearMonth payrollMonth;

    @JsonProperty("status")
    private String status;

    @JsonProperty("rateTableVersion")
    private String rateTableVersion;

    @JsonProperty("socialInsuranceExemption")
    private boolean socialInsuranceExemption;

    @JsonUnwrapped
    private PayrollResult result;

    public PayslipRecord() {}

    public PayslipRecord(String employeeId, YearMonth payrollMonth, String rateTableVersion,
                         boolean socialInsuranceExemption, PayrollResult result) {
        this.employeeId = employeeId;
        this.payrollMonth = payrollMonth;
        this.status = STATUS_CALCULATED;
        this.rateTableVersion = rateTableVersion;
        this.socialInsuranceExemption = socialInsuranceExemption;
        this.result = result;
    }

    public String getEmployeeId() { return employeeId; }
    public void setEmployeeId(String employeeId) { this.employeeId = employeeId; }

    public YearMonth getPayrollMonth() { return payrollMonth; }
    public void setPayrollMonth(YearMonth payrollMonth) { this.payrollMonth = payrollMonth; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getRateTableVersion() { return rateTableVersion; }
    public void setRateTableVersion(String rateTableVersion) { this.rateTableVersion = rateTableVersion; }

    public boolean isSocialInsuranceExemption() { return socialInsuranceExemption; }
    public void setSocialInsuranceExemption(boolean socialInsuranceExemption) { this.socialInsuranceExemption = socialInsuranceExemption; }

    public PayrollResult getResult() { return result; }
    public void setResult(PayrollResult result) { this.result = result; }
}
