package com.payroll.payslip;

import com.payroll.calculator.model.AttendanceRecord;
import com.payroll.calculator.model.SalaryConfig;
import com.payroll.payslip.model.TaxInfo;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collection;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory state shared by the attendance and employee-events processors.
 *
 * The two source topics are keyed differently, so one employee's records land in different
 * tasks. Both processors are therefore handed the same instance instead of partitioned state
 * stores. The state is rebuilt by replaying both topics from the earliest offset.
 */
public class PayslipState {

    // employeeId -> date -> latest record for that day
    private final ConcurrentHashMap<String, NavigableMap<LocalDate, AttendanceRecord>> attendance = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SalaryConfig> salaries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TaxInfo> taxInfo = new ConcurrentHashMap<>();
    private final Set<String> deactivatedEmployees = Collections.newSetFromMap(new ConcurrentHashMap<>());

    /** Stores a day's record, replacing an earlier one for the same date. */
    public void putAttendance(String employeeId, AttendanceRecord record) {
        attendance.computeIfAbsent(employeeId, id -> new ConcurrentSkipListMap<>()).put(record.getDate(), record);
    }

    public Collection<AttendanceRecord> attendance(String employeeId) {
        NavigableMap<LocalDate, AttendanceRecord> days = attendance.get(employeeId);
        return days == null ? Collections.emptyList() : days.values();
    }

    /** Months with at least one attendance record, in ascending order. */
    public NavigableSet<YearMonth> months(String employeeId) {
        NavigableSet<YearMonth> months = new TreeSet<>();
        for (AttendanceRecord record : attendance(employeeId)) {
            months.add(YearMonth.from(record.getDate()));
        }
        return months;
    }

    public void putSalary(String employeeId, SalaryConfig salary) {
        salaries.put(employeeId, salary);
    }

    public SalaryConfig salary(String employeeId) {
        return salaries.get(employeeId);
    }

    public void putTaxInfo(String employeeId, TaxInfo info) {
        taxInfo.put(employeeId, info);
    }

    public TaxInfo taxInfo(String employeeId) {
        return taxInfo.getOrDefault(employeeId, TaxInfo.defaults(employeeId));
    }

    public boolean isDeactivated(String employeeId) {
        return deactivatedEmployees.contains(employeeId);
    }

    /**
     * Marks the employee deactivated and drops everything held for them.
     *
     * @return the months that had attendance before the removal
     */
    public NavigableSet<YearMonth> deactivate(String employeeId) {
        NavigableSet<YearMonth> months = months(employeeId);
        deactivatedEmployees.add(employeeId);
        attendance.remove(employeeId);
        salaries.remove(employeeId);
        taxInfo.remove(employeeId);
        return months;
    }
}
