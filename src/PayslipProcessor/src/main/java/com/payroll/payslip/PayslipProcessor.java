package com.payroll.payslip;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payroll.calculator.AttendanceAggregator;
import com.payroll.calculator.LaborTimeChecker;
import com.payroll.calculator.LaborTimeViolation;
import com.payroll.calculator.PayrollEngine;
import com.payroll.calculator.model.AttendanceRecord;
import com.payroll.calculator.model.AttendanceTotals;
import com.payroll.calculator.model.PayrollResult;
import com.payroll.calculator.model.SalaryConfig;
import com.payroll.calculator.model.TaxConfig;
import com.payroll.payslip.model.AttendanceEntry;
import com.payroll.payslip.model.PayslipRecord;
import com.payroll.payslip.model.SalarySettings;
import com.payroll.payslip.model.TaxInfo;
import org.apache.kafka.streams.processor.api.Processor;
import org.apache.kafka.streams.processor.api.ProcessorContext;
import org.apache.kafka.streams.processor.api.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.YearMonth;
import java.util.NavigableSet;

/**
 * Handles both the attendance and the employee-events sources. An attendance record recalculates
 * the month it falls in; a salary or tax change recalculates each month held for that employee.
 * Every recalculated month is emitted as a payslip.
 */
public class PayslipProcessor implements Processor<String, String, String, String> {

    private static final Logger log = LoggerFactory.getLogger(PayslipProcessor.class);

    static final String ATTENDANCE_SOURCE = "attendance";
    static final String EMPLOYEE_EVENTS_SOURCE = "employee-events";

    static final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private final String sourceName;
    private final PayslipState state;
    private final PayrollEngine engine;
    private ProcessorContext<String, String> context;

    /**
     * @param sourceName identifies which source topic this processor instance handles:
     *                   "attendance" or "employee-events"
     */
    public PayslipProcessor(String sourceName, PayslipState state, PayrollEngine engine) {
        this.sourceName = sourceName;
        this.state = state;
        this.engine = engine;
    }

    @Override
    public void init(ProcessorContext<String, String> context) {
        this.context = context;
    }

    @Override
    public void process(Record<String, String> record) {
        if (record.value() == null) return;

        try {
            if (ATTENDANCE_SOURCE.equals(sourceName)) {
                handleAttendance(record);
            } else {
                handleEmployeeEvent(record);
            }
        } catch (Exception e) {
            log.error("Error processing record from {}: {}", sourceName, e.getMessage(), e);
        }
    }

    private void handleAttendance(Record<String, String> record) throws Exception {
        AttendanceEntry entry = mapper.readValue(record.value(), AttendanceEntry.class);
        String employeeId = entry.getEmployeeId();
        if (employeeId == null || entry.getDate() == null) {
            log.warn("Attendance skipped: missing EmployeeId or Date in {}", record.value());
            return;
        }

        // Late attendance for a deactivated employee must not bring their month back
        if (state.isDeactivated(employeeId)) {
            emitTombstone(employeeId, YearMonth.from(entry.getDate()));
            log.info("Attendance skipped (deactivated): employee={}, date={}, tombstone emitted",
                employeeId, entry.getDate());
            return;
        }

        // Negative hours are rejected here, before the day is stored
        AttendanceRecord day = entry.toRecord();
        state.putAttendance(employeeId, day);
        log.info("Attendance updated: employee={}, date={}, work={}",
            employeeId, day.getDate(), day.getWorkHours().orZero());
        recalculate(employeeId, YearMonth.from(day.getDate()));
    }

    private void handleEmployeeEvent(Record<String, String> record) throws Exception {
        JsonNode envelope = mapper.readTree(record.value());

        // Outbox CloudEvent: data is a stringified JSON, or an object when published directly
        JsonNode dataNode = envelope.path("data");
        if (dataNode.isMissingNode() || dataNode.isNull()) return;
        JsonNode data = dataNode.isTextual() ? mapper.readTree(dataNode.asText()) : dataNode;

        // Extract event type from DomainEvents[0].EventType
        JsonNode domainEvents = data.path("DomainEvents");
        if (!domainEvents.isArray() || domainEvents.isEmpty()) return;
        String eventType = domainEvents.get(0).path("EventType").asText("");

        if ("employee.deactivated".equals(eventType)) {
            handleEmployeeDeactivated(data);
        } else if (eventType.startsWith("salary.")) {
            handleSalaryEvent(data);
        } else if (eventType.startsWith("taxinfo.")) {
            handleTaxInfoEvent(data);
        }
        // employee.created/updated carry nothing the payroll run needs
    }

    private void handleEmployeeDeactivated(JsonNode data) throws Exception {
        String employeeId = data.path("Id").asText(null);
        if (employeeId == null) return;

        NavigableSet<YearMonth> months = state.deactivate(employeeId);
        for (YearMonth month : months) {
            emitTombstone(employeeId, month);
        }

        log.info("Employee deactivated: employee={}, tombstones emitted for {} months", employeeId, months.size());
    }

    private void handleSalaryEvent(JsonNode data) throws Exception {
        SalarySettings settings = mapper.treeToValue(data, SalarySettings.class);
        String employeeId = settings.getEmployeeId();
        if (employeeId == null || state.isDeactivated(employeeId)) return;

        state.putSalary(employeeId, settings.toSalaryConfig());
        log.info("Salary updated: employee={}, base={}", employeeId, settings.getBaseSalary());
        recalculate(employeeId);
    }

    private void handleTaxInfoEvent(JsonNode data) throws Exception {
        TaxInfo info = mapper.treeToValue(data, TaxInfo.class);
        String employeeId = info.getEmployeeId();
        if (employeeId == null || state.isDeactivated(employeeId)) return;

        // Fail on bad values now rather than on every later recalculation
        info.validate();

        state.putTaxInfo(employeeId, info);
        log.info("Tax info updated: employee={}, dependents={}", employeeId, info.getDependents());
        recalculate(employeeId);
    }

    // Salary and tax settings apply to every month, so all held months are recalculated
    private void recalculate(String employeeId) throws Exception {
        for (YearMonth month : state.months(employeeId)) {
            recalculate(employeeId, month);
        }
    }

    private void recalculate(String employeeId, YearMonth month) throws Exception {
        SalaryConfig salary = state.salary(employeeId);
        if (salary == null) {
            log.debug("No salary settings yet for employee={}, nothing emitted", employeeId);
            return;
        }

        AttendanceTotals totals = AttendanceAggregator.aggregate(state.attendance(employeeId), month);
        TaxConfig tax = state.taxInfo(employeeId).toTaxConfig(month.getYear());

        for (LaborTimeViolation violation : LaborTimeChecker.check(totals)) {
            log.warn("Labor time {}: employee={}, month={}: {}",
                violation.getSeverity(), employeeId, month, violation.getMessage());
        }

        PayrollResult result = engine.calculate(totals, salary, tax);
        PayslipRecord payslip = new PayslipRecord(employeeId, month,
            engine.getRateTable().getVersion(), tax.isSocialInsuranceExemption(), result);

        context.forward(new Record<>(outputKey(employeeId, month), mapper.writeValueAsString(payslip),
            System.currentTimeMillis()));
        log.info("Payslip emitted: employee={}, month={}, gross={}, net={}",
            employeeId, month, result.getGrossSalary(), result.getNetSalary());
    }

    private void emitTombstone(String employeeId, YearMonth month) throws Exception {
        context.forward(new Record<>(outputKey(employeeId, month), null, System.currentTimeMillis()));
    }

    // Output key: {"employeeId":"...","payrollMonth":"2024-04"}
    static String outputKey(String employeeId, YearMonth month) throws Exception {
        return mapper.writeValueAsString(
            mapper.createObjectNode()
                .put("employeeId", employeeId)
                .put("payrollMonth", month.toString())
        );
    }
}
