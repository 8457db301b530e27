package com.payroll.calculator;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A monthly hour total that exceeds a limit of the overtime agreement.
 */
public final class LaborTimeViolation {

    public enum Type {
        MONTHLY_OVERTIME_LIMIT,
        MONTHLY_TOTAL_LIMIT
    }

    public enum Severity {
        WARNING,
        ERROR
    }

    private final Type type;
    private final Severity severity;
    private final BigDecimal hours;
    private final BigDecimal limit;

    public LaborTimeViolation(Type type, Severity severity, BigDecimal hours, BigDecimal limit) {
        this.type = Objects.requireNonNull(type, "type");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.hours = Objects.requireNonNull(hours, "hours");
        this.limit = Objects.requireNonNull(limit, "limit");
    }

    public Type getType() { return type; }

    public Severity getSeverity() { return severity; }

    public BigDecimal getHours() { return hours; }

    public BigDecimal getLimit() { return limit; }

    public String getMessage() {
        String what = switch (type) {
            case MONTHLY_OVERTIME_LIMIT -> "Monthly overtime";
            case MONTHLY_TOTAL_LIMIT -> "Monthly working time";
        };
        return what + " of " + hours.toPlainString() + "h exceeds " + limit.toPlainString() + "h";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LaborTimeViolation)) return false;
        LaborTimeViolation that = (LaborTimeViolation) o;
        return type == that.type && severity == that.severity
            && hours.compareTo(that.hours) == 0 && limit.compareTo(that.limit) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, severity);
    }

    @Override
    public String toString() {
        return severity + " " + type + ": " + getMessage();
    }
}
