package com.payroll.calculator.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * An hour figure as it arrives from an attendance source: possibly null, a number, a numeric string,
 * or something unparseable.
 *
 * <p>Attendance rows are written by clock terminals and manual edits, and an hour column is often
 * left empty for days that are still open. Parsing is therefore lenient: anything that is not a
 * finite number, or lies outside {@link #MAX_HOURS} or {@link #MAX_SCALE}, reads as absent, and
 * {@link #orZero()} is the one explicit place where an absent value becomes zero hours.
 */
public final class HourValue {

    /** Largest magnitude a parsed figure may have. */
    public static final BigDecimal MAX_HOURS = BigDecimal.valueOf(10_000);

    /** Most decimal places a parsed figure may carry once trailing zeros are stripped. */
    public static final int MAX_SCALE = 10;

    private static final HourValue ABSENT = new HourValue(null);

    private final BigDecimal hours;

    private HourValue(BigDecimal hours) {
        this.hours = hours;
    }

    public static HourValue absent() {
        return ABSENT;
    }

    public static HourValue of(BigDecimal hours) {
        return hours == null ? ABSENT : new HourValue(hours);
    }

    /**
     * Reads a raw value as produced by a JSON binder or a result set: {@code null}, a {@link Number}
     * or a {@link CharSequence}.
     */
    public static HourValue parse(Object raw) {
        if (raw == null) return ABSENT;
        if (raw instanceof BigDecimal) return bounded((BigDecimal) raw);
        if (raw instanceof Number) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return ABSENT;
            return bounded(new BigDecimal(raw.toString()));
        }
        if (raw instanceof CharSequence) {
            String text = raw.toString().trim();
            if (text.isEmpty()) return ABSENT;
            try {
                return bounded(new BigDecimal(text));
            } catch (NumberFormatException e) {
                return ABSENT;
            }
        }
        return ABSENT;
    }

    // compareTo and stripTrailingZeros stay cheap for extreme exponents; summing such a value would not
    private static HourValue bounded(BigDecimal hours) {
        if (hours.abs().compareTo(MAX_HOURS) > 0) return ABSENT;
        BigDecimal stripped = hours.stripTrailingZeros();
        if (stripped.scale() > MAX_SCALE || stripped.scale() < -MAX_SCALE) return ABSENT;
        return new HourValue(stripped.scale() < 0 ? stripped.setScale(0) : stripped);
    }

    public boolean isPresent() { return hours != null; }

    public Optional<BigDecimal> value() { return Optional.ofNullable(hours); }

    public BigDecimal orZero() {
        return hours != null ? hours : BigDecimal.ZERO;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HourValue)) return false;
        HourValue other = (HourValue) o;
        if (hours == null || other.hours == null) return hours == other.hours;
        return hours.compareTo(other.hours) == 0;
    }

    @Override
    public int hashCode() {
        return hours == null ? 0 : hours.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return hours == null ? "absent" : hours.toPlainString();
    }
}
