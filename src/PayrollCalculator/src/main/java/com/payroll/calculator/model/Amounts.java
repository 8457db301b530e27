package com.payroll.calculator.model;

import java.math.BigDecimal;
import java.util.Objects;

final class Amounts {

    private Amounts() {}

    static BigDecimal requireNonNegative(BigDecimal value, String name) {
        Objects.requireNonNull(value, name);
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value.toPlainString());
        }
        return value;
    }

    static BigDecimal nonNegativeOrZero(BigDecimal value, String name) {
        return value == null ? BigDecimal.ZERO : requireNonNegative(value, name);
    }

    /** Numeric equality, so 8 and 8.0 match. Either side may be null. */
    static boolean same(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) return a == b;
        return a.compareTo(b) == 0;
    }

    /** Hashes consistent with {@link #same}. */
    static int hash(BigDecimal... values) {
        int result = 1;
        for (BigDecimal value : values) {
            result = 31 * result + (value == null ? 0 : value.stripTrailingZeros().hashCode());
        }
        return result;
    }
}
