package com.payroll.calculator;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Yen {

    private Yen() {}

    /** Half-up to a whole yen. */
    static BigDecimal round(BigDecimal amount) {
        return amount.setScale(0, RoundingMode.HALF_UP);
    }
}
