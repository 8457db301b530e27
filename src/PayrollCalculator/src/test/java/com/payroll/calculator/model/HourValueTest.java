package com.payroll.calculator.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class HourValueTest {

    @Test
    void parse_readsNumbersAndNumericStrings() {
        assertThat(HourValue.parse(8).orZero()).isEqualByComparingTo("8");
        assertThat(HourValue.parse(7.5d).orZero()).isEqualByComparingTo("7.5");
        assertThat(HourValue.parse(" 2.25 ").orZero()).isEqualByComparingTo("2.25");
        assertThat(HourValue.parse(new BigDecimal("1.10")).orZero()).isEqualByComparingTo("1.1");
    }

    @Test
    void parse_treatsNullBlankAndGarbageAsAbsent() {
        assertThat(HourValue.parse(null).isPresent()).isFalse();
        assertThat(HourValue.parse("").isPresent()).isFalse();
        assertThat(HourValue.parse("   ").isPresent()).isFalse();
        assertThat(HourValue.parse("eight").isPresent()).isFalse();
        assertThat(HourValue.parse(Double.NaN).isPresent()).isFalse();
        assertThat(HourValue.parse(Double.POSITIVE_INFINITY).isPresent()).isFalse();
        assertThat(HourValue.parse(new Object()).isPresent()).isFalse();
    }

    @Test
    void orZero_isTheOnlyCoercionToZero() {
        HourValue absent = HourValue.parse("n/a");

        assertThat(absent.value()).isEmpty();
        assertThat(absent.orZero()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void parse_keepsNegativeNumbersAsTheyAre() {
        assertThat(HourValue.parse("-1.5").orZero()).isEqualByComparingTo("-1.5");
    }

    @Test
    void equals_ignoresScale() {
        assertThat(HourValue.parse("8.0")).isEqualTo(HourValue.parse(8));
        assertThat(HourValue.absent()).isEqualTo(HourValue.of(null));
        assertThat(HourValue.absent()).isNotEqualTo(HourValue.parse(0));
    }

    @Test
    void parse_treatsOutOfRangeFiguresAsAbsent() {
        assertThat(HourValue.parse("1e30000000").isPresent()).isFalse();
        assertThat(HourValue.parse("-1e999999999").isPresent()).isFalse();
        assertThat(HourValue.parse("1e-30000000").isPresent()).isFalse();
        assertThat(HourValue.parse(new BigDecimal("1E+30000000")).isPresent()).isFalse();
        assertThat(HourValue.parse(1e300d).isPresent()).isFalse();
        assertThat(HourValue.parse("10000.5").isPresent()).isFalse();
        assertThat(HourValue.parse("0.00000000001").isPresent()).isFalse();
    }

    @Test
    void parse_acceptsFiguresAtTheBounds() {
        assertThat(HourValue.parse("10000").orZero()).isEqualByComparingTo("10000");
        assertThat(HourValue.parse("1E+4").orZero()).isEqualByComparingTo("10000");
        assertThat(HourValue.parse("0.0000000001").orZero()).isEqualByComparingTo("0.0000000001");
        assertThat(HourValue.parse("7.50000000000000").orZero()).isEqualByComparingTo("7.5");
        assertThat(HourValue.parse("0E+30000000").orZero()).isEqualByComparingTo("0");
    }
}
