package com.payroll.calculator;

import com.payroll.calculator.model.AttendanceTotals;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayComponentCalculatorTest {

    private final PayComponentCalculator calculator = new PayComponentCalculator(RateTable.standard());

    private static AttendanceTotals overtime(double hours) {
        return AttendanceTotals.of(0, hours, 0, 0);
    }

    @Test
    void hourlyRate_dividesByStandardMonthlyHours() {
        assertThat(calculator.hourlyRate(new BigDecimal("300000"))).isEqualByComparingTo("1875");
        assertThat(calculator.hourlyRate(new BigDecimal("300000"), new BigDecimal("150"))).isEqualByComparingTo("2000");
    }

    @Test
    void hourlyRate_keepsFractionsUnrounded() {
        assertThat(calculator.hourlyRate(new BigDecimal("250001"))).isEqualByComparingTo("1562.50625");
    }

    @Test
    void hourlyRate_rejectsNonPositiveHours() {
        assertThatThrownBy(() -> calculator.hourlyRate(new BigDecimal("300000"), BigDecimal.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void overtimePay_roundsOnceAfterSummingTranches() {
        // 10h x 1875 x 1.25 = 23437.5
        assertThat(calculator.overtimePay(overtime(10), new BigDecimal("1875"))).isEqualByComparingTo("23438");
    }

    @Test
    void overtimePay_atThresholdIsAllNormalRate() {
        BigDecimal rate = new BigDecimal("2000");

        assertThat(calculator.overtimePay(overtime(60), rate)).isEqualByComparingTo("150000");
    }

    @Test
    void overtimePay_beyondThresholdUsesExtendedRate() {
        BigDecimal rate = new BigDecimal("2000");
        BigDecimal at60 = calculator.overtimePay(overtime(60), rate);
        BigDecimal at61 = calculator.overtimePay(overtime(61), rate);

        assertThat(at61.subtract(at60)).isEqualByComparingTo("3000");
    }

    @Test
    void overtimePay_extendedRateIgnoresCustomNormalRate() {
        BigDecimal rate = new BigDecimal("1000");

        // 60h x 1000 x 1.30 + 5h x 1000 x 1.50
        assertThat(calculator.overtimePay(overtime(65), rate, new BigDecimal("1.30"))).isEqualByComparingTo("85500");
    }

    @Test
    void overtimePay_neverDecreasesWithMoreHours() {
        BigDecimal rate = new BigDecimal("1562.5");
        BigDecimal previous = BigDecimal.ZERO;
        for (int quarterHours = 0; quarterHours <= 400; quarterHours++) {
            BigDecimal pay = calculator.overtimePay(overtime(quarterHours / 4.0), rate);
            assertThat(pay).isGreaterThanOrEqualTo(previous);
            previous = pay;
        }
    }

    @Test
    void nightPay_paysOnlyThePremiumPart() {
        AttendanceTotals totals = AttendanceTotals.of(0, 0, 8, 0);

        // 8h x 1875 x (1.25 - 1)
        assertThat(calculator.nightPay(totals, new BigDecimal("1875"))).isEqualByComparingTo("3750");
        assertThat(calculator.nightPay(totals, new BigDecimal("1875"), new BigDecimal("1.5"))).isEqualByComparingTo("7500");
    }

    @Test
    void holidayPay_paysTheFullRate() {
        AttendanceTotals totals = AttendanceTotals.of(0, 0, 0, 8);

        // 8h x 1875 x 1.35
        assertThat(calculator.holidayPay(totals, new BigDecimal("1875"))).isEqualByComparingTo("20250");
    }

    @Test
    void nightAndHolidayPay_neverDecreaseWithMoreHours() {
        BigDecimal rate = new BigDecimal("1733.33");
        BigDecimal previousNight = BigDecimal.ZERO;
        BigDecimal previousHoliday = BigDecimal.ZERO;
        for (int hours = 0; hours <= 100; hours++) {
            BigDecimal night = calculator.nightPay(AttendanceTotals.of(0, 0, hours, 0), rate);
            BigDecimal holiday = calculator.holidayPay(AttendanceTotals.of(0, 0, 0, hours), rate);
            assertThat(night).isGreaterThanOrEqualTo(previousNight);
            assertThat(holiday).isGreaterThanOrEqualTo(previousHoliday);
            previousNight = night;
            previousHoliday = holiday;
        }
    }

    @Test
    void components_areZeroWithoutHours() {
        BigDecimal rate = new BigDecimal("1875");

        assertThat(calculator.overtimePay(AttendanceTotals.ZERO, rate)).isEqualByComparingTo("0");
        assertThat(calculator.nightPay(AttendanceTotals.ZERO, rate)).isEqualByComparingTo("0");
        assertThat(calculator.holidayPay(AttendanceTotals.ZERO, rate)).isEqualByComparingTo("0");
    }
}
