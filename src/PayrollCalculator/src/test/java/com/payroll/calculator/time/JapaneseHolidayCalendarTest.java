package com.payroll.calculator.time;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class JapaneseHolidayCalendarTest {

    @Test
    void fixedDateHolidays() {
        assertThat(JapaneseHolidayCalendar.isNationalHoliday(LocalDate.of(2024, 1, 1))).isTrue();
        assertThat(JapaneseHolidayCalendar.isNationalHoliday(LocalDate.of(2024, 4, 29))).isTrue();
        assertThat(JapaneseHolidayCalendar.isNationalHoliday(LocalDate.of(2024, 11, 3))).isTrue();
        assertThat(JapaneseHolidayCalendar.isNationalHoliday(LocalDate.of(2024, 4, 30))).isFalse();
    }

    @Test
    void happyMondayHolidays() {
        assertThat(JapaneseHolidayCalendar.isNationalHoliday(LocalDate.of(2024, 1, 8))).isTrue();
        assertThat(JapaneseHolidayCalendar.isNationalHoliday(LocalDate.of(2024, 1, 15))).isFalse();
        assertThat(JapaneseHolidayCalendar.isNationalHoliday(LocalDate.of(2024, 7, 15))).isTrue();
        assertThat(JapaneseHolidayCalendar.isNationalHoliday(LocalDate.of(2024, 9, 16))).isTrue();
        assertThat(JapaneseHolidayCalendar.isNationalHoliday(LocalDate.of(2024, 10, 14))).isTrue();
    }

    @Test
    void equinoxDays() {
        assertThat(JapaneseHolidayCalendar.vernalEquinoxDay(2024)).isEqualTo(20);
        assertThat(JapaneseHolidayCalendar.autumnalEquinoxDay(2024)).isEqualTo(22);
        assertThat(JapaneseHolidayCalendar.vernalEquinoxDay(2025)).isEqualTo(20);
        assertThat(JapaneseHolidayCalendar.autumnalEquinoxDay(2025)).isEqualTo(23);
        assertThat(JapaneseHolidayCalendar.isNationalHoliday(LocalDate.of(2024, 9, 22))).isTrue();
        assertThat(JapaneseHolidayCalendar.isNationalHoliday(LocalDate.of(2024, 9, 24))).isFalse();
    }

    @Test
    void sundayIsLegalHoliday() {
        LocalDate sunday = LocalDate.of(2024, 4, 7);

        assertThat(JapaneseHolidayCalendar.isLegalHoliday(sunday)).isTrue();
        assertThat(JapaneseHolidayCalendar.isNationalHoliday(sunday)).isFalse();
        assertThat(JapaneseHolidayCalendar.isHoliday(sunday)).isTrue();
        assertThat(JapaneseHolidayCalendar.isHoliday(LocalDate.of(2024, 4, 6))).isFalse();
    }
}
