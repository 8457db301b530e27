package com.payroll.calculator.time;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.temporal.TemporalAdjusters;
import java.util.Set;

/**
 * National holidays of Japan, approximately: fixed-date holidays, the Happy Monday holidays and the
 * two equinox days. Substitute holidays and one-off holidays are not included.
 */
public final class JapaneseHolidayCalendar {

    private static final Set<MonthDay> FIXED_HOLIDAYS = Set.of(
        MonthDay.of(1, 1),    // New Year's Day
        MonthDay.of(2, 11),   // National Foundation Day
        MonthDay.of(2, 23),   // Emperor's Birthday
        MonthDay.of(4, 29),   // Showa Day
        MonthDay.of(5, 3),    // Constitution Memorial Day
        MonthDay.of(5, 4),    // Greenery Day
        MonthDay.of(5, 5),    // Children's Day
        MonthDay.of(8, 11),   // Mountain Day
        MonthDay.of(11, 3),   // Culture Day
        MonthDay.of(11, 23)   // Labor Thanksgiving Day
    );

    private JapaneseHolidayCalendar() {}

    /** Sunday is the statutory weekly day off. */
    public static boolean isLegalHoliday(LocalDate date) {
        return date.getDayOfWeek() == DayOfWeek.SUNDAY;
    }

    public static boolean isNationalHoliday(LocalDate date) {
        if (FIXED_HOLIDAYS.contains(MonthDay.from(date))) return true;

        int year = date.getYear();
        return switch (date.getMonth()) {
            case JANUARY -> isNthMonday(date, 2);    // Coming of Age Day
            case MARCH -> date.getDayOfMonth() == vernalEquinoxDay(year);
            case JULY -> isNthMonday(date, 3);       // Marine Day
            case SEPTEMBER -> isNthMonday(date, 3)   // Respect for the Aged Day
                || date.getDayOfMonth() == autumnalEquinoxDay(year);
            case OCTOBER -> isNthMonday(date, 2);    // Sports Day
            default -> false;
        };
    }

    public static boolean isHoliday(LocalDate date) {
        return isLegalHoliday(date) || isNationalHoliday(date);
    }

    /** Day of March, by the usual approximation; 20 outside 1851-2150. */
    static int vernalEquinoxDay(int year) {
        if (year >= 1851 && year <= 1899) return equinox(19.8277, 0.2422, year, 1851);
        if (year >= 1900 && year <= 1979) return equinox(21.124, 0.2422, year, 1900);
        if (year >= 1980 && year <= 2099) return equinox(20.8431, 0.242194, year, 1980);
        if (year >= 2100 && year <= 2150) return equinox(21.8510, 0.242194, year, 2100);
        return 20;
    }

    /** Day of September, by the usual approximation; 23 outside 1851-2150. */
    static int autumnalEquinoxDay(int year) {
        if (year >= 1851 && year <= 1899) return equinox(22.7020, 0.2422, year, 1851);
        if (year >= 1900 && year <= 1979) return equinox(23.2488, 0.2422, year, 1900);
        if (year >= 1980 && year <= 2099) return equinox(23.2488, 0.242194, year, 1980);
        if (year >= 2100 && year <= 2150) return equinox(24.2488, 0.242194, year, 2100);
        return 23;
    }

    private static int equinox(double base, double drift, int year, int epoch) {
        int elapsed = year - epoch;
        return (int) Math.floor(base + drift * elapsed - Math.floor(elapsed / 4.0));
    }

    private static boolean isNthMonday(LocalDate date, int nth) {
        LocalDate nthMonday = date.with(TemporalAdjusters.dayOfWeekInMonth(nth, DayOfWeek.MONDAY));
        return date.equals(nthMonday);
    }
}
