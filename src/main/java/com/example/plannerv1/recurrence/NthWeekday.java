package com.example.plannerv1.recurrence;

import com.example.plannerv1.exception.PatternValidationException;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * The Nth occurrence of a weekday within a month, e.g. 2nd Tuesday or last Friday.
 *
 * @param ordinal 1..5 for first through fifth, {@link #LAST} for the last one in the month
 * @param weekday the weekday
 */
public record NthWeekday(int ordinal, DayOfWeek weekday) {

    public static final int LAST = -1;

    public NthWeekday {
        if (weekday == null) {
            throw new PatternValidationException("nthWeekday.weekday", "曜日は必須です");
        }
        if (ordinal != LAST && (ordinal < 1 || ordinal > 5)) {
            throw new PatternValidationException("nthWeekday.ordinal", "第N週は1〜5または-1(最終)で指定してください: " + ordinal);
        }
    }

    public static NthWeekday last(DayOfWeek weekday) {
        return new NthWeekday(LAST, weekday);
    }

    public boolean matches(LocalDate date) {
        if (date.getDayOfWeek() != weekday) {
            return false;
        }
        if (ordinal == LAST) {
            return date.getDayOfMonth() + 7 > date.lengthOfMonth();
        }
        return (date.getDayOfMonth() - 1) / 7 + 1 == ordinal;
    }
}
