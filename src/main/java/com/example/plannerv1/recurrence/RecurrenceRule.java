package com.example.plannerv1.recurrence;

import com.example.plannerv1.exception.PatternValidationException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A recurrence rule. Each variant carries exactly the fields it needs and validates them on construction.
 *
 * <ul>
 *   <li>{@link Daily} - every N days
 *   <li>{@link Weekly} - every N weeks on the given weekdays
 *   <li>{@link MonthlyByDay} - every N months on a day of month
 *   <li>{@link Yearly} - every N years on a month/day
 *   <li>{@link NthWeekdayOfMonth} - every N months on e.g. the 2nd Tuesday
 *   <li>{@link SpecificDatesOfMonth} - every N months on a set of days of month
 *   <li>{@link AfterCompletion} - N days after the previous instance was completed
 * </ul>
 */
public sealed interface RecurrenceRule
        permits RecurrenceRule.Daily,
                RecurrenceRule.Weekly,
                RecurrenceRule.MonthlyByDay,
                RecurrenceRule.Yearly,
                RecurrenceRule.NthWeekdayOfMonth,
                RecurrenceRule.SpecificDatesOfMonth,
                RecurrenceRule.AfterCompletion {

    RecurrenceType type();

    /**
     * Whether {@code date} is an occurrence for a recurrence anchored at {@code start}.
     * Callers guarantee {@code date} is not before {@code start}.
     */
    boolean occursOn(LocalDate date, LocalDate start);

    record Daily(int interval) implements RecurrenceRule {
        public Daily {
            requireInterval(interval);
        }

        @Override
        public RecurrenceType type() {
            return RecurrenceType.DAILY;
        }

        @Override
        public boolean occursOn(LocalDate date, LocalDate start) {
            return ChronoUnit.DAYS.between(start, date) % interval == 0;
        }
    }

    record Weekly(int interval, Set<DayOfWeek> daysOfWeek) implements RecurrenceRule {
        public Weekly {
            requireInterval(interval);
            if (daysOfWeek == null || daysOfWeek.isEmpty()) {
                throw new PatternValidationException("daysOfWeek", "毎週の繰り返しには曜日を1つ以上指定してください");
            }
            daysOfWeek = Collections.unmodifiableSet(EnumSet.copyOf(daysOfWeek));
        }

        @Override
        public RecurrenceType type() {
            return RecurrenceType.WEEKLY;
        }

        @Override
        public boolean occursOn(LocalDate date, LocalDate start) {
            if (!daysOfWeek.contains(date.getDayOfWeek())) {
                return false;
            }
            LocalDate startWeek = start.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            LocalDate dateWeek = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            return ChronoUnit.WEEKS.between(startWeek, dateWeek) % interval == 0;
        }
    }

    record MonthlyByDay(int interval, int dayOfMonth) implements RecurrenceRule {
        public MonthlyByDay {
            requireInterval(interval);
            requireDayOfMonth("dayOfMonth", dayOfMonth);
        }

        @Override
        public RecurrenceType type() {
            return RecurrenceType.MONTHLY_BY_DAY;
        }

        @Override
        public boolean occursOn(LocalDate date, LocalDate start) {
            // months without this day are skipped, no rollover to the last day
            return date.getDayOfMonth() == dayOfMonth && monthAligned(date, start, interval);
        }
    }

    record Yearly(int interval, int monthOfYear, int dayOfMonth) implements RecurrenceRule {
        public Yearly {
            requireInterval(interval);
            if (monthOfYear < 1 || monthOfYear > 12) {
                throw new PatternValidationException("monthOfYear", "月は1〜12で指定してください: " + monthOfYear);
            }
            requireDayOfMonth("dayOfMonth", dayOfMonth);
            if (dayOfMonth > Month.of(monthOfYear).maxLength()) {
                throw new PatternValidationException("dayOfMonth",
                        monthOfYear + "月に" + dayOfMonth + "日は存在しません");
            }
        }

        @Override
        public RecurrenceType type() {
            return RecurrenceType.YEARLY;
        }

        @Override
        public boolean occursOn(LocalDate date, LocalDate start) {
            return date.getMonthValue() == monthOfYear
                    && date.getDayOfMonth() == dayOfMonth
                    && (date.getYear() - start.getYear()) % interval == 0;
        }
    }

    record NthWeekdayOfMonth(int interval, NthWeekday nthWeekday) implements RecurrenceRule {
        public NthWeekdayOfMonth {
            requireInterval(interval);
            if (nthWeekday == null) {
                throw new PatternValidationException("nthWeekday", "第N曜日の指定は必須です");
            }
        }

        @Override
        public RecurrenceType type() {
            return RecurrenceType.NTH_WEEKDAY_OF_MONTH;
        }

        @Override
        public boolean occursOn(LocalDate date, LocalDate start) {
            return nthWeekday.matches(date) && monthAligned(date, start, interval);
        }
    }

    record SpecificDatesOfMonth(int interval, SortedSet<Integer> days) implements RecurrenceRule {
        public SpecificDatesOfMonth {
            requireInterval(interval);
            if (days == null || days.isEmpty()) {
                throw new PatternValidationException("specificDatesOfMonth", "日付を1つ以上指定してください");
            }
            for (Integer day : days) {
                requireDayOfMonth("specificDatesOfMonth", day == null ? 0 : day);
            }
            days = Collections.unmodifiableSortedSet(new TreeSet<>(days));
        }

        @Override
        public RecurrenceType type() {
            return RecurrenceType.SPECIFIC_DATES_OF_MONTH;
        }

        @Override
        public boolean occursOn(LocalDate date, LocalDate start) {
            return days.contains(date.getDayOfMonth()) && monthAligned(date, start, interval);
        }
    }

    /**
     * Never expanded from the calendar; the next instance is created when the active one is completed.
     * {@code daysAfterCompletion} may be absent on stored data and is checked where it is needed.
     */
    record AfterCompletion(Integer daysAfterCompletion) implements RecurrenceRule {
        public AfterCompletion {
            if (daysAfterCompletion != null && daysAfterCompletion < 1) {
                throw new PatternValidationException("daysAfterCompletion", "完了後の日数は1以上で指定してください");
            }
        }

        @Override
        public RecurrenceType type() {
            return RecurrenceType.AFTER_COMPLETION;
        }

        @Override
        public boolean occursOn(LocalDate date, LocalDate start) {
            return false;
        }
    }

    private static void requireInterval(int interval) {
        if (interval < 1) {
            throw new PatternValidationException("interval", "間隔は1以上で指定してください: " + interval);
        }
    }

    private static void requireDayOfMonth(String field, int day) {
        if (day < 1 || day > 31) {
            throw new PatternValidationException(field, "日は1〜31で指定してください: " + day);
        }
    }

    private static boolean monthAligned(LocalDate date, LocalDate start, int interval) {
        return ChronoUnit.MONTHS.between(YearMonth.from(start), YearMonth.from(date)) % interval == 0;
    }
}
