package com.example.plannerv1.pattern;

import com.example.plannerv1.recurrence.NthWeekday;
import com.example.plannerv1.recurrence.RecurrenceRule;
import com.example.plannerv1.exception.PatternValidationException;

import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Converts between the flat rule columns of {@link RecurringPattern} and {@link RecurrenceRule}.
 * This is the only place that knows which column belongs to which rule type.
 */
final class RecurrenceRules {

    private RecurrenceRules() {}

    static RecurrenceRule fromPattern(RecurringPattern p) {
        int interval = p.getInterval() == null ? 1 : p.getInterval();
        return switch (p.getRecurrenceType()) {
            case DAILY -> new RecurrenceRule.Daily(interval);
            case WEEKLY -> new RecurrenceRule.Weekly(interval, parseDays(p.getDaysOfWeekCsv()));
            case MONTHLY_BY_DAY -> new RecurrenceRule.MonthlyByDay(interval, required("dayOfMonth", p.getDayOfMonth()));
            case YEARLY -> new RecurrenceRule.Yearly(interval,
                    required("monthOfYear", p.getMonthOfYear()),
                    required("dayOfMonth", p.getDayOfMonth()));
            case NTH_WEEKDAY_OF_MONTH -> new RecurrenceRule.NthWeekdayOfMonth(interval,
                    new NthWeekday(required("nthWeekday.ordinal", p.getNthOrdinal()), p.getNthWeekday()));
            case SPECIFIC_DATES_OF_MONTH -> new RecurrenceRule.SpecificDatesOfMonth(interval,
                    parseInts(p.getSpecificDatesCsv()));
            case AFTER_COMPLETION -> new RecurrenceRule.AfterCompletion(p.getDaysAfterCompletion());
        };
    }

    static void applyTo(RecurrenceRule rule, RecurringPattern p) {
        if (rule == null) {
            throw new PatternValidationException("recurrenceType", "繰り返しルールは必須です");
        }
        p.setRecurrenceType(rule.type());
        p.setInterval(1);
        p.setDaysOfWeekCsv(null);
        p.setDayOfMonth(null);
        p.setMonthOfYear(null);
        p.setNthOrdinal(null);
        p.setNthWeekday(null);
        p.setSpecificDatesCsv(null);
        p.setDaysAfterCompletion(null);

        if (rule instanceof RecurrenceRule.Daily d) {
            p.setInterval(d.interval());
        } else if (rule instanceof RecurrenceRule.Weekly w) {
            p.setInterval(w.interval());
            p.setDaysOfWeekCsv(EnumSet.copyOf(w.daysOfWeek()).stream()
                    .map(DayOfWeek::name).collect(Collectors.joining(",")));
        } else if (rule instanceof RecurrenceRule.MonthlyByDay m) {
            p.setInterval(m.interval());
            p.setDayOfMonth(m.dayOfMonth());
        } else if (rule instanceof RecurrenceRule.Yearly y) {
            p.setInterval(y.interval());
            p.setMonthOfYear(y.monthOfYear());
            p.setDayOfMonth(y.dayOfMonth());
        } else if (rule instanceof RecurrenceRule.NthWeekdayOfMonth n) {
            p.setInterval(n.interval());
            p.setNthOrdinal(n.nthWeekday().ordinal());
            p.setNthWeekday(n.nthWeekday().weekday());
        } else if (rule instanceof RecurrenceRule.SpecificDatesOfMonth s) {
            p.setInterval(s.interval());
            p.setSpecificDatesCsv(s.days().stream().map(String::valueOf).collect(Collectors.joining(",")));
        } else if (rule instanceof RecurrenceRule.AfterCompletion a) {
            p.setDaysAfterCompletion(a.daysAfterCompletion());
        }
    }

    private static int required(String field, Integer value) {
        if (value == null) {
            throw new PatternValidationException(field, field + " は必須です");
        }
        return value;
    }

    private static Set<DayOfWeek> parseDays(String csv) {
        if (csv == null || csv.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(DayOfWeek::valueOf)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(DayOfWeek.class)));
    }

    private static SortedSet<Integer> parseInts(String csv) {
        SortedSet<Integer> out = new TreeSet<>();
        if (csv == null || csv.isBlank()) {
            return out;
        }
        for (String part : csv.split(",")) {
            String s = part.trim();
            if (!s.isEmpty()) {
                try {
                    out.add(Integer.parseInt(s));
                } catch (NumberFormatException e) {
                    throw new PatternValidationException("specificDatesOfMonth", "日付の形式が不正です: " + s);
                }
            }
        }
        return out;
    }
}
