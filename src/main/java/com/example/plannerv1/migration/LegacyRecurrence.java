package com.example.plannerv1.migration;

import com.example.plannerv1.exception.PatternValidationException;
import com.example.plannerv1.recurrence.EndCondition;
import com.example.plannerv1.recurrence.NthWeekday;
import com.example.plannerv1.recurrence.RecurrenceRule;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 旧形式でタスクに埋め込まれていた繰り返し設定（JSON）。
 * 曜日は 0=日曜 .. 6=土曜。日付は "yyyy-MM-dd" または ISO 日時文字列（日付部分のみ使う）。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyRecurrence(
        String type,
        Integer interval,
        List<Integer> daysOfWeek,
        Integer dayOfMonth,
        Integer monthOfYear,
        LegacyNthWeekday nthWeekday,
        List<Integer> specificDatesOfMonth,
        Integer daysAfterCompletion,
        LegacyEndCondition endCondition,
        List<String> exceptions
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LegacyNthWeekday(Integer n, Integer weekday) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LegacyEndCondition(String type, String endDate, Integer maxOccurrences) {}

    /**
     * 旧形式のルールを変換する。旧形式で省略されていた日付項目は開始日から補う。
     * "monthly" は指定されている項目に応じて第N曜日・日付指定・日指定のいずれかになる。
     */
    public RecurrenceRule toRule(LocalDate startDate) {
        if (type == null || type.isBlank()) {
            throw new PatternValidationException("recurrence.type", "繰り返しの種類がありません");
        }
        int n = interval == null || interval < 1 ? 1 : interval;
        switch (type) {
            case "daily":
                return new RecurrenceRule.Daily(n);
            case "weekly":
                Set<DayOfWeek> days = daysOfWeek == null || daysOfWeek.isEmpty()
                        ? EnumSet.of(startDate.getDayOfWeek())
                        : toDaysOfWeek(daysOfWeek);
                return new RecurrenceRule.Weekly(n, days);
            case "monthly":
                if (nthWeekday != null && nthWeekday.n() != null && nthWeekday.weekday() != null) {
                    return new RecurrenceRule.NthWeekdayOfMonth(n,
                            new NthWeekday(nthWeekday.n(), toDayOfWeek(nthWeekday.weekday())));
                }
                if (specificDatesOfMonth != null && !specificDatesOfMonth.isEmpty()) {
                    return new RecurrenceRule.SpecificDatesOfMonth(n, new TreeSet<>(specificDatesOfMonth));
                }
                return new RecurrenceRule.MonthlyByDay(n, dayOfMonth != null ? dayOfMonth : startDate.getDayOfMonth());
            case "yearly":
                return new RecurrenceRule.Yearly(n,
                        monthOfYear != null ? monthOfYear : startDate.getMonthValue(),
                        dayOfMonth != null ? dayOfMonth : startDate.getDayOfMonth());
            case "afterCompletion":
                if (daysAfterCompletion == null) {
                    throw new PatternValidationException("recurrence.daysAfterCompletion", "完了後の日数がありません");
                }
                return new RecurrenceRule.AfterCompletion(daysAfterCompletion);
            case "custom":
                throw new PatternValidationException("recurrence.type", "custom 形式の繰り返しは移行できません");
            default:
                throw new PatternValidationException("recurrence.type", "未知の繰り返し種類です: " + type);
        }
    }

    public EndCondition toEndCondition() {
        if (endCondition == null || endCondition.type() == null) {
            return EndCondition.never();
        }
        switch (endCondition.type()) {
            case "never":
                return EndCondition.never();
            case "date":
                return EndCondition.onDate(parseDate("recurrence.endCondition.endDate", endCondition.endDate()));
            case "occurrences":
                if (endCondition.maxOccurrences() == null) {
                    throw new PatternValidationException("recurrence.endCondition.maxOccurrences", "回数がありません");
                }
                return EndCondition.afterOccurrences(endCondition.maxOccurrences());
            default:
                throw new PatternValidationException("recurrence.endCondition.type", "未知の終了条件です: " + endCondition.type());
        }
    }

    public Set<LocalDate> exceptionDates() {
        Set<LocalDate> out = new TreeSet<>();
        if (exceptions != null) {
            for (String s : exceptions) {
                out.add(parseDate("recurrence.exceptions", s));
            }
        }
        return out;
    }

    static DayOfWeek toDayOfWeek(int legacy) {
        if (legacy < 0 || legacy > 6) {
            throw new PatternValidationException("recurrence.daysOfWeek", "曜日は0〜6で指定してください: " + legacy);
        }
        return legacy == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(legacy);
    }

    private static Set<DayOfWeek> toDaysOfWeek(List<Integer> legacy) {
        Set<DayOfWeek> out = EnumSet.noneOf(DayOfWeek.class);
        for (Integer d : legacy) {
            if (d != null) {
                out.add(toDayOfWeek(d));
            }
        }
        return out;
    }

    private static LocalDate parseDate(String field, String value) {
        if (value == null || value.length() < 10) {
            throw new PatternValidationException(field, "日付の形式が不正です: " + value);
        }
        try {
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException e) {
            throw new PatternValidationException(field, "日付の形式が不正です: " + value);
        }
    }
}
