package com.example.plannerv1.pattern;

import com.example.plannerv1.exception.PatternValidationException;
import com.example.plannerv1.recurrence.EndCondition;
import com.example.plannerv1.recurrence.NthWeekday;
import com.example.plannerv1.recurrence.RecurrenceRule;
import com.example.plannerv1.recurrence.RecurrenceType;
import com.example.plannerv1.task.PriorityLetter;
import com.example.plannerv1.task.TemplateFields;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * パターン作成リクエスト
 */
public record PatternRequest(
        @NotBlank @Size(max = 500) String title,
        @Size(max = 5000) String description,
        String categoryId,
        PriorityLetter priorityLetter,
        @Min(1) Integer priorityNumber,
        LocalTime startTime,
        @Min(1) Integer durationMinutes,
        @NotNull RecurrenceType recurrenceType,
        @Min(1) Integer interval,
        List<DayOfWeek> daysOfWeek,
        @Min(1) @Max(31) Integer dayOfMonth,
        @Min(1) @Max(12) Integer monthOfYear,
        NthWeekdayBody nthWeekday,
        List<Integer> specificDatesOfMonth,
        @Min(1) Integer daysAfterCompletion,
        EndConditionBody endCondition,
        @NotNull LocalDate startDate,
        List<LocalDate> exceptionDates
) {

    public record NthWeekdayBody(Integer ordinal, DayOfWeek weekday) {
        NthWeekday toNthWeekday() {
            if (ordinal == null) {
                throw new PatternValidationException("nthWeekday.ordinal", "第N週は必須です");
            }
            return new NthWeekday(ordinal, weekday);
        }
    }

    public record EndConditionBody(EndCondition.Type type, LocalDate endDate, Integer maxOccurrences) {
        EndCondition toEndCondition() {
            return new EndCondition(type, endDate, maxOccurrences);
        }
    }

    public TemplateFields template() {
        return new TemplateFields(title, description, categoryId, priorityLetter, priorityNumber, startTime, durationMinutes);
    }

    public RecurrenceRule rule() {
        return buildRule(recurrenceType, interval, daysOfWeek, dayOfMonth, monthOfYear, nthWeekday,
                specificDatesOfMonth, daysAfterCompletion);
    }

    public EndCondition toEndCondition() {
        return endCondition == null ? EndCondition.never() : endCondition.toEndCondition();
    }

    public Set<LocalDate> exceptionDateSet() {
        return exceptionDates == null ? Set.of() : new TreeSet<>(exceptionDates);
    }

    /**
     * 種類ごとに必要な項目だけを使ってルールを組み立てる。不足があれば PatternValidationException。
     * 新規作成・更新どちらでも完了後繰り返しの日数は必須とする。
     */
    static RecurrenceRule buildRule(RecurrenceType type, Integer interval, List<DayOfWeek> daysOfWeek,
                                    Integer dayOfMonth, Integer monthOfYear, NthWeekdayBody nthWeekday,
                                    List<Integer> specificDatesOfMonth, Integer daysAfterCompletion) {
        if (type == null) {
            throw new PatternValidationException("recurrenceType", "繰り返しの種類は必須です");
        }
        int n = interval == null ? 1 : interval;
        return switch (type) {
            case DAILY -> new RecurrenceRule.Daily(n);
            case WEEKLY -> new RecurrenceRule.Weekly(n, daysOfWeek == null || daysOfWeek.isEmpty()
                    ? Set.of() : EnumSet.copyOf(daysOfWeek));
            case MONTHLY_BY_DAY -> new RecurrenceRule.MonthlyByDay(n, require("dayOfMonth", dayOfMonth));
            case YEARLY -> new RecurrenceRule.Yearly(n, require("monthOfYear", monthOfYear), require("dayOfMonth", dayOfMonth));
            case NTH_WEEKDAY_OF_MONTH -> {
                if (nthWeekday == null) {
                    throw new PatternValidationException("nthWeekday", "第N曜日の指定は必須です");
                }
                yield new RecurrenceRule.NthWeekdayOfMonth(n, nthWeekday.toNthWeekday());
            }
            case SPECIFIC_DATES_OF_MONTH -> new RecurrenceRule.SpecificDatesOfMonth(n,
                    specificDatesOfMonth == null ? new TreeSet<>() : new TreeSet<>(specificDatesOfMonth));
            case AFTER_COMPLETION -> new RecurrenceRule.AfterCompletion(require("daysAfterCompletion", daysAfterCompletion));
        };
    }

    private static int require(String field, Integer value) {
        if (value == null) {
            throw new PatternValidationException(field, field + " は必須です");
        }
        return value;
    }
}
