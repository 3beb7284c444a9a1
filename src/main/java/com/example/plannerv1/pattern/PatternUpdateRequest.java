package com.example.plannerv1.pattern;

import com.example.plannerv1.recurrence.RecurrenceRule;
import com.example.plannerv1.recurrence.RecurrenceType;
import com.example.plannerv1.task.PriorityLetter;
import com.example.plannerv1.task.TemplateFields;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * パターン更新リクエスト。null の項目は変更しない。
 * ルールは recurrenceType が指定されたときだけ、指定された項目で丸ごと置き換える。
 */
public record PatternUpdateRequest(
        @Size(max = 500) String title,
        @Size(max = 5000) String description,
        String categoryId,
        PriorityLetter priorityLetter,
        @Min(1) Integer priorityNumber,
        LocalTime startTime,
        @Min(1) Integer durationMinutes,
        RecurrenceType recurrenceType,
        @Min(1) Integer interval,
        List<DayOfWeek> daysOfWeek,
        @Min(1) @Max(31) Integer dayOfMonth,
        @Min(1) @Max(12) Integer monthOfYear,
        PatternRequest.NthWeekdayBody nthWeekday,
        List<Integer> specificDatesOfMonth,
        @Min(1) Integer daysAfterCompletion,
        PatternRequest.EndConditionBody endCondition,
        LocalDate startDate,
        List<LocalDate> exceptionDates
) {

    public boolean replacesRule() {
        return recurrenceType != null;
    }

    RecurrenceRule rule() {
        return PatternRequest.buildRule(recurrenceType, interval, daysOfWeek, dayOfMonth, monthOfYear, nthWeekday,
                specificDatesOfMonth, daysAfterCompletion);
    }

    TemplateFields mergeTemplate(TemplateFields current) {
        return new TemplateFields(
                title != null ? title : current.title(),
                description != null ? description : current.description(),
                categoryId != null ? categoryId : current.categoryId(),
                priorityLetter != null ? priorityLetter : current.priorityLetter(),
                priorityNumber != null ? priorityNumber : current.priorityNumber(),
                startTime != null ? startTime : current.startTime(),
                durationMinutes != null ? durationMinutes : current.durationMinutes());
    }
}
