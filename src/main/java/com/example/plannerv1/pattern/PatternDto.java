package com.example.plannerv1.pattern;

import com.example.plannerv1.recurrence.EndCondition;
import com.example.plannerv1.recurrence.RecurrenceType;
import com.example.plannerv1.task.PriorityLetter;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Set;

public record PatternDto(
        Long id,
        String ownerId,
        String title,
        String description,
        String categoryId,
        PriorityLetter priorityLetter,
        Integer priorityNumber,
        LocalTime startTime,
        Integer durationMinutes,
        RecurrenceType recurrenceType,
        Integer interval,
        String daysOfWeek,
        Integer dayOfMonth,
        Integer monthOfYear,
        Integer nthOrdinal,
        DayOfWeek nthWeekday,
        String specificDatesOfMonth,
        Integer daysAfterCompletion,
        EndCondition endCondition,
        Set<LocalDate> exceptionDates,
        LocalDate startDate,
        LocalDate generatedUntil,
        Long activeInstanceId,
        Long migratedFromTaskId,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static PatternDto from(RecurringPattern p) {
        return new PatternDto(
                p.getId(),
                p.getOwnerId(),
                p.getTitle(),
                p.getDescription(),
                p.getCategoryId(),
                p.getPriorityLetter(),
                p.getPriorityNumber(),
                p.getStartTime(),
                p.getDurationMinutes(),
                p.getRecurrenceType(),
                p.getInterval(),
                p.getDaysOfWeekCsv(),
                p.getDayOfMonth(),
                p.getMonthOfYear(),
                p.getNthOrdinal(),
                p.getNthWeekday(),
                p.getSpecificDatesCsv(),
                p.getDaysAfterCompletion(),
                p.endCondition(),
                p.exceptionDates(),
                p.getStartDate(),
                p.getGeneratedUntil(),
                p.getActiveInstanceId(),
                p.getMigratedFromTaskId(),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }
}
