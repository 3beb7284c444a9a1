package com.example.plannerv1.pattern;

import com.example.plannerv1.task.PriorityLetter;
import com.example.plannerv1.task.Task;
import com.example.plannerv1.task.TaskStatus;

import java.time.LocalDate;
import java.time.LocalTime;

public record TaskInstanceDto(
        Long id,
        Long recurringPatternId,
        LocalDate scheduledDate,
        LocalDate instanceDate,
        String title,
        String description,
        String categoryId,
        PriorityLetter priorityLetter,
        Integer priorityNumber,
        LocalTime startTime,
        Integer durationMinutes,
        TaskStatus status
) {
    public static TaskInstanceDto from(Task task) {
        return new TaskInstanceDto(
                task.getId(),
                task.getRecurringPatternId(),
                task.getScheduledDate(),
                task.getInstanceDate(),
                task.getTitle(),
                task.getDescription(),
                task.getCategoryId(),
                task.getPriorityLetter(),
                task.getPriorityNumber(),
                task.getStartTime(),
                task.getDurationMinutes(),
                task.getStatus()
        );
    }
}
