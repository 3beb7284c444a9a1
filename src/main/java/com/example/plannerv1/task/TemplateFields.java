package com.example.plannerv1.task;

import java.time.LocalTime;
import java.util.Objects;

/**
 * パターンから生成されるタスクに引き継ぐ項目。
 * 再生成時の「未編集」判定もこの項目の一致で行う。
 */
public record TemplateFields(
        String title,
        String description,
        String categoryId,
        PriorityLetter priorityLetter,
        Integer priorityNumber,
        LocalTime startTime,
        Integer durationMinutes
) {
    public TemplateFields {
        description = description == null ? "" : description;
        priorityLetter = priorityLetter == null ? PriorityLetter.B : priorityLetter;
        priorityNumber = priorityNumber == null ? 1 : priorityNumber;
    }

    public boolean sameAs(TemplateFields other) {
        return other != null
                && Objects.equals(title, other.title)
                && Objects.equals(description, other.description)
                && Objects.equals(categoryId, other.categoryId)
                && priorityLetter == other.priorityLetter
                && Objects.equals(priorityNumber, other.priorityNumber)
                && Objects.equals(startTime, other.startTime)
                && Objects.equals(durationMinutes, other.durationMinutes);
    }
}
