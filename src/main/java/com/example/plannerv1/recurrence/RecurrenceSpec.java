package com.example.plannerv1.recurrence;

import com.example.plannerv1.exception.PatternValidationException;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Everything the occurrence generator needs to expand a recurrence.
 *
 * @param rule           the recurrence rule
 * @param startDate      first date occurrences may fall on; also the interval anchor
 * @param endCondition   when the recurrence stops
 * @param exceptionDates dates that never produce an occurrence
 */
public record RecurrenceSpec(RecurrenceRule rule,
                             LocalDate startDate,
                             EndCondition endCondition,
                             Set<LocalDate> exceptionDates) {

    public RecurrenceSpec {
        if (rule == null) {
            throw new PatternValidationException("recurrenceType", "繰り返しルールは必須です");
        }
        if (startDate == null) {
            throw new PatternValidationException("startDate", "開始日は必須です");
        }
        endCondition = endCondition == null ? EndCondition.never() : endCondition;
        exceptionDates = exceptionDates == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new TreeSet<>(exceptionDates));
    }

    public RecurrenceSpec(RecurrenceRule rule, LocalDate startDate, EndCondition endCondition) {
        this(rule, startDate, endCondition, Set.of());
    }
}
