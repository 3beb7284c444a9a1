package com.example.plannerv1.recurrence;

import com.example.plannerv1.exception.PatternValidationException;

import java.time.LocalDate;
import java.util.Optional;

/**
 * When a recurrence stops producing occurrences.
 */
public record EndCondition(Type type, LocalDate endDate, Integer maxOccurrences) {

    public enum Type { NEVER, ON_DATE, AFTER_OCCURRENCES }

    private static final EndCondition NEVER = new EndCondition(Type.NEVER, null, null);

    public EndCondition {
        if (type == null) {
            type = Type.NEVER;
        }
        switch (type) {
            case NEVER -> {
                endDate = null;
                maxOccurrences = null;
            }
            case ON_DATE -> {
                if (endDate == null) {
                    throw new PatternValidationException("endCondition.endDate", "終了日は必須です");
                }
                maxOccurrences = null;
            }
            case AFTER_OCCURRENCES -> {
                if (maxOccurrences == null || maxOccurrences < 1) {
                    throw new PatternValidationException("endCondition.maxOccurrences", "回数は1以上で指定してください");
                }
                endDate = null;
            }
        }
    }

    public static EndCondition never() {
        return NEVER;
    }

    public static EndCondition onDate(LocalDate endDate) {
        return new EndCondition(Type.ON_DATE, endDate, null);
    }

    public static EndCondition afterOccurrences(int maxOccurrences) {
        return new EndCondition(Type.AFTER_OCCURRENCES, null, maxOccurrences);
    }

    /**
     * The last date this condition allows, when it is bounded by a date.
     */
    public Optional<LocalDate> lastAllowedDate() {
        return type == Type.ON_DATE ? Optional.of(endDate) : Optional.empty();
    }

    /**
     * True when this condition lets the recurrence run strictly longer than {@code previous}:
     * becoming never-ending, moving the end date later, or setting an end date where none was set.
     */
    public boolean extendsBeyond(EndCondition previous) {
        return switch (type) {
            case NEVER -> previous.type != Type.NEVER;
            case ON_DATE -> switch (previous.type) {
                case NEVER -> false;
                case ON_DATE -> endDate.isAfter(previous.endDate);
                case AFTER_OCCURRENCES -> true;
            };
            case AFTER_OCCURRENCES -> previous.type == Type.AFTER_OCCURRENCES
                    && maxOccurrences > previous.maxOccurrences;
        };
    }

    /**
     * True when this condition ends on a date strictly earlier than {@code previous} allowed.
     */
    public boolean endsBefore(EndCondition previous) {
        if (type != Type.ON_DATE) {
            return false;
        }
        return switch (previous.type) {
            case NEVER -> true;
            case ON_DATE -> endDate.isBefore(previous.endDate);
            case AFTER_OCCURRENCES -> false;
        };
    }
}
