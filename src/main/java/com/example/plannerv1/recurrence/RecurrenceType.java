package com.example.plannerv1.recurrence;

public enum RecurrenceType {
    DAILY,
    WEEKLY,
    MONTHLY_BY_DAY,
    YEARLY,
    NTH_WEEKDAY_OF_MONTH,
    SPECIFIC_DATES_OF_MONTH,
    AFTER_COMPLETION
}
