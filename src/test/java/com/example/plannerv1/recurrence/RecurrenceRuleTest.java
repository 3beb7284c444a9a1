package com.example.plannerv1.recurrence;

import com.example.plannerv1.exception.PatternValidationException;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecurrenceRuleTest {

    @Test
    void intervalBelowOne_isRejected() {
        assertThatThrownBy(() -> new RecurrenceRule.Daily(0))
                .isInstanceOf(PatternValidationException.class)
                .extracting("field").isEqualTo("interval");
    }

    @Test
    void weekly_withoutDays_isRejected() {
        assertThatThrownBy(() -> new RecurrenceRule.Weekly(1, Set.of()))
                .isInstanceOf(PatternValidationException.class)
                .extracting("field").isEqualTo("daysOfWeek");
    }

    @Test
    void yearly_dayThatNeverExists_isRejected() {
        assertThatThrownBy(() -> new RecurrenceRule.Yearly(1, 2, 30))
                .isInstanceOf(PatternValidationException.class);
        assertThatThrownBy(() -> new RecurrenceRule.Yearly(1, 13, 1))
                .isInstanceOf(PatternValidationException.class);
    }

    @Test
    void specificDates_outOfRange_isRejected() {
        assertThatThrownBy(() -> new RecurrenceRule.SpecificDatesOfMonth(1, new TreeSet<>(Set.of(0, 10))))
                .isInstanceOf(PatternValidationException.class);
    }

    @Test
    void nthWeekday_ordinalOutOfRange_isRejected() {
        assertThatThrownBy(() -> new NthWeekday(6, DayOfWeek.MONDAY)).isInstanceOf(PatternValidationException.class);
        assertThatThrownBy(() -> new NthWeekday(0, DayOfWeek.MONDAY)).isInstanceOf(PatternValidationException.class);
    }

    @Test
    void nthWeekday_last_matchesFinalOccurrenceOnly() {
        NthWeekday lastMonday = NthWeekday.last(DayOfWeek.MONDAY);

        assertThat(lastMonday.matches(LocalDate.of(2026, 8, 31))).isTrue();
        assertThat(lastMonday.matches(LocalDate.of(2026, 8, 24))).isFalse();
    }

    @Test
    void afterCompletion_allowsMissingDays_butNotZero() {
        assertThat(new RecurrenceRule.AfterCompletion(null).daysAfterCompletion()).isNull();
        assertThatThrownBy(() -> new RecurrenceRule.AfterCompletion(0)).isInstanceOf(PatternValidationException.class);
    }

    @Test
    void weekly_copiesDaysDefensively() {
        RecurrenceRule.Weekly weekly = new RecurrenceRule.Weekly(1, new java.util.HashSet<>(Set.of(DayOfWeek.FRIDAY)));

        assertThat(weekly.daysOfWeek()).containsExactly(DayOfWeek.FRIDAY);
        assertThat(weekly.type()).isEqualTo(RecurrenceType.WEEKLY);
    }
}
