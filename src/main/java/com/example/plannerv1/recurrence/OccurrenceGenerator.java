package com.example.plannerv1.recurrence;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands a {@link RecurrenceSpec} into concrete calendar dates.
 *
 * <p>Pure and deterministic: no I/O, no clock. Dates are local calendar dates.
 *
 * <p>Rules applied, in order, for each candidate date:
 * <ol>
 *   <li>the date must match the rule, with the interval anchored at the start date
 *   <li>exception dates are skipped and do not count toward {@code maxOccurrences}
 *   <li>once {@code maxOccurrences} dates have been produced since the start date, expansion stops
 *   <li>only dates inside {@code [max(from, start), min(to, endDate)]} are returned
 * </ol>
 * Occurrence counting always starts at the pattern start, so asking for a later window
 * never returns occurrences past the configured count.
 */
public final class OccurrenceGenerator {

    private OccurrenceGenerator() {}

    /**
     * Returns the occurrence dates of {@code spec} in {@code [from, to]}, ascending and without duplicates.
     * Returns an empty list when {@code to} is before {@code from} or the rule is completion-driven.
     */
    public static List<LocalDate> generateOccurrenceDates(RecurrenceSpec spec, LocalDate from, LocalDate to) {
        if (from == null || to == null || to.isBefore(from)) {
            return List.of();
        }
        RecurrenceRule rule = spec.rule();
        if (rule instanceof RecurrenceRule.AfterCompletion) {
            return List.of();
        }

        LocalDate start = spec.startDate();
        EndCondition end = spec.endCondition();

        LocalDate lower = from.isAfter(start) ? from : start;
        LocalDate upper = to;
        if (end.type() == EndCondition.Type.ON_DATE && end.endDate().isBefore(upper)) {
            upper = end.endDate();
        }
        if (upper.isBefore(lower)) {
            return List.of();
        }

        boolean counted = end.type() == EndCondition.Type.AFTER_OCCURRENCES;
        int max = counted ? end.maxOccurrences() : Integer.MAX_VALUE;
        LocalDate scanFrom = counted ? start : lower;

        List<LocalDate> result = new ArrayList<>();
        int produced = 0;
        for (LocalDate d = scanFrom; !d.isAfter(upper); d = d.plusDays(1)) {
            if (!rule.occursOn(d, start)) {
                continue;
            }
            if (spec.exceptionDates().contains(d)) {
                continue;
            }
            produced++;
            if (produced > max) {
                break;
            }
            if (!d.isBefore(lower)) {
                result.add(d);
            }
        }
        return result;
    }
}
