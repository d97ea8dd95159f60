package io.quakeflow.extract;

import io.quakeflow.models.Interval;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a range of whole years into contiguous, non-overlapping intervals.
 */
public final class IntervalGenerator {

    private IntervalGenerator() {}

    /**
     * Covers exactly [Jan 1 of {@code startYear}, Dec 31 of {@code endYear}] with
     * intervals of {@code intervalYears} years each. The last interval is
     * truncated at the global end; an interval that would cover less than one
     * day is dropped.
     */
    public static List<Interval> generate(int startYear, int endYear, int intervalYears) {
        if (startYear > endYear) {
            throw new IllegalArgumentException(
                    "startYear " + startYear + " is after endYear " + endYear);
        }
        if (intervalYears < 1) {
            throw new IllegalArgumentException("intervalYears must be >= 1, got " + intervalYears);
        }

        LocalDate globalEnd = LocalDate.of(endYear, 12, 31);
        List<Interval> intervals = new ArrayList<>();

        LocalDate current = LocalDate.of(startYear, 1, 1);
        while (!current.isAfter(globalEnd)) {
            LocalDate end = current.plusYears(intervalYears).minusDays(1);
            if (end.isAfter(globalEnd)) {
                end = globalEnd;
            }
            if (end.isBefore(current)) {
                break;
            }
            intervals.add(new Interval(current, end));
            current = end.plusDays(1);
        }
        return intervals;
    }
}
