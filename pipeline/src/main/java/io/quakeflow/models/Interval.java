package io.quakeflow.models;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Inclusive calendar-day range [startDate, endDate] used to chunk a fetch.
 */
public final class Interval implements Comparable<Interval> {

    private final LocalDate startDate;
    private final LocalDate endDate;

    public Interval(LocalDate startDate, LocalDate endDate) {
        this.startDate = Objects.requireNonNull(startDate, "startDate");
        this.endDate = Objects.requireNonNull(endDate, "endDate");
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException(
                    "Interval end " + endDate + " is before start " + startDate);
        }
    }

    public LocalDate getStartDate() { return startDate; }
    public LocalDate getEndDate() { return endDate; }

    /** Number of calendar days covered, both ends included. */
    public long lengthInDays() {
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    /** Exclusive upper bound for range queries: midnight after endDate. */
    public LocalDate exclusiveEnd() {
        return endDate.plusDays(1);
    }

    /** File-name friendly label, e.g. {@code 2010-01-01_2010-12-31}. */
    public String label() {
        return startDate + "_" + endDate;
    }

    @Override
    public int compareTo(Interval other) {
        return startDate.compareTo(other.startDate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Interval)) return false;
        Interval that = (Interval) o;
        return startDate.equals(that.startDate) && endDate.equals(that.endDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startDate, endDate);
    }

    @Override
    public String toString() {
        return "[" + startDate + " .. " + endDate + "]";
    }
}
