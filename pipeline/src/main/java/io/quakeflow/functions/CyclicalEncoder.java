package io.quakeflow.functions;

import io.quakeflow.models.FeatureRow;

import java.util.List;

/**
 * Sine/cosine encoding of hour, month and day of week so that adjacent
 * values across the wrap (23h and 0h, December and January) stay close.
 * Requires {@link CalendarFeatures} to have run.
 */
public class CyclicalEncoder implements FeatureFunction {

    static final double HOURS_PER_DAY = 24.0;
    static final double MONTHS_PER_YEAR = 12.0;
    static final double DAYS_PER_WEEK = 7.0;

    @Override
    public void apply(List<FeatureRow> rows) {
        for (FeatureRow row : rows) {
            row.setHourSin(sin(row.getHour(), HOURS_PER_DAY));
            row.setHourCos(cos(row.getHour(), HOURS_PER_DAY));
            row.setMonthSin(sin(row.getMonth(), MONTHS_PER_YEAR));
            row.setMonthCos(cos(row.getMonth(), MONTHS_PER_YEAR));
            row.setDayOfWeekSin(sin(row.getDayOfWeek(), DAYS_PER_WEEK));
            row.setDayOfWeekCos(cos(row.getDayOfWeek(), DAYS_PER_WEEK));
        }
    }

    static double sin(double value, double period) {
        return Math.sin(2 * Math.PI * value / period);
    }

    static double cos(double value, double period) {
        return Math.cos(2 * Math.PI * value / period);
    }
}
