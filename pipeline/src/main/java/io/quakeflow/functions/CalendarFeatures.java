package io.quakeflow.functions;

import io.quakeflow.models.FeatureRow;
import io.quakeflow.utils.TimeUtils;

import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.util.List;

/**
 * Calendar decomposition of the event time in UTC.
 * day_of_week is 0 for Monday; week_of_year is the ISO week.
 */
public class CalendarFeatures implements FeatureFunction {

    @Override
    public void apply(List<FeatureRow> rows) {
        for (FeatureRow row : rows) {
            ZonedDateTime t = TimeUtils.toUtc(row.getTime());
            row.setYear(t.getYear());
            row.setMonth(t.getMonthValue());
            row.setDay(t.getDayOfMonth());
            row.setHour(t.getHour());
            row.setDayOfWeek(t.getDayOfWeek().getValue() - 1);
            row.setDayOfYear(t.getDayOfYear());
            row.setWeekOfYear(t.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        }
    }
}
