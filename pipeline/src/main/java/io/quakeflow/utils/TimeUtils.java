package io.quakeflow.utils;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Epoch-millisecond helpers. Event times are always interpreted in UTC.
 */
public final class TimeUtils {

    public static final long MILLIS_PER_HOUR = 3_600_000L;
    public static final long MILLIS_PER_DAY = 24 * MILLIS_PER_HOUR;

    private TimeUtils() {}

    public static ZonedDateTime toUtc(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis).atZone(ZoneOffset.UTC);
    }

    /**
     * Elapsed time in fractional hours.
     */
    public static double hoursBetween(long fromMillis, long toMillis) {
        return (toMillis - fromMillis) / (double) MILLIS_PER_HOUR;
    }
}
