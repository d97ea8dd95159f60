package io.quakeflow.utils;

/**
 * Geographic helpers for location features.
 */
public final class GeoUtils {

    private static final double RING_EAST_LON = 120.0;
    private static final double RING_WEST_LON = -70.0;
    private static final double RING_MAX_ABS_LAT = 60.0;

    private GeoUtils() {}

    /**
     * Distance from the equator in degrees.
     */
    public static double absLatitude(double lat) {
        return Math.abs(lat);
    }

    /**
     * Coarse high-seismic-activity indicator, a heuristic proxy for the
     * Pacific Ring of Fire and not a plate-boundary lookup: the longitude band
     * that wraps the antimeridian from 120E eastwards to 70W, restricted to
     * latitudes within 60 degrees of the equator.
     */
    public static boolean isInHighActivityRegion(double lat, double lon) {
        boolean pacificBand = lon >= RING_EAST_LON || lon <= RING_WEST_LON;
        return pacificBand && Math.abs(lat) <= RING_MAX_ABS_LAT;
    }
}
