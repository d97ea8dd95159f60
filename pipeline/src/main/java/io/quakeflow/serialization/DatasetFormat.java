package io.quakeflow.serialization;

import java.util.Locale;

/**
 * On-disk dataset formats the quality gate can read.
 */
public enum DatasetFormat {
    /** Nested GeoJSON FeatureCollection as returned by USGS. */
    GEOJSON,
    /** Columnar Parquet table. */
    PARQUET;

    public static DatasetFormat fromString(String value) {
        if (value != null) {
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "geojson": return GEOJSON;
                case "parquet": return PARQUET;
                default: break;
            }
        }
        throw new IllegalArgumentException("Unsupported format: " + value);
    }
}
