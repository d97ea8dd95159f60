package io.quakeflow.functions;

import io.quakeflow.models.FeatureRow;
import io.quakeflow.utils.GeoUtils;

import java.util.List;

/** Absolute latitude and the {@code pacific_ring} flag, a coarse longitude/latitude heuristic. */
public class LocationFeatures implements FeatureFunction {

    @Override
    public void apply(List<FeatureRow> rows) {
        for (FeatureRow row : rows) {
            row.setAbsLatitude(GeoUtils.absLatitude(row.getLatitude()));
            row.setPacificRing(GeoUtils.isInHighActivityRegion(row.getLatitude(), row.getLongitude()) ? 1 : 0);
        }
    }
}
