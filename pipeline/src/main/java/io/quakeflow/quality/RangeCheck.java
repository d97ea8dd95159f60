package io.quakeflow.quality;

import io.quakeflow.models.CheckResult;
import io.quakeflow.models.RawDataset;

import java.util.ArrayList;
import java.util.List;

/**
 * Counts rows whose magnitude, longitude or latitude lies outside its
 * physical range. Missing and non-numeric values are not counted here.
 */
public class RangeCheck implements QualityCheck {

    public static final String NAME = "value_ranges";

    private static final List<Bound> BOUNDS = List.of(
            new Bound("magnitude", 0, 10, "[0, 10]"),
            new Bound("longitude", -180, 180, "[-180, 180]"),
            new Bound("latitude", -90, 90, "[-90, 90]"));

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run(RawDataset dataset) {
        List<String> violations = new ArrayList<>();
        for (Bound bound : BOUNDS) {
            if (!dataset.hasColumn(bound.column)) {
                continue;
            }
            long outside = 0;
            for (Object value : dataset.column(bound.column)) {
                if (value instanceof Number && !QualityCheck.isMissing(value)) {
                    double d = ((Number) value).doubleValue();
                    if (d < bound.min || d > bound.max) {
                        outside++;
                    }
                }
            }
            if (outside > 0) {
                violations.add(String.format("Found %d rows with %s outside %s range",
                        outside, bound.column, bound.label));
            }
        }
        return CheckResult.of(violations);
    }

    private static final class Bound {
        final String column;
        final double min;
        final double max;
        final String label;

        Bound(String column, double min, double max, String label) {
            this.column = column;
            this.min = min;
            this.max = max;
            this.label = label;
        }
    }
}
