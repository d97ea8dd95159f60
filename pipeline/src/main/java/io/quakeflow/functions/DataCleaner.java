package io.quakeflow.functions;

import io.quakeflow.models.FeatureRow;
import io.quakeflow.utils.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Row-level cleaning. Every step returns a new list and is idempotent, so
 * {@link #clean} applied twice equals applying it once.
 */
public class DataCleaner {

    private static final Logger LOG = LoggerFactory.getLogger(DataCleaner.class);

    static final double MIN_MAGNITUDE = 0.0;
    static final double MAX_MAGNITUDE = 10.0;

    /** Keeps the first row seen for each id. Rows without an id are kept. */
    public List<FeatureRow> dropDuplicates(List<FeatureRow> rows) {
        Set<String> seen = new HashSet<>();
        List<FeatureRow> result = new ArrayList<>(rows.size());
        for (FeatureRow row : rows) {
            if (row.getId() == null || seen.add(row.getId())) {
                result.add(row);
            }
        }
        logDropped("duplicate", rows.size(), result.size());
        return result;
    }

    public List<FeatureRow> dropMissingCore(List<FeatureRow> rows) {
        List<FeatureRow> result = new ArrayList<>(rows.size());
        for (FeatureRow row : rows) {
            if (row.hasCoreAttributes()) {
                result.add(row);
            }
        }
        logDropped("incomplete", rows.size(), result.size());
        return result;
    }

    /**
     * Fills nulls in the optional numeric event attributes with the column
     * median. Lag columns and mag_std_24h are left alone: there a null means
     * the history was too short. A column with no values at all stays null.
     */
    public List<FeatureRow> imputeMedians(List<FeatureRow> rows) {
        imputeDouble(rows, FeatureRow::getDepth, FeatureRow::setDepth, "depth");
        imputeDouble(rows, FeatureRow::getGap, FeatureRow::setGap, "gap");
        imputeDouble(rows, FeatureRow::getDmin, FeatureRow::setDmin, "dmin");
        imputeDouble(rows, FeatureRow::getRms, FeatureRow::setRms, "rms");
        imputeInteger(rows, FeatureRow::getSignificance, FeatureRow::setSignificance, "significance");
        imputeInteger(rows, FeatureRow::getNst, FeatureRow::setNst, "nst");
        return new ArrayList<>(rows);
    }

    public List<FeatureRow> filterMagnitudeRange(List<FeatureRow> rows) {
        List<FeatureRow> result = new ArrayList<>(rows.size());
        for (FeatureRow row : rows) {
            double mag = row.getMagnitude();
            if (mag >= MIN_MAGNITUDE && mag <= MAX_MAGNITUDE) {
                result.add(row);
            }
        }
        logDropped("out-of-range magnitude", rows.size(), result.size());
        return result;
    }

    public List<FeatureRow> absDepth(List<FeatureRow> rows) {
        for (FeatureRow row : rows) {
            if (row.getDepth() != null) {
                row.setDepth(Math.abs(row.getDepth()));
            }
        }
        return new ArrayList<>(rows);
    }

    public List<FeatureRow> clean(List<FeatureRow> rows) {
        List<FeatureRow> result = dropDuplicates(rows);
        result = dropMissingCore(result);
        result = imputeMedians(result);
        result = filterMagnitudeRange(result);
        return absDepth(result);
    }

    private static void imputeDouble(List<FeatureRow> rows, Function<FeatureRow, Double> getter,
                                     Setter<Double> setter, String column) {
        List<Double> present = new ArrayList<>();
        for (FeatureRow row : rows) {
            if (getter.apply(row) != null) {
                present.add(getter.apply(row));
            }
        }
        if (present.isEmpty() || present.size() == rows.size()) {
            return;
        }
        double median = Statistics.median(present);
        for (FeatureRow row : rows) {
            if (getter.apply(row) == null) {
                setter.set(row, median);
            }
        }
        LOG.debug("Imputed {} null {} value(s) with median {}", rows.size() - present.size(), column, median);
    }

    private static void imputeInteger(List<FeatureRow> rows, Function<FeatureRow, Integer> getter,
                                      Setter<Integer> setter, String column) {
        imputeDouble(rows,
                row -> getter.apply(row) == null ? null : getter.apply(row).doubleValue(),
                (row, value) -> setter.set(row, (int) Math.round(value)),
                column);
    }

    private static void logDropped(String reason, int before, int after) {
        if (after < before) {
            LOG.info("Dropped {} {} row(s)", before - after, reason);
        }
    }

    @FunctionalInterface
    private interface Setter<V> {
        void set(FeatureRow row, V value);
    }
}
