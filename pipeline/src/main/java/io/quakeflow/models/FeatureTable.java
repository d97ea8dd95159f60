package io.quakeflow.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of the feature transform: rows ordered by occurrence time ascending.
 */
public final class FeatureTable {

    private final List<FeatureRow> rows;

    public FeatureTable(List<FeatureRow> rows) {
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public List<FeatureRow> getRows() { return rows; }

    public List<String> getColumns() {
        return FeatureRow.COLUMNS;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** Non-null numeric values of a column, in row order. */
    public List<Double> numericColumn(String column) {
        List<Double> values = new ArrayList<>(rows.size());
        for (FeatureRow row : rows) {
            Double value = row.numericValue(column);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    @Override
    public String toString() {
        return String.format("FeatureTable{rows=%d, columns=%d}", rows.size(), FeatureRow.COLUMNS.size());
    }
}
