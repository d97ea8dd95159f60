package io.quakeflow.functions;

import io.quakeflow.models.FeatureRow;

import java.util.List;

/**
 * A feature stage that fills columns of every row in place.
 * Rows are expected in ascending time order.
 */
public interface FeatureFunction {

    void apply(List<FeatureRow> rows);
}
