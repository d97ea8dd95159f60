package io.quakeflow.quality;

import io.quakeflow.models.CheckResult;
import io.quakeflow.models.RawDataset;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fails a core column that is absent, or whose share of missing values
 * exceeds the threshold. A share exactly at the threshold passes.
 */
public class NullRatioCheck implements QualityCheck {

    public static final String NAME = "null_values";

    private final double threshold;

    public NullRatioCheck(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run(RawDataset dataset) {
        List<String> violations = new ArrayList<>();
        int total = dataset.size();

        for (String column : CORE_COLUMNS) {
            if (!dataset.hasColumn(column)) {
                violations.add("Missing required column: " + column);
                continue;
            }
            if (total == 0) {
                continue;
            }
            long missing = dataset.column(column).stream().filter(QualityCheck::isMissing).count();
            double ratio = (double) missing / total;
            if (ratio > threshold) {
                violations.add(String.format(Locale.ROOT,
                        "Column '%s' has %.2f%% null values (threshold: %.2f%%)",
                        column, ratio * 100, threshold * 100));
            }
        }
        return CheckResult.of(violations);
    }
}
