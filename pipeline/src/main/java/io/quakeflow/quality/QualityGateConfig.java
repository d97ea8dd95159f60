package io.quakeflow.quality;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Thresholds and check toggles for the quality gate. All four checks are
 * enabled by default.
 */
public final class QualityGateConfig {

    public static final int DEFAULT_MIN_ROWS = 100;
    public static final double DEFAULT_NULL_THRESHOLD = 0.01;

    public static final List<String> ALL_CHECKS = List.of(
            RowCountCheck.NAME, NullRatioCheck.NAME, SchemaCheck.NAME, RangeCheck.NAME);

    private final int minRows;
    private final double nullThreshold;
    private final Set<String> enabledChecks;

    public QualityGateConfig(int minRows, double nullThreshold, Set<String> enabledChecks) {
        if (minRows < 0) {
            throw new IllegalArgumentException("minRows must be >= 0, got " + minRows);
        }
        if (nullThreshold < 0.0 || nullThreshold > 1.0) {
            throw new IllegalArgumentException("nullThreshold must be within [0, 1], got " + nullThreshold);
        }
        for (String check : enabledChecks) {
            if (!ALL_CHECKS.contains(check)) {
                throw new IllegalArgumentException("Unknown quality check: " + check);
            }
        }
        this.minRows = minRows;
        this.nullThreshold = nullThreshold;
        this.enabledChecks = Collections.unmodifiableSet(new LinkedHashSet<>(enabledChecks));
    }

    public static QualityGateConfig defaults() {
        return new QualityGateConfig(DEFAULT_MIN_ROWS, DEFAULT_NULL_THRESHOLD, new LinkedHashSet<>(ALL_CHECKS));
    }

    public QualityGateConfig withMinRows(int rows) {
        return new QualityGateConfig(rows, nullThreshold, enabledChecks);
    }

    public QualityGateConfig withNullThreshold(double threshold) {
        return new QualityGateConfig(minRows, threshold, enabledChecks);
    }

    public QualityGateConfig without(String checkName) {
        Set<String> remaining = new LinkedHashSet<>(enabledChecks);
        remaining.remove(checkName);
        return new QualityGateConfig(minRows, nullThreshold, remaining);
    }

    public int getMinRows() { return minRows; }
    public double getNullThreshold() { return nullThreshold; }
    public Set<String> getEnabledChecks() { return enabledChecks; }

    public boolean isEnabled(String checkName) {
        return enabledChecks.contains(checkName);
    }
}
