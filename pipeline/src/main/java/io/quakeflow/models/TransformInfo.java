package io.quakeflow.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.quakeflow.utils.Statistics;

import java.util.List;

/**
 * Whether a log transform should be applied to a target column, and the
 * parameters needed to invert it. Consumed by the downstream trainer.
 */
public final class TransformInfo {

    public static final double SKEWNESS_THRESHOLD = 1.0;
    private static final double SHIFT_EPSILON = 0.001;

    @JsonProperty("target")
    private final String target;

    @JsonProperty("log_transform")
    private final boolean logTransform;

    @JsonProperty("y_shift")
    private final double shift;

    @JsonProperty("y_original_mean")
    private final double originalMean;

    @JsonProperty("skewness")
    private final double skewness;

    public TransformInfo(String target, boolean logTransform, double shift,
                         double originalMean, double skewness) {
        this.target = target;
        this.logTransform = logTransform;
        this.shift = shift;
        this.originalMean = originalMean;
        this.skewness = skewness;
    }

    /**
     * Derives the transform for {@code target} from a feature table.
     * Skewness above {@link #SKEWNESS_THRESHOLD} enables {@code log1p}; a
     * non-positive minimum records a shift of {@code min - 0.001}.
     */
    public static TransformInfo analyze(FeatureTable table, String target) {
        List<Double> values = table.numericColumn(target);
        double skew = Statistics.skewness(values);
        double mean = Statistics.mean(values);
        if (!(skew > SKEWNESS_THRESHOLD)) {
            return new TransformInfo(target, false, 0.0, mean, skew);
        }
        double min = Statistics.min(values);
        double shift = min <= 0 ? min - SHIFT_EPSILON : 0.0;
        return new TransformInfo(target, true, shift, mean, skew);
    }

    public double apply(double y) {
        if (!logTransform) {
            return y;
        }
        return Math.log1p(y - shift);
    }

    public double inverse(double transformed) {
        if (!logTransform) {
            return transformed;
        }
        return Math.expm1(transformed) + shift;
    }

    public String getTarget() { return target; }
    public boolean isLogTransform() { return logTransform; }
    public double getShift() { return shift; }
    public double getOriginalMean() { return originalMean; }
    public double getSkewness() { return skewness; }

    @Override
    public String toString() {
        return String.format("TransformInfo{target=%s, log=%b, shift=%.4f, skew=%.3f}",
                target, logTransform, shift, skewness);
    }
}
