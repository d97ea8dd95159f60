package io.quakeflow.utils;

import java.util.Arrays;
import java.util.List;

/**
 * Descriptive statistics over plain double columns.
 * Sample statistics use the n - 1 denominator.
 */
public final class Statistics {

    private Statistics() {}

    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    public static double median(List<Double> values) {
        if (values.isEmpty()) {
            return Double.NaN;
        }
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /** Sample standard deviation; NaN for fewer than two values. */
    public static double stdDev(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            return Double.NaN;
        }
        double mean = mean(values);
        double ss = 0.0;
        for (double v : values) {
            ss += (v - mean) * (v - mean);
        }
        return Math.sqrt(ss / (n - 1));
    }

    /**
     * Adjusted Fisher-Pearson skewness (G1). NaN for fewer than three values
     * or a constant column.
     */
    public static double skewness(List<Double> values) {
        int n = values.size();
        if (n < 3) {
            return Double.NaN;
        }
        double mean = mean(values);
        double m2 = 0.0;
        double m3 = 0.0;
        for (double v : values) {
            double d = v - mean;
            m2 += d * d;
            m3 += d * d * d;
        }
        m2 /= n;
        m3 /= n;
        if (m2 == 0.0) {
            return Double.NaN;
        }
        double g1 = m3 / Math.pow(m2, 1.5);
        return Math.sqrt((double) n * (n - 1)) / (n - 2) * g1;
    }

    public static double min(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).min().orElse(Double.NaN);
    }

    public static double max(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).max().orElse(Double.NaN);
    }

    /** One-line describe() style summary: count, mean, std, min, max. */
    public static String describe(String column, List<Double> values) {
        return String.format("%-16s count=%d mean=%.4f std=%.4f min=%.4f max=%.4f",
                column, values.size(), mean(values), stdDev(values), min(values), max(values));
    }
}
