package io.quakeflow.functions;

import io.quakeflow.models.FeatureRow;
import io.quakeflow.utils.TimeUtils;

import java.util.List;

/**
 * Time-based trailing windows over magnitude. Row j belongs to row i's
 * window of width W when {@code t_i - W < t_j <= t_i} and j <= i, so a
 * window always holds the current row and never a later one.
 *
 * <p>Each window is found with a left pointer that only moves forward, and
 * means come from prefix arrays. The 24h standard deviation is taken over
 * the window's own rows in two passes, since differences of prefix sums
 * lose the small spread of a short window after a long history.
 */
public class RollingWindowFunction implements FeatureFunction {

    static final long WINDOW_24H = TimeUtils.MILLIS_PER_DAY;
    static final long WINDOW_7D = 7 * TimeUtils.MILLIS_PER_DAY;
    static final long WINDOW_30D = 30 * TimeUtils.MILLIS_PER_DAY;

    @Override
    public void apply(List<FeatureRow> rows) {
        int n = rows.size();
        if (n == 0) {
            return;
        }

        // Centre on the first magnitude to keep the squared sums well conditioned
        double offset = rows.get(0).getMagnitude();
        double[] sum = new double[n + 1];
        for (int i = 0; i < n; i++) {
            sum[i + 1] = sum[i] + rows.get(i).getMagnitude() - offset;
        }

        int left24h = 0;
        int left7d = 0;
        int left30d = 0;
        for (int i = 0; i < n; i++) {
            long t = rows.get(i).getTime();
            left24h = advance(rows, left24h, t - WINDOW_24H);
            left7d = advance(rows, left7d, t - WINDOW_7D);
            left30d = advance(rows, left30d, t - WINDOW_30D);

            FeatureRow row = rows.get(i);
            row.setMagRolling24h(mean(sum, left24h, i, offset));
            row.setMagRolling7d(mean(sum, left7d, i, offset));
            row.setMagRolling30d(mean(sum, left30d, i, offset));
            row.setCountRolling24h(i - left24h + 1);
            row.setCountRolling7d(i - left7d + 1);
            row.setMagStd24h(std(rows, left24h, i));
        }
    }

    /** First index whose time is strictly after {@code lowerBound}. */
    private static int advance(List<FeatureRow> rows, int left, long lowerBound) {
        while (rows.get(left).getTime() <= lowerBound) {
            left++;
        }
        return left;
    }

    private static double mean(double[] sum, int from, int to, double offset) {
        int count = to - from + 1;
        return (sum[to + 1] - sum[from]) / count + offset;
    }

    /** Sample standard deviation of magnitudes in {@code [from, to]}; null below two rows. */
    static Double std(List<FeatureRow> rows, int from, int to) {
        int count = to - from + 1;
        if (count < 2) {
            return null;
        }
        double mean = 0.0;
        for (int j = from; j <= to; j++) {
            mean += rows.get(j).getMagnitude();
        }
        mean /= count;
        double squares = 0.0;
        for (int j = from; j <= to; j++) {
            double d = rows.get(j).getMagnitude() - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / (count - 1));
    }
}
