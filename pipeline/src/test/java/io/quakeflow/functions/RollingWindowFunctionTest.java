package io.quakeflow.functions;

import io.quakeflow.models.FeatureRow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.quakeflow.functions.FeatureFixtures.HOUR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RollingWindowFunctionTest {

    private final RollingWindowFunction function = new RollingWindowFunction();

    @Test
    void testMatchesBruteForce() {
        // Includes a tie, an event exactly 24h after another and a long gap
        long[] hours = {0, 1, 1, 5, 25, 26, 48, 200, 200 + 24 * 7, 1000};
        double[] mags = {3.1, 4.0, 2.5, 5.2, 3.3, 4.8, 2.9, 6.0, 3.7, 4.4};
        List<FeatureRow> rows = FeatureFixtures.rows(mags, hours);

        function.apply(rows);

        for (int i = 0; i < rows.size(); i++) {
            FeatureRow row = rows.get(i);
            assertThat(row.getMagRolling24h()).as("24h mean at %d", i)
                    .isCloseTo(bruteMean(rows, i, 24 * HOUR), within(1e-9));
            assertThat(row.getMagRolling7d()).as("7d mean at %d", i)
                    .isCloseTo(bruteMean(rows, i, 7 * 24 * HOUR), within(1e-9));
            assertThat(row.getMagRolling30d()).as("30d mean at %d", i)
                    .isCloseTo(bruteMean(rows, i, 30 * 24 * HOUR), within(1e-9));
            assertThat(row.getCountRolling24h()).isEqualTo(window(rows, i, 24 * HOUR).size());
            assertThat(row.getCountRolling7d()).isEqualTo(window(rows, i, 7 * 24 * HOUR).size());

            List<Double> w24 = window(rows, i, 24 * HOUR);
            if (w24.size() < 2) {
                assertThat(row.getMagStd24h()).isNull();
            } else {
                assertThat(row.getMagStd24h()).isCloseTo(bruteStd(w24), within(1e-9));
            }
        }
    }

    @Test
    void testWindowExcludesRowExactlyAtLowerBound() {
        List<FeatureRow> rows = FeatureFixtures.rows(new double[]{4.0, 2.0}, new long[]{0, 24});

        function.apply(rows);

        assertThat(rows.get(1).getCountRolling24h()).isEqualTo(1);
        assertThat(rows.get(1).getMagRolling24h()).isEqualTo(2.0);
        assertThat(rows.get(1).getCountRolling7d()).isEqualTo(2);
    }

    @Test
    void testLaterRowWithSameTimestampIsNotVisible() {
        List<FeatureRow> rows = FeatureFixtures.rows(new double[]{3.0, 5.0}, new long[]{2, 2});

        function.apply(rows);

        assertThat(rows.get(0).getCountRolling24h()).isEqualTo(1);
        assertThat(rows.get(0).getMagRolling24h()).isEqualTo(3.0);
        assertThat(rows.get(1).getCountRolling24h()).isEqualTo(2);
        assertThat(rows.get(1).getMagRolling24h()).isCloseTo(4.0, within(1e-9));
    }

    @Test
    void testStdOfEqualMagnitudesAfterLongHistory() {
        int history = 200_000;
        double[] mags = new double[history + 2];
        long[] hours = new long[history + 2];
        for (int i = 0; i < history; i++) {
            mags[i] = 2.0 + (i % 50) / 10.0;
            hours[i] = i;
        }
        mags[history] = 4.1;
        hours[history] = history + 1000L;
        mags[history + 1] = 4.1;
        hours[history + 1] = history + 1001L;
        List<FeatureRow> rows = FeatureFixtures.rows(mags, hours);

        function.apply(rows);

        FeatureRow last = rows.get(history + 1);
        assertThat(last.getCountRolling24h()).isEqualTo(2);
        assertThat(last.getMagStd24h()).isCloseTo(0.0, within(1e-9));
        assertThat(last.getMagRolling24h()).isCloseTo(4.1, within(1e-6));
        assertThat(rows.get(history).getMagStd24h()).isNull();
    }

    @Test
    void testEmptyInput() {
        List<FeatureRow> rows = new ArrayList<>();
        function.apply(rows);
        assertThat(rows).isEmpty();
    }

    // Helper

    private static List<Double> window(List<FeatureRow> rows, int i, long width) {
        long t = rows.get(i).getTime();
        List<Double> values = new ArrayList<>();
        for (int j = 0; j <= i; j++) {
            long tj = rows.get(j).getTime();
            if (tj > t - width && tj <= t) {
                values.add(rows.get(j).getMagnitude());
            }
        }
        return values;
    }

    private static double bruteMean(List<FeatureRow> rows, int i, long width) {
        List<Double> values = window(rows, i, width);
        return values.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
    }

    private static double bruteStd(List<Double> values) {
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        double ss = 0;
        for (double v : values) {
            ss += (v - mean) * (v - mean);
        }
        return Math.sqrt(ss / (values.size() - 1));
    }
}
