package io.quakeflow.functions;

import io.quakeflow.models.FeatureRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LagFeatureFunctionTest {

    @Test
    void testLagsOverFiveRows() {
        List<FeatureRow> rows = FeatureFixtures.rows(
                new double[]{3.0, 3.5, 4.0, 4.5, 5.0},
                new long[]{0, 2, 3, 10, 34});

        new LagFeatureFunction().apply(rows);

        assertThat(rows).extracting(FeatureRow::getTimeSinceLast).containsExactly(0.0, 2.0, 1.0, 7.0, 24.0);
        assertThat(rows).extracting(FeatureRow::getMagLag1).containsExactly(null, 3.0, 3.5, 4.0, 4.5);
        assertThat(rows).extracting(FeatureRow::getMagLag2).containsExactly(null, null, 3.0, 3.5, 4.0);
        assertThat(rows).extracting(FeatureRow::getMagLag3).containsExactly(null, null, null, 3.0, 3.5);
    }

    @Test
    void testFractionalHours() {
        List<FeatureRow> rows = FeatureFixtures.rows(new double[]{3.0, 3.0}, new long[]{0, 0});
        rows.get(1).setTime(rows.get(0).getTime() + 90 * 60_000L);

        new LagFeatureFunction().apply(rows);

        assertThat(rows.get(1).getTimeSinceLast()).isCloseTo(1.5, within(1e-9));
    }
}
