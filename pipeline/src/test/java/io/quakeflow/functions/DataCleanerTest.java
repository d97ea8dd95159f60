package io.quakeflow.functions;

import io.quakeflow.models.FeatureRow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.quakeflow.functions.FeatureFixtures.BASE_TIME;
import static io.quakeflow.functions.FeatureFixtures.HOUR;
import static io.quakeflow.functions.FeatureFixtures.event;
import static org.assertj.core.api.Assertions.assertThat;

class DataCleanerTest {

    private final DataCleaner cleaner = new DataCleaner();

    @Test
    void testDropDuplicatesKeepsFirst() {
        List<FeatureRow> rows = List.of(
                row("a", 3.0, 0), row("b", 3.5, 1), row("a", 9.9, 2));

        List<FeatureRow> result = cleaner.dropDuplicates(rows);

        assertThat(result).extracting(FeatureRow::getId).containsExactly("a", "b");
        assertThat(result.get(0).getMagnitude()).isEqualTo(3.0);
    }

    @Test
    void testImputesMedianButNotLags() {
        List<FeatureRow> rows = new ArrayList<>(List.of(
                row("a", 3.0, 0), row("b", 3.5, 1), row("c", 4.0, 2), row("d", 4.5, 3)));
        rows.get(0).setDepth(5.0);
        rows.get(1).setDepth(15.0);
        rows.get(2).setDepth(null);
        rows.get(3).setDepth(7.0);
        rows.get(0).setNst(10);
        rows.get(1).setNst(21);

        List<FeatureRow> result = cleaner.imputeMedians(rows);

        assertThat(result.get(2).getDepth()).isEqualTo(7.0);
        assertThat(result.get(2).getNst()).isEqualTo(16);
        assertThat(result.get(0).getMagLag1()).isNull();
        assertThat(result.get(0).getMagStd24h()).isNull();
        assertThat(result.get(0).getGap()).isNull();
    }

    @Test
    void testMagnitudeRangeAndDepth() {
        List<FeatureRow> rows = List.of(
                row("a", -0.1, 0), row("b", 0.0, 1), row("c", 10.0, 2), row("d", 10.1, 3));
        rows.get(1).setDepth(-3.0);

        List<FeatureRow> result = cleaner.absDepth(cleaner.filterMagnitudeRange(rows));

        assertThat(result).extracting(FeatureRow::getId).containsExactly("b", "c");
        assertThat(result.get(0).getDepth()).isEqualTo(3.0);
    }

    @Test
    void testCleanIsIdempotent() {
        List<FeatureRow> rows = new ArrayList<>(List.of(
                row("a", 3.0, 0), row("a", 3.1, 1), row("b", 11.0, 2),
                row("c", 4.0, 3), row("d", 5.0, 4)));
        rows.get(3).setDepth(-8.0);
        rows.get(4).setDepth(null);
        rows.get(4).setRms(0.4);
        FeatureRow missingLat = row("e", 4.0, 5);
        missingLat.setLatitude(null);
        rows.add(missingLat);

        List<FeatureRow> once = cleaner.clean(rows);
        List<String> idsOnce = ids(once);
        List<Double> depthsOnce = depths(once);

        List<FeatureRow> twice = cleaner.clean(once);

        assertThat(idsOnce).containsExactly("a", "c", "d");
        assertThat(ids(twice)).isEqualTo(idsOnce);
        assertThat(depths(twice)).isEqualTo(depthsOnce);
        assertThat(depthsOnce).doesNotContainNull().allMatch(d -> d >= 0);
    }

    // Helper

    private static FeatureRow row(String id, double mag, int hour) {
        return FeatureRow.fromEvent(event(id, mag, BASE_TIME + hour * HOUR));
    }

    private static List<String> ids(List<FeatureRow> rows) {
        List<String> ids = new ArrayList<>();
        rows.forEach(r -> ids.add(r.getId()));
        return ids;
    }

    private static List<Double> depths(List<FeatureRow> rows) {
        List<Double> depths = new ArrayList<>();
        rows.forEach(r -> depths.add(r.getDepth()));
        return depths;
    }
}
