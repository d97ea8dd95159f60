package io.quakeflow.functions;

import io.quakeflow.models.Event;
import io.quakeflow.models.FeatureRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Event and row builders shared by the feature tests.
 */
final class FeatureFixtures {

    /** 2021-01-04T00:00:00Z, a Monday. */
    static final long BASE_TIME = 1609718400000L;
    static final long HOUR = 3_600_000L;

    private FeatureFixtures() {}

    static Event event(String id, double magnitude, long time) {
        Event event = new Event();
        event.setId(id);
        event.setMagnitude(magnitude);
        event.setTime(time);
        event.setLongitude(-150.0);
        event.setLatitude(60.0);
        event.setDepth(10.0);
        return event;
    }

    static List<FeatureRow> rows(double[] magnitudes, long[] hoursFromBase) {
        List<FeatureRow> rows = new ArrayList<>();
        for (int i = 0; i < magnitudes.length; i++) {
            rows.add(FeatureRow.fromEvent(event("e" + i, magnitudes[i], BASE_TIME + hoursFromBase[i] * HOUR)));
        }
        return rows;
    }
}
