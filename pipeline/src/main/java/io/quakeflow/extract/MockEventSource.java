package io.quakeflow.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quakeflow.models.Interval;
import io.quakeflow.serialization.JsonMappers;

/**
 * Offline source: returns the same single hardcoded event for any interval,
 * never touching the network.
 */
public class MockEventSource implements EventSource {

    public static final String MOCK_ID = "mock1";
    public static final double MOCK_MAGNITUDE = 4.7;
    public static final long MOCK_TIME_MS = 1609459200000L; // 2021-01-01T00:00:00Z

    private final ObjectMapper mapper = JsonMappers.create();

    @Override
    public JsonNode fetch(Interval interval, double minMagnitude) {
        ObjectNode collection = mapper.createObjectNode();
        collection.put("type", "FeatureCollection");

        ObjectNode feature = collection.putArray("features").addObject();
        feature.put("type", "Feature");
        ObjectNode props = feature.putObject("properties");
        props.put("mag", MOCK_MAGNITUDE);
        props.put("time", MOCK_TIME_MS);
        props.put("magType", "ml");
        ObjectNode geometry = feature.putObject("geometry");
        geometry.put("type", "Point");
        geometry.putArray("coordinates").add(-150.0).add(60.0).add(10.0);
        feature.put("id", MOCK_ID);

        return collection;
    }

    @Override
    public String describe() {
        return "mock";
    }
}
