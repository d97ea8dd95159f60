package io.quakeflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quakeflow.exceptions.PermanentError;
import io.quakeflow.models.Event;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Flattens GeoJSON features onto the {@link Event} shape.
 * Missing or unparseable optional fields become null (or 0 for the tsunami
 * flag); flattening never throws on a malformed feature.
 */
public class GeoJsonEventParser {

    private static final Pattern NUMERIC_TEXT = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final ObjectMapper mapper;

    public GeoJsonEventParser() {
        this.mapper = JsonMappers.create();
    }

    /**
     * Parses a FeatureCollection response body.
     *
     * @throws PermanentError when the body is not JSON or not an object
     */
    public JsonNode parseCollection(String body) throws PermanentError {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PermanentError("Response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PermanentError("Response is not a GeoJSON object");
        }
        return root;
    }

    public JsonNode readCollection(Path file) throws IOException {
        return mapper.readTree(file.toFile());
    }

    public List<JsonNode> features(JsonNode collection) {
        List<JsonNode> features = new ArrayList<>();
        JsonNode node = collection.path("features");
        if (node.isArray()) {
            node.forEach(features::add);
        }
        return features;
    }

    public List<Event> toEvents(List<JsonNode> features) {
        List<Event> events = new ArrayList<>(features.size());
        for (JsonNode feature : features) {
            events.add(toEvent(feature));
        }
        return events;
    }

    public Event toEvent(JsonNode feature) {
        JsonNode props = feature.path("properties");
        JsonNode coords = feature.path("geometry").path("coordinates");

        Event event = new Event();
        event.setId(text(feature.get("id")));
        event.setMagnitude(toDouble(props.get("mag")));
        event.setTime(toLong(props.get("time")));
        event.setPlace(text(props.get("place")));
        event.setLongitude(toDouble(coords.get(0)));
        event.setLatitude(toDouble(coords.get(1)));
        event.setDepth(toDouble(coords.get(2)));
        event.setMagType(text(props.get("magType")));
        event.setEventType(text(props.get("type")));
        event.setStatus(text(props.get("status")));
        Long tsunami = toLong(props.get("tsunami"));
        event.setTsunami(tsunami == null ? 0 : tsunami.intValue());
        event.setSignificance(toInteger(props.get("sig")));
        event.setGap(toDouble(props.get("gap")));
        event.setDmin(toDouble(props.get("dmin")));
        event.setRms(toDouble(props.get("rms")));
        event.setNst(toInteger(props.get("nst")));
        return event;
    }

    // --- Lenient scalar conversion ---

    static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }

    static Double toDouble(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual() && NUMERIC_TEXT.matcher(node.textValue().trim()).matches()) {
            return Double.valueOf(node.textValue().trim());
        }
        return null;
    }

    static Long toLong(JsonNode node) {
        Double value = toDouble(node);
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        return value.longValue();
    }

    static Integer toInteger(JsonNode node) {
        Long value = toLong(node);
        return value == null ? null : value.intValue();
    }
}
