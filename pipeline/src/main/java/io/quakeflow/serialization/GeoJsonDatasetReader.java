package io.quakeflow.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import io.quakeflow.models.RawDataset;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads a GeoJSON FeatureCollection into a {@link RawDataset}, keeping each
 * value's JSON type so the quality gate can detect non-numeric values.
 */
public class GeoJsonDatasetReader {

    static final List<String> COLUMNS = List.of("id", "magnitude", "time", "longitude", "latitude", "depth");

    private final GeoJsonEventParser parser = new GeoJsonEventParser();

    public RawDataset read(Path file) throws IOException {
        JsonNode collection = parser.readCollection(file);
        List<JsonNode> features = parser.features(collection);

        List<Map<String, Object>> rows = new ArrayList<>(features.size());
        for (JsonNode feature : features) {
            JsonNode props = feature.path("properties");
            JsonNode coords = feature.path("geometry").path("coordinates");

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", GeoJsonEventParser.text(feature.get("id")));
            row.put("magnitude", raw(props.get("mag")));
            row.put("time", raw(props.get("time")));
            row.put("longitude", raw(coords.get(0)));
            row.put("latitude", raw(coords.get(1)));
            row.put("depth", raw(coords.get(2)));
            rows.add(row);
        }

        Set<String> columns = new LinkedHashSet<>(COLUMNS);
        return new RawDataset(file.toString(), columns, rows);
    }

    private static Object raw(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        return node.toString();
    }
}
