package io.quakeflow.sinks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quakeflow.models.Interval;
import io.quakeflow.serialization.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/**
 * Writes raw extraction output: a GeoJSON FeatureCollection plus a gzipped
 * NDJSON file (one feature per line) per interval, and the same pair for the
 * merged dataset.
 */
public class RawOutputSink {

    private static final Logger LOG = LoggerFactory.getLogger(RawOutputSink.class);

    public static final String FILE_PREFIX = "earthquakes_";
    public static final String COMBINED_BASENAME = "earthquakes_combined";

    private final Path outputDir;
    private final ObjectMapper mapper;

    public RawOutputSink(Path outputDir) {
        this.outputDir = outputDir;
        this.mapper = JsonMappers.create();
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /** Persists one interval's response as-is. Returns the GeoJSON path. */
    public Path writeInterval(Interval interval, JsonNode collection) throws IOException {
        String base = FILE_PREFIX + interval.label();
        Path geojson = writeGeoJson(base, collection);
        writeNdjson(base, collection.path("features"));
        return geojson;
    }

    /**
     * Writes the merged dataset annotated with run-level metadata.
     *
     * @return paths of the combined GeoJSON and NDJSON files, in that order
     */
    public List<Path> writeCombined(List<JsonNode> features, LocalDate rangeStart, LocalDate rangeEnd,
                                    int intervalsMerged, Instant collectedAt) throws IOException {
        ObjectNode collection = mapper.createObjectNode();
        collection.put("type", "FeatureCollection");

        ObjectNode metadata = collection.putObject("metadata");
        metadata.put("total_features", features.size());
        metadata.put("date_range", rangeStart + " to " + rangeEnd);
        metadata.put("intervals_merged", intervalsMerged);
        metadata.put("collected_at", collectedAt.toString());

        ArrayNode array = collection.putArray("features");
        features.forEach(array::add);

        Path geojson = writeGeoJson(COMBINED_BASENAME, collection);
        Path ndjson = writeNdjson(COMBINED_BASENAME, array);
        LOG.info("Merged {} features from {} intervals into {}", features.size(), intervalsMerged, geojson);
        return List.of(geojson, ndjson);
    }

    private Path writeGeoJson(String base, JsonNode collection) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(base + ".geojson");
        mapper.writeValue(target.toFile(), collection);
        LOG.debug("Saved {}", target);
        return target;
    }

    private Path writeNdjson(String base, JsonNode features) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(base + ".ndjson.gz");
        try (Writer writer = new BufferedWriter(new OutputStreamWriter(
                new GZIPOutputStream(Files.newOutputStream(target)), StandardCharsets.UTF_8))) {
            if (features.isArray()) {
                for (JsonNode feature : features) {
                    writer.write(mapper.writeValueAsString(feature));
                    writer.write('\n');
                }
            }
        }
        LOG.debug("Saved NDJSON {}", target);
        return target;
    }
}
