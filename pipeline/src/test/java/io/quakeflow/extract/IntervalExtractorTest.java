package io.quakeflow.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quakeflow.exceptions.ExtractionFailedException;
import io.quakeflow.exceptions.PermanentError;
import io.quakeflow.exceptions.TransientError;
import io.quakeflow.models.Event;
import io.quakeflow.models.ExtractionResult;
import io.quakeflow.models.Interval;
import io.quakeflow.serialization.JsonMappers;
import io.quakeflow.sinks.RawOutputSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntervalExtractorTest {

    private static final ObjectMapper MAPPER = JsonMappers.create();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path outDir;

    private FakeSource source;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        source = new FakeSource();
        sleeps = new ArrayList<>();
    }

    @Test
    void testFailedIntervalIsSkippedAndMergeKeepsOthers() throws Exception {
        source.events(2010, "a1", "a2");
        source.failing(2011);
        source.events(2012, "c1");

        ExtractionResult result = extractor(true).extract(2010, 2012, 1, 3.0, true);

        assertThat(result.getSummary().getTotalIntervals()).isEqualTo(3);
        assertThat(result.getSummary().getSuccessfulIntervals()).isEqualTo(2);
        assertThat(result.getSummary().getFailedIntervals()).isEqualTo(1);
        assertThat(result.getSummary().getTotalEvents()).isEqualTo(3);
        assertThat(result.getMergedEvents()).isPresent();
        assertThat(result.getMergedEvents().get()).extracting(Event::getId)
                .containsExactly("a1", "a2", "c1");

        JsonNode combined = MAPPER.readTree(result.getMergedGeoJson().get().toFile());
        assertThat(combined.path("features")).hasSize(3);
        assertThat(combined.path("metadata").path("total_features").asInt()).isEqualTo(3);
        assertThat(combined.path("metadata").path("intervals_merged").asInt()).isEqualTo(2);
        assertThat(combined.path("metadata").path("date_range").asText()).isEqualTo("2010-01-01 to 2012-12-31");
        assertThat(combined.path("metadata").path("collected_at").asText()).isEqualTo("2024-03-01T12:00:00Z");
    }

    @Test
    void testPerIntervalFilesWritten() throws Exception {
        source.events(2010, "a1");
        source.events(2011, "b1", "b2");

        extractor(true).extract(2010, 2011, 1, 3.0, false);

        assertThat(outDir.resolve("earthquakes_2010-01-01_2010-12-31.geojson")).exists();
        assertThat(outDir.resolve("earthquakes_2010-01-01_2010-12-31.ndjson.gz")).exists();
        assertThat(outDir.resolve("earthquakes_2011-01-01_2011-12-31.geojson")).exists();
        assertThat(readNdjson(outDir.resolve("earthquakes_2011-01-01_2011-12-31.ndjson.gz"))).hasSize(2);
        assertThat(outDir.resolve("earthquakes_combined.geojson")).doesNotExist();
    }

    @Test
    void testNoMergeLeavesMergedResultEmpty() {
        source.events(2010, "a1");

        ExtractionResult result = extractor(true).extract(2010, 2010, 1, 3.0, false);

        assertThat(result.getMergedEvents()).isEmpty();
        assertThat(result.getMergedGeoJson()).isEmpty();
    }

    @Test
    void testAllIntervalsFailing() {
        source.failing(2010);
        source.failing(2011);

        assertThatThrownBy(() -> extractor(true).extract(2010, 2011, 1, 3.0, true))
                .isInstanceOf(ExtractionFailedException.class)
                .hasMessageContaining("All 2 interval(s) failed")
                .satisfies(e -> assertThat(((ExtractionFailedException) e).getSummary().getFailedIntervals())
                        .isEqualTo(2));
    }

    @Test
    void testZeroEventsPolicy() {
        source.events(2010);

        assertThatThrownBy(() -> extractor(true).extract(2010, 2010, 1, 3.0, true))
                .isInstanceOf(ExtractionFailedException.class)
                .hasMessageContaining("No events");

        ExtractionResult lenient = extractor(false).extract(2010, 2010, 1, 3.0, true);
        assertThat(lenient.getSummary().getTotalEvents()).isZero();
        assertThat(lenient.getMergedEvents().get()).isEmpty();
    }

    @Test
    void testPacingBetweenRequests() {
        source.events(2010, "a1");
        source.events(2011, "b1");
        source.events(2012, "c1");

        extractor(true).extract(2010, 2012, 1, 3.0, false);

        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1));
        assertThat(source.requested).extracting(i -> i.getStartDate().getYear())
                .containsExactly(2010, 2011, 2012);
    }

    @Test
    void testMockSourceNeedsNoNetwork() {
        IntervalExtractor extractor = new IntervalExtractor(new MockEventSource(), new RawOutputSink(outDir),
                Duration.ZERO, true, sleeps::add, CLOCK);

        ExtractionResult result = extractor.extract(2020, 2021, 1, 3.0, true);

        List<Event> events = result.getMergedEvents().get();
        assertThat(events).hasSize(2);
        assertThat(events.get(0).getId()).isEqualTo(MockEventSource.MOCK_ID);
        assertThat(events.get(0).getMagnitude()).isEqualTo(4.7);
        assertThat(events.get(0).getTime()).isEqualTo(1609459200000L);
        assertThat(events.get(0).getLongitude()).isEqualTo(-150.0);
        assertThat(events.get(0).getMagType()).isEqualTo("ml");
    }

    @Test
    void testUsgsQueryUsesExclusiveEnd() {
        UsgsEventSource usgs = new UsgsEventSource(null, "https://example.test/query");
        Interval interval = IntervalGenerator.generate(2015, 2015, 1).get(0);

        assertThat(usgs.buildQuery(interval, 3.0)).isEqualTo(
                "https://example.test/query?format=geojson&starttime=2015-01-01&endtime=2016-01-01&minmagnitude=3.0");
    }

    // Helper

    private IntervalExtractor extractor(boolean failOnZeroEvents) {
        return new IntervalExtractor(source, new RawOutputSink(outDir), Duration.ofSeconds(1),
                failOnZeroEvents, sleeps::add, CLOCK);
    }

    private static List<String> readNdjson(Path file) throws Exception {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new GZIPInputStream(Files.newInputStream(file)), StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.toList());
        }
    }

    private static class FakeSource implements EventSource {
        private final Map<Integer, List<String>> idsByYear = new HashMap<>();
        private final Set<Integer> failingYears = new HashSet<>();
        private final List<Interval> requested = new ArrayList<>();

        void events(int year, String... ids) {
            idsByYear.put(year, List.of(ids));
        }

        void failing(int year) {
            failingYears.add(year);
        }

        @Override
        public JsonNode fetch(Interval interval, double minMagnitude) throws TransientError, PermanentError {
            requested.add(interval);
            int year = interval.getStartDate().getYear();
            if (failingYears.contains(year)) {
                throw new TransientError("HTTP 503 after 6 attempt(s): busy");
            }
            ObjectNode collection = MAPPER.createObjectNode();
            collection.put("type", "FeatureCollection");
            ArrayNode features = collection.putArray("features");
            long time = interval.getStartDate().atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
            for (String id : idsByYear.getOrDefault(year, List.of())) {
                ObjectNode feature = features.addObject();
                feature.put("type", "Feature");
                feature.put("id", id);
                ObjectNode props = feature.putObject("properties");
                props.put("mag", 4.0);
                props.put("time", time);
                time += 3_600_000L;
                feature.putObject("geometry").putArray("coordinates").add(10.0).add(20.0).add(5.0);
            }
            return collection;
        }

        @Override
        public String describe() {
            return "fake";
        }
    }
}
