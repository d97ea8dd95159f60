package io.quakeflow.functions;

import com.fasterxml.jackson.databind.JsonNode;
import io.quakeflow.exceptions.DataIntegrityError;
import io.quakeflow.models.Event;
import io.quakeflow.models.FeatureRow;
import io.quakeflow.models.FeatureTable;
import io.quakeflow.models.TransformInfo;
import io.quakeflow.serialization.GeoJsonEventParser;
import io.quakeflow.sinks.ParquetFeatureSink;
import io.quakeflow.utils.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns raw events into the feature table.
 *
 * Order of work:
 * - drop duplicate ids and rows missing a core attribute
 * - sort by time ascending
 * - calendar, cyclical, lag, rolling-window and location features
 * - full cleaning (imputation, magnitude range, absolute depth)
 * - final sort by time
 *
 * Lag and rolling features only read rows at or before the current one.
 */
public class FeatureTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureTransformer.class);

    private static final List<String> CORE_ATTRIBUTES = List.of("magnitude", "time", "longitude", "latitude");

    private static final List<String> SUMMARY_COLUMNS = List.of("magnitude", "depth", "time_since_last");

    private static final Comparator<FeatureRow> BY_TIME = Comparator.comparing(FeatureRow::getTime);

    private final DataCleaner cleaner;
    private final List<FeatureFunction> functions;
    private final GeoJsonEventParser parser;
    private final ParquetFeatureSink sink;

    public FeatureTransformer() {
        this.cleaner = new DataCleaner();
        this.functions = List.of(
                new CalendarFeatures(),
                new CyclicalEncoder(),
                new LagFeatureFunction(),
                new RollingWindowFunction(),
                new LocationFeatures());
        this.parser = new GeoJsonEventParser();
        this.sink = new ParquetFeatureSink();
    }

    /**
     * @throws DataIntegrityError when there are no events, a core attribute
     *         is null in every event, or no usable row survives cleaning
     */
    public FeatureTable transform(List<Event> events) {
        if (events.isEmpty()) {
            throw new DataIntegrityError("No events to transform");
        }
        for (String core : CORE_ATTRIBUTES) {
            boolean anyPresent = events.stream().anyMatch(e -> coreValue(e, core) != null);
            if (!anyPresent) {
                throw new DataIntegrityError("Required column '" + core + "' is missing from every event");
            }
        }

        List<FeatureRow> rows = new ArrayList<>(events.size());
        for (Event event : events) {
            rows.add(FeatureRow.fromEvent(event));
        }

        rows = cleaner.dropDuplicates(rows);
        rows = cleaner.dropMissingCore(rows);
        requireRows(rows, "pre-cleaning");
        rows.sort(BY_TIME);

        for (FeatureFunction function : functions) {
            function.apply(rows);
        }

        rows = cleaner.clean(rows);
        requireRows(rows, "cleaning");
        rows.sort(BY_TIME);

        FeatureTable table = new FeatureTable(rows);
        LOG.info("Feature table ready: {} rows x {} columns (from {} events)",
                table.size(), table.getColumns().size(), events.size());
        return table;
    }

    /**
     * Reads a GeoJSON FeatureCollection, transforms it and writes Parquet.
     */
    public FeatureTable transformFile(Path input, Path output) throws IOException {
        LOG.info("Loading events from {}", input);
        JsonNode collection = parser.readCollection(input);
        List<Event> events = parser.toEvents(parser.features(collection));
        LOG.info("Loaded {} events", events.size());

        FeatureTable table = transform(events);
        sink.write(table, output);
        logSummary(table);
        return table;
    }

    private static Object coreValue(Event event, String attribute) {
        switch (attribute) {
            case "magnitude": return event.getMagnitude();
            case "time": return event.getTime();
            case "longitude": return event.getLongitude();
            case "latitude": return event.getLatitude();
            default: throw new IllegalArgumentException("Not a core attribute: " + attribute);
        }
    }

    private static void requireRows(List<FeatureRow> rows, String stage) {
        if (rows.isEmpty()) {
            throw new DataIntegrityError("No usable rows remain after " + stage);
        }
    }

    private static void logSummary(FeatureTable table) {
        LOG.info("Final shape: ({}, {})", table.size(), table.getColumns().size());
        LOG.info("Columns: {}", table.getColumns());
        for (String column : SUMMARY_COLUMNS) {
            LOG.info("{}", Statistics.describe(column, table.numericColumn(column)));
        }
        LOG.info("{}", TransformInfo.analyze(table, "magnitude"));
    }
}
