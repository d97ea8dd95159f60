package io.quakeflow.models;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * What an extraction run hands back: the per-interval results, the summary,
 * and, when merging was requested, the merged events and their file paths.
 */
public final class ExtractionResult {

    private final List<FetchResult> results;
    private final ExtractionSummary summary;
    private final List<Event> mergedEvents;
    private final Path mergedGeoJson;
    private final Path mergedNdjson;

    public ExtractionResult(List<FetchResult> results, ExtractionSummary summary,
                            List<Event> mergedEvents, Path mergedGeoJson, Path mergedNdjson) {
        this.results = Collections.unmodifiableList(results);
        this.summary = summary;
        this.mergedEvents = mergedEvents == null ? null : Collections.unmodifiableList(mergedEvents);
        this.mergedGeoJson = mergedGeoJson;
        this.mergedNdjson = mergedNdjson;
    }

    public List<FetchResult> getResults() { return results; }
    public ExtractionSummary getSummary() { return summary; }

    public Optional<List<Event>> getMergedEvents() {
        return Optional.ofNullable(mergedEvents);
    }

    public Optional<Path> getMergedGeoJson() {
        return Optional.ofNullable(mergedGeoJson);
    }

    public Optional<Path> getMergedNdjson() {
        return Optional.ofNullable(mergedNdjson);
    }
}
