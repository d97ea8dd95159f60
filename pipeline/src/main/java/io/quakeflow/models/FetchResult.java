package io.quakeflow.models;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of fetching one interval: either the parsed events (with the raw
 * GeoJSON features they came from) or the reason the fetch failed.
 */
public final class FetchResult {

    private final Interval interval;
    private final List<Event> events;
    private final List<JsonNode> rawFeatures;
    private final String failureReason;

    private FetchResult(Interval interval, List<Event> events, List<JsonNode> rawFeatures,
                        String failureReason) {
        this.interval = interval;
        this.events = events;
        this.rawFeatures = rawFeatures;
        this.failureReason = failureReason;
    }

    public static FetchResult success(Interval interval, List<Event> events, List<JsonNode> rawFeatures) {
        return new FetchResult(interval,
                Collections.unmodifiableList(events),
                Collections.unmodifiableList(rawFeatures),
                null);
    }

    public static FetchResult failure(Interval interval, String reason) {
        return new FetchResult(interval, List.of(), List.of(), reason);
    }

    public Interval getInterval() { return interval; }
    public List<Event> getEvents() { return events; }
    public List<JsonNode> getRawFeatures() { return rawFeatures; }
    public String getFailureReason() { return failureReason; }

    public boolean isSuccess() {
        return failureReason == null;
    }

    public int getCount() {
        return events.size();
    }

    @Override
    public String toString() {
        return isSuccess()
                ? String.format("FetchResult{%s, ok, count=%d}", interval, getCount())
                : String.format("FetchResult{%s, failed: %s}", interval, failureReason);
    }
}
