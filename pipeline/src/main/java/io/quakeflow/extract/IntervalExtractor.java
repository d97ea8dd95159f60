package io.quakeflow.extract;

import com.fasterxml.jackson.databind.JsonNode;
import io.quakeflow.client.JdkHttpTransport;
import io.quakeflow.client.SessionClient;
import io.quakeflow.exceptions.ExtractionFailedException;
import io.quakeflow.exceptions.FetchException;
import io.quakeflow.models.Event;
import io.quakeflow.models.ExtractionResult;
import io.quakeflow.models.ExtractionSummary;
import io.quakeflow.models.FetchResult;
import io.quakeflow.models.Interval;
import io.quakeflow.serialization.GeoJsonEventParser;
import io.quakeflow.sinks.RawOutputSink;
import io.quakeflow.utils.PipelineConfig;
import io.quakeflow.utils.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fetches a multi-year range interval by interval.
 *
 * <p>Intervals are fetched strictly in order with a fixed pause between
 * requests. A failed interval is logged and skipped; the run only fails when
 * every interval failed, or when no events came back at all and the
 * zero-events policy is on. Merging concatenates successful intervals in
 * start-date order without deduplicating.
 */
public class IntervalExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(IntervalExtractor.class);

    private final EventSource source;
    private final RawOutputSink sink;
    private final Duration interRequestDelay;
    private final boolean failOnZeroEvents;
    private final Sleeper sleeper;
    private final Clock clock;
    private final GeoJsonEventParser parser = new GeoJsonEventParser();

    public IntervalExtractor(EventSource source, RawOutputSink sink, Duration interRequestDelay,
                             boolean failOnZeroEvents, Sleeper sleeper, Clock clock) {
        this.source = source;
        this.sink = sink;
        this.interRequestDelay = interRequestDelay;
        this.failOnZeroEvents = failOnZeroEvents;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Wires the USGS (or mock) source, session client and raw sink from config.
     */
    public static IntervalExtractor fromConfig(PipelineConfig config, Path outputDir) {
        EventSource source;
        if (config.isMock()) {
            source = new MockEventSource();
        } else {
            SessionClient client = new SessionClient(
                    new JdkHttpTransport(Duration.ofSeconds(30)),
                    config.getRetryPolicy(),
                    config.getRequestTimeout(),
                    config.getUserAgent(),
                    Sleeper.SYSTEM);
            source = new UsgsEventSource(client, config.getBaseUrl());
        }
        Duration delay = config.isMock() ? Duration.ZERO : config.getInterRequestDelay();
        return new IntervalExtractor(source, new RawOutputSink(outputDir), delay,
                config.isFailOnZeroEvents(), Sleeper.SYSTEM, Clock.systemUTC());
    }

    public ExtractionResult extract(int startYear, int endYear, int intervalYears,
                                    double minMagnitude, boolean merge) {
        List<Interval> intervals = IntervalGenerator.generate(startYear, endYear, intervalYears);
        LOG.info("Extracting {} interval(s) {}..{} (minmagnitude={}) via {}",
                intervals.size(), startYear, endYear, minMagnitude, source.describe());

        List<FetchResult> results = new ArrayList<>(intervals.size());
        for (int i = 0; i < intervals.size(); i++) {
            if (i > 0) {
                pace();
            }
            results.add(fetchInterval(intervals.get(i), minMagnitude));
        }

        ExtractionSummary summary = new ExtractionSummary(results);
        LOG.info(summary.render());

        if (summary.allFailed()) {
            throw new ExtractionFailedException(String.format(
                    "All %d interval(s) failed to download", summary.getTotalIntervals()), summary);
        }
        if (failOnZeroEvents && summary.getTotalEvents() == 0) {
            throw new ExtractionFailedException("No events retrieved from any interval", summary);
        }

        if (!merge) {
            return new ExtractionResult(results, summary, null, null, null);
        }
        return merge(intervals, results, summary);
    }

    private FetchResult fetchInterval(Interval interval, double minMagnitude) {
        JsonNode collection;
        try {
            collection = source.fetch(interval, minMagnitude);
        } catch (FetchException e) {
            LOG.warn("Interval {} failed ({}): {}", interval,
                    e.isRetryable() ? "transient" : "permanent", e.getMessage());
            return FetchResult.failure(interval, e.getMessage());
        }

        List<JsonNode> features = parser.features(collection);
        List<Event> events = parser.toEvents(features);
        try {
            Path saved = sink.writeInterval(interval, collection);
            LOG.info("Interval {}: {} events saved to {}", interval, events.size(), saved);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist raw output for " + interval, e);
        }
        return FetchResult.success(interval, events, features);
    }

    private ExtractionResult merge(List<Interval> intervals, List<FetchResult> results,
                                   ExtractionSummary summary) {
        List<FetchResult> successful = new ArrayList<>();
        for (FetchResult result : results) {
            if (result.isSuccess()) {
                successful.add(result);
            }
        }
        successful.sort(Comparator.comparing(FetchResult::getInterval));

        List<Event> events = new ArrayList<>();
        List<JsonNode> features = new ArrayList<>();
        for (FetchResult result : successful) {
            events.addAll(result.getEvents());
            features.addAll(result.getRawFeatures());
        }

        Interval first = intervals.get(0);
        Interval last = intervals.get(intervals.size() - 1);
        try {
            List<Path> paths = sink.writeCombined(features, first.getStartDate(), last.getEndDate(),
                    successful.size(), clock.instant());
            return new ExtractionResult(results, summary, events, paths.get(0), paths.get(1));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write combined output", e);
        }
    }

    private void pace() {
        try {
            sleeper.sleep(interRequestDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted between interval requests", e);
        }
    }
}
