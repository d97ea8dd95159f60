package io.quakeflow.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Success/failure accounting for one extraction run.
 */
public final class ExtractionSummary {

    private final int totalIntervals;
    private final int successfulIntervals;
    private final long totalEvents;
    private final List<String> failures;

    public ExtractionSummary(List<FetchResult> results) {
        List<String> failed = new ArrayList<>();
        int ok = 0;
        long events = 0;
        for (FetchResult result : results) {
            if (result.isSuccess()) {
                ok++;
                events += result.getCount();
            } else {
                failed.add(result.getInterval() + ": " + result.getFailureReason());
            }
        }
        this.totalIntervals = results.size();
        this.successfulIntervals = ok;
        this.totalEvents = events;
        this.failures = Collections.unmodifiableList(failed);
    }

    public int getTotalIntervals() { return totalIntervals; }
    public int getSuccessfulIntervals() { return successfulIntervals; }
    public int getFailedIntervals() { return totalIntervals - successfulIntervals; }
    public long getTotalEvents() { return totalEvents; }
    public List<String> getFailures() { return failures; }

    public boolean allFailed() {
        return totalIntervals > 0 && successfulIntervals == 0;
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Extraction summary: ")
                .append(successfulIntervals).append('/').append(totalIntervals)
                .append(" intervals successful, ")
                .append(totalEvents).append(" events");
        for (String failure : failures) {
            sb.append(System.lineSeparator()).append("  failed ").append(failure);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("ExtractionSummary{ok=%d/%d, events=%d}",
                successfulIntervals, totalIntervals, totalEvents);
    }
}
