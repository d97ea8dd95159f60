package io.quakeflow.utils;

import io.quakeflow.client.RetryPolicy;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDate;

/**
 * Immutable settings for one pipeline run, passed explicitly to every stage.
 * Built by {@link ConfigLoader} from the environment, then optionally
 * overridden from the command line via {@link #toBuilder()}.
 */
public final class PipelineConfig {

    // Extraction
    private final String baseUrl;
    private final String userAgent;
    private final Duration requestTimeout;
    private final RetryPolicy retryPolicy;
    private final Duration interRequestDelay;
    private final boolean failOnZeroEvents;
    private final int startYear;
    private final int endYear;
    private final int intervalYears;
    private final double minMagnitude;
    private final boolean merge;
    private final boolean mock;

    // Quality gate
    private final int minRows;
    private final double nullThreshold;

    // Orchestration
    private final int pipelineRetries;
    private final Duration pipelineRetryDelay;

    // Locations
    private final Path rawDir;
    private final Path processedDir;

    private PipelineConfig(Builder b) {
        this.baseUrl = b.baseUrl;
        this.userAgent = b.userAgent;
        this.requestTimeout = b.requestTimeout;
        this.retryPolicy = b.retryPolicy;
        this.interRequestDelay = b.interRequestDelay;
        this.failOnZeroEvents = b.failOnZeroEvents;
        this.startYear = b.startYear;
        this.endYear = b.endYear;
        this.intervalYears = b.intervalYears;
        this.minMagnitude = b.minMagnitude;
        this.merge = b.merge;
        this.mock = b.mock;
        this.minRows = b.minRows;
        this.nullThreshold = b.nullThreshold;
        this.pipelineRetries = b.pipelineRetries;
        this.pipelineRetryDelay = b.pipelineRetryDelay;
        this.rawDir = b.rawDir;
        this.processedDir = b.processedDir;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.baseUrl = baseUrl;
        b.userAgent = userAgent;
        b.requestTimeout = requestTimeout;
        b.retryPolicy = retryPolicy;
        b.interRequestDelay = interRequestDelay;
        b.failOnZeroEvents = failOnZeroEvents;
        b.startYear = startYear;
        b.endYear = endYear;
        b.intervalYears = intervalYears;
        b.minMagnitude = minMagnitude;
        b.merge = merge;
        b.mock = mock;
        b.minRows = minRows;
        b.nullThreshold = nullThreshold;
        b.pipelineRetries = pipelineRetries;
        b.pipelineRetryDelay = pipelineRetryDelay;
        b.rawDir = rawDir;
        b.processedDir = processedDir;
        return b;
    }

    public static class Builder {
        private String baseUrl = ConfigLoader.DEFAULT_BASE_URL;
        private String userAgent = ConfigLoader.DEFAULT_USER_AGENT;
        private Duration requestTimeout = Duration.ofSeconds(180);
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private Duration interRequestDelay = Duration.ofSeconds(1);
        private boolean failOnZeroEvents = true;
        private int startYear = 2010;
        private int endYear = LocalDate.now().getYear() - 1;
        private int intervalYears = 1;
        private double minMagnitude = 3.0;
        private boolean merge = true;
        private boolean mock = false;
        private int minRows = 100;
        private double nullThreshold = 0.01;
        private int pipelineRetries = 2;
        private Duration pipelineRetryDelay = Duration.ofMinutes(5);
        private Path rawDir = Paths.get("data", "raw");
        private Path processedDir = Paths.get("data", "processed");

        public Builder baseUrl(String v) { this.baseUrl = v; return this; }
        public Builder userAgent(String v) { this.userAgent = v; return this; }
        public Builder requestTimeout(Duration v) { this.requestTimeout = v; return this; }
        public Builder retryPolicy(RetryPolicy v) { this.retryPolicy = v; return this; }
        public Builder interRequestDelay(Duration v) { this.interRequestDelay = v; return this; }
        public Builder failOnZeroEvents(boolean v) { this.failOnZeroEvents = v; return this; }
        public Builder startYear(int v) { this.startYear = v; return this; }
        public Builder endYear(int v) { this.endYear = v; return this; }
        public Builder intervalYears(int v) { this.intervalYears = v; return this; }
        public Builder minMagnitude(double v) { this.minMagnitude = v; return this; }
        public Builder merge(boolean v) { this.merge = v; return this; }
        public Builder mock(boolean v) { this.mock = v; return this; }
        public Builder minRows(int v) { this.minRows = v; return this; }
        public Builder nullThreshold(double v) { this.nullThreshold = v; return this; }
        public Builder pipelineRetries(int v) { this.pipelineRetries = v; return this; }
        public Builder pipelineRetryDelay(Duration v) { this.pipelineRetryDelay = v; return this; }
        public Builder rawDir(Path v) { this.rawDir = v; return this; }
        public Builder processedDir(Path v) { this.processedDir = v; return this; }

        public PipelineConfig build() {
            if (startYear > endYear) {
                throw new IllegalStateException(
                        "FATAL: start year " + startYear + " is after end year " + endYear);
            }
            if (intervalYears < 1) {
                throw new IllegalStateException("FATAL: interval years must be >= 1, got " + intervalYears);
            }
            if (nullThreshold < 0 || nullThreshold > 1) {
                throw new IllegalStateException("FATAL: null threshold must be in [0, 1], got " + nullThreshold);
            }
            if (pipelineRetries < 0) {
                throw new IllegalStateException("FATAL: pipeline retries must be >= 0, got " + pipelineRetries);
            }
            return new PipelineConfig(this);
        }
    }

    // --- Getters ---
    public String getBaseUrl() { return baseUrl; }
    public String getUserAgent() { return userAgent; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public RetryPolicy getRetryPolicy() { return retryPolicy; }
    public Duration getInterRequestDelay() { return interRequestDelay; }
    public boolean isFailOnZeroEvents() { return failOnZeroEvents; }
    public int getStartYear() { return startYear; }
    public int getEndYear() { return endYear; }
    public int getIntervalYears() { return intervalYears; }
    public double getMinMagnitude() { return minMagnitude; }
    public boolean isMerge() { return merge; }
    public boolean isMock() { return mock; }
    public int getMinRows() { return minRows; }
    public double getNullThreshold() { return nullThreshold; }
    public int getPipelineRetries() { return pipelineRetries; }
    public Duration getPipelineRetryDelay() { return pipelineRetryDelay; }
    public Path getRawDir() { return rawDir; }
    public Path getProcessedDir() { return processedDir; }

    @Override
    public String toString() {
        return String.format("PipelineConfig{years=%d-%d/%d, minMag=%.1f, merge=%b, mock=%b, raw=%s, processed=%s}",
                startYear, endYear, intervalYears, minMagnitude, merge, mock, rawDir, processedDir);
    }
}
