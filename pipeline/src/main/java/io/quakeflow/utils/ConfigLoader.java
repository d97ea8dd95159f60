package io.quakeflow.utils;

import io.quakeflow.client.RetryPolicy;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link PipelineConfig} from environment variables.
 * No hardcoded secrets; fails fast on malformed values.
 */
public final class ConfigLoader {

    public static final String DEFAULT_BASE_URL = "https://earthquake.usgs.gov/fdsnws/event/1/query";
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (EarthquakeForecastProject; Java)";

    private final Map<String, String> env;

    private ConfigLoader(Map<String, String> env) {
        this.env = env;
    }

    public static PipelineConfig fromEnvironment() {
        return load(System.getenv());
    }

    public static PipelineConfig load(Map<String, String> env) {
        return new ConfigLoader(env).toConfig();
    }

    private PipelineConfig toConfig() {
        RetryPolicy retryPolicy = new RetryPolicy(
                getInt("QUAKEFLOW_MAX_RETRIES", 5),
                getDouble("QUAKEFLOW_BACKOFF_FACTOR", 1.5),
                getStatuses("QUAKEFLOW_RETRY_STATUSES", RetryPolicy.DEFAULT_RETRY_STATUSES));

        return PipelineConfig.builder()
                // --- USGS client ---
                .baseUrl(getOrDefault("QUAKEFLOW_BASE_URL", DEFAULT_BASE_URL))
                .userAgent(getOrDefault("QUAKEFLOW_USER_AGENT", DEFAULT_USER_AGENT))
                .requestTimeout(Duration.ofSeconds(getLong("QUAKEFLOW_REQUEST_TIMEOUT_SECONDS", 180)))
                .retryPolicy(retryPolicy)
                .interRequestDelay(Duration.ofMillis(getLong("QUAKEFLOW_INTER_REQUEST_DELAY_MS", 1000)))
                // --- Extraction ---
                .failOnZeroEvents(getBoolean("QUAKEFLOW_FAIL_ON_ZERO_EVENTS", true))
                .startYear(getInt("QUAKEFLOW_START_YEAR", 2010))
                .endYear(getInt("QUAKEFLOW_END_YEAR", LocalDate.now().getYear() - 1))
                .intervalYears(getInt("QUAKEFLOW_INTERVAL_YEARS", 1))
                .minMagnitude(getDouble("QUAKEFLOW_MIN_MAGNITUDE", 3.0))
                .merge(getBoolean("QUAKEFLOW_MERGE", true))
                .mock(getBoolean("QUAKEFLOW_USE_MOCK", false))
                // --- Quality gate ---
                .minRows(getInt("QUAKEFLOW_MIN_ROWS", 100))
                .nullThreshold(getDouble("QUAKEFLOW_NULL_THRESHOLD", 0.01))
                // --- Orchestration ---
                .pipelineRetries(getInt("QUAKEFLOW_PIPELINE_RETRIES", 2))
                .pipelineRetryDelay(Duration.ofSeconds(getLong("QUAKEFLOW_PIPELINE_RETRY_DELAY_SECONDS", 300)))
                // --- Locations ---
                .rawDir(Paths.get(getOrDefault("QUAKEFLOW_RAW_DIR", "data/raw")))
                .processedDir(Paths.get(getOrDefault("QUAKEFLOW_PROCESSED_DIR", "data/processed")))
                .build();
    }

    // --- Helper Methods ---
    private String getOrDefault(String key, String defaultValue) {
        String value = env.get(key);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    private int getInt(String key, int defaultValue) {
        String value = getOrDefault(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw malformed(key, value, e);
        }
    }

    private long getLong(String key, long defaultValue) {
        String value = getOrDefault(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw malformed(key, value, e);
        }
    }

    private double getDouble(String key, double defaultValue) {
        String value = getOrDefault(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw malformed(key, value, e);
        }
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String value = getOrDefault(key, null);
        if (value == null) {
            return defaultValue;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("true") || v.equals("1") || v.equals("yes")) {
            return true;
        }
        if (v.equals("false") || v.equals("0") || v.equals("no")) {
            return false;
        }
        throw new IllegalStateException("FATAL: Environment variable " + key + " is not a boolean: " + value);
    }

    private Set<Integer> getStatuses(String key, Set<Integer> defaultValue) {
        String value = getOrDefault(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(Integer::valueOf)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        } catch (NumberFormatException e) {
            throw malformed(key, value, e);
        }
    }

    private static IllegalStateException malformed(String key, String value, Exception cause) {
        return new IllegalStateException(
                "FATAL: Environment variable " + key + " has malformed value: " + value, cause);
    }
}
