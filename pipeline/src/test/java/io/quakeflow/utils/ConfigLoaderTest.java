package io.quakeflow.utils;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @Test
    void testDefaults() {
        PipelineConfig config = ConfigLoader.load(Map.of("QUAKEFLOW_END_YEAR", "2023"));

        assertThat(config.getBaseUrl()).isEqualTo("https://earthquake.usgs.gov/fdsnws/event/1/query");
        assertThat(config.getUserAgent()).isEqualTo("Mozilla/5.0 (EarthquakeForecastProject; Java)");
        assertThat(config.getRequestTimeout()).isEqualTo(Duration.ofSeconds(180));
        assertThat(config.getRetryPolicy().getMaxRetries()).isEqualTo(5);
        assertThat(config.getRetryPolicy().getBackoffFactor()).isEqualTo(1.5);
        assertThat(config.getInterRequestDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.isFailOnZeroEvents()).isTrue();
        assertThat(config.getStartYear()).isEqualTo(2010);
        assertThat(config.getMinMagnitude()).isEqualTo(3.0);
        assertThat(config.getMinRows()).isEqualTo(100);
        assertThat(config.getNullThreshold()).isEqualTo(0.01);
        assertThat(config.getPipelineRetries()).isEqualTo(2);
        assertThat(config.getPipelineRetryDelay()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.getRawDir()).isEqualTo(Paths.get("data/raw"));
        assertThat(config.getProcessedDir()).isEqualTo(Paths.get("data/processed"));
        assertThat(config.isMock()).isFalse();
    }

    @Test
    void testOverrides() {
        PipelineConfig config = ConfigLoader.load(Map.of(
                "QUAKEFLOW_START_YEAR", "2015",
                "QUAKEFLOW_END_YEAR", "2018",
                "QUAKEFLOW_RETRY_STATUSES", "429, 503",
                "QUAKEFLOW_USE_MOCK", "yes",
                "QUAKEFLOW_MIN_MAGNITUDE", "4.5"));

        assertThat(config.getStartYear()).isEqualTo(2015);
        assertThat(config.getEndYear()).isEqualTo(2018);
        assertThat(config.getRetryPolicy().getRetryStatuses()).containsExactly(429, 503);
        assertThat(config.isMock()).isTrue();
        assertThat(config.getMinMagnitude()).isEqualTo(4.5);
    }

    @Test
    void testMalformedNumberFailsFast() {
        assertThatThrownBy(() -> ConfigLoader.load(Map.of("QUAKEFLOW_MIN_ROWS", "many")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("FATAL:")
                .hasMessageContaining("QUAKEFLOW_MIN_ROWS");
    }

    @Test
    void testInconsistentRangeFailsFast() {
        assertThatThrownBy(() -> ConfigLoader.load(Map.of(
                "QUAKEFLOW_START_YEAR", "2020", "QUAKEFLOW_END_YEAR", "2019")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("FATAL:");
    }

    @Test
    void testToBuilderKeepsValues() {
        PipelineConfig base = ConfigLoader.load(Map.of("QUAKEFLOW_END_YEAR", "2020"));

        PipelineConfig changed = base.toBuilder().minMagnitude(5.0).build();

        assertThat(changed.getMinMagnitude()).isEqualTo(5.0);
        assertThat(changed.getEndYear()).isEqualTo(2020);
        assertThat(changed.getUserAgent()).isEqualTo(base.getUserAgent());
    }
}
