package io.quakeflow.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import io.quakeflow.exceptions.PermanentError;
import io.quakeflow.models.Event;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeoJsonEventParserTest {

    private final GeoJsonEventParser parser = new GeoJsonEventParser();

    @Test
    void testFlattensUsgsFeature() throws Exception {
        JsonNode collection = parser.parseCollection("{\"type\":\"FeatureCollection\",\"features\":[{"
                + "\"type\":\"Feature\",\"id\":\"us7000abcd\","
                + "\"properties\":{\"mag\":5.4,\"place\":\"10 km S of Town\",\"time\":1609459200000,"
                + "\"magType\":\"mww\",\"type\":\"earthquake\",\"status\":\"reviewed\",\"tsunami\":1,"
                + "\"sig\":449,\"gap\":25.0,\"dmin\":1.2,\"rms\":0.8,\"nst\":57},"
                + "\"geometry\":{\"type\":\"Point\",\"coordinates\":[142.3,38.1,29.0]}}]}");

        List<Event> events = parser.toEvents(parser.features(collection));

        assertThat(events).hasSize(1);
        Event e = events.get(0);
        assertThat(e.getId()).isEqualTo("us7000abcd");
        assertThat(e.getMagnitude()).isEqualTo(5.4);
        assertThat(e.getTime()).isEqualTo(1609459200000L);
        assertThat(e.getLongitude()).isEqualTo(142.3);
        assertThat(e.getLatitude()).isEqualTo(38.1);
        assertThat(e.getDepth()).isEqualTo(29.0);
        assertThat(e.getMagType()).isEqualTo("mww");
        assertThat(e.getEventType()).isEqualTo("earthquake");
        assertThat(e.getTsunami()).isEqualTo(1);
        assertThat(e.getSignificance()).isEqualTo(449);
        assertThat(e.getNst()).isEqualTo(57);
        assertThat(e.hasCoreAttributes()).isTrue();
    }

    @Test
    void testMissingFieldsBecomeNull() throws Exception {
        JsonNode collection = parser.parseCollection("{\"features\":[{\"id\":\"x\","
                + "\"properties\":{\"mag\":null,\"time\":1609459200000,\"gap\":\"n/a\"},"
                + "\"geometry\":{\"coordinates\":[10.0]}}]}");

        Event e = parser.toEvents(parser.features(collection)).get(0);

        assertThat(e.getMagnitude()).isNull();
        assertThat(e.getLatitude()).isNull();
        assertThat(e.getGap()).isNull();
        assertThat(e.getPlace()).isNull();
        assertThat(e.getTsunami()).isZero();
        assertThat(e.hasCoreAttributes()).isFalse();
    }

    @Test
    void testNumericStringsAreParsed() throws Exception {
        JsonNode collection = parser.parseCollection("{\"features\":[{\"id\":\"y\","
                + "\"properties\":{\"mag\":\"4.2\",\"time\":\"1609459200000\"},"
                + "\"geometry\":{\"coordinates\":[\"-1.5e1\",20,3]}}]}");

        Event e = parser.toEvents(parser.features(collection)).get(0);

        assertThat(e.getMagnitude()).isEqualTo(4.2);
        assertThat(e.getTime()).isEqualTo(1609459200000L);
        assertThat(e.getLongitude()).isEqualTo(-15.0);
    }

    @Test
    void testInvalidBodyIsPermanent() {
        assertThatThrownBy(() -> parser.parseCollection("<html>busy</html>"))
                .isInstanceOf(PermanentError.class);
        assertThatThrownBy(() -> parser.parseCollection("[1,2]"))
                .isInstanceOf(PermanentError.class);
        assertThatThrownBy(() -> parser.parseCollection("{\"features\": ["))
                .isInstanceOf(PermanentError.class)
                .hasMessageStartingWith("Response is not valid JSON: ");
    }

    @Test
    void testDatasetFormatParsing() {
        assertThat(DatasetFormat.fromString("GeoJSON")).isEqualTo(DatasetFormat.GEOJSON);
        assertThat(DatasetFormat.fromString("parquet")).isEqualTo(DatasetFormat.PARQUET);
        assertThatThrownBy(() -> DatasetFormat.fromString("csv"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported format: csv");
    }
}
