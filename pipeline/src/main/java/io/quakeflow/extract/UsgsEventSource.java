package io.quakeflow.extract;

import com.fasterxml.jackson.databind.JsonNode;
import io.quakeflow.client.SessionClient;
import io.quakeflow.exceptions.PermanentError;
import io.quakeflow.exceptions.TransientError;
import io.quakeflow.models.Interval;
import io.quakeflow.serialization.GeoJsonEventParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Fetches events from the USGS FDSN event web service.
 * The query end is exclusive, so an interval's last day is fully covered.
 */
public class UsgsEventSource implements EventSource {

    private static final Logger LOG = LoggerFactory.getLogger(UsgsEventSource.class);

    private final SessionClient client;
    private final String baseUrl;
    private final GeoJsonEventParser parser;

    public UsgsEventSource(SessionClient client, String baseUrl) {
        this.client = client;
        this.baseUrl = baseUrl;
        this.parser = new GeoJsonEventParser();
    }

    public String buildQuery(Interval interval, double minMagnitude) {
        return String.format(Locale.ROOT, "%s?format=geojson&starttime=%s&endtime=%s&minmagnitude=%s",
                baseUrl, interval.getStartDate(), interval.exclusiveEnd(), minMagnitude);
    }

    @Override
    public JsonNode fetch(Interval interval, double minMagnitude) throws TransientError, PermanentError {
        String url = buildQuery(interval, minMagnitude);
        LOG.info("Fetching {} from {}", interval, url);
        String body = client.request(url);
        return parser.parseCollection(body);
    }

    @Override
    public String describe() {
        return "usgs(" + baseUrl + ")";
    }
}
