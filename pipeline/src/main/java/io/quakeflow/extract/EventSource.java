package io.quakeflow.extract;

import com.fasterxml.jackson.databind.JsonNode;
import io.quakeflow.exceptions.PermanentError;
import io.quakeflow.exceptions.TransientError;
import io.quakeflow.models.Interval;

/**
 * Supplier of raw GeoJSON FeatureCollections, one per interval.
 */
public interface EventSource {

    JsonNode fetch(Interval interval, double minMagnitude) throws TransientError, PermanentError;

    /** Short name for logs. */
    String describe();
}
