package io.quakeflow.exceptions;

import io.quakeflow.models.ExtractionSummary;

/**
 * Thrown when an extraction run produced nothing usable: every interval failed,
 * or zero events were retrieved while the zero-events policy is enabled.
 */
public class ExtractionFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ExtractionSummary summary;

    public ExtractionFailedException(String message, ExtractionSummary summary) {
        super(message);
        this.summary = summary;
    }

    public ExtractionSummary getSummary() {
        return summary;
    }
}
