package io.quakeflow.exceptions;

/**
 * Network or service-side failure: timeouts, connection errors, 5xx responses
 * and exhausted retries. The extractor records it as a failed interval.
 */
public class TransientError extends FetchException {

    private static final long serialVersionUID = 1L;

    public TransientError(String message) {
        super(message);
    }

    public TransientError(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
