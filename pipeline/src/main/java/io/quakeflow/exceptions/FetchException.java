package io.quakeflow.exceptions;

/**
 * Base type for failures surfaced by the session client.
 * Callers decide per request whether the failure ends an interval or the run.
 */
public abstract class FetchException extends Exception {

    private static final long serialVersionUID = 1L;

    protected FetchException(String message) {
        super(message);
    }

    protected FetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
