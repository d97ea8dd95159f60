package io.quakeflow.exceptions;

/**
 * Malformed request, 4xx response or unparseable payload. Never retried.
 */
public class PermanentError extends FetchException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public PermanentError(String message) {
        this(message, -1);
    }

    public PermanentError(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public PermanentError(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
