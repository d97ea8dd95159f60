package io.quakeflow.client;

import io.quakeflow.exceptions.PermanentError;
import io.quakeflow.exceptions.TransientError;
import io.quakeflow.utils.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound HTTP session with bounded retry and exponential backoff.
 *
 * <p>Every request carries the configured User-Agent: the upstream service
 * rejects clients that do not identify themselves. Connection failures,
 * timeouts and retryable statuses are retried per {@link RetryPolicy};
 * when attempts run out a {@link TransientError} is raised. 4xx responses
 * and malformed URLs raise {@link PermanentError} immediately.
 *
 * <p>Safe to reuse for many sequential calls; not designed for concurrent use.
 */
public class SessionClient {

    private static final Logger LOG = LoggerFactory.getLogger(SessionClient.class);
    private static final int BODY_PREVIEW_CHARS = 200;

    private final HttpTransport transport;
    private final RetryPolicy retryPolicy;
    private final Duration timeout;
    private final Sleeper sleeper;
    private final Map<String, String> headers;

    public SessionClient(HttpTransport transport, RetryPolicy retryPolicy, Duration timeout,
                         String userAgent, Sleeper sleeper) {
        if (userAgent == null || userAgent.isBlank()) {
            throw new IllegalArgumentException("A User-Agent is required: upstream rejects anonymous clients");
        }
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.timeout = timeout;
        this.sleeper = sleeper;

        Map<String, String> h = new LinkedHashMap<>();
        h.put("User-Agent", userAgent);
        h.put("Accept", "application/json");
        this.headers = Collections.unmodifiableMap(h);
    }

    /**
     * GET {@code url} and return the response body.
     */
    public String request(String url) throws TransientError, PermanentError {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new PermanentError("Malformed request URL: " + url, e);
        }

        int attempt = 0;
        while (true) {
            attempt++;
            HttpTransport.Response response;
            try {
                LOG.debug("GET {} (attempt {}/{})", uri, attempt, retryPolicy.maxAttempts());
                response = transport.get(uri, headers, timeout);
            } catch (IOException e) {
                if (!retryPolicy.hasAttemptsLeft(attempt)) {
                    throw new TransientError(String.format("Request failed after %d attempt(s): %s",
                            attempt, describe(e)), e);
                }
                LOG.warn("Request to {} failed ({}), retrying", uri, describe(e));
                pause(retryPolicy.backoff(attempt));
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientError("Interrupted while waiting for " + uri, e);
            }

            int status = response.statusCode();
            if (response.isSuccess()) {
                return response.body();
            }

            if (retryPolicy.isRetryableStatus(status)) {
                if (!retryPolicy.hasAttemptsLeft(attempt)) {
                    throw new TransientError(String.format("HTTP %d after %d attempt(s): %s",
                            status, attempt, preview(response.body())));
                }
                Duration delay = retryPolicy.delayFor(attempt, parseRetryAfter(response.retryAfter()));
                LOG.warn("HTTP {} from {}, retrying in {} ms", status, uri, delay.toMillis());
                pause(delay);
                continue;
            }

            if (status >= 500) {
                throw new TransientError(String.format("HTTP %d: %s", status, preview(response.body())));
            }
            throw new PermanentError(String.format("HTTP %d: %s", status, preview(response.body())), status);
        }
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    private void pause(Duration delay) throws TransientError {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientError("Interrupted during retry backoff", e);
        }
    }

    /**
     * Retry-After is either delta-seconds or an HTTP-date.
     */
    static Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() < 10 && trimmed.chars().allMatch(Character::isDigit)) {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration until = Duration.between(ZonedDateTime.now(at.getZone()), at);
            return until.isNegative() ? Duration.ZERO : until;
        } catch (DateTimeParseException e) {
            LOG.debug("Ignoring unparseable Retry-After header: {}", value);
            return null;
        }
    }

    private static String describe(IOException e) {
        return e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
    }

    private static String preview(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= BODY_PREVIEW_CHARS ? body : body.substring(0, BODY_PREVIEW_CHARS);
    }
}
