package io.quakeflow.client;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Request-level retry policy: how many retries, how the backoff grows, and
 * which HTTP statuses are worth retrying. Independent of any transport.
 *
 * <p>The n-th retry (1-based) waits {@code backoffFactor * 2^(n-1)} seconds,
 * capped at {@link #getMaxBackoff()}. A server-provided Retry-After hint
 * replaces the computed delay, subject to the same cap.
 */
public final class RetryPolicy {

    public static final Set<Integer> DEFAULT_RETRY_STATUSES = Set.of(500, 502, 503, 504);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(120);

    private final int maxRetries;
    private final double backoffFactor;
    private final Set<Integer> retryStatuses;
    private final Duration maxBackoff;

    public RetryPolicy(int maxRetries, double backoffFactor, Set<Integer> retryStatuses) {
        this(maxRetries, backoffFactor, retryStatuses, DEFAULT_MAX_BACKOFF);
    }

    public RetryPolicy(int maxRetries, double backoffFactor, Set<Integer> retryStatuses,
                       Duration maxBackoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (backoffFactor < 0) {
            throw new IllegalArgumentException("backoffFactor must be >= 0, got " + backoffFactor);
        }
        this.maxRetries = maxRetries;
        this.backoffFactor = backoffFactor;
        this.retryStatuses = Collections.unmodifiableSet(new LinkedHashSet<>(retryStatuses));
        this.maxBackoff = maxBackoff;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(5, 1.5, DEFAULT_RETRY_STATUSES);
    }

    public static RetryPolicy noRetries() {
        return new RetryPolicy(0, 0.0, DEFAULT_RETRY_STATUSES);
    }

    /** Total attempts including the first one. */
    public int maxAttempts() {
        return maxRetries + 1;
    }

    public boolean isRetryableStatus(int status) {
        return retryStatuses.contains(status);
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts();
    }

    /**
     * Delay before retry number {@code retry} (1-based).
     */
    public Duration backoff(int retry) {
        if (retry < 1) {
            return Duration.ZERO;
        }
        double seconds = backoffFactor * Math.pow(2, retry - 1);
        long millis = (long) Math.min(seconds * 1000.0, (double) maxBackoff.toMillis());
        return Duration.ofMillis(millis);
    }

    /** Delay honouring a Retry-After hint when one was given. */
    public Duration delayFor(int retry, Duration retryAfter) {
        if (retryAfter != null && !retryAfter.isNegative()) {
            return retryAfter.compareTo(maxBackoff) > 0 ? maxBackoff : retryAfter;
        }
        return backoff(retry);
    }

    public int getMaxRetries() { return maxRetries; }
    public double getBackoffFactor() { return backoffFactor; }
    public Set<Integer> getRetryStatuses() { return retryStatuses; }
    public Duration getMaxBackoff() { return maxBackoff; }

    @Override
    public String toString() {
        return String.format("RetryPolicy{retries=%d, factor=%.2f, statuses=%s}",
                maxRetries, backoffFactor, retryStatuses);
    }
}
