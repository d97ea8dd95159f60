package io.quakeflow.utils;

import java.time.Duration;

/**
 * Blocking pause, injectable so backoff and pacing can be tested without
 * real waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
