package com.example.changewatcher.models;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/**
 * Tuning for one watcher: reconnect backoff, retry budget, and how events are awaited.
 */
@Value
@Builder(toBuilder = true)
public class WatcherSettings {

    @Builder.Default
    Duration baseDelay = Duration.ofMillis(500);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);

    /**
     * Fraction of the exponential delay added as random jitter. Kept below 1 so
     * successive delays still strictly increase until they reach {@link #maxDelay}.
     */
    @Builder.Default
    double jitter = 0.5;

    /** consecutive failed reconnects tolerated before giving up */
    @Builder.Default
    int maxAttempts = 10;

    /** longest a single poll of the feed blocks; also bounds how late a cancellation is noticed */
    @Builder.Default
    Duration awaitTime = Duration.ofSeconds(1);

    @Builder.Default
    HandlerErrorPolicy handlerErrorPolicy = HandlerErrorPolicy.CONTINUE;

    public static WatcherSettings defaults() {
        return builder().build();
    }
}
