package com.example.changewatcher.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with bounded jitter: attempt {@code n} waits
 * {@code min(base * 2^(n-1) * (1 + jitter * r), cap)} with {@code r} in [0, 1).
 * With {@code jitter < 1} the delays strictly increase until they hit the cap.
 */
public class BackoffPolicy {

        private final long baseMillis;
        private final long capMillis;
        private final double jitter;
        private final DoubleSupplier random;

        public BackoffPolicy(Duration base, Duration cap, double jitter) {
                this(base, cap, jitter, () -> ThreadLocalRandom.current().nextDouble());
        }

        public BackoffPolicy(Duration base, Duration cap, double jitter, DoubleSupplier random) {
                if (base.toMillis() < 1) {
                        throw new IllegalArgumentException("Base delay must be at least 1ms: " + base);
                }
                if (cap.compareTo(base) < 0) {
                        throw new IllegalArgumentException("Delay cap " + cap + " is below base delay " + base);
                }
                if (jitter < 0 || jitter >= 1) {
                        throw new IllegalArgumentException("Jitter must be in [0, 1): " + jitter);
                }
                this.baseMillis = base.toMillis();
                this.capMillis = cap.toMillis();
                this.jitter = jitter;
                this.random = random;
        }

        /**
         * @param attempt 1 for the first retry
         */
        public Duration delayFor(int attempt) {
                if (attempt < 1) {
                        throw new IllegalArgumentException("Attempts start at 1: " + attempt);
                }
                double exponential = Math.scalb((double) baseMillis, Math.min(attempt - 1, 62));
                double jittered = exponential * (1 + jitter * random.getAsDouble());
                return Duration.ofMillis((long) Math.min(jittered, (double) capMillis));
        }
}
