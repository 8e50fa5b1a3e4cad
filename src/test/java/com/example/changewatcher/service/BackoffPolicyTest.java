package com.example.changewatcher.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

        @Test
        void testDelaysDoubleWithoutJitter() {
                BackoffPolicy backoff = new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(10), 0.0);

                assertEquals(Duration.ofMillis(100), backoff.delayFor(1));
                assertEquals(Duration.ofMillis(200), backoff.delayFor(2));
                assertEquals(Duration.ofMillis(400), backoff.delayFor(3));
                assertEquals(Duration.ofMillis(800), backoff.delayFor(4));
        }

        @Test
        void testDelaysStrictlyIncreaseUntilCapEvenWithMaximumJitter() {
                Duration cap = Duration.ofSeconds(5);
                // worst case for monotonicity: previous attempt gets the most jitter
                double[] randoms = { 0.9999, 0.0, 0.9999, 0.0, 0.9999, 0.0, 0.9999, 0.0, 0.9999, 0.0, 0.9999, 0.0 };
                int[] index = { 0 };
                BackoffPolicy backoff = new BackoffPolicy(Duration.ofMillis(100), cap, 0.9, () -> randoms[index[0]++]);

                Duration previous = Duration.ZERO;
                boolean reachedCap = false;
                for (int attempt = 1; attempt <= 12; attempt++) {
                        Duration delay = backoff.delayFor(attempt);
                        assertTrue(delay.compareTo(cap) <= 0, "delay " + delay + " exceeds cap");
                        if (reachedCap) {
                                assertEquals(cap, delay);
                        } else {
                                assertTrue(delay.compareTo(previous) > 0,
                                                "attempt " + attempt + ": " + delay + " <= " + previous);
                        }
                        reachedCap = delay.equals(cap);
                        previous = delay;
                }
                assertTrue(reachedCap);
        }

        @Test
        void testRandomJitterNeverExceedsCap() {
                Duration cap = Duration.ofMillis(3000);
                BackoffPolicy backoff = new BackoffPolicy(Duration.ofMillis(50), cap, 0.5);

                for (int i = 0; i < 200; i++) {
                        for (int attempt = 1; attempt <= 20; attempt++) {
                                assertTrue(backoff.delayFor(attempt).compareTo(cap) <= 0);
                        }
                }
        }

        @Test
        void testHugeAttemptNumbersSaturateAtCap() {
                BackoffPolicy backoff = new BackoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(30), 0.5);

                assertEquals(Duration.ofSeconds(30), backoff.delayFor(1_000_000));
        }

        @Test
        void testRejectsInvalidParameters() {
                assertThrows(IllegalArgumentException.class,
                                () -> new BackoffPolicy(Duration.ZERO, Duration.ofSeconds(1), 0.5));
                assertThrows(IllegalArgumentException.class,
                                () -> new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 0.5));
                assertThrows(IllegalArgumentException.class,
                                () -> new BackoffPolicy(Duration.ofMillis(10), Duration.ofSeconds(1), 1.0));
                BackoffPolicy backoff = new BackoffPolicy(Duration.ofMillis(10), Duration.ofSeconds(1), 0.5);
                assertThrows(IllegalArgumentException.class, () -> backoff.delayFor(0));
        }
}
