package com.example.changewatcher.service;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot flag shared between whoever stops a watcher and the streaming loop.
 */
public final class CancellationSignal {

        private final CountDownLatch latch = new CountDownLatch(1);

        public void cancel() {
                latch.countDown();
        }

        public boolean isCancelled() {
                return latch.getCount() == 0;
        }

        /**
         * Sleeps for up to {@code timeout}, waking early on cancellation.
         *
         * @return true if cancelled
         */
        public boolean await(Duration timeout) throws InterruptedException {
                return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
}
