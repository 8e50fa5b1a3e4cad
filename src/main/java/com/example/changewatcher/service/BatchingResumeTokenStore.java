package com.example.changewatcher.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.changewatcher.exceptions.StoreException;
import com.example.changewatcher.models.ResumeToken;

/**
 * Coalesces saves: only the newest token is kept, and it reaches the delegate
 * at most once per flush interval. A crash loses at most one interval of
 * checkpoints, which means replaying those events after restart.
 */
public class BatchingResumeTokenStore implements ResumeTokenStore {

        private static final Logger LOGGER = LoggerFactory.getLogger(BatchingResumeTokenStore.class);

        private final ResumeTokenStore delegate;
        private final Duration flushInterval;
        private final Clock clock;
        private volatile ResumeToken pending;
        private Instant lastFlush;

        public BatchingResumeTokenStore(ResumeTokenStore delegate, Duration flushInterval) {
                this(delegate, flushInterval, Clock.systemUTC());
        }

        public BatchingResumeTokenStore(ResumeTokenStore delegate, Duration flushInterval, Clock clock) {
                if (flushInterval.isNegative()) {
                        throw new IllegalArgumentException("Flush interval must not be negative: " + flushInterval);
                }
                this.delegate = delegate;
                this.flushInterval = flushInterval;
                this.clock = clock;
                this.lastFlush = clock.instant();
        }

        @Override
        public void save(ResumeToken token) throws StoreException {
                pending = token;
                Instant now = clock.instant();
                if (!now.isBefore(lastFlush.plus(flushInterval))) {
                        flush();
                }
        }

        @Override
        public Optional<ResumeToken> load() throws StoreException {
                ResumeToken current = pending;
                return current != null ? Optional.of(current) : delegate.load();
        }

        @Override
        public void flush() throws StoreException {
                ResumeToken current = pending;
                if (current == null) {
                        return;
                }
                // pending stays set on failure so the next flush retries it
                delegate.save(current);
                lastFlush = clock.instant();
                if (pending == current) {
                        pending = null;
                }
                LOGGER.debug("Flushed resume token {}", current);
        }
}
