package com.example.changewatcher.service;

import java.time.Duration;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.changewatcher.exceptions.FeedConnectException;
import com.example.changewatcher.exceptions.FeedConnectException.Reason;
import com.example.changewatcher.exceptions.FeedStreamException;
import com.example.changewatcher.exceptions.StoreException;
import com.example.changewatcher.exceptions.SupervisorExhaustedException;
import com.example.changewatcher.metrics.WatcherMetrics;
import com.example.changewatcher.models.ChangeEvent;
import com.example.changewatcher.models.FilterSpec;
import com.example.changewatcher.models.ResumeToken;
import com.example.changewatcher.models.WatcherSettings;

/**
 * ReconnectSupervisor keeps one subscription alive and exposes it as a single
 * pull-based sequence through {@link #next()}. When the feed breaks or ends it
 * closes the broken source, backs off, and reopens after the last stored
 * resume token. An expired token leads to a resubscription from now plus a
 * gap notification. Too many consecutive failures end in {@link State#GIVING_UP}.
 * <p>
 * Not thread-safe: one streaming loop drives it, {@link #close()} included.
 * Other threads stop it through the {@link CancellationSignal}.
 */
public class ReconnectSupervisor implements AutoCloseable {

        private static final Logger LOGGER = LoggerFactory.getLogger(ReconnectSupervisor.class);

        public enum State {
                CONNECTED,
                DISCONNECTED,
                BACKING_OFF,
                GIVING_UP
        }

        private final FeedConnection connection;
        private final ResumeTokenStore resumeTokenStore;
        private final FilterSpec filter;
        private final ChangeFeedListener listener;
        private final BackoffPolicy backoff;
        private final int maxAttempts;
        private final CancellationSignal signal;
        private final WatcherMetrics metrics;
        private final Consumer<State> stateListener;

        private EventSource source;
        private volatile State state = State.DISCONNECTED;
        private int attempt;
        private boolean initialOpenPending = true;
        private Throwable lastFailure;

        public ReconnectSupervisor(FeedConnection connection, ResumeTokenStore resumeTokenStore, FilterSpec filter,
                        ChangeFeedListener listener, WatcherSettings settings, BackoffPolicy backoff,
                        CancellationSignal signal, WatcherMetrics metrics, Consumer<State> stateListener) {
                this.connection = connection;
                this.resumeTokenStore = resumeTokenStore;
                this.filter = filter;
                this.listener = listener;
                this.backoff = backoff;
                this.maxAttempts = settings.getMaxAttempts();
                this.signal = signal;
                this.metrics = metrics;
                this.stateListener = stateListener;
        }

        public State getState() {
                return state;
        }

        /**
         * Consecutive failed reconnects since the last successful one.
         */
        public int getAttempt() {
                return attempt;
        }

        /**
         * Opens the first subscription, retrying like any reconnect.
         *
         * @return false if cancelled before a connection was made
         */
        public boolean connect() throws SupervisorExhaustedException {
                if (state == State.CONNECTED) {
                        return true;
                }
                return reconnect();
        }

        /**
         * Blocks until the next event, reconnecting as needed.
         *
         * @return the next event in feed order, or null once cancelled
         * @throws SupervisorExhaustedException when reconnecting is given up; thrown once,
         *                                      later calls fail with IllegalStateException
         */
        public ChangeEvent next() throws SupervisorExhaustedException {
                if (state == State.GIVING_UP) {
                        throw new IllegalStateException("Supervisor has given up reconnecting");
                }
                while (!signal.isCancelled()) {
                        if (state != State.CONNECTED) {
                                if (!reconnect()) {
                                        return null;
                                }
                                continue;
                        }
                        try {
                                ChangeEvent event = source.tryNext();
                                if (event != null) {
                                        return event;
                                }
                                if (source.isEndOfStream()) {
                                        LOGGER.warn("Change stream ended unexpectedly; reconnecting");
                                        disconnect(null);
                                }
                        } catch (FeedStreamException e) {
                                LOGGER.warn("Change stream failed; reconnecting: {}", e.getMessage(), e);
                                disconnect(e);
                        }
                }
                LOGGER.debug("Cancellation observed");
                return null;
        }

        private boolean reconnect() throws SupervisorExhaustedException {
                while (!signal.isCancelled()) {
                        if (initialOpenPending) {
                                initialOpenPending = false;
                        } else {
                                transition(State.BACKING_OFF);
                                if (attempt >= maxAttempts) {
                                        giveUp("Giving up after " + attempt + " failed reconnect attempts");
                                }
                                attempt++;
                                metrics.reconnectAttempts().inc();
                                Duration delay = backoff.delayFor(attempt);
                                LOGGER.info("Reconnecting in {} ms (attempt {} of {})", delay.toMillis(), attempt,
                                                maxAttempts);
                                if (awaitCancellation(delay)) {
                                        return false;
                                }
                        }
                        try {
                                open();
                                return true;
                        } catch (FeedConnectException e) {
                                lastFailure = e;
                                if (!e.isRetryable()) {
                                        transition(State.BACKING_OFF);
                                        giveUp("Change feed cannot be opened: " + e.getMessage());
                                }
                                LOGGER.warn("Could not open change feed: {}", e.getMessage());
                                transition(State.DISCONNECTED);
                        } catch (StoreException e) {
                                lastFailure = e;
                                LOGGER.warn("Could not load resume token: {}", e.getMessage());
                                transition(State.DISCONNECTED);
                        }
                }
                return false;
        }

        private void open() throws FeedConnectException, StoreException {
                ResumeToken resumeAfter = resumeTokenStore.load().orElse(null);
                try {
                        source = connection.open(filter, resumeAfter);
                } catch (FeedConnectException e) {
                        if (e.getReason() != Reason.TOKEN_EXPIRED || resumeAfter == null) {
                                throw e;
                        }
                        LOGGER.warn("Resume token {} is no longer in the change feed history; resubscribing from now",
                                        resumeAfter);
                        source = connection.open(filter, null);
                        connected();
                        metrics.gaps().inc();
                        notifyGap(resumeAfter);
                        return;
                }
                connected();
        }

        private void connected() {
                attempt = 0;
                lastFailure = null;
                transition(State.CONNECTED);
        }

        private void notifyGap(ResumeToken lastKnownPosition) {
                try {
                        listener.onGap(lastKnownPosition);
                } catch (RuntimeException e) {
                        LOGGER.error("Gap callback failed", e);
                }
        }

        private void disconnect(Throwable cause) {
                closeSource();
                lastFailure = cause;
                transition(State.DISCONNECTED);
        }

        private void giveUp(String message) throws SupervisorExhaustedException {
                closeSource();
                transition(State.GIVING_UP);
                LOGGER.error("{}; last failure: {}", message, lastFailure == null ? "none" : lastFailure.toString());
                throw new SupervisorExhaustedException(message, attempt, lastFailure);
        }

        private boolean awaitCancellation(Duration delay) {
                try {
                        return signal.await(delay);
                } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        signal.cancel();
                        return true;
                }
        }

        private void transition(State next) {
                State previous = state;
                if (previous == next) {
                        return;
                }
                state = next;
                LOGGER.debug("Supervisor {} -> {}", previous, next);
                stateListener.accept(next);
        }

        private void closeSource() {
                if (source != null) {
                        source.close();
                        source = null;
                }
        }

        /**
         * Idempotent.
         */
        @Override
        public void close() {
                closeSource();
                connection.close();
        }
}
