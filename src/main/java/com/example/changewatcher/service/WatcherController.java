package com.example.changewatcher.service;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.changewatcher.exceptions.HandlerException;
import com.example.changewatcher.exceptions.StoreException;
import com.example.changewatcher.exceptions.SupervisorExhaustedException;
import com.example.changewatcher.exceptions.UncheckedWatcherException;
import com.example.changewatcher.exceptions.WatcherException;
import com.example.changewatcher.metrics.WatcherMetrics;
import com.example.changewatcher.models.ChangeEvent;
import com.example.changewatcher.models.FilterSpec;
import com.example.changewatcher.models.WatcherSettings;
import com.example.changewatcher.models.WatcherState;

import io.prometheus.client.Histogram;

/**
 * WatcherController runs one watch of a change feed from start to shutdown and
 * owns the {@link WatcherState}. Events can be consumed three ways over the same
 * pull core: a callback handler ({@link #run}), a blocking iterator
 * ({@link #iterate}) or a {@link Stream} ({@link #stream}).
 * <p>
 * A controller is single-use. The subscription is released and the resume
 * token store flushed on every exit path.
 */
public class WatcherController implements AutoCloseable {

        private static final Logger LOGGER = LoggerFactory.getLogger(WatcherController.class);

        private static final ChangeFeedListener LOGGING_LISTENER = new ChangeFeedListener() {
        };

        private final FeedConnection connection;
        private final ResumeTokenStore resumeTokenStore;
        private final WatcherSettings settings;
        private final BackoffPolicy backoff;
        private final WatcherMetrics metrics;

        private volatile WatcherState state = WatcherState.IDLE;
        private volatile CancellationSignal signal;

        public WatcherController(FeedConnection connection, ResumeTokenStore resumeTokenStore,
                        WatcherSettings settings, WatcherMetrics metrics) {
                this(connection, resumeTokenStore, settings,
                                new BackoffPolicy(settings.getBaseDelay(), settings.getMaxDelay(), settings.getJitter()),
                                metrics);
        }

        public WatcherController(FeedConnection connection, ResumeTokenStore resumeTokenStore,
                        WatcherSettings settings, BackoffPolicy backoff, WatcherMetrics metrics) {
                this.connection = connection;
                this.resumeTokenStore = resumeTokenStore;
                this.settings = settings;
                this.backoff = backoff;
                this.metrics = metrics;
                metrics.recordState(state);
        }

        public WatcherState getState() {
                return state;
        }

        /**
         * Watches for {@code duration}, then shuts down. Blocks the calling thread.
         */
        public void run(FilterSpec filter, ChangeEventHandler handler, Duration duration) throws WatcherException {
                CancellationSignal timeout = new CancellationSignal();
                ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(daemonThreadFactory());
                try {
                        timer.schedule(() -> {
                                LOGGER.info("Watch duration {} elapsed, closing the change stream", duration);
                                timeout.cancel();
                        }, duration.toMillis(), TimeUnit.MILLISECONDS);
                        run(filter, handler, timeout);
                } finally {
                        timer.shutdownNow();
                }
        }

        /**
         * Watches until {@code signal} is cancelled. Blocks the calling thread.
         *
         * @throws SupervisorExhaustedException if the feed could not be kept open
         * @throws HandlerException             if the handler failed under the abort policy
         */
        public void run(FilterSpec filter, ChangeEventHandler handler, CancellationSignal signal)
                        throws WatcherException {
                if (handler == null) {
                        throw new IllegalArgumentException("handler must not be null");
                }
                begin(signal);
                EventDispatcher dispatcher = new EventDispatcher(resumeTokenStore, settings.getHandlerErrorPolicy(),
                                metrics);
                ReconnectSupervisor supervisor = null;
                Throwable failure = null;
                try {
                        supervisor = newSupervisor(filter, handler, signal);
                        if (supervisor.connect()) {
                                ChangeEvent event;
                                while ((event = supervisor.next()) != null) {
                                        dispatcher.dispatch(event, handler);
                                }
                        }
                } catch (SupervisorExhaustedException | HandlerException e) {
                        failure = e;
                        throw e;
                } catch (RuntimeException | Error e) {
                        failure = e;
                        throw e;
                } finally {
                        release(supervisor, handler, failure);
                }
        }

        /**
         * Watches until {@code signal} is cancelled or the iterator is closed. Gaps
         * and fatal failures are only logged.
         */
        public ChangeFeedIterator iterate(FilterSpec filter, CancellationSignal signal) {
                return iterate(filter, LOGGING_LISTENER, signal);
        }

        /**
         * Watches until {@code signal} is cancelled or the iterator is closed,
         * reporting gaps and fatal failures to {@code listener}.
         */
        public ChangeFeedIterator iterate(FilterSpec filter, ChangeFeedListener listener, CancellationSignal signal) {
                if (listener == null) {
                        throw new IllegalArgumentException("listener must not be null");
                }
                begin(signal);
                try {
                        return new EventIterator(newSupervisor(filter, listener, signal), listener,
                                        new EventDispatcher(resumeTokenStore, settings.getHandlerErrorPolicy(), metrics));
                } catch (RuntimeException e) {
                        release(null, listener, e);
                        throw e;
                }
        }

        public Stream<ChangeEvent> stream(FilterSpec filter, CancellationSignal signal) {
                return stream(filter, LOGGING_LISTENER, signal);
        }

        /**
         * Same as {@link #iterate(FilterSpec, ChangeFeedListener, CancellationSignal)}
         * as an ordered sequential stream; closing the stream stops the watcher.
         */
        public Stream<ChangeEvent> stream(FilterSpec filter, ChangeFeedListener listener, CancellationSignal signal) {
                ChangeFeedIterator iterator = iterate(filter, listener, signal);
                return StreamSupport
                                .stream(Spliterators.spliteratorUnknownSize(iterator,
                                                Spliterator.ORDERED | Spliterator.NONNULL), false)
                                .onClose(iterator::close);
        }

        /**
         * Asks a running watch to stop at its next suspension point. Idempotent.
         */
        public void cancel() {
                CancellationSignal current = signal;
                if (current != null) {
                        current.cancel();
                }
        }

        /**
         * Cancels the watch; a controller that never started becomes CLOSED. Idempotent.
         */
        @Override
        public void close() {
                cancel();
                synchronized (this) {
                        if (state == WatcherState.IDLE) {
                                transition(WatcherState.CLOSED);
                        }
                }
        }

        private synchronized void begin(CancellationSignal signal) {
                if (signal == null) {
                        throw new IllegalArgumentException("signal must not be null");
                }
                if (state != WatcherState.IDLE) {
                        throw new IllegalStateException("Watcher can only be started once; current state " + state);
                }
                this.signal = signal;
                transition(WatcherState.CONNECTING);
        }

        private ReconnectSupervisor newSupervisor(FilterSpec filter, ChangeFeedListener listener,
                        CancellationSignal signal) {
                return new ReconnectSupervisor(connection, resumeTokenStore, filter, listener, settings, backoff, signal,
                                metrics, this::onSupervisorState);
        }

        private void onSupervisorState(ReconnectSupervisor.State supervisorState) {
                switch (supervisorState) {
                        case CONNECTED:
                                transition(WatcherState.STREAMING);
                                break;
                        case DISCONNECTED:
                        case BACKING_OFF:
                                if (state == WatcherState.STREAMING) {
                                        transition(WatcherState.RECONNECTING);
                                }
                                break;
                        default:
                                break;
                }
        }

        private void release(ReconnectSupervisor supervisor, ChangeFeedListener listener, Throwable failure) {
                if (failure == null) {
                        transition(WatcherState.CLOSING);
                }
                try {
                        if (supervisor != null) {
                                supervisor.close();
                        } else {
                                connection.close();
                        }
                } catch (RuntimeException e) {
                        LOGGER.warn("Error releasing change feed connection", e);
                }
                try {
                        resumeTokenStore.flush();
                } catch (StoreException | RuntimeException e) {
                        metrics.checkpointFailures().inc();
                        LOGGER.warn("Could not flush resume token on shutdown: {}", e.getMessage(), e);
                }
                if (failure == null) {
                        transition(WatcherState.CLOSED);
                        LOGGER.info("Watcher closed");
                        return;
                }
                transition(WatcherState.FAILED);
                try {
                        listener.onFatal(failure);
                } catch (RuntimeException e) {
                        LOGGER.error("Fatal-failure callback failed", e);
                }
        }

        private synchronized void transition(WatcherState next) {
                if (state == next) {
                        return;
                }
                LOGGER.info("Watcher {} -> {}", state, next);
                state = next;
                metrics.recordState(next);
        }

        private static ThreadFactory daemonThreadFactory() {
                return runnable -> {
                        Thread thread = new Thread(runnable);
                        thread.setDaemon(true);
                        thread.setName("watcher-timer");
                        return thread;
                };
        }

        private final class EventIterator implements ChangeFeedIterator {

                private final ReconnectSupervisor supervisor;
                private final ChangeFeedListener listener;
                private final EventDispatcher dispatcher;
                private ChangeEvent lookahead;
                private ChangeEvent lastReturned;
                private Histogram.Timer lastReturnedTimer;
                private boolean finished;

                private EventIterator(ReconnectSupervisor supervisor, ChangeFeedListener listener,
                                EventDispatcher dispatcher) {
                        this.supervisor = supervisor;
                        this.listener = listener;
                        this.dispatcher = dispatcher;
                }

                @Override
                public boolean hasNext() {
                        if (lookahead != null) {
                                return true;
                        }
                        if (finished) {
                                return false;
                        }
                        commitLastReturned();
                        try {
                                lookahead = supervisor.next();
                        } catch (SupervisorExhaustedException e) {
                                finish(e);
                                throw new UncheckedWatcherException(e);
                        } catch (RuntimeException | Error e) {
                                finish(e);
                                throw e;
                        }
                        if (lookahead == null) {
                                finish(null);
                                return false;
                        }
                        return true;
                }

                @Override
                public ChangeEvent next() {
                        if (!hasNext()) {
                                throw new NoSuchElementException("Change feed watcher is closed");
                        }
                        ChangeEvent event = lookahead;
                        lookahead = null;
                        lastReturned = event;
                        lastReturnedTimer = dispatcher.beginPulled(event);
                        return event;
                }

                @Override
                public void close() {
                        if (finished) {
                                return;
                        }
                        cancel();
                        commitLastReturned();
                        finish(null);
                }

                private void commitLastReturned() {
                        if (lastReturned != null) {
                                dispatcher.completePulled(lastReturned, lastReturnedTimer);
                                lastReturned = null;
                                lastReturnedTimer = null;
                        }
                }

                private void finish(Throwable failure) {
                        if (finished) {
                                return;
                        }
                        finished = true;
                        lookahead = null;
                        release(supervisor, listener, failure);
                }
        }
}
