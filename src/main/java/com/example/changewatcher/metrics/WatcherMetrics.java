package com.example.changewatcher.metrics;

import com.example.changewatcher.models.WatcherState;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

/**
 * Prometheus collectors for one watcher process. Registered into the registry
 * passed in, so tests can use a private {@link CollectorRegistry}.
 */
public class WatcherMetrics {

        private final Counter eventsDispatched;
        private final Counter handlerFailures;
        private final Counter checkpointFailures;
        private final Counter reconnectAttempts;
        private final Counter gaps;
        private final Gauge eventLag;
        private final Gauge watcherState;
        private final Histogram dispatchDuration;

        public WatcherMetrics(CollectorRegistry registry) {
                eventsDispatched = Counter.build().name("watcher_events_dispatched")
                                .help("Change events delivered to the handler.").register(registry);
                handlerFailures = Counter.build().name("watcher_handler_failures")
                                .help("Change events whose handler threw.").register(registry);
                checkpointFailures = Counter.build().name("watcher_checkpoint_failures")
                                .help("Resume tokens that could not be persisted.").register(registry);
                reconnectAttempts = Counter.build().name("watcher_reconnect_attempts")
                                .help("Attempts to reopen the change feed after a disconnect.").register(registry);
                gaps = Counter.build().name("watcher_gaps")
                                .help("Resubscriptions from now after the resume token expired.").register(registry);
                eventLag = Gauge.build().name("watcher_event_lag_milliseconds")
                                .help("Delay between the cluster time of the last event and its dispatch.")
                                .register(registry);
                watcherState = Gauge.build().name("watcher_state")
                                .help("1 for the watcher's current state, 0 for the others.")
                                .labelNames("state").register(registry);
                dispatchDuration = Histogram.build().name("watcher_dispatch_duration_seconds")
                                .help("Time spent in the handler plus checkpointing, per event.")
                                .buckets(0.0, 0.05, 0.1, 0.2, 0.5, 0.7, 1, 2).register(registry);
        }

        public Counter eventsDispatched() {
                return eventsDispatched;
        }

        public Counter handlerFailures() {
                return handlerFailures;
        }

        public Counter checkpointFailures() {
                return checkpointFailures;
        }

        public Counter reconnectAttempts() {
                return reconnectAttempts;
        }

        public Counter gaps() {
                return gaps;
        }

        public Gauge eventLag() {
                return eventLag;
        }

        public Histogram dispatchDuration() {
                return dispatchDuration;
        }

        public void recordState(WatcherState state) {
                for (WatcherState each : WatcherState.values()) {
                        watcherState.labels(each.name()).set(each == state ? 1 : 0);
                }
        }

        public double stateValue(WatcherState state) {
                return watcherState.labels(state.name()).get();
        }
}
