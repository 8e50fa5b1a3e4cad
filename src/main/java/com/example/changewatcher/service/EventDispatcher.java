package com.example.changewatcher.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.changewatcher.exceptions.HandlerException;
import com.example.changewatcher.exceptions.StoreException;
import com.example.changewatcher.metrics.WatcherMetrics;
import com.example.changewatcher.models.ChangeEvent;
import com.example.changewatcher.models.HandlerErrorPolicy;

import io.prometheus.client.Histogram;

/**
 * EventDispatcher hands each event to the handler and then checkpoints its
 * position. Callers invoke it from a single loop, so delivery is sequential and
 * in arrival order.
 */
public class EventDispatcher {

        private static final Logger LOGGER = LoggerFactory.getLogger(EventDispatcher.class);

        private final ResumeTokenStore resumeTokenStore;
        private final HandlerErrorPolicy errorPolicy;
        private final WatcherMetrics metrics;

        public EventDispatcher(ResumeTokenStore resumeTokenStore, HandlerErrorPolicy errorPolicy,
                        WatcherMetrics metrics) {
                this.resumeTokenStore = resumeTokenStore;
                this.errorPolicy = errorPolicy;
                this.metrics = metrics;
        }

        /**
         * @throws HandlerException only under {@link HandlerErrorPolicy#ABORT}; the
         *                          event is then not checkpointed
         */
        public DispatchResult dispatch(ChangeEvent event, ChangeEventHandler handler) throws HandlerException {
                Histogram.Timer timer = metrics.dispatchDuration().startTimer();
                try {
                        recordLag(event);
                        try {
                                handler.onEvent(event);
                        } catch (Exception e) {
                                metrics.handlerFailures().inc();
                                HandlerException failure = new HandlerException(event, e);
                                if (errorPolicy == HandlerErrorPolicy.ABORT) {
                                        LOGGER.error("Handler failed, aborting watcher: {}", failure.getMessage(), e);
                                        throw failure;
                                }
                                LOGGER.error("Handler failed, skipping event: {}", failure.getMessage(), e);
                                checkpoint(event);
                                return DispatchResult.HANDLER_FAILED;
                        }
                        metrics.eventsDispatched().inc();
                        checkpoint(event);
                        return DispatchResult.DELIVERED;
                } finally {
                        timer.observeDuration();
                }
        }

        /**
         * Starts delivery of an event the consumer pulled itself: counts it, records
         * its lag and times it until {@link #completePulled}.
         */
        public Histogram.Timer beginPulled(ChangeEvent event) {
                recordLag(event);
                metrics.eventsDispatched().inc();
                return metrics.dispatchDuration().startTimer();
        }

        /**
         * The consumer is done with a pulled event: checkpoints it and stops its timer.
         */
        public void completePulled(ChangeEvent event, Histogram.Timer timer) {
                try {
                        checkpoint(event);
                } finally {
                        timer.observeDuration();
                }
        }

        /**
         * Persists the event's position. A store failure is logged and counted; the
         * stream goes on.
         */
        public void checkpoint(ChangeEvent event) {
                try {
                        resumeTokenStore.save(event.getPosition());
                } catch (StoreException e) {
                        metrics.checkpointFailures().inc();
                        LOGGER.warn("Could not checkpoint position {}, continuing: {}", event.getPosition(),
                                        e.getMessage(), e);
                }
        }

        private void recordLag(ChangeEvent event) {
                if (event.getClusterTime() != null) {
                        long eventMillis = event.getClusterTime().getTime() * 1000L;
                        metrics.eventLag().set(System.currentTimeMillis() - eventMillis);
                }
        }
}
