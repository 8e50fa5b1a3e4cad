package com.example.changewatcher.service;

import org.slf4j.LoggerFactory;

import com.example.changewatcher.models.ResumeToken;

/**
 * Watcher-level notifications for a consumer, whichever way it reads events.
 */
public interface ChangeFeedListener {

        /**
         * The resume point expired and the watcher resubscribed from now: changes
         * after {@code lastKnownPosition} up to the resubscription were missed.
         *
         * @param lastKnownPosition the expired token, or null if none was stored
         */
        default void onGap(ResumeToken lastKnownPosition) {
                LoggerFactory.getLogger(ChangeFeedListener.class)
                                .warn("Change feed resumed from now; events after {} were missed", lastKnownPosition);
        }

        /**
         * The watcher stopped for good.
         */
        default void onFatal(Throwable cause) {
                LoggerFactory.getLogger(ChangeFeedListener.class).error("Watcher failed", cause);
        }
}
