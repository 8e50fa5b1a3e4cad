package com.example.changewatcher.service;

import com.example.changewatcher.exceptions.FeedConnectException;
import com.example.changewatcher.models.FilterSpec;
import com.example.changewatcher.models.ResumeToken;

/**
 * FeedConnection abstracts subscribing to one resource's change feed.
 * At most one {@link EventSource} is live at a time: opening a new one closes
 * the previous one first.
 */
public interface FeedConnection extends AutoCloseable {

        /**
         * Subscribes to the feed.
         *
         * @param filter      applied server-side for the whole life of the returned source
         * @param resumeAfter position to resume just after, or null to start from now
         * @return a lazy event sequence, restartable only by calling open again
         * @throws FeedConnectException with {@link FeedConnectException.Reason#TOKEN_EXPIRED}
         *                              when {@code resumeAfter} has fallen out of the feed's history
         */
        EventSource open(FilterSpec filter, ResumeToken resumeAfter) throws FeedConnectException;

        /**
         * Closes the live source, if any. Idempotent.
         */
        @Override
        void close();
}
