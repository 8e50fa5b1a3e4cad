package com.example.changewatcher.service;

import com.example.changewatcher.exceptions.FeedStreamException;
import com.example.changewatcher.models.ChangeEvent;

/**
 * One open subscription: a lazy, ordered, potentially infinite sequence of events.
 */
public interface EventSource extends AutoCloseable {

        /**
         * Waits a bounded time for the next event.
         *
         * @return the next event, or null if none arrived in time or the stream has ended
         */
        ChangeEvent tryNext() throws FeedStreamException;

        /**
         * True once the remote side has terminated the stream; no more events will come.
         */
        boolean isEndOfStream();

        /**
         * Idempotent.
         */
        @Override
        void close();
}
