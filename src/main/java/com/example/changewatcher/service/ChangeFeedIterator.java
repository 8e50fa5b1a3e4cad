package com.example.changewatcher.service;

import java.util.Iterator;

import com.example.changewatcher.models.ChangeEvent;

/**
 * Blocking, pull-style view of a watcher. {@code hasNext()} waits for the next
 * event and returns false once the watcher is cancelled; fatal failures surface
 * as {@link com.example.changewatcher.exceptions.UncheckedWatcherException}.
 * The position of each returned event is checkpointed when the following one
 * is requested, or on {@link #close()}.
 */
public interface ChangeFeedIterator extends Iterator<ChangeEvent>, AutoCloseable {

        /**
         * Stops the watcher and releases the subscription. Idempotent.
         */
        @Override
        void close();
}
