package com.example.changewatcher.service;

import java.util.Optional;

import com.example.changewatcher.exceptions.StoreException;
import com.example.changewatcher.models.ResumeToken;

/**
 * Remembers the last successfully processed position of one watcher.
 * Single writer: only the active dispatch loop saves.
 */
public interface ResumeTokenStore {

        void save(ResumeToken token) throws StoreException;

        /**
         * @return the last saved token, or empty if nothing was saved yet
         * @throws StoreException if the backend cannot be read
         */
        Optional<ResumeToken> load() throws StoreException;

        /**
         * Writes out anything held back by batching. A no-op for stores that write through.
         */
        default void flush() throws StoreException {
        }
}
