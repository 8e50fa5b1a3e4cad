package com.example.changewatcher.exceptions;

/**
 * Base of the watcher's checked failures.
 */
public abstract class WatcherException extends Exception {

        protected WatcherException(String message) {
                super(message);
        }

        protected WatcherException(String message, Throwable cause) {
                super(message, cause);
        }
}
