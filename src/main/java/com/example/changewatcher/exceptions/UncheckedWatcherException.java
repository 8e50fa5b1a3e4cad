package com.example.changewatcher.exceptions;

/**
 * Carries a {@link WatcherException} through {@link java.util.Iterator} and
 * {@link java.util.stream.Stream} methods, which cannot throw checked exceptions.
 */
public class UncheckedWatcherException extends RuntimeException {

        public UncheckedWatcherException(WatcherException cause) {
                super(cause.getMessage(), cause);
        }

        @Override
        public synchronized WatcherException getCause() {
                return (WatcherException) super.getCause();
        }
}
