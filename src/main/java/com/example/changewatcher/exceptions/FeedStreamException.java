package com.example.changewatcher.exceptions;

/**
 * An open subscription broke while waiting for the next event.
 */
public class FeedStreamException extends WatcherException {

        public FeedStreamException(String message, Throwable cause) {
                super(message, cause);
        }
}
