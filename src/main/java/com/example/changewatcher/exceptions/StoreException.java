package com.example.changewatcher.exceptions;

/**
 * The resume token store could not read or write a checkpoint.
 */
public class StoreException extends WatcherException {

        public StoreException(String message) {
                super(message);
        }

        public StoreException(String message, Throwable cause) {
                super(message, cause);
        }
}
