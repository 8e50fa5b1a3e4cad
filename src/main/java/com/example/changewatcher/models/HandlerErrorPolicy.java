package com.example.changewatcher.models;

/**
 * What the dispatcher does after the consumer's handler throws.
 */
public enum HandlerErrorPolicy {
    /** report the failure, treat the event as consumed, keep streaming */
    CONTINUE,
    /** stop the watcher and hand the failure to its owner */
    ABORT
}
