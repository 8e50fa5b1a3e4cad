package com.example.changewatcher.exceptions;

import com.example.changewatcher.models.ChangeEvent;

/**
 * The consumer's handler threw while receiving an event.
 */
public class HandlerException extends WatcherException {

        private final transient ChangeEvent event;

        public HandlerException(ChangeEvent event, Throwable cause) {
                super("Handler failed on " + event.getOperationType() + " event at " + event.getPosition(), cause);
                this.event = event;
        }

        public ChangeEvent getEvent() {
                return event;
        }
}
