package com.example.changewatcher.service;

import com.example.changewatcher.models.ChangeEvent;

/**
 * ChangeEventHandler is the consumer side of a watcher. Events arrive one at a
 * time, in feed order, never concurrently.
 */
@FunctionalInterface
public interface ChangeEventHandler extends ChangeFeedListener {

        /**
         * Business logic for one change event. Anything thrown is reported as a
         * {@link com.example.changewatcher.exceptions.HandlerException}.
         */
        void onEvent(ChangeEvent event) throws Exception;
}
