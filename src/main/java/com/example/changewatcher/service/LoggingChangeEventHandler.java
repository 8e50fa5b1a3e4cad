package com.example.changewatcher.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.changewatcher.models.ChangeEvent;
import com.example.changewatcher.models.ResumeToken;

/**
 * Default consumer: writes every change to the log.
 */
@Component
public class LoggingChangeEventHandler implements ChangeEventHandler {

        private static final Logger LOGGER = LoggerFactory.getLogger(LoggingChangeEventHandler.class);

        @Override
        public void onEvent(ChangeEvent event) {
                LOGGER.info("{} {} {}", event.getOperationType(), String.join("/", event.getResourcePath()),
                                event.getPayload().toJson());
        }

        @Override
        public void onGap(ResumeToken lastKnownPosition) {
                LOGGER.warn("Resumed from now; changes after {} were not observed", lastKnownPosition);
        }

        @Override
        public void onFatal(Throwable cause) {
                LOGGER.error("Watcher failed and will not retry", cause);
        }
}
