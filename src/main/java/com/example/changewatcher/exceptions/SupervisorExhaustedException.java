package com.example.changewatcher.exceptions;

/**
 * The reconnect supervisor gave up. Terminal: nothing retries after this.
 */
public class SupervisorExhaustedException extends WatcherException {

        private final int attempts;

        public SupervisorExhaustedException(String message, int attempts, Throwable lastFailure) {
                super(message, lastFailure);
                this.attempts = attempts;
        }

        public int getAttempts() {
                return attempts;
        }
}
