package com.example.changewatcher.exceptions;

/**
 * Opening a subscription to the change feed failed.
 */
public class FeedConnectException extends WatcherException {

        public enum Reason {
                /** network, timeout, election; worth retrying */
                UNREACHABLE,
                AUTH_FAILED,
                INVALID_FILTER,
                /** the requested resume point is no longer in the feed's history */
                TOKEN_EXPIRED
        }

        private final Reason reason;

        public FeedConnectException(Reason reason, String message) {
                super(message);
                this.reason = reason;
        }

        public FeedConnectException(Reason reason, String message, Throwable cause) {
                super(message, cause);
                this.reason = reason;
        }

        public Reason getReason() {
                return reason;
        }

        public boolean isRetryable() {
                return reason == Reason.UNREACHABLE || reason == Reason.TOKEN_EXPIRED;
        }

        @Override
        public String getMessage() {
                return reason + ": " + super.getMessage();
        }
}
