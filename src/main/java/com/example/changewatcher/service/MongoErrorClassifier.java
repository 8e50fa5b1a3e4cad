package com.example.changewatcher.service;

import java.util.Set;

import com.example.changewatcher.exceptions.FeedConnectException.Reason;
import com.mongodb.MongoException;
import com.mongodb.MongoSecurityException;

/**
 * Maps driver exceptions raised while opening a change stream to connect-failure reasons.
 */
final class MongoErrorClassifier {

        static final int CAPPED_POSITION_LOST = 136;
        static final int INVALID_RESUME_TOKEN = 260;
        static final int CHANGE_STREAM_FATAL_ERROR = 280;
        static final int CHANGE_STREAM_HISTORY_LOST = 286;

        private static final Set<Integer> TOKEN_EXPIRED_CODES = Set.of(CAPPED_POSITION_LOST, INVALID_RESUME_TOKEN,
                        CHANGE_STREAM_FATAL_ERROR, CHANGE_STREAM_HISTORY_LOST);
        private static final Set<Integer> AUTH_CODES = Set.of(13, 18);
        private static final Set<Integer> INVALID_FILTER_CODES = Set.of(2, 9, 40324);

        private MongoErrorClassifier() {
        }

        static Reason classify(MongoException e) {
                if (e instanceof MongoSecurityException) {
                        return Reason.AUTH_FAILED;
                }
                int code = e.getCode();
                if (TOKEN_EXPIRED_CODES.contains(code)) {
                        return Reason.TOKEN_EXPIRED;
                }
                if (AUTH_CODES.contains(code)) {
                        return Reason.AUTH_FAILED;
                }
                if (INVALID_FILTER_CODES.contains(code)) {
                        return Reason.INVALID_FILTER;
                }
                return Reason.UNREACHABLE;
        }
}
