package com.example.changewatcher.service;

import java.util.Optional;

import com.example.changewatcher.models.ResumeToken;

/**
 * Keeps the token for the life of the process only. The default backend.
 */
public class InMemoryResumeTokenStore implements ResumeTokenStore {

        private volatile ResumeToken token;

        public InMemoryResumeTokenStore() {
        }

        public InMemoryResumeTokenStore(ResumeToken initial) {
                this.token = initial;
        }

        @Override
        public void save(ResumeToken token) {
                this.token = token;
        }

        @Override
        public Optional<ResumeToken> load() {
                return Optional.ofNullable(token);
        }
}
