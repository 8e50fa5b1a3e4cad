package com.example.changewatcher.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.time.Duration;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import com.example.changewatcher.service.BatchingResumeTokenStore;
import com.example.changewatcher.service.InMemoryResumeTokenStore;
import com.example.changewatcher.service.MongoResumeTokenStore;
import com.example.changewatcher.service.ResumeTokenStore;
import com.mongodb.client.MongoCollection;

class WatcherConfigTest {

        private WatcherConfig config;

        @SuppressWarnings("unchecked")
        private final MongoCollection<Document> resumeTokenCollection = mock(MongoCollection.class);

        private final RetryTemplate retryTemplate = RetryTemplate.builder().maxAttempts(1).build();

        @BeforeEach
        void setUp() {
                config = new WatcherConfig();
                ReflectionTestUtils.setField(config, "watcherName", "listings-indexer");
                ReflectionTestUtils.setField(config, "appName", "changeWatcher");
                ReflectionTestUtils.setField(config, "flushInterval", Duration.ZERO);
        }

        @Test
        void testMemoryStore() {
                ReflectionTestUtils.setField(config, "checkpointStore", "memory");

                assertTrue(config.resumeTokenStore(resumeTokenCollection, retryTemplate) instanceof InMemoryResumeTokenStore);
        }

        @Test
        void testMongoStore() {
                ReflectionTestUtils.setField(config, "checkpointStore", "Mongo");

                assertTrue(config.resumeTokenStore(resumeTokenCollection, retryTemplate) instanceof MongoResumeTokenStore);
        }

        @Test
        void testFlushIntervalWrapsStoreInBatching() {
                ReflectionTestUtils.setField(config, "checkpointStore", "mongo");
                ReflectionTestUtils.setField(config, "flushInterval", Duration.ofSeconds(5));

                ResumeTokenStore store = config.resumeTokenStore(resumeTokenCollection, retryTemplate);

                assertTrue(store instanceof BatchingResumeTokenStore);
        }

        @Test
        void testUnknownStoreIsRejected() {
                ReflectionTestUtils.setField(config, "checkpointStore", "redis");

                IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                                () -> config.resumeTokenStore(resumeTokenCollection, retryTemplate));

                assertEquals("Unknown watcher.checkpoint.store: redis", e.getMessage());
        }
}
