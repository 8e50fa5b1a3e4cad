package com.example.changewatcher.config;

import java.time.Duration;
import java.util.Map;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import com.example.changewatcher.metrics.WatcherMetrics;
import com.example.changewatcher.models.FilterSpec;
import com.example.changewatcher.models.HandlerErrorPolicy;
import com.example.changewatcher.models.WatcherSettings;
import com.example.changewatcher.service.BatchingResumeTokenStore;
import com.example.changewatcher.service.FeedConnection;
import com.example.changewatcher.service.InMemoryResumeTokenStore;
import com.example.changewatcher.service.MongoFeedConnection;
import com.example.changewatcher.service.MongoResumeTokenStore;
import com.example.changewatcher.service.ResumeTokenStore;
import com.example.changewatcher.service.WatcherController;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.changestream.FullDocument;

@Configuration
public class WatcherConfig {

        private static final Logger LOGGER = LoggerFactory.getLogger(WatcherConfig.class);

        @Value("${watcher.name:change-watcher}")
        private String watcherName;

        @Value("${spring.application.name:changeWatcher}")
        private String appName;

        // e.g. watcher.filter={'operationType':'insert','fullDocument.address.market':'Sydney'}
        @Value("#{${watcher.filter:{:}}}")
        private Map<String, Object> filter;

        @Value("${watcher.full-document:updateLookup}")
        private String fullDocument;

        @Value("${watcher.backoff.base-delay:500ms}")
        private Duration baseDelay;

        @Value("${watcher.backoff.max-delay:30s}")
        private Duration maxDelay;

        @Value("${watcher.backoff.jitter:0.5}")
        private double jitter;

        @Value("${watcher.backoff.max-attempts:10}")
        private int maxAttempts;

        @Value("${watcher.await-time:1s}")
        private Duration awaitTime;

        @Value("${watcher.handler-error-policy:CONTINUE}")
        private HandlerErrorPolicy handlerErrorPolicy;

        @Value("${watcher.checkpoint.store:memory}")
        private String checkpointStore;

        @Value("${watcher.checkpoint.flush-interval:0s}")
        private Duration flushInterval;

        @Bean
        public WatcherSettings watcherSettings() {
                return WatcherSettings.builder()
                                .baseDelay(baseDelay)
                                .maxDelay(maxDelay)
                                .jitter(jitter)
                                .maxAttempts(maxAttempts)
                                .awaitTime(awaitTime)
                                .handlerErrorPolicy(handlerErrorPolicy)
                                .build();
        }

        @Bean
        public FilterSpec filterSpec() {
                return FilterSpec.of(filter);
        }

        @Bean
        public ResumeTokenStore resumeTokenStore(
                        @Qualifier("resumeTokenCollection") MongoCollection<Document> resumeTokenCollection,
                        RetryTemplate checkpointRetryTemplate) {
                ResumeTokenStore store;
                if ("mongo".equalsIgnoreCase(checkpointStore)) {
                        store = new MongoResumeTokenStore(resumeTokenCollection, checkpointRetryTemplate, watcherName,
                                        appName);
                } else if ("memory".equalsIgnoreCase(checkpointStore)) {
                        store = new InMemoryResumeTokenStore();
                } else {
                        throw new IllegalArgumentException("Unknown watcher.checkpoint.store: " + checkpointStore);
                }
                LOGGER.info("Checkpointing to {} store, flush interval {}", checkpointStore, flushInterval);
                return flushInterval.isZero() ? store : new BatchingResumeTokenStore(store, flushInterval);
        }

        @Bean
        public FeedConnection feedConnection(
                        @Qualifier("changestreamCollection") MongoCollection<Document> changestreamCollection,
                        WatcherSettings watcherSettings) {
                return new MongoFeedConnection(changestreamCollection, FullDocument.fromString(fullDocument),
                                watcherSettings.getAwaitTime());
        }

        @Bean
        public WatcherController watcherController(FeedConnection feedConnection, ResumeTokenStore resumeTokenStore,
                        WatcherSettings watcherSettings, WatcherMetrics watcherMetrics) {
                return new WatcherController(feedConnection, resumeTokenStore, watcherSettings, watcherMetrics);
        }
}
