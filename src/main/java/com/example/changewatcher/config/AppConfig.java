package com.example.changewatcher.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import com.mongodb.MongoNotPrimaryException;
import com.mongodb.MongoSocketReadException;
import com.mongodb.MongoSocketWriteException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.MongoWriteConcernException;

@Configuration
public class AppConfig {

        @Value("${spring.mongodb.retry.maxattempts:3}")
        private int maxAttempts;

        @Value("${spring.mongodb.retry.initialdelayms:500}")
        private long initialDelayMs;

        // Checkpoint writes are retried on network, timeout and election errors only
        @Bean
        public RetryTemplate checkpointRetryTemplate() {
                return RetryTemplate.builder()
                                .maxAttempts(maxAttempts)
                                .fixedBackoff(initialDelayMs)
                                .retryOn(List.<Class<? extends Throwable>>of(MongoTimeoutException.class,
                                                MongoSocketReadException.class, MongoSocketWriteException.class,
                                                MongoWriteConcernException.class, MongoNotPrimaryException.class))
                                .build();
        }
}
