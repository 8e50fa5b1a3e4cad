package com.example.changewatcher.config;

import java.util.concurrent.TimeUnit;

import org.bson.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.ReadPreference;
import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.connection.ConnectionPoolSettings;

@Configuration
public class MongoConfig {

        @Value("${spring.mongodb.uri}")
        private String mongoUri;

        @Value("${spring.mongodb.resumetoken.collection}")
        private String resumeTokenCollName;

        @Value("${spring.mongodb.collection}")
        private String collName;

        @Value("${spring.mongodb.database}")
        private String dbName;

        @Value("${spring.application.name:changeWatcher}")
        private String appName;

        // One watcher needs a single cursor connection plus checkpoint writes
        @Bean(destroyMethod = "close")
        public MongoClient mongoClient() {
                MongoClientSettings clientSettings = MongoClientSettings.builder()
                                .applyConnectionString(new ConnectionString(mongoUri))
                                .applyToConnectionPoolSettings((ConnectionPoolSettings.Builder builder) -> builder
                                                .maxSize(8).minSize(1))
                                .applyToSocketSettings(builder -> builder.connectTimeout(30, TimeUnit.SECONDS))
                                .retryReads(true).retryWrites(true).readPreference(ReadPreference.primaryPreferred())
                                .writeConcern(WriteConcern.MAJORITY).applicationName(appName).build();

                return MongoClients.create(clientSettings);
        }

        // Checkpoint collection, used when watcher.checkpoint.store=mongo
        @Bean
        public MongoCollection<Document> resumeTokenCollection(MongoClient mongoClient) {
                return mongoClient.getDatabase(dbName).getCollection(resumeTokenCollName, Document.class);
        }

        // The collection whose change stream is watched
        @Bean
        public MongoCollection<Document> changestreamCollection(MongoClient mongoClient) {
                return mongoClient.getDatabase(dbName).getCollection(collName, Document.class);
        }
}
