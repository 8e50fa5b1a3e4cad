package com.example.changewatcher.service;

import java.util.Date;
import java.util.Optional;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;

import com.example.changewatcher.exceptions.StoreException;
import com.example.changewatcher.models.Checkpoint;
import com.example.changewatcher.models.ResumeToken;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.UpdateOptions;

/**
 * MongoResumeTokenStore keeps each watcher's resume token in one upserted
 * document of a checkpoint collection, keyed by watcher name.
 * Transient write errors are retried by the given {@link RetryTemplate}.
 */
public class MongoResumeTokenStore implements ResumeTokenStore {

        private static final Logger LOGGER = LoggerFactory.getLogger(MongoResumeTokenStore.class);

        private final MongoCollection<Document> checkpointCollection;
        private final RetryTemplate retryTemplate;
        private final String watcherName;
        private final String appName;

        public MongoResumeTokenStore(MongoCollection<Document> checkpointCollection, RetryTemplate retryTemplate,
                        String watcherName, String appName) {
                this.checkpointCollection = checkpointCollection;
                this.retryTemplate = retryTemplate;
                this.watcherName = watcherName;
                this.appName = appName;
        }

        @Override
        public void save(ResumeToken token) throws StoreException {
                Document checkpoint = new Checkpoint(watcherName, token, new Date(), appName).toDocument();
                checkpoint.remove(Checkpoint.ID_FIELD);
                try {
                        retryTemplate.execute(context -> {
                                if (context.getRetryCount() > 0) {
                                        LOGGER.warn("Retrying checkpoint write for watcher {}, attempt {}", watcherName,
                                                        context.getRetryCount() + 1);
                                }
                                return checkpointCollection.updateOne(Filters.eq(Checkpoint.ID_FIELD, watcherName),
                                                new Document("$set", checkpoint), new UpdateOptions().upsert(true));
                        });
                } catch (RuntimeException e) {
                        // a closed client throws IllegalStateException rather than MongoException
                        throw new StoreException("Could not save resume token for watcher " + watcherName, e);
                }
        }

        @Override
        public Optional<ResumeToken> load() throws StoreException {
                Document document;
                try {
                        document = checkpointCollection.find(Filters.eq(Checkpoint.ID_FIELD, watcherName)).first();
                } catch (RuntimeException e) {
                        throw new StoreException("Could not load resume token for watcher " + watcherName, e);
                }
                Checkpoint checkpoint = Checkpoint.fromDocument(document);
                if (checkpoint == null) {
                        LOGGER.info("No resume token stored for watcher {}", watcherName);
                        return Optional.empty();
                }
                LOGGER.info("Found resume token for watcher {} saved at {}", watcherName, checkpoint.getDate());
                return Optional.of(checkpoint.getResumeToken());
        }
}
