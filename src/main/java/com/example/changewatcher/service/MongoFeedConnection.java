package com.example.changewatcher.service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.changewatcher.exceptions.FeedConnectException;
import com.example.changewatcher.exceptions.FeedConnectException.Reason;
import com.example.changewatcher.models.FilterSpec;
import com.example.changewatcher.models.ResumeToken;
import com.mongodb.MongoException;
import com.mongodb.client.ChangeStreamIterable;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.model.changestream.FullDocument;

/**
 * MongoFeedConnection subscribes to one collection's change stream.
 * Resuming uses {@code startAfter}, which also accepts the token of an
 * invalidate event.
 */
public class MongoFeedConnection implements FeedConnection {

        private static final Logger LOGGER = LoggerFactory.getLogger(MongoFeedConnection.class);

        private final MongoCollection<Document> collection;
        private final FullDocument fullDocument;
        private final Duration awaitTime;
        private final ChangeEventDecoder decoder = new ChangeEventDecoder();
        private MongoEventSource current;

        public MongoFeedConnection(MongoCollection<Document> collection, FullDocument fullDocument, Duration awaitTime) {
                this.collection = collection;
                this.fullDocument = fullDocument;
                this.awaitTime = awaitTime;
        }

        @Override
        public synchronized EventSource open(FilterSpec filter, ResumeToken resumeAfter) throws FeedConnectException {
                close();
                List<String> invalidPaths = filter.invalidPaths();
                if (!invalidPaths.isEmpty()) {
                        throw new FeedConnectException(Reason.INVALID_FILTER, "Invalid field paths " + invalidPaths);
                }
                try {
                        ChangeStreamIterable<Document> changeStream = collection.watch(filter.toPipeline())
                                        .fullDocument(fullDocument)
                                        .maxAwaitTime(awaitTime.toMillis(), TimeUnit.MILLISECONDS);
                        if (resumeAfter != null) {
                                changeStream = changeStream.startAfter(resumeAfter.toBsonDocument());
                        }
                        MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor = changeStream.cursor();
                        current = new MongoEventSource(cursor, decoder);
                        LOGGER.info("Opened change stream on {} {}", collection.getNamespace(),
                                        resumeAfter != null ? "after " + resumeAfter : "from now");
                        return current;
                } catch (MongoException e) {
                        Reason reason = MongoErrorClassifier.classify(e);
                        LOGGER.warn("Could not open change stream on {}: {} ({})", collection.getNamespace(), reason,
                                        e.getMessage());
                        throw new FeedConnectException(reason, "Could not open change stream on "
                                        + collection.getNamespace(), e);
                }
        }

        @Override
        public synchronized void close() {
                if (current != null) {
                        current.close();
                        current = null;
                }
        }
}
