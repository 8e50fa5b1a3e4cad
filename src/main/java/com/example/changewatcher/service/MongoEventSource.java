package com.example.changewatcher.service;

import java.util.NoSuchElementException;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.changewatcher.exceptions.FeedStreamException;
import com.example.changewatcher.models.ChangeEvent;
import com.example.changewatcher.models.OperationType;
import com.mongodb.MongoException;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.model.changestream.ChangeStreamDocument;

/**
 * Pulls events off an open change stream cursor. The server closes the cursor
 * after an invalidate event, so that event is the last one.
 */
class MongoEventSource implements EventSource {

        private static final Logger LOGGER = LoggerFactory.getLogger(MongoEventSource.class);

        private final MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor;
        private final ChangeEventDecoder decoder;
        private volatile boolean endOfStream;
        private volatile boolean closed;

        MongoEventSource(MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor, ChangeEventDecoder decoder) {
                this.cursor = cursor;
                this.decoder = decoder;
        }

        @Override
        public ChangeEvent tryNext() throws FeedStreamException {
                if (endOfStream || closed) {
                        return null;
                }
                ChangeStreamDocument<Document> raw;
                try {
                        raw = cursor.tryNext();
                } catch (NoSuchElementException | IllegalStateException e) {
                        LOGGER.debug("Cursor is finished: {}", e.toString());
                        endOfStream = true;
                        return null;
                } catch (MongoException e) {
                        throw new FeedStreamException("Change stream failed while awaiting the next event", e);
                }
                if (raw == null) {
                        return null;
                }
                ChangeEvent event = decoder.decode(raw);
                if (event.getOperationType() == OperationType.INVALIDATE) {
                        LOGGER.info("Change stream invalidated at {}", event.getPosition());
                        endOfStream = true;
                }
                return event;
        }

        @Override
        public boolean isEndOfStream() {
                return endOfStream;
        }

        @Override
        public void close() {
                if (closed) {
                        return;
                }
                closed = true;
                try {
                        cursor.close();
                } catch (MongoException e) {
                        LOGGER.warn("Error closing change stream cursor: {}", e.getMessage());
                }
        }
}
