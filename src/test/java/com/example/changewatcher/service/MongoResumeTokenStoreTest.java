package com.example.changewatcher.service;

import static com.example.changewatcher.service.TestEvents.token;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Date;
import java.util.List;
import java.util.Optional;

import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.Binary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.retry.support.RetryTemplate;

import com.example.changewatcher.exceptions.StoreException;
import com.example.changewatcher.models.ResumeToken;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.MongoSocketReadException;
import com.mongodb.ServerAddress;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.result.UpdateResult;

public class MongoResumeTokenStoreTest {

        @Mock
        private MongoCollection<Document> resumeTokenCollection;

        @Mock
        private FindIterable<Document> findIterable;

        private MongoResumeTokenStore resumeTokenStore;

        @BeforeEach
        public void setUp() {
                MockitoAnnotations.openMocks(this);
                RetryTemplate retryTemplate = RetryTemplate.builder()
                                .maxAttempts(3)
                                .fixedBackoff(1)
                                .retryOn(List.<Class<? extends Throwable>>of(MongoSocketReadException.class))
                                .build();
                resumeTokenStore = new MongoResumeTokenStore(resumeTokenCollection, retryTemplate, "test-watcher",
                                "changeWatcherTest");
                when(resumeTokenCollection.find(any(Bson.class))).thenReturn(findIterable);
        }

        @Test
        public void testSaveUpsertsOneDocumentPerWatcher() throws Exception {
                resumeTokenStore.save(token(5));

                ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);
                ArgumentCaptor<Bson> update = ArgumentCaptor.forClass(Bson.class);
                ArgumentCaptor<UpdateOptions> options = ArgumentCaptor.forClass(UpdateOptions.class);
                verify(resumeTokenCollection, times(1)).updateOne(filter.capture(), update.capture(), options.capture());

                assertEquals("test-watcher", render(filter.getValue()).getString("_id").getValue());
                BsonDocument set = render(update.getValue()).getDocument("$set");
                assertEquals(token(5).getData(), set.getDocument("resumeToken").getString("_data").getValue());
                assertEquals("changeWatcherTest", set.getString("appName").getValue());
                assertTrue(options.getValue().isUpsert());
        }

        @Test
        public void testSaveKeepsWholeTokenDocument() throws Exception {
                BsonDocument issued = new BsonDocument("_data", new BsonString("8263F0A1B2000000012B042C0100296E5A1004"))
                                .append("_typeBits", new BsonBinary(new byte[] { 0x40 }));

                resumeTokenStore.save(ResumeToken.of(issued));

                ArgumentCaptor<Bson> update = ArgumentCaptor.forClass(Bson.class);
                verify(resumeTokenCollection, times(1)).updateOne(any(Bson.class), update.capture(),
                                any(UpdateOptions.class));
                assertEquals(issued, render(update.getValue()).getDocument("$set").getDocument("resumeToken"));
        }

        @Test
        public void testSaveOnClosedClientIsStoreException() {
                when(resumeTokenCollection.updateOne(any(Bson.class), any(Bson.class), any(UpdateOptions.class)))
                                .thenThrow(new IllegalStateException("state should be: open"));

                assertThrows(StoreException.class, () -> resumeTokenStore.save(token(6)));
        }

        @Test
        public void testSaveRetriesTransientFailures() throws Exception {
                when(resumeTokenCollection.updateOne(any(Bson.class), any(Bson.class), any(UpdateOptions.class)))
                                .thenThrow(new MongoSocketReadException("connection reset", new ServerAddress()))
                                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

                resumeTokenStore.save(token(6));

                verify(resumeTokenCollection, times(2)).updateOne(any(Bson.class), any(Bson.class),
                                any(UpdateOptions.class));
        }

        @Test
        public void testSaveSurfacesPersistentFailureAsStoreException() {
                when(resumeTokenCollection.updateOne(any(Bson.class), any(Bson.class), any(UpdateOptions.class)))
                                .thenThrow(new MongoSocketReadException("connection reset", new ServerAddress()));

                assertThrows(StoreException.class, () -> resumeTokenStore.save(token(6)));
                verify(resumeTokenCollection, times(3)).updateOne(any(Bson.class), any(Bson.class),
                                any(UpdateOptions.class));
        }

        @Test
        public void testSaveDoesNotRetryNonTransientFailures() {
                when(resumeTokenCollection.updateOne(any(Bson.class), any(Bson.class), any(UpdateOptions.class)))
                                .thenThrow(new MongoException("not authorized"));

                assertThrows(StoreException.class, () -> resumeTokenStore.save(token(6)));
                verify(resumeTokenCollection, times(1)).updateOne(any(Bson.class), any(Bson.class),
                                any(UpdateOptions.class));
        }

        @Test
        public void testLoadReturnsStoredToken() throws Exception {
                Document tokenDoc = new Document("_id", "test-watcher")
                                .append("resumeToken", new Document("_data", token(3).getData()))
                                .append("date", new Date())
                                .append("appName", "changeWatcherTest");
                when(findIterable.first()).thenReturn(tokenDoc);

                Optional<ResumeToken> loaded = resumeTokenStore.load();

                assertEquals(Optional.of(token(3)), loaded);
                verify(resumeTokenCollection, times(1)).find(any(Bson.class));
        }

        @Test
        public void testLoadRestoresTypeBits() throws Exception {
                when(findIterable.first()).thenReturn(new Document("_id", "test-watcher")
                                .append("resumeToken", new Document("_data", "8263F0A1B2000000012B042C0100296E5A1004")
                                                .append("_typeBits", new Binary(new byte[] { 0x40 })))
                                .append("date", new Date()));

                ResumeToken loaded = resumeTokenStore.load().orElseThrow();

                assertEquals(new BsonDocument("_data", new BsonString("8263F0A1B2000000012B042C0100296E5A1004"))
                                .append("_typeBits", new BsonBinary(new byte[] { 0x40 })), loaded.toBsonDocument());
        }

        @Test
        public void testLoadIsEmptyWithoutCheckpoint() throws Exception {
                when(findIterable.first()).thenReturn(null);

                assertTrue(resumeTokenStore.load().isEmpty());
        }

        @Test
        public void testLoadIgnoresDocumentWithoutTokenData() throws Exception {
                when(findIterable.first()).thenReturn(new Document("_id", "test-watcher")
                                .append("resumeToken", new Document()));

                assertTrue(resumeTokenStore.load().isEmpty());
        }

        @Test
        public void testLoadFailureIsStoreException() {
                when(findIterable.first()).thenThrow(new MongoSocketReadException("reset", new ServerAddress()));

                assertThrows(StoreException.class, () -> resumeTokenStore.load());
        }

        private static BsonDocument render(Bson bson) {
                return bson.toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry());
        }
}
