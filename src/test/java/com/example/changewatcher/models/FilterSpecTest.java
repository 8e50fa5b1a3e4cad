package com.example.changewatcher.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bson.BsonDocument;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.Test;

import com.mongodb.MongoClientSettings;

class FilterSpecTest {

        @Test
        void testEmptyFilterHasNoPipeline() {
                assertTrue(FilterSpec.matchAll().toPipeline().isEmpty());
                assertSame(FilterSpec.matchAll(), FilterSpec.of(Map.of()));
                assertSame(FilterSpec.matchAll(), FilterSpec.of(null));
        }

        @Test
        void testSingleConditionBecomesOneMatchStage() {
                FilterSpec filter = FilterSpec.builder().operationType(OperationType.INSERT).build();

                List<Bson> pipeline = filter.toPipeline();

                assertEquals(1, pipeline.size());
                assertEquals(BsonDocument.parse("{'$match': {'operationType': 'insert'}}"), render(pipeline.get(0)));
        }

        @Test
        void testConditionsAreConjunctive() {
                FilterSpec filter = FilterSpec.builder()
                                .operationType(OperationType.INSERT)
                                .match("fullDocument.address.country", "Australia")
                                .match("fullDocument.address.market", "Sydney")
                                .build();

                List<Bson> pipeline = filter.toPipeline();

                assertEquals(1, pipeline.size());
                BsonDocument match = render(pipeline.get(0)).getDocument("$match");
                String json = match.toJson();
                assertTrue(match.containsKey("$and"), json);
                assertEquals(3, match.getArray("$and").size(), json);
                assertTrue(json.contains("\"fullDocument.address.country\": \"Australia\""), json);
                assertTrue(json.contains("\"fullDocument.address.market\": \"Sydney\""), json);
        }

        @Test
        void testInsertionOrderIsKept() {
                Map<String, Object> matches = new LinkedHashMap<>();
                matches.put("b", 1);
                matches.put("a", 2);

                assertEquals(List.of("b", "a"), List.copyOf(FilterSpec.of(matches).getMatches().keySet()));
        }

        @Test
        void testInvalidPathsAreReported() {
                FilterSpec filter = FilterSpec.builder()
                                .match("fullDocument.name", "ok")
                                .match("$where", "1")
                                .match(" ", "x")
                                .match("fullDocument..name", "x")
                                .build();

                assertEquals(List.of("$where", " ", "fullDocument..name"), filter.invalidPaths());
        }

        private static BsonDocument render(Bson bson) {
                return bson.toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry());
        }
}
