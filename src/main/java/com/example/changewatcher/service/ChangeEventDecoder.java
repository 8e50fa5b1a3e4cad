package com.example.changewatcher.service;

import java.util.ArrayList;
import java.util.List;

import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.Document;

import com.example.changewatcher.models.ChangeEvent;
import com.example.changewatcher.models.OperationType;
import com.example.changewatcher.models.ResumeToken;
import com.mongodb.MongoNamespace;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.model.changestream.UpdateDescription;

/**
 * Turns the driver's change stream documents into {@link ChangeEvent}s.
 */
public class ChangeEventDecoder {

        public ChangeEvent decode(ChangeStreamDocument<Document> raw) {
                return new ChangeEvent(OperationType.fromMongo(raw.getOperationType()), resourcePath(raw),
                                payload(raw), ResumeToken.of(raw.getResumeToken()), raw.getClusterTime());
        }

        private List<String> resourcePath(ChangeStreamDocument<Document> raw) {
                List<String> path = new ArrayList<>(3);
                MongoNamespace namespace = raw.getNamespace();
                if (namespace == null) {
                        return path;
                }
                path.add(namespace.getDatabaseName());
                path.add(namespace.getCollectionName());
                BsonDocument documentKey = raw.getDocumentKey();
                if (documentKey != null && documentKey.containsKey("_id")) {
                        path.add(keyString(documentKey.get("_id")));
                }
                return path;
        }

        private String keyString(BsonValue id) {
                if (id.isObjectId()) {
                        return id.asObjectId().getValue().toHexString();
                }
                if (id.isString()) {
                        return id.asString().getValue();
                }
                if (id.isInt32()) {
                        return Integer.toString(id.asInt32().getValue());
                }
                if (id.isInt64()) {
                        return Long.toString(id.asInt64().getValue());
                }
                return new BsonDocument("_id", id).toJson();
        }

        private Document payload(ChangeStreamDocument<Document> raw) {
                if (raw.getFullDocument() != null) {
                        return raw.getFullDocument();
                }
                UpdateDescription update = raw.getUpdateDescription();
                if (update != null) {
                        Document description = new Document();
                        if (update.getUpdatedFields() != null) {
                                description.append("updatedFields", update.getUpdatedFields());
                        }
                        if (update.getRemovedFields() != null) {
                                description.append("removedFields", update.getRemovedFields());
                        }
                        return description;
                }
                return new Document();
        }
}
