package com.example.changewatcher.models;

import java.util.List;

import org.bson.BsonTimestamp;
import org.bson.Document;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One decoded change from the feed. Immutable; consumed once by the
 * dispatcher and then dropped.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ChangeEvent {

    private final OperationType operationType;
    /** database, collection and document key, as far as the event carries them */
    private final List<String> resourcePath;
    private final Document payload;
    private final ResumeToken position;
    private final BsonTimestamp clusterTime;

    public ChangeEvent(OperationType operationType, List<String> resourcePath, Document payload,
            ResumeToken position, BsonTimestamp clusterTime) {
        if (operationType == null || position == null) {
            throw new IllegalArgumentException("Change event needs an operation type and a position");
        }
        this.operationType = operationType;
        this.resourcePath = resourcePath == null ? List.of() : List.copyOf(resourcePath);
        this.payload = payload == null ? new Document() : new Document(payload);
        this.position = position;
        this.clusterTime = clusterTime;
    }

    /**
     * Returns a shallow copy of the payload document.
     */
    public Document getPayload() {
        return new Document(payload);
    }
}
