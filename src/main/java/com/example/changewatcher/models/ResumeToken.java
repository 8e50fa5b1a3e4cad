package com.example.changewatcher.models;

import java.util.HexFormat;

import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;

import lombok.EqualsAndHashCode;

/**
 * Opaque position in a change feed: "resume from just after here".
 * <p>
 * Wraps the whole {@code _id} document of a change stream event, including
 * {@code _typeBits} when the server adds it, and hands it back unchanged when
 * resuming. Tokens compare by their {@code _data} key string, which the server
 * encodes so that it sorts in feed order. Nothing outside the feed layer should
 * look inside.
 */
@EqualsAndHashCode(of = {"document"})
public final class ResumeToken implements Comparable<ResumeToken> {

    private static final String DATA_FIELD = "_data";

    private final BsonDocument document;
    private final String sortKey;

    private ResumeToken(BsonDocument document) {
        this.document = document;
        this.sortKey = sortKey(document);
    }

    /**
     * A token carrying only a {@code _data} string.
     */
    public static ResumeToken fromData(String data) {
        if (data == null || data.isEmpty()) {
            throw new IllegalArgumentException("Resume token data must not be empty");
        }
        return new ResumeToken(new BsonDocument(DATA_FIELD, new BsonString(data)));
    }

    public static ResumeToken of(BsonDocument resumeToken) {
        if (resumeToken == null || resumeToken.isEmpty()) {
            throw new IllegalArgumentException("Resume token document must not be empty");
        }
        return new ResumeToken(resumeToken.clone());
    }

    /**
     * The {@code _data} key the token is ordered by.
     */
    public String getData() {
        return sortKey;
    }

    /**
     * A copy of the token exactly as the feed issued it.
     */
    public BsonDocument toBsonDocument() {
        return document.clone();
    }

    @Override
    public int compareTo(ResumeToken other) {
        return sortKey.compareTo(other.sortKey);
    }

    @Override
    public String toString() {
        return "ResumeToken{" + sortKey + "}";
    }

    // Pre-4.2 servers encode _data as binary
    private static String sortKey(BsonDocument document) {
        BsonValue data = document.get(DATA_FIELD);
        if (data == null) {
            return document.toJson();
        }
        if (data.isString()) {
            return data.asString().getValue();
        }
        if (data.isBinary()) {
            return HexFormat.of().withUpperCase().formatHex(data.asBinary().getData());
        }
        return data.toString();
    }
}
