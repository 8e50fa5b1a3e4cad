package com.example.changewatcher.models;

/**
 * The kinds of change a feed reports. Operation types the watcher does not
 * distinguish (drop, rename, ...) collapse into {@link #OTHER}.
 */
public enum OperationType {
    INSERT,
    UPDATE,
    DELETE,
    REPLACE,
    INVALIDATE,
    OTHER;

    public static OperationType fromMongo(com.mongodb.client.model.changestream.OperationType mongoType) {
        if (mongoType == null) {
            return OTHER;
        }
        switch (mongoType) {
            case INSERT:
                return INSERT;
            case UPDATE:
                return UPDATE;
            case DELETE:
                return DELETE;
            case REPLACE:
                return REPLACE;
            case INVALIDATE:
                return INVALIDATE;
            default:
                return OTHER;
        }
    }
}
