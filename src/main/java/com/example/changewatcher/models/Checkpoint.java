package com.example.changewatcher.models;

import java.util.Date;

import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.Document;

import com.mongodb.MongoClientSettings;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * The stored form of a watcher's last processed position, one document per watcher.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = {"watcherName"})
@ToString
public class Checkpoint {

    public static final String ID_FIELD = "_id";
    public static final String RESUME_TOKEN_FIELD = "resumeToken";
    public static final String DATE_FIELD = "date";
    public static final String APP_NAME_FIELD = "appName";

    private static final String DATA_FIELD = "_data";

    private String watcherName;
    private ResumeToken resumeToken;
    private Date date;
    private String appName;

    public Document toDocument() {
        return new Document(ID_FIELD, watcherName)
                .append(RESUME_TOKEN_FIELD, resumeToken.toBsonDocument())
                .append(DATE_FIELD, date)
                .append(APP_NAME_FIELD, appName);
    }

    /**
     * Returns null when the document carries no usable token.
     */
    public static Checkpoint fromDocument(Document document) {
        if (document == null) {
            return null;
        }
        BsonValue token = document.toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry())
                .get(RESUME_TOKEN_FIELD);
        if (token == null || !token.isDocument() || !token.asDocument().containsKey(DATA_FIELD)) {
            return null;
        }
        return new Checkpoint(document.getString(ID_FIELD), ResumeToken.of(token.asDocument()),
                document.getDate(DATE_FIELD), document.getString(APP_NAME_FIELD));
    }
}
