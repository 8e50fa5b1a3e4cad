package com.example.changewatcher.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.bson.conversions.Bson;

import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.Filters;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Conjunctive equality filter applied server-side: every field path must equal
 * its expected value. Fixed for the lifetime of a subscription.
 */
@ToString
@EqualsAndHashCode
public final class FilterSpec {

    private static final FilterSpec MATCH_ALL = new FilterSpec(Collections.emptyMap());

    private final Map<String, Object> matches;

    private FilterSpec(Map<String, Object> matches) {
        this.matches = Collections.unmodifiableMap(new LinkedHashMap<>(matches));
    }

    public static FilterSpec matchAll() {
        return MATCH_ALL;
    }

    public static FilterSpec of(Map<String, ?> matches) {
        Builder builder = builder();
        if (matches != null) {
            matches.forEach(builder::match);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> getMatches() {
        return matches;
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    /**
     * Paths that cannot be used as a {@code $match} key: blank, or starting with an operator.
     */
    public List<String> invalidPaths() {
        List<String> invalid = new ArrayList<>();
        for (String path : matches.keySet()) {
            if (path == null || path.isBlank() || path.startsWith("$") || path.startsWith(".")
                    || path.endsWith(".") || path.contains("..")) {
                invalid.add(String.valueOf(path));
            }
        }
        return invalid;
    }

    /**
     * The aggregation pipeline handed to {@code watch()}; empty when matching everything.
     */
    public List<Bson> toPipeline() {
        if (matches.isEmpty()) {
            return List.of();
        }
        List<Bson> conditions = new ArrayList<>();
        matches.forEach((path, value) -> conditions.add(Filters.eq(path, value)));
        Bson match = conditions.size() == 1 ? conditions.get(0) : Filters.and(conditions);
        return List.of(Aggregates.match(match));
    }

    public static final class Builder {
        private final Map<String, Object> matches = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder match(String fieldPath, Object expectedValue) {
            matches.put(fieldPath, expectedValue);
            return this;
        }

        public Builder operationType(OperationType operationType) {
            return match("operationType", operationType.name().toLowerCase(Locale.ROOT));
        }

        public FilterSpec build() {
            return matches.isEmpty() ? MATCH_ALL : new FilterSpec(matches);
        }
    }
}
