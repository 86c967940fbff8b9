package com.example.ingestionservice.vector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadata filter for vector queries, rendered in the Mongo-style operator
 * syntax the index understands ($eq, $in, $gte, $lte).
 * 
 * <pre>
 * MetadataFilter.create()
 *         .eq("source", "fireflies")
 *         .in("access_list", List.of("a@example.com"))
 *         .range("timestamp_epoch", from, to);
 * </pre>
 */
public class MetadataFilter {

    private final Map<String, Map<String, Object>> conditions = new LinkedHashMap<>();

    public static MetadataFilter create() {
        return new MetadataFilter();
    }

    public MetadataFilter eq(String field, Object value) {
        condition(field).put("$eq", value);
        return this;
    }

    public MetadataFilter in(String field, Collection<?> values) {
        condition(field).put("$in", new ArrayList<>(values));
        return this;
    }

    /**
     * Inclusive numeric range; either bound may be null.
     */
    public MetadataFilter range(String field, Long gte, Long lte) {
        if (gte != null) {
            condition(field).put("$gte", gte);
        }
        if (lte != null) {
            condition(field).put("$lte", lte);
        }
        return this;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public Map<String, Object> toMap() {
        return new LinkedHashMap<>(conditions);
    }

    /**
     * Evaluate against a document's metadata. A list-valued field matches
     * $eq / $in when any of its elements does.
     */
    public boolean matches(Map<String, Object> metadata) {
        for (Map.Entry<String, Map<String, Object>> entry : conditions.entrySet()) {
            Object actual = metadata.get(entry.getKey());
            for (Map.Entry<String, Object> op : entry.getValue().entrySet()) {
                if (!matches(actual, op.getKey(), op.getValue())) {
                    return false;
                }
            }
        }
        return true;
    }

    private Map<String, Object> condition(String field) {
        return conditions.computeIfAbsent(field, f -> new LinkedHashMap<>());
    }

    private static boolean matches(Object actual, String operator, Object expected) {
        if (actual == null) {
            return false;
        }
        switch (operator) {
            case "$eq":
                return valuesOf(actual).stream().anyMatch(v -> looselyEquals(v, expected));
            case "$in":
                Collection<?> allowed = (Collection<?>) expected;
                return valuesOf(actual).stream().anyMatch(v -> allowed.stream().anyMatch(a -> looselyEquals(v, a)));
            case "$gte":
                return actual instanceof Number n && n.doubleValue() >= ((Number) expected).doubleValue();
            case "$lte":
                return actual instanceof Number n && n.doubleValue() <= ((Number) expected).doubleValue();
            default:
                throw new IllegalArgumentException("Unsupported filter operator: " + operator);
        }
    }

    private static List<?> valuesOf(Object actual) {
        return actual instanceof Collection<?> c ? new ArrayList<>(c) : List.of(actual);
    }

    private static boolean looselyEquals(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return x.doubleValue() == y.doubleValue();
        }
        return a.equals(b);
    }
}
