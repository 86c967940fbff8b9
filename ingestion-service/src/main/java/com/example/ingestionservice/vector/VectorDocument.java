package com.example.ingestionservice.vector;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A document as stored in the vector index.
 * 
 * id is derived only from (source, natural key), see {@link #idFor(String, String)},
 * so re-ingesting the same item overwrites instead of duplicating.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = {"content", "embedding"})
public class VectorDocument {

    private final String id;
    private final String source;
    private final String title;
    private final String content;
    private final List<Float> embedding;
    private final Map<String, Object> metadata;

    public Map<String, Object> getMetadata() {
        return metadata != null ? Collections.unmodifiableMap(metadata) : Map.of();
    }

    public boolean hasEmbedding() {
        return embedding != null && !embedding.isEmpty();
    }

    public VectorDocument withEmbedding(List<Float> values) {
        return toBuilder().embedding(values).build();
    }

    public static String idFor(String source, String naturalKey) {
        if (source == null || source.isBlank() || naturalKey == null || naturalKey.isBlank()) {
            throw new IllegalArgumentException("source and natural key are required for a document id");
        }
        return source + "-" + naturalKey;
    }
}
