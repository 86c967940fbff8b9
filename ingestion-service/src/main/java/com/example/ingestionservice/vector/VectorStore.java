package com.example.ingestionservice.vector;

import java.util.List;

/**
 * Vector index contract.
 * 
 * upsert is keyed by document id: writing an existing id replaces it.
 */
public interface VectorStore {

    /**
     * Upsert one batch. Throws if the batch was not accepted.
     *
     * @return number of vectors the store reports as written
     */
    int upsert(List<VectorDocument> documents);

    List<VectorMatch> query(List<Float> embedding, MetadataFilter filter, int topK);
}
