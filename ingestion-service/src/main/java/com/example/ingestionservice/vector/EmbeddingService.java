package com.example.ingestionservice.vector;

import java.util.List;

public interface EmbeddingService {

    /**
     * Longest input sent for embedding; longer text is truncated, never rejected.
     */
    int MAX_INPUT_CHARS = 8000;

    /**
     * @return embedding vector, or an empty list when the text is blank
     */
    List<Float> embed(String text);
}
