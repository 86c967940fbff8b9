package com.example.ingestionservice.vector;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic bag-of-words embedding for tests: similar text gives similar vectors.
 */
public class HashingEmbeddingService implements EmbeddingService {

    private static final int DIMENSIONS = 64;

    private int calls;

    @Override
    public List<Float> embed(String text) {
        calls++;
        if (text == null || text.isBlank()) {
            return List.of();
        }
        float[] vector = new float[DIMENSIONS];
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (!token.isEmpty()) {
                vector[Math.floorMod(token.hashCode(), DIMENSIONS)] += 1.0f;
            }
        }
        List<Float> values = new ArrayList<>(DIMENSIONS);
        for (float v : vector) {
            values.add(v);
        }
        return values;
    }

    public int getCalls() {
        return calls;
    }
}
