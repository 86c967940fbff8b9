package com.example.ingestionservice.record;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Upstream systems the pipeline ingests from.
 * The key is used in vector ids, checkpoint rows and the REST path.
 */
public enum Source {
    JIRA("jira"),
    TEMPO("tempo"),
    FIREFLIES("fireflies"),
    NOTION("notion"),
    SLACK("slack");

    private final String key;

    Source(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<Source> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(source -> source.key.equals(normalized))
                .findFirst();
    }
}
