package com.example.ingestionservice.resolver;

import com.example.ingestionservice.record.ActivityRecord;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * A record together with its resolved identity and any looked-up attributes
 * (author name, epic, team) used for document metadata.
 */
@Getter
public class ResolvedRecord {

    public static final String AUTHOR_NAME = "author_name";
    public static final String EPIC_KEY = "epic_key";
    public static final String TEAM = "team";

    private final ActivityRecord record;
    private final CanonicalIdentity identity;
    private final Map<String, String> attributes;

    public ResolvedRecord(ActivityRecord record, CanonicalIdentity identity, Map<String, String> attributes) {
        this.record = record;
        this.identity = identity;
        this.attributes = attributes != null ? Collections.unmodifiableMap(attributes) : Map.of();
    }

    public ResolvedRecord(ActivityRecord record, CanonicalIdentity identity) {
        this(record, identity, Map.of());
    }

    public String attribute(String name) {
        return attributes.get(name);
    }
}
