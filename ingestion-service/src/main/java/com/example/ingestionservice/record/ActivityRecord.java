package com.example.ingestionservice.record;

import lombok.Getter;

import java.time.Instant;

/**
 * Raw item fetched from a source, before identity resolution.
 * 
 * One subclass per record kind, each carrying only its own fields.
 * Consumers branch on the kind through {@link ActivityRecordVisitor},
 * so adding a kind fails compilation at every place that must handle it.
 */
@Getter
public abstract class ActivityRecord {

    private final Instant timestamp;
    private final String body;

    protected ActivityRecord(Instant timestamp, String body) {
        this.timestamp = timestamp;
        this.body = body;
    }

    public abstract Source getSource();

    public abstract RecordKind getKind();

    /**
     * Identifier the source itself assigns to this record. May be null for
     * sources that re-report items without a stable id.
     */
    public abstract String getSourceId();

    public abstract <R> R accept(ActivityRecordVisitor<R> visitor);
}
