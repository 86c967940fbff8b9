package com.example.ingestionservice.record;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Meeting transcript. The same meeting can be re-reported under a new id
 * once processing finishes, which is why transcripts go through dedup.
 */
@Getter
public class FirefliesTranscriptRecord extends ActivityRecord {

    private final String transcriptId;
    private final String title;
    /** Meeting start, epoch milliseconds. */
    private final Long dateMillis;
    /** Minutes; null when the source did not report it. */
    private final Double duration;
    private final int sentenceCount;
    @Getter(AccessLevel.NONE)
    private final boolean hasTranscript;
    private final List<String> participants;
    private final List<String> attendeeEmails;
    private final List<String> sharedWith;
    private final boolean isPublic;
    private final String organizerEmail;

    @Builder
    public FirefliesTranscriptRecord(String transcriptId, String title, Long dateMillis, Double duration,
                                     int sentenceCount, boolean hasTranscript, List<String> participants,
                                     List<String> attendeeEmails, List<String> sharedWith, boolean isPublic,
                                     String organizerEmail, String content) {
        super(dateMillis != null ? Instant.ofEpochMilli(dateMillis) : null, content);
        this.transcriptId = transcriptId;
        this.title = title;
        this.dateMillis = dateMillis;
        this.duration = duration;
        this.sentenceCount = sentenceCount;
        this.hasTranscript = hasTranscript;
        this.participants = participants != null ? List.copyOf(participants) : List.of();
        this.attendeeEmails = attendeeEmails != null ? List.copyOf(attendeeEmails) : List.of();
        this.sharedWith = sharedWith != null ? List.copyOf(sharedWith) : List.of();
        this.isPublic = isPublic;
        this.organizerEmail = organizerEmail;
    }

    public boolean hasTranscript() {
        return hasTranscript;
    }

    @Override
    public Source getSource() {
        return Source.FIREFLIES;
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.TRANSCRIPT;
    }

    @Override
    public String getSourceId() {
        return transcriptId;
    }

    @Override
    public <R> R accept(ActivityRecordVisitor<R> visitor) {
        return visitor.visitTranscript(this);
    }
}
