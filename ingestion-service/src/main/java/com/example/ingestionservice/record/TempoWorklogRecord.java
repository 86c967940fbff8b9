package com.example.ingestionservice.record;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Tempo worklog. Tempo only knows the numeric Jira issue id; the issue key
 * comes either from the description text or from a Jira lookup.
 */
@Getter
public class TempoWorklogRecord extends ActivityRecord {

    private final String worklogId;
    private final String issueId;
    private final String description;
    private final long timeSpentSeconds;
    private final String authorAccountId;
    private final LocalDate startDate;

    @Builder
    public TempoWorklogRecord(String worklogId, String issueId, String description, long timeSpentSeconds,
                              String authorAccountId, LocalDate startDate, Instant updated) {
        super(updated, description);
        this.worklogId = worklogId;
        this.issueId = issueId;
        this.description = description;
        this.timeSpentSeconds = timeSpentSeconds;
        this.authorAccountId = authorAccountId;
        this.startDate = startDate;
    }

    public double getHours() {
        return timeSpentSeconds / 3600.0;
    }

    @Override
    public Source getSource() {
        return Source.TEMPO;
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.WORKLOG;
    }

    @Override
    public String getSourceId() {
        return worklogId;
    }

    @Override
    public <R> R accept(ActivityRecordVisitor<R> visitor) {
        return visitor.visitWorklog(this);
    }
}
