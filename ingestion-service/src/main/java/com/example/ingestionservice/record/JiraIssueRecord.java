package com.example.ingestionservice.record;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
public class JiraIssueRecord extends ActivityRecord {

    private final String issueId;
    private final String issueKey;
    private final String projectKey;
    private final String summary;
    private final String description;
    private final String issueType;
    private final String status;
    private final String assignee;
    private final String parentKey;
    private final String parentSummary;
    private final String epicKey;
    private final String epicName;

    @Builder
    public JiraIssueRecord(String issueId, String issueKey, String projectKey, String summary,
                           String description, String issueType, String status, String assignee,
                           String parentKey, String parentSummary, String epicKey, String epicName,
                           Instant updated) {
        super(updated, description);
        this.issueId = issueId;
        this.issueKey = issueKey;
        this.projectKey = projectKey;
        this.summary = summary;
        this.description = description;
        this.issueType = issueType;
        this.status = status;
        this.assignee = assignee;
        this.parentKey = parentKey;
        this.parentSummary = parentSummary;
        this.epicKey = epicKey;
        this.epicName = epicName;
    }

    @Override
    public Source getSource() {
        return Source.JIRA;
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.ISSUE;
    }

    @Override
    public String getSourceId() {
        return issueId;
    }

    @Override
    public <R> R accept(ActivityRecordVisitor<R> visitor) {
        return visitor.visitIssue(this);
    }
}
