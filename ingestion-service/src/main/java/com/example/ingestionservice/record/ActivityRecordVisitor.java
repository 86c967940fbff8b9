package com.example.ingestionservice.record;

public interface ActivityRecordVisitor<R> {

    R visitIssue(JiraIssueRecord issue);

    R visitWorklog(TempoWorklogRecord worklog);

    R visitTranscript(FirefliesTranscriptRecord transcript);

    R visitPage(NotionPageRecord page);

    R visitMessage(SlackMessageRecord message);
}
