package com.example.ingestionservice.vector;

import com.example.ingestionservice.record.ActivityRecord;
import com.example.ingestionservice.record.ActivityRecordVisitor;
import com.example.ingestionservice.record.FirefliesTranscriptRecord;
import com.example.ingestionservice.record.JiraIssueRecord;
import com.example.ingestionservice.record.NotionPageRecord;
import com.example.ingestionservice.record.SlackMessageRecord;
import com.example.ingestionservice.record.TempoWorklogRecord;
import com.example.ingestionservice.resolver.IssueKeyExtractor;
import com.example.ingestionservice.resolver.ResolvedRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Builds the stored document (id, title, content, metadata) for each record kind.
 * 
 * Natural keys:
 * - jira: issue key → "jira-SUBS-482"
 * - tempo: worklog id → "tempo-123456" (issue key goes to metadata)
 * - fireflies: transcript id
 * - notion: page id
 * - slack: channel id + ts
 * 
 * Access control: transcripts carry access_type public|shared and access_list =
 * attendees ∪ shared_with, exactly as reported. Every other source is access_type=all
 * with no access_list.
 */
@Component
public class VectorDocumentFactory {

    public static final String ACCESS_TYPE = "access_type";
    public static final String ACCESS_LIST = "access_list";
    public static final String ACCESS_ALL = "all";
    public static final String ACCESS_PUBLIC = "public";
    public static final String ACCESS_SHARED = "shared";
    public static final String TIMESTAMP_EPOCH = "timestamp_epoch";

    static final int MAX_TITLE_METADATA = 500;
    static final int MAX_CONTENT_PREVIEW = 1000;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final String jiraBaseUrl;

    public VectorDocumentFactory(@Value("${ingestion.jira.base-url:https://example.atlassian.net}") String jiraBaseUrl) {
        this.jiraBaseUrl = jiraBaseUrl.replaceAll("/+$", "");
    }

    public VectorDocument create(ResolvedRecord resolved) {
        if (!resolved.getIdentity().isResolved()) {
            throw new IllegalArgumentException("Cannot build a document for an unresolved record");
        }
        ActivityRecord record = resolved.getRecord();
        DocumentParts parts = record.accept(new PartsVisitor(resolved));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", record.getSource().key());
        metadata.put("title", truncate(parts.title, MAX_TITLE_METADATA));
        metadata.put("content_preview", truncate(parts.content, MAX_CONTENT_PREVIEW));
        Instant timestamp = record.getTimestamp();
        if (timestamp != null) {
            metadata.put("timestamp", timestamp.toString());
            metadata.put(TIMESTAMP_EPOCH, timestamp.getEpochSecond());
            metadata.put("date", DATE.format(timestamp));
        }
        metadata.putAll(parts.metadata);

        return VectorDocument.builder()
                .id(VectorDocument.idFor(record.getSource().key(), parts.naturalKey))
                .source(record.getSource().key())
                .title(parts.title)
                .content(parts.content)
                .metadata(metadata)
                .build();
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static class DocumentParts {
        private String naturalKey;
        private String title;
        private String content;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
    }

    private class PartsVisitor implements ActivityRecordVisitor<DocumentParts> {

        private final ResolvedRecord resolved;

        PartsVisitor(ResolvedRecord resolved) {
            this.resolved = resolved;
        }

        @Override
        public DocumentParts visitIssue(JiraIssueRecord issue) {
            String key = resolved.getIdentity().getResolvedKey();
            DocumentParts parts = new DocumentParts();
            parts.naturalKey = key;
            parts.title = key + ": " + nullToEmpty(issue.getSummary());

            StringBuilder content = new StringBuilder(nullToEmpty(issue.getSummary()))
                    .append("\n\n").append(nullToEmpty(issue.getDescription()));
            if (issue.getParentKey() != null && issue.getParentSummary() != null) {
                content.append("\n\nParent Issue: ").append(issue.getParentKey())
                        .append(" - ").append(issue.getParentSummary());
            }
            if (issue.getEpicKey() != null && issue.getEpicName() != null) {
                content.append("\n\nEpic: ").append(issue.getEpicKey()).append(" - ").append(issue.getEpicName());
            }
            parts.content = content.toString();

            parts.metadata.put("issue_key", key);
            parts.metadata.put("project_key", issue.getProjectKey() != null
                    ? issue.getProjectKey() : IssueKeyExtractor.projectOf(key));
            parts.metadata.put("issue_type", issue.getIssueType() != null ? issue.getIssueType() : "Unknown");
            parts.metadata.put("status", issue.getStatus() != null ? issue.getStatus() : "Unknown");
            parts.metadata.put("assignee", issue.getAssignee() != null ? issue.getAssignee() : "Unassigned");
            if (issue.getEpicKey() != null) {
                parts.metadata.put("epic_key", issue.getEpicKey());
            }
            parts.metadata.put("url", jiraBaseUrl + "/browse/" + key);
            parts.metadata.put(ACCESS_TYPE, ACCESS_ALL);
            return parts;
        }

        @Override
        public DocumentParts visitWorklog(TempoWorklogRecord worklog) {
            String issueKey = resolved.getIdentity().getResolvedKey();
            String author = resolved.attribute(ResolvedRecord.AUTHOR_NAME);
            DocumentParts parts = new DocumentParts();
            parts.naturalKey = worklog.getWorklogId();
            parts.title = issueKey + " worklog" + (author != null ? " by " + author : "");
            parts.content = String.format("%s logged %.2fh on %s (%s)%n%n%s",
                    author != null ? author : nullToEmpty(worklog.getAuthorAccountId()),
                    worklog.getHours(),
                    issueKey,
                    worklog.getStartDate(),
                    nullToEmpty(worklog.getDescription()));

            parts.metadata.put("worklog_id", worklog.getWorklogId());
            parts.metadata.put("issue_key", issueKey);
            parts.metadata.put("project_key", IssueKeyExtractor.projectOf(issueKey));
            parts.metadata.put("hours", worklog.getHours());
            parts.metadata.put("author_account_id", nullToEmpty(worklog.getAuthorAccountId()));
            if (author != null) {
                parts.metadata.put("author_name", author);
            }
            if (resolved.attribute(ResolvedRecord.EPIC_KEY) != null) {
                parts.metadata.put("epic_key", resolved.attribute(ResolvedRecord.EPIC_KEY));
            }
            if (resolved.attribute(ResolvedRecord.TEAM) != null) {
                parts.metadata.put("team", resolved.attribute(ResolvedRecord.TEAM));
            }
            parts.metadata.put("resolution_path", resolved.getIdentity().getResolutionPath().name().toLowerCase(Locale.ROOT));
            parts.metadata.put(ACCESS_TYPE, ACCESS_ALL);
            return parts;
        }

        @Override
        public DocumentParts visitTranscript(FirefliesTranscriptRecord transcript) {
            String title = transcript.getTitle() != null ? transcript.getTitle() : "Untitled Meeting";
            DocumentParts parts = new DocumentParts();
            parts.naturalKey = resolved.getIdentity().getResolvedKey();
            parts.title = title;
            parts.content = title + "\n\n" + nullToEmpty(transcript.getBody());

            TreeSet<String> accessList = new TreeSet<>();
            addEmails(accessList, transcript.getAttendeeEmails());
            addEmails(accessList, transcript.getSharedWith());

            parts.metadata.put("meeting_id", transcript.getTranscriptId());
            parts.metadata.put("attendees", new ArrayList<>(transcript.getParticipants()));
            parts.metadata.put("attendee_emails", new ArrayList<>(transcript.getAttendeeEmails()));
            parts.metadata.put("duration", transcript.getDuration() != null ? transcript.getDuration() : 0.0);
            parts.metadata.put(ACCESS_TYPE, transcript.isPublic() ? ACCESS_PUBLIC : ACCESS_SHARED);
            parts.metadata.put(ACCESS_LIST, new ArrayList<>(accessList));
            parts.metadata.put("shared_with", new ArrayList<>(transcript.getSharedWith()));
            parts.metadata.put("is_public", transcript.isPublic());
            return parts;
        }

        @Override
        public DocumentParts visitPage(NotionPageRecord page) {
            DocumentParts parts = new DocumentParts();
            parts.naturalKey = resolved.getIdentity().getResolvedKey();
            parts.title = page.getTitle() != null ? page.getTitle() : "Untitled";
            parts.content = nullToEmpty(page.getBody());
            parts.metadata.put("page_id", page.getPageId());
            parts.metadata.put("url", nullToEmpty(page.getUrl()));
            parts.metadata.put(ACCESS_TYPE, ACCESS_ALL);
            return parts;
        }

        @Override
        public DocumentParts visitMessage(SlackMessageRecord message) {
            DocumentParts parts = new DocumentParts();
            parts.naturalKey = resolved.getIdentity().getResolvedKey();
            parts.title = "#" + nullToEmpty(message.getChannelName());
            parts.content = nullToEmpty(message.getBody());
            parts.metadata.put("channel_id", message.getChannelId());
            parts.metadata.put("channel_name", nullToEmpty(message.getChannelName()));
            parts.metadata.put("is_private", message.isPrivateChannel());
            parts.metadata.put("user_id", message.getUser() != null ? message.getUser() : "unknown");
            parts.metadata.put(ACCESS_TYPE, ACCESS_ALL);
            return parts;
        }

        private void addEmails(TreeSet<String> target, List<String> emails) {
            for (String email : emails) {
                if (email != null && !email.isBlank()) {
                    target.add(email);
                }
            }
        }
    }
}
