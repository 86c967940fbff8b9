package com.example.ingestionservice.service;

import com.example.ingestionservice.dto.FirefliesTranscriptDto;
import com.example.ingestionservice.dto.JiraIssueDto;
import com.example.ingestionservice.dto.NotionPageDto;
import com.example.ingestionservice.dto.SlackResponse;
import com.example.ingestionservice.dto.TempoWorklogDto;
import com.example.ingestionservice.metrics.IngestionMetrics;
import com.example.ingestionservice.record.FirefliesTranscriptRecord;
import com.example.ingestionservice.record.JiraIssueRecord;
import com.example.ingestionservice.record.NotionPageRecord;
import com.example.ingestionservice.record.SlackMessageRecord;
import com.example.ingestionservice.record.TempoWorklogRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Adapter for converting external API DTOs to activity records.
 * Applies normalization (ADF flattening, Notion rich text, timestamps) so
 * downstream code only sees plain text and {@link Instant}s.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RecordMapper {

    /** Jira Cloud writes offsets without a colon: 2024-11-01T10:15:30.123+0000 */
    private static final DateTimeFormatter JIRA_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");
    private static final String EPIC_TYPE = "Epic";

    private final IngestionMetrics ingestionMetrics;

    public JiraIssueRecord jiraIssueToRecord(JiraIssueDto dto) {
        JiraIssueDto.Fields fields = dto.getFields() != null ? dto.getFields() : new JiraIssueDto.Fields();
        String issueType = fields.getIssueType() != null ? fields.getIssueType().getName() : null;
        JiraIssueDto.Parent parent = fields.getParent();
        String parentKey = parent != null ? parent.getKey() : null;
        String parentSummary = parent != null && parent.getFields() != null ? parent.getFields().getSummary() : null;
        String parentType = parent != null && parent.getFields() != null && parent.getFields().getIssueType() != null
                ? parent.getFields().getIssueType().getName() : null;

        String epicKey = null;
        String epicName = null;
        if (EPIC_TYPE.equalsIgnoreCase(issueType)) {
            epicKey = dto.getKey();
            epicName = fields.getSummary();
        } else if (EPIC_TYPE.equalsIgnoreCase(parentType)) {
            epicKey = parentKey;
            epicName = parentSummary;
        }

        String updated = fields.getUpdated() != null ? fields.getUpdated() : fields.getCreated();

        return JiraIssueRecord.builder()
                .issueId(dto.getId())
                .issueKey(dto.getKey())
                .projectKey(fields.getProject() != null ? fields.getProject().getKey() : null)
                .summary(fields.getSummary())
                .description(flattenAdf(fields.getDescription()))
                .issueType(issueType)
                .status(fields.getStatus() != null ? fields.getStatus().getName() : null)
                .assignee(fields.getAssignee() != null ? fields.getAssignee().getDisplayName() : null)
                .parentKey(parentKey)
                .parentSummary(parentSummary)
                .epicKey(epicKey)
                .epicName(epicName)
                .updated(parseTimestamp(updated, "updated", dto.getKey()))
                .build();
    }

    public TempoWorklogRecord tempoWorklogToRecord(TempoWorklogDto dto) {
        String worklogId = dto.getTempoWorklogId() != null ? String.valueOf(dto.getTempoWorklogId()) : null;
        LocalDate startDate = parseDate(dto.getStartDate(), "startDate", worklogId);
        Instant updated = dto.getUpdatedAt() != null
                ? parseTimestamp(dto.getUpdatedAt(), "updatedAt", worklogId)
                : startDate != null ? startDate.atStartOfDay(ZoneOffset.UTC).toInstant() : null;

        return TempoWorklogRecord.builder()
                .worklogId(worklogId)
                .issueId(dto.getIssue() != null && dto.getIssue().getId() != null
                        ? String.valueOf(dto.getIssue().getId()) : null)
                .description(dto.getDescription())
                .timeSpentSeconds(dto.getTimeSpentSeconds())
                .authorAccountId(dto.getAuthor() != null ? dto.getAuthor().getAccountId() : null)
                .startDate(startDate)
                .updated(updated)
                .build();
    }

    public FirefliesTranscriptRecord firefliesTranscriptToRecord(FirefliesTranscriptDto dto) {
        List<FirefliesTranscriptDto.Sentence> sentences =
                dto.getSentences() != null ? dto.getSentences() : List.of();
        List<String> attendeeEmails = new ArrayList<>();
        if (dto.getMeetingAttendees() != null) {
            for (FirefliesTranscriptDto.Attendee attendee : dto.getMeetingAttendees()) {
                if (attendee.getEmail() != null && !attendee.getEmail().isBlank()) {
                    attendeeEmails.add(attendee.getEmail().trim());
                }
            }
        }
        FirefliesTranscriptDto.SharingSettings sharing = dto.getSharingSettings();

        StringBuilder content = new StringBuilder();
        for (FirefliesTranscriptDto.Sentence sentence : sentences) {
            if (sentence.getText() == null || sentence.getText().isBlank()) {
                continue;
            }
            if (sentence.getSpeakerName() != null) {
                content.append(sentence.getSpeakerName()).append(": ");
            }
            content.append(sentence.getText()).append('\n');
        }

        return FirefliesTranscriptRecord.builder()
                .transcriptId(dto.getId())
                .title(dto.getTitle())
                .dateMillis(dto.getDate())
                .duration(dto.getDuration())
                .sentenceCount(sentences.size())
                .hasTranscript(!sentences.isEmpty())
                .participants(dto.getParticipants())
                .attendeeEmails(attendeeEmails)
                .sharedWith(sharing != null ? sharing.getSharedWith() : List.of())
                .isPublic(sharing != null && sharing.isPublicMeeting())
                .organizerEmail(dto.getOrganizerEmail())
                .content(content.toString().trim())
                .build();
    }

    public NotionPageRecord notionPageToRecord(NotionPageDto dto, String content) {
        return NotionPageRecord.builder()
                .pageId(dto.getId())
                .title(notionTitle(dto))
                .url(dto.getUrl())
                .content(content)
                .lastEdited(parseTimestamp(dto.getLastEditedTime(), "lastEditedTime", dto.getId()))
                .build();
    }

    public SlackMessageRecord slackMessageToRecord(SlackResponse.Channel channel, SlackResponse.Message message) {
        return SlackMessageRecord.builder()
                .channelId(channel.getId())
                .channelName(channel.getName())
                .ts(message.getTs())
                .user(message.getUser())
                .privateChannel(channel.isPrivateChannel())
                .text(message.getText())
                .build();
    }

    /**
     * Plain text of Notion blocks, one line per block that carries rich text.
     */
    @SuppressWarnings("unchecked")
    public String notionBlocksToText(List<Map<String, Object>> blocks) {
        StringBuilder text = new StringBuilder();
        for (Map<String, Object> block : blocks) {
            Object type = block.get("type");
            if (!(type instanceof String typeName) || !(block.get(typeName) instanceof Map<?, ?> body)) {
                continue;
            }
            Object richText = ((Map<String, Object>) body).get("rich_text");
            String line = plainText(richText);
            if (!line.isBlank()) {
                text.append(line).append('\n');
            }
        }
        return text.toString().trim();
    }

    /**
     * Title of a Notion page: the property whose type is "title".
     */
    @SuppressWarnings("unchecked")
    String notionTitle(NotionPageDto dto) {
        if (dto.getProperties() != null) {
            for (Object value : dto.getProperties().values()) {
                if (value instanceof Map<?, ?> property && "title".equals(property.get("type"))) {
                    String title = plainText(((Map<String, Object>) property).get("title"));
                    if (!title.isBlank()) {
                        return title;
                    }
                }
            }
        }
        return "Untitled";
    }

    /**
     * Flatten Atlassian Document Format to plain text. Plain strings (API v2) pass through.
     */
    @SuppressWarnings("unchecked")
    String flattenAdf(Object description) {
        if (description == null) {
            return null;
        }
        if (description instanceof String text) {
            return text;
        }
        StringBuilder out = new StringBuilder();
        appendAdf(description, out);
        String flattened = out.toString().replaceAll("\n{3,}", "\n\n").trim();
        return flattened.isEmpty() ? null : flattened;
    }

    @SuppressWarnings("unchecked")
    private void appendAdf(Object node, StringBuilder out) {
        if (node instanceof List<?> list) {
            for (Object child : list) {
                appendAdf(child, out);
            }
            return;
        }
        if (!(node instanceof Map<?, ?> map)) {
            return;
        }
        Map<String, Object> adf = (Map<String, Object>) map;
        if ("text".equals(adf.get("type")) && adf.get("text") instanceof String text) {
            out.append(text);
        } else if ("hardBreak".equals(adf.get("type"))) {
            out.append('\n');
        }
        appendAdf(adf.get("content"), out);
        Object type = adf.get("type");
        if ("paragraph".equals(type) || "heading".equals(type) || "listItem".equals(type)) {
            out.append('\n');
        }
    }

    @SuppressWarnings("unchecked")
    private String plainText(Object richText) {
        if (!(richText instanceof List<?> parts)) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (Object part : parts) {
            if (part instanceof Map<?, ?> map && map.get("plain_text") instanceof String plain) {
                text.append(plain);
            }
        }
        return text.toString();
    }

    /**
     * Parse an upstream timestamp to an Instant.
     * Accepts ISO-8601 with offset, Jira's offset-without-colon form and offset-less
     * values (taken as UTC). A malformed value falls back to now() with a warning.
     */
    Instant parseTimestamp(String raw, String fieldName, String recordIdentifier) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return OffsetDateTime.parse(raw, JIRA_FORMATTER).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.warn("⚠️ Failed to parse {}. recordId={} rawValue=[{}]. Fallback to now(). Error: {}",
                    fieldName, recordIdentifier, raw, e.getMessage());
            ingestionMetrics.recordParserWarning();
            return Instant.now();
        }
    }

    private LocalDate parseDate(String raw, String fieldName, String recordIdentifier) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            log.warn("⚠️ Failed to parse {}. recordId={} rawValue=[{}]. Error: {}",
                    fieldName, recordIdentifier, raw, e.getMessage());
            ingestionMetrics.recordParserWarning();
            return null;
        }
    }

    public static boolean isUserMessage(SlackResponse.Message message) {
        return message != null
                && Objects.equals("message", message.getType())
                && message.getSubtype() == null
                && message.getText() != null
                && !message.getText().isBlank();
    }
}
