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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Upstream JSON → record mapping, using payloads shaped like the real APIs.
 */
class RecordMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry meterRegistry;
    private RecordMapper mapper;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        mapper = new RecordMapper(new IngestionMetrics(meterRegistry));
    }

    @Test
    void testJiraIssueToRecord_AdfDescriptionAndEpicParent() throws Exception {
        // GIVEN
        JiraIssueDto dto = objectMapper.readValue("""
                {
                  "id": "10001",
                  "key": "SUBS-482",
                  "fields": {
                    "summary": "Login redirect loop",
                    "description": {
                      "type": "doc",
                      "content": [
                        {"type": "paragraph", "content": [{"type": "text", "text": "Users bounce"}, {"type": "text", "text": " back."}]},
                        {"type": "paragraph", "content": [{"type": "text", "text": "Only on Safari."}]}
                      ]
                    },
                    "issuetype": {"name": "Bug"},
                    "status": {"name": "In Progress"},
                    "assignee": {"accountId": "acc-1", "displayName": "Ada Lovelace"},
                    "project": {"key": "SUBS"},
                    "parent": {"key": "SUBS-100", "fields": {"summary": "Auth revamp", "issuetype": {"name": "Epic"}}},
                    "updated": "2024-11-01T10:15:30.123+0000"
                  }
                }
                """, JiraIssueDto.class);

        // WHEN
        JiraIssueRecord record = mapper.jiraIssueToRecord(dto);

        // THEN
        assertThat(record.getIssueKey()).isEqualTo("SUBS-482");
        assertThat(record.getDescription()).isEqualTo("Users bounce back.\nOnly on Safari.");
        assertThat(record.getEpicKey()).isEqualTo("SUBS-100");
        assertThat(record.getEpicName()).isEqualTo("Auth revamp");
        assertThat(record.getAssignee()).isEqualTo("Ada Lovelace");
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2024-11-01T10:15:30.123Z"));
    }

    @Test
    void testJiraIssueToRecord_EpicIsItsOwnEpic() throws Exception {
        JiraIssueDto dto = objectMapper.readValue("""
                {"id": "1", "key": "SUBS-100", "fields": {"summary": "Auth revamp", "issuetype": {"name": "Epic"},
                 "updated": "2024-11-01T10:15:30+00:00"}}
                """, JiraIssueDto.class);

        JiraIssueRecord record = mapper.jiraIssueToRecord(dto);

        assertThat(record.getEpicKey()).isEqualTo("SUBS-100");
        assertThat(record.getEpicName()).isEqualTo("Auth revamp");
    }

    @Test
    void testJiraIssueToRecord_NonEpicParent_NoEpic() throws Exception {
        JiraIssueDto dto = objectMapper.readValue("""
                {"id": "2", "key": "SUBS-2", "fields": {"summary": "Subtask", "description": "plain v2 text",
                 "parent": {"key": "SUBS-1", "fields": {"summary": "Story", "issuetype": {"name": "Story"}}}}}
                """, JiraIssueDto.class);

        JiraIssueRecord record = mapper.jiraIssueToRecord(dto);

        assertThat(record.getEpicKey()).isNull();
        assertThat(record.getParentKey()).isEqualTo("SUBS-1");
        assertThat(record.getDescription()).isEqualTo("plain v2 text");
    }

    @Test
    void testTempoWorklogToRecord() throws Exception {
        TempoWorklogDto dto = objectMapper.readValue("""
                {"tempoWorklogId": 555, "issue": {"id": 10001}, "description": "2024-11-01 standup",
                 "timeSpentSeconds": 5400, "author": {"accountId": "acc-1"},
                 "startDate": "2024-11-01", "updatedAt": "2024-11-01T18:00:00Z"}
                """, TempoWorklogDto.class);

        TempoWorklogRecord record = mapper.tempoWorklogToRecord(dto);

        assertThat(record.getWorklogId()).isEqualTo("555");
        assertThat(record.getIssueId()).isEqualTo("10001");
        assertThat(record.getHours()).isEqualTo(1.5);
        assertThat(record.getStartDate()).isEqualTo(LocalDate.of(2024, 11, 1));
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2024-11-01T18:00:00Z"));
    }

    @Test
    void testTempoWorklogToRecord_NoUpdatedAt_FallsBackToStartDate() throws Exception {
        TempoWorklogDto dto = objectMapper.readValue("""
                {"tempoWorklogId": 556, "timeSpentSeconds": 60, "startDate": "2024-11-02"}
                """, TempoWorklogDto.class);

        assertThat(mapper.tempoWorklogToRecord(dto).getTimestamp()).isEqualTo(Instant.parse("2024-11-02T00:00:00Z"));
    }

    @Test
    void testFirefliesTranscriptToRecord_SpeakerLinesAndSharing() throws Exception {
        FirefliesTranscriptDto dto = objectMapper.readValue("""
                {"id": "tr-1", "title": "Pricing review", "date": 1730455200000, "duration": 42.5,
                 "participants": ["ana@acme.io", "ben@acme.io"],
                 "organizer_email": "ana@acme.io",
                 "meeting_attendees": [{"email": " ben@acme.io "}, {"email": ""}],
                 "sentences": [
                   {"text": "Numbers look good.", "speaker_name": "Ana"},
                   {"text": "  "},
                   {"text": "Agreed.", "speaker_name": "Ben"}
                 ],
                 "sharing_settings": {"shared_with": ["cfo@acme.io"], "is_public": false}}
                """, FirefliesTranscriptDto.class);

        FirefliesTranscriptRecord record = mapper.firefliesTranscriptToRecord(dto);

        assertThat(record.getBody()).isEqualTo("Ana: Numbers look good.\nBen: Agreed.");
        assertThat(record.getSentenceCount()).isEqualTo(3);
        assertThat(record.hasTranscript()).isTrue();
        assertThat(record.getAttendeeEmails()).containsExactly("ben@acme.io");
        assertThat(record.getSharedWith()).containsExactly("cfo@acme.io");
        assertThat(record.isPublic()).isFalse();
        assertThat(record.getTimestamp()).isEqualTo(Instant.ofEpochMilli(1_730_455_200_000L));
    }

    @Test
    void testNotionPageToRecord_TitleFromTitleProperty() throws Exception {
        NotionPageDto dto = objectMapper.readValue("""
                {"id": "page-1", "url": "https://notion.so/page-1", "last_edited_time": "2024-11-01T09:30:00.000Z",
                 "properties": {
                   "Status": {"type": "select"},
                   "Name": {"type": "title", "title": [{"plain_text": "Release "}, {"plain_text": "plan"}]}
                 }}
                """, NotionPageDto.class);

        NotionPageRecord record = mapper.notionPageToRecord(dto, "body text");

        assertThat(record.getTitle()).isEqualTo("Release plan");
        assertThat(record.getBody()).isEqualTo("body text");
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2024-11-01T09:30:00Z"));
    }

    @Test
    void testNotionTitle_NoTitleProperty_Untitled() {
        assertThat(mapper.notionTitle(new NotionPageDto())).isEqualTo("Untitled");
    }

    @Test
    void testNotionBlocksToText_OneLinePerTextBlock() throws Exception {
        List<Map<String, Object>> blocks = objectMapper.readValue("""
                [
                  {"type": "heading_1", "heading_1": {"rich_text": [{"plain_text": "Goals"}]}},
                  {"type": "divider", "divider": {}},
                  {"type": "paragraph", "paragraph": {"rich_text": [{"plain_text": "Ship "}, {"plain_text": "v2"}]}}
                ]
                """, new TypeReference<List<Map<String, Object>>>() { });

        assertThat(mapper.notionBlocksToText(blocks)).isEqualTo("Goals\nShip v2");
    }

    @Test
    void testSlackMessageToRecord_AndUserMessageFilter() throws Exception {
        SlackResponse.Channel channel = objectMapper.readValue("""
                {"id": "C1", "name": "eng", "is_member": true, "is_private": true}
                """, SlackResponse.Channel.class);
        SlackResponse.Message message = objectMapper.readValue("""
                {"type": "message", "ts": "1730455200.000100", "user": "U1", "text": "deploy done"}
                """, SlackResponse.Message.class);
        SlackResponse.Message join = objectMapper.readValue("""
                {"type": "message", "subtype": "channel_join", "ts": "1730455201.000100", "text": "joined"}
                """, SlackResponse.Message.class);

        SlackMessageRecord record = mapper.slackMessageToRecord(channel, message);

        assertThat(record.getSourceId()).isEqualTo("C1-1730455200.000100");
        assertThat(record.isPrivateChannel()).isTrue();
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2024-11-01T10:00:00.000100Z"));
        assertThat(RecordMapper.isUserMessage(message)).isTrue();
        assertThat(RecordMapper.isUserMessage(join)).isFalse();
    }

    @Test
    void testParseTimestamp_Formats() {
        assertThat(mapper.parseTimestamp("2024-11-01T10:15:30+02:00", "f", "id"))
                .isEqualTo(Instant.parse("2024-11-01T08:15:30Z"));
        assertThat(mapper.parseTimestamp("2024-11-01T10:15:30.000-0500", "f", "id"))
                .isEqualTo(Instant.parse("2024-11-01T15:15:30Z"));
        assertThat(mapper.parseTimestamp("2024-11-01T10:15:30", "f", "id"))
                .isEqualTo(Instant.parse("2024-11-01T10:15:30Z"));
        assertThat(mapper.parseTimestamp(null, "f", "id")).isNull();
    }

    @Test
    void testParseTimestamp_Malformed_FallsBackToNowAndCountsWarning() {
        Instant before = Instant.now();

        Instant parsed = mapper.parseTimestamp("yesterday-ish", "updated", "SUBS-1");

        assertThat(parsed).isBetween(before, Instant.now().plus(Duration.ofSeconds(1)));
        assertThat(meterRegistry.get("parser_warning_count").counter().count()).isEqualTo(1.0);
    }
}
