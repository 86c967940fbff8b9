package com.example.ingestionservice.source;

import com.example.ingestionservice.client.external.SlackClient;
import com.example.ingestionservice.dto.SlackResponse;
import com.example.ingestionservice.metrics.IngestionMetrics;
import com.example.ingestionservice.record.ActivityRecord;
import com.example.ingestionservice.record.SlackMessageRecord;
import com.example.ingestionservice.retry.RetryTestSupport;
import com.example.ingestionservice.service.RecordMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SlackRecordSourceTest {

    private static final FetchWindow WINDOW = FetchWindow.of(
            Instant.parse("2024-11-01T00:00:00Z"), Instant.parse("2024-11-02T00:00:00Z"));

    private SlackClient slackClient;
    private SlackRecordSource source;

    @BeforeEach
    void setUp() {
        slackClient = mock(SlackClient.class);
        IngestionMetrics metrics = new IngestionMetrics(new SimpleMeterRegistry());
        source = new SlackRecordSource(slackClient, new RecordMapper(metrics), RetryTestSupport.noBackoff(metrics, 2));
    }

    @Test
    void testFetch_MemberChannelsOnly_UserMessagesOldestFirst() {
        // GIVEN: two channel pages; C9 is not joined
        when(slackClient.listChannels(isNull())).thenReturn(channels("cursor-2",
                new SlackResponse.Channel("C2", "ops", true, false),
                new SlackResponse.Channel("C9", "random", false, false)));
        when(slackClient.listChannels("cursor-2")).thenReturn(channels(null,
                new SlackResponse.Channel("C1", "eng", true, true)));

        // history is newest first; the join event is dropped
        when(slackClient.history(eq("C1"), anyLong(), anyLong(), isNull())).thenReturn(history(
                message("1730430000.000200", null, "second"),
                message("1730426400.000100", "channel_join", "joined"),
                message("1730422800.000100", null, "first")));
        when(slackClient.history(eq("C2"), anyLong(), anyLong(), isNull())).thenReturn(history(
                message("1730419200.000100", null, "ops note")));

        // WHEN
        List<ActivityRecord> records = source.fetch(WINDOW);

        // THEN: channels in id order, messages ascending within a channel
        assertThat(records).extracting(record -> record.getBody())
                .containsExactly("first", "second", "ops note");
        assertThat(((SlackMessageRecord) records.get(0)).isPrivateChannel()).isTrue();
        verify(slackClient, never()).history(eq("C9"), anyLong(), anyLong(), isNull());
    }

    @Test
    void testFetch_HistoryBoundsCoverWholeWindow() {
        when(slackClient.listChannels(isNull())).thenReturn(channels(null,
                new SlackResponse.Channel("C1", "eng", true, false)));
        when(slackClient.history(eq("C1"), anyLong(), anyLong(), isNull())).thenReturn(history());

        source.fetch(WINDOW);

        // latest is exclusive upstream, so one second past the window end
        verify(slackClient).history("C1", 1730419200L, 1730505601L, null);
    }

    private static SlackResponse channels(String nextCursor, SlackResponse.Channel... channels) {
        SlackResponse response = new SlackResponse();
        response.setOk(true);
        response.setChannels(List.of(channels));
        if (nextCursor != null) {
            response.setResponseMetadata(new SlackResponse.ResponseMetadata(nextCursor));
        }
        return response;
    }

    private static SlackResponse history(SlackResponse.Message... messages) {
        SlackResponse response = new SlackResponse();
        response.setOk(true);
        response.setMessages(List.of(messages));
        response.setHasMore(false);
        return response;
    }

    private static SlackResponse.Message message(String ts, String subtype, String text) {
        return new SlackResponse.Message("message", subtype, ts, "U123", text);
    }
}
