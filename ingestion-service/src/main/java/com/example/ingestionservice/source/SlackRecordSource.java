package com.example.ingestionservice.source;

import com.example.ingestionservice.client.external.SlackClient;
import com.example.ingestionservice.dto.SlackResponse;
import com.example.ingestionservice.record.ActivityRecord;
import com.example.ingestionservice.record.Source;
import com.example.ingestionservice.retry.RetryEnvelope;
import com.example.ingestionservice.service.RecordMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Messages of every channel the bot is a member of. Joins, edits and other
 * subtyped events are not activity and are dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlackRecordSource implements RecordSource {

    private final SlackClient slackClient;
    private final RecordMapper recordMapper;
    private final RetryEnvelope retryEnvelope;

    @Override
    public Source source() {
        return Source.SLACK;
    }

    @Override
    public List<ActivityRecord> fetch(FetchWindow window) {
        slackClient.requireConfigured();

        List<SlackResponse.Channel> channels = listMemberChannels();
        channels.sort(Comparator.comparing(SlackResponse.Channel::getId));

        long oldest = window.getFrom().getEpochSecond();
        long latest = window.getTo().getEpochSecond() + 1;
        List<ActivityRecord> records = new ArrayList<>();
        for (SlackResponse.Channel channel : channels) {
            List<ActivityRecord> channelRecords = new ArrayList<>();
            String cursor = null;
            do {
                String pageCursor = cursor;
                SlackResponse page = retryEnvelope.execute("slack.history",
                        () -> slackClient.history(channel.getId(), oldest, latest, pageCursor));
                for (SlackResponse.Message message : page.getMessages()) {
                    if (RecordMapper.isUserMessage(message)) {
                        channelRecords.add(recordMapper.slackMessageToRecord(channel, message));
                    }
                }
                cursor = page.isHasMore() ? page.nextCursor() : null;
            } while (cursor != null);

            // history is newest first
            channelRecords.sort(Comparator.comparing(ActivityRecord::getTimestamp,
                    Comparator.nullsFirst(Comparator.naturalOrder())));
            records.addAll(channelRecords);
        }

        log.info("Fetched {} Slack messages from {} channels for window {}",
                records.size(), channels.size(), window);
        return records;
    }

    private List<SlackResponse.Channel> listMemberChannels() {
        List<SlackResponse.Channel> channels = new ArrayList<>();
        String cursor = null;
        do {
            String pageCursor = cursor;
            SlackResponse page = retryEnvelope.execute("slack.channels", () -> slackClient.listChannels(pageCursor));
            for (SlackResponse.Channel channel : page.getChannels()) {
                if (channel.isMember()) {
                    channels.add(channel);
                }
            }
            cursor = page.nextCursor();
        } while (cursor != null);
        return channels;
    }
}
