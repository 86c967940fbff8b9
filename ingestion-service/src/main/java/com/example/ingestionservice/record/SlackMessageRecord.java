package com.example.ingestionservice.record;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Slack message. Slack identifies a message by channel + ts, where ts is a
 * "seconds.micros" string.
 */
@Getter
public class SlackMessageRecord extends ActivityRecord {

    private final String channelId;
    private final String channelName;
    private final String ts;
    private final String user;
    private final boolean privateChannel;

    @Builder
    public SlackMessageRecord(String channelId, String channelName, String ts, String user,
                              boolean privateChannel, String text) {
        super(parseTs(ts), text);
        this.channelId = channelId;
        this.channelName = channelName;
        this.ts = ts;
        this.user = user;
        this.privateChannel = privateChannel;
    }

    @Override
    public Source getSource() {
        return Source.SLACK;
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.MESSAGE;
    }

    @Override
    public String getSourceId() {
        return channelId + "-" + ts;
    }

    @Override
    public <R> R accept(ActivityRecordVisitor<R> visitor) {
        return visitor.visitMessage(this);
    }

    private static Instant parseTs(String ts) {
        if (ts == null || ts.isBlank()) {
            return null;
        }
        try {
            long micros = new BigDecimal(ts).movePointRight(6).longValue();
            return Instant.ofEpochSecond(micros / 1_000_000, (micros % 1_000_000) * 1000);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
