package com.example.ingestionservice.record;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
public class NotionPageRecord extends ActivityRecord {

    private final String pageId;
    private final String title;
    private final String url;

    @Builder
    public NotionPageRecord(String pageId, String title, String url, String content, Instant lastEdited) {
        super(lastEdited, content);
        this.pageId = pageId;
        this.title = title;
        this.url = url;
    }

    @Override
    public Source getSource() {
        return Source.NOTION;
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.PAGE;
    }

    @Override
    public String getSourceId() {
        return pageId;
    }

    @Override
    public <R> R accept(ActivityRecordVisitor<R> visitor) {
        return visitor.visitPage(this);
    }
}
