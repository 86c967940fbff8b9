package com.example.ingestionservice.source;

import com.example.ingestionservice.client.external.ExternalApiException;
import com.example.ingestionservice.client.external.NotionClient;
import com.example.ingestionservice.dto.NotionListResponse;
import com.example.ingestionservice.dto.NotionPageDto;
import com.example.ingestionservice.record.ActivityRecord;
import com.example.ingestionservice.record.Source;
import com.example.ingestionservice.retry.RetryEnvelope;
import com.example.ingestionservice.service.RecordMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Notion search has no date filter: pages come newest-edited first and paging
 * stops at the first page edited before the window.
 * 
 * Page body fetch failures degrade to a title-only record with a warning.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotionRecordSource implements RecordSource {

    private final NotionClient notionClient;
    private final RecordMapper recordMapper;
    private final RetryEnvelope retryEnvelope;

    @Override
    public Source source() {
        return Source.NOTION;
    }

    @Override
    public List<ActivityRecord> fetch(FetchWindow window) {
        notionClient.requireConfigured();

        List<NotionPageDto> inWindow = new ArrayList<>();
        String cursor = null;
        boolean reachedOlder = false;
        do {
            String startCursor = cursor;
            NotionListResponse<NotionPageDto> page = retryEnvelope.execute("notion.search",
                    () -> notionClient.searchPages(startCursor));
            for (NotionPageDto dto : page.getResults()) {
                Instant lastEdited = lastEdited(dto);
                if (lastEdited == null) {
                    continue;
                }
                if (lastEdited.isBefore(window.getFrom())) {
                    reachedOlder = true;
                    break;
                }
                if (window.contains(lastEdited)) {
                    inWindow.add(dto);
                }
            }
            cursor = page.isHasMore() ? page.getNextCursor() : null;
        } while (cursor != null && !reachedOlder);

        // oldest first, matching the other sources
        List<ActivityRecord> records = new ArrayList<>(inWindow.size());
        for (int i = inWindow.size() - 1; i >= 0; i--) {
            NotionPageDto dto = inWindow.get(i);
            records.add(recordMapper.notionPageToRecord(dto, pageContent(dto.getId())));
        }

        log.info("Fetched {} Notion pages for window {}", records.size(), window);
        return records;
    }

    private String pageContent(String pageId) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        try {
            String cursor = null;
            do {
                String startCursor = cursor;
                NotionListResponse<Map<String, Object>> page = retryEnvelope.execute("notion.blocks",
                        () -> notionClient.getBlockChildren(pageId, startCursor));
                blocks.addAll(page.getResults());
                cursor = page.isHasMore() ? page.getNextCursor() : null;
            } while (cursor != null);
        } catch (ExternalApiException.AuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not fetch content of Notion page id={}, indexing title only: {}",
                    pageId, e.getMessage());
        }
        return recordMapper.notionBlocksToText(blocks);
    }

    private static Instant lastEdited(NotionPageDto dto) {
        if (dto.getLastEditedTime() == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(dto.getLastEditedTime()).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("⚠️ Skipping Notion page id={} with unparseable last_edited_time=[{}]",
                    dto.getId(), dto.getLastEditedTime());
            return null;
        }
    }
}
