package com.example.ingestionservice.client.external;

import com.example.ingestionservice.dto.NotionListResponse;
import com.example.ingestionservice.dto.NotionPageDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client for the Notion API.
 * 
 * - /v1/search returns pages sorted by last_edited_time, newest first, cursor paged
 * - /v1/blocks/{id}/children returns the page body, cursor paged
 */
@Component
@Slf4j
public class NotionClient {

    public static final String UPSTREAM = "notion";
    public static final String NOTION_VERSION = "2022-06-28";
    public static final int PAGE_SIZE = 100;
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private static final ParameterizedTypeReference<NotionListResponse<NotionPageDto>> PAGE_LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<NotionListResponse<Map<String, Object>>> BLOCK_LIST =
            new ParameterizedTypeReference<>() {};

    private final WebClient notionWebClient;
    private final String apiKey;

    public NotionClient(@Qualifier("notionWebClient") WebClient notionWebClient,
                        @Value("${ingestion.notion.api-key:}") String apiKey) {
        this.notionWebClient = notionWebClient;
        this.apiKey = apiKey;
    }

    public void requireConfigured() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ExternalApiException.SourceNotConfiguredException(UPSTREAM, "ingestion.notion.api-key");
        }
    }

    public NotionListResponse<NotionPageDto> searchPages(String startCursor) {
        requireConfigured();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("filter", Map.of("property", "object", "value", "page"));
        body.put("sort", Map.of("direction", "descending", "timestamp", "last_edited_time"));
        body.put("page_size", PAGE_SIZE);
        if (startCursor != null) {
            body.put("start_cursor", startCursor);
        }

        NotionListResponse<NotionPageDto> response = notionWebClient.post()
                .uri("/v1/search")
                .header("Authorization", "Bearer " + apiKey)
                .header("Notion-Version", NOTION_VERSION)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, r -> UpstreamErrors.map(UPSTREAM, r))
                .bodyToMono(PAGE_LIST)
                .timeout(TIMEOUT)
                .block();
        return response != null ? response : new NotionListResponse<>();
    }

    public NotionListResponse<Map<String, Object>> getBlockChildren(String blockId, String startCursor) {
        requireConfigured();
        NotionListResponse<Map<String, Object>> response = notionWebClient.get()
                .uri(uri -> {
                    uri.path("/v1/blocks/{id}/children").queryParam("page_size", PAGE_SIZE);
                    if (startCursor != null) {
                        uri.queryParam("start_cursor", startCursor);
                    }
                    return uri.build(blockId);
                })
                .header("Authorization", "Bearer " + apiKey)
                .header("Notion-Version", NOTION_VERSION)
                .retrieve()
                .onStatus(HttpStatusCode::isError, r -> UpstreamErrors.map(UPSTREAM, r))
                .bodyToMono(BLOCK_LIST)
                .timeout(TIMEOUT)
                .block();
        return response != null ? response : new NotionListResponse<>();
    }
}
