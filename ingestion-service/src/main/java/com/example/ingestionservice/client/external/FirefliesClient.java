package com.example.ingestionservice.client.external;

import com.example.ingestionservice.dto.FirefliesResponse;
import com.example.ingestionservice.dto.FirefliesTranscriptDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Client for the Fireflies GraphQL API.
 * 
 * GraphQL errors come back as HTTP 200 with an "errors" array; they are raised
 * as {@link ExternalApiException} without a status (not retried), except the
 * rate-limit code which maps to 429.
 */
@Component
@Slf4j
public class FirefliesClient {

    public static final String UPSTREAM = "fireflies";
    public static final int PAGE_SIZE = 50; // Fireflies API max per request
    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    static final String TRANSCRIPTS_QUERY = """
            query Transcripts($fromDate: DateTime, $toDate: DateTime, $limit: Int, $skip: Int) {
              transcripts(fromDate: $fromDate, toDate: $toDate, limit: $limit, skip: $skip) {
                id
                title
                date
                duration
                participants
                organizer_email
                meeting_attendees { email name }
                sentences { text speaker_name }
              }
            }
            """;

    private final WebClient firefliesWebClient;
    private final String apiKey;

    public FirefliesClient(@Qualifier("firefliesWebClient") WebClient firefliesWebClient,
                           @Value("${ingestion.fireflies.api-key:}") String apiKey) {
        this.firefliesWebClient = firefliesWebClient;
        this.apiKey = apiKey;
    }

    public void requireConfigured() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ExternalApiException.SourceNotConfiguredException(UPSTREAM, "ingestion.fireflies.api-key");
        }
    }

    /**
     * One page of transcripts dated within [from, to).
     */
    public List<FirefliesTranscriptDto> fetchTranscripts(Instant from, Instant to, int skip) {
        requireConfigured();
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("fromDate", from.toString());
        variables.put("toDate", to.toString());
        variables.put("limit", PAGE_SIZE);
        variables.put("skip", skip);

        FirefliesResponse response = firefliesWebClient.post()
                .uri("/graphql")
                .header("Authorization", "Bearer " + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", TRANSCRIPTS_QUERY, "variables", variables))
                .retrieve()
                .onStatus(HttpStatusCode::isError, r -> UpstreamErrors.map(UPSTREAM, r))
                .bodyToMono(FirefliesResponse.class)
                .timeout(TIMEOUT)
                .block();

        if (response == null) {
            return List.of();
        }
        if (response.getErrors() != null && !response.getErrors().isEmpty()) {
            boolean rateLimited = response.getErrors().stream()
                    .anyMatch(error -> "too_many_requests".equalsIgnoreCase(error.getCode()));
            if (rateLimited) {
                throw new ExternalApiException.RateLimitExceededException(UPSTREAM);
            }
            String message = response.getErrors().stream()
                    .map(FirefliesResponse.Error::getMessage)
                    .collect(Collectors.joining("; "));
            throw new ExternalApiException(UPSTREAM, null, "Fireflies GraphQL error: " + message);
        }
        if (response.getPayload() == null || response.getPayload().getTranscripts() == null) {
            return List.of();
        }
        log.debug("Fetched {} Fireflies transcripts (skip={})", response.getPayload().getTranscripts().size(), skip);
        return response.getPayload().getTranscripts();
    }
}
