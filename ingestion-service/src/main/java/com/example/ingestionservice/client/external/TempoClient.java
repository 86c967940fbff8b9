package com.example.ingestionservice.client.external;

import com.example.ingestionservice.dto.TempoPage;
import com.example.ingestionservice.dto.TempoTeamMembershipDto;
import com.example.ingestionservice.dto.TempoWorklogDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Client for Tempo API v4.
 * 
 * CRITICAL DESIGN:
 * - Worklogs are paged by metadata.next (absolute URL), limit 5000 per page
 * - Worklogs reference Jira issues by numeric id only
 * - NO retry here: callers wrap each page in RetryEnvelope
 */
@Component
@Slf4j
public class TempoClient {

    public static final String UPSTREAM = "tempo";
    public static final int PAGE_LIMIT = 5000;
    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    private static final ParameterizedTypeReference<TempoPage<TempoWorklogDto>> WORKLOG_PAGE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<TempoPage<TempoTeamMembershipDto>> MEMBERSHIP_PAGE =
            new ParameterizedTypeReference<>() {};

    private final WebClient tempoWebClient;
    private final String apiToken;

    public TempoClient(@Qualifier("tempoWebClient") WebClient tempoWebClient,
                       @Value("${ingestion.tempo.api-token:}") String apiToken) {
        this.tempoWebClient = tempoWebClient;
        this.apiToken = apiToken;
    }

    public void requireConfigured() {
        if (apiToken == null || apiToken.isBlank()) {
            throw new ExternalApiException.SourceNotConfiguredException(UPSTREAM, "ingestion.tempo.api-token");
        }
    }

    /**
     * First page of worklogs in [from, to] (inclusive dates).
     */
    public TempoPage<TempoWorklogDto> fetchWorklogs(LocalDate from, LocalDate to) {
        requireConfigured();
        log.debug("Fetching Tempo worklogs from={} to={}", from, to);
        TempoPage<TempoWorklogDto> page = tempoWebClient.get()
                .uri(uri -> uri.path("/4/worklogs")
                        .queryParam("from", from)
                        .queryParam("to", to)
                        .queryParam("limit", PAGE_LIMIT)
                        .build())
                .header("Authorization", "Bearer " + apiToken)
                .header("Accept", "application/json")
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> UpstreamErrors.map(UPSTREAM, response))
                .bodyToMono(WORKLOG_PAGE)
                .timeout(TIMEOUT)
                .block();
        return page != null ? page : new TempoPage<>();
    }

    /**
     * Follow metadata.next of a previous page.
     */
    public TempoPage<TempoWorklogDto> fetchWorklogs(String nextUrl) {
        requireConfigured();
        TempoPage<TempoWorklogDto> page = tempoWebClient.get()
                .uri(URI.create(nextUrl))
                .header("Authorization", "Bearer " + apiToken)
                .header("Accept", "application/json")
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> UpstreamErrors.map(UPSTREAM, response))
                .bodyToMono(WORKLOG_PAGE)
                .timeout(TIMEOUT)
                .block();
        return page != null ? page : new TempoPage<>();
    }

    /**
     * Name of the first Tempo team the account belongs to.
     */
    public Optional<String> getTeamName(String accountId) {
        requireConfigured();
        try {
            TempoPage<TempoTeamMembershipDto> page = tempoWebClient.get()
                    .uri(uri -> uri.path("/4/team-memberships/account/{accountId}").build(accountId))
                    .header("Authorization", "Bearer " + apiToken)
                    .header("Accept", "application/json")
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> UpstreamErrors.map(UPSTREAM, response))
                    .bodyToMono(MEMBERSHIP_PAGE)
                    .timeout(TIMEOUT)
                    .block();
            if (page == null || page.getResults() == null) {
                return Optional.empty();
            }
            return page.getResults().stream()
                    .filter(membership -> membership.getTeam() != null && membership.getTeam().getName() != null)
                    .map(membership -> membership.getTeam().getName())
                    .findFirst();
        } catch (ExternalApiException e) {
            if (e.hasStatus() && e.getStatusCode() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw e;
        }
    }
}
