package com.example.ingestionservice.client.external;

import com.example.ingestionservice.dto.JiraSearchResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Client for Jira REST API v3.
 * 
 * CRITICAL DESIGN:
 * - Blocking calls on WebClient, one HTTP request per method call
 * - NO retry here: callers wrap each call in RetryEnvelope
 * - Lookups return empty on 404 (the id does not exist), throw on anything else
 * - Must be called OUTSIDE @Transactional
 */
@Component
@Slf4j
public class JiraClient {

    public static final String UPSTREAM = "jira";
    static final String SEARCH_FIELDS = "summary,description,issuetype,status,assignee,project,parent,created,updated";
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final WebClient jiraWebClient;
    private final String baseUrl;
    private final String email;
    private final String apiToken;

    public JiraClient(@Qualifier("jiraWebClient") WebClient jiraWebClient,
                      @Value("${ingestion.jira.base-url:https://example.atlassian.net}") String baseUrl,
                      @Value("${ingestion.jira.email:}") String email,
                      @Value("${ingestion.jira.api-token:}") String apiToken) {
        this.jiraWebClient = jiraWebClient;
        this.baseUrl = baseUrl;
        this.email = email;
        this.apiToken = apiToken;
    }

    public void requireConfigured() {
        if (isBlank(apiToken)) {
            throw new ExternalApiException.SourceNotConfiguredException(UPSTREAM, "ingestion.jira.api-token");
        }
        if (isBlank(email)) {
            throw new ExternalApiException.SourceNotConfiguredException(UPSTREAM, "ingestion.jira.email");
        }
    }

    public String getBaseUrl() {
        return baseUrl == null ? "" : baseUrl.replaceAll("/+$", "");
    }

    /**
     * One page of a JQL search.
     *
     * @param jql JQL query, e.g. {@code updated >= "2024-11-01" AND updated <= "2024-11-30" ORDER BY updated ASC}
     * @param startAt zero-based offset
     * @param maxResults page size (Jira caps at 100)
     */
    public JiraSearchResponse searchIssues(String jql, int startAt, int maxResults) {
        requireConfigured();
        log.debug("Searching Jira issues: startAt={}, maxResults={}, jql={}", startAt, maxResults, jql);

        JiraSearchResponse response = get(uri -> uri
                        .path("/rest/api/3/search")
                        .queryParam("jql", jql)
                        .queryParam("startAt", startAt)
                        .queryParam("maxResults", maxResults)
                        .queryParam("fields", SEARCH_FIELDS)
                        .build(),
                new ParameterizedTypeReference<JiraSearchResponse>() {});
        return response != null ? response : new JiraSearchResponse();
    }

    /**
     * Numeric issue id → issue key.
     */
    public Optional<String> getIssueKey(String issueId) {
        requireConfigured();
        return getOptionalMap(uri -> uri
                .path("/rest/api/3/issue/{id}")
                .queryParam("fields", "key")
                .build(issueId))
                .map(issue -> (String) issue.get("key"));
    }

    /**
     * Atlassian account id → display name.
     */
    public Optional<String> getDisplayName(String accountId) {
        requireConfigured();
        return getOptionalMap(uri -> uri
                .path("/rest/api/3/user")
                .queryParam("accountId", accountId)
                .build())
                .map(user -> (String) user.get("displayName"));
    }

    /**
     * Epic of an issue: the issue itself when it is an epic, otherwise its parent.
     */
    @SuppressWarnings("unchecked")
    public Optional<String> getEpicKey(String issueKey) {
        requireConfigured();
        return getOptionalMap(uri -> uri
                .path("/rest/api/3/issue/{key}")
                .queryParam("fields", "parent,issuetype")
                .build(issueKey))
                .flatMap(issue -> {
                    Map<String, Object> fields = (Map<String, Object>) issue.get("fields");
                    if (fields == null) {
                        return Optional.empty();
                    }
                    Map<String, Object> issueType = (Map<String, Object>) fields.get("issuetype");
                    if (issueType != null && "Epic".equalsIgnoreCase((String) issueType.get("name"))) {
                        return Optional.ofNullable((String) issue.get("key"));
                    }
                    Map<String, Object> parent = (Map<String, Object>) fields.get("parent");
                    return parent != null ? Optional.ofNullable((String) parent.get("key")) : Optional.empty();
                });
    }

    private Optional<Map<String, Object>> getOptionalMap(Function<UriBuilder, URI> uriFunction) {
        try {
            return Optional.ofNullable(get(uriFunction, new ParameterizedTypeReference<Map<String, Object>>() {}));
        } catch (ExternalApiException e) {
            if (e.hasStatus() && e.getStatusCode() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    private <T> T get(Function<UriBuilder, URI> uriFunction, ParameterizedTypeReference<T> type) {
        return jiraWebClient.get()
                .uri(uriFunction)
                .header("Authorization", basicAuth())
                .header("Accept", "application/json")
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> UpstreamErrors.map(UPSTREAM, response))
                .bodyToMono(type)
                .timeout(TIMEOUT)
                .block();
    }

    private String basicAuth() {
        return "Basic " + Base64.getEncoder()
                .encodeToString((email + ":" + apiToken).getBytes(StandardCharsets.UTF_8));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
