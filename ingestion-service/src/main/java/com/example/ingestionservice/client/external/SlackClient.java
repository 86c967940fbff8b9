package com.example.ingestionservice.client.external;

import com.example.ingestionservice.dto.SlackResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Client for the Slack Web API.
 * 
 * Slack answers HTTP 200 with ok=false for most failures. Those become
 * {@link ExternalApiException}: "ratelimited" as 429 (retried), token errors as
 * authentication failures, the rest without a status (not retried).
 */
@Component
@Slf4j
public class SlackClient {

    public static final String UPSTREAM = "slack";
    public static final int PAGE_SIZE = 200;
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final WebClient slackWebClient;
    private final String botToken;

    public SlackClient(@Qualifier("slackWebClient") WebClient slackWebClient,
                       @Value("${ingestion.slack.bot-token:}") String botToken) {
        this.slackWebClient = slackWebClient;
        this.botToken = botToken;
    }

    public void requireConfigured() {
        if (botToken == null || botToken.isBlank()) {
            throw new ExternalApiException.SourceNotConfiguredException(UPSTREAM, "ingestion.slack.bot-token");
        }
    }

    public SlackResponse listChannels(String cursor) {
        requireConfigured();
        return call(slackWebClient.get()
                .uri(uri -> {
                    uri.path("/conversations.list")
                            .queryParam("types", "public_channel,private_channel")
                            .queryParam("exclude_archived", true)
                            .queryParam("limit", PAGE_SIZE);
                    if (cursor != null) {
                        uri.queryParam("cursor", cursor);
                    }
                    return uri.build();
                }));
    }

    /**
     * Messages of one channel with oldest <= ts < latest (epoch seconds).
     */
    public SlackResponse history(String channelId, long oldestEpochSeconds, long latestEpochSeconds, String cursor) {
        requireConfigured();
        return call(slackWebClient.get()
                .uri(uri -> {
                    uri.path("/conversations.history")
                            .queryParam("channel", channelId)
                            .queryParam("oldest", oldestEpochSeconds)
                            .queryParam("latest", latestEpochSeconds)
                            .queryParam("limit", PAGE_SIZE);
                    if (cursor != null) {
                        uri.queryParam("cursor", cursor);
                    }
                    return uri.build();
                }));
    }

    private SlackResponse call(WebClient.RequestHeadersSpec<?> request) {
        SlackResponse response = request
                .header("Authorization", "Bearer " + botToken)
                .retrieve()
                .onStatus(HttpStatusCode::isError, r -> UpstreamErrors.map(UPSTREAM, r))
                .bodyToMono(SlackResponse.class)
                .timeout(TIMEOUT)
                .block();

        if (response == null) {
            return new SlackResponse();
        }
        if (!response.isOk()) {
            String error = response.getError();
            if ("ratelimited".equals(error)) {
                throw new ExternalApiException.RateLimitExceededException(UPSTREAM);
            }
            if ("invalid_auth".equals(error) || "not_authed".equals(error) || "token_revoked".equals(error)) {
                throw new ExternalApiException.AuthenticationException(UPSTREAM, 401);
            }
            log.warn("Slack API error: {}", error);
            throw new ExternalApiException(UPSTREAM, null, "Slack API error: " + error);
        }
        return response;
    }
}
