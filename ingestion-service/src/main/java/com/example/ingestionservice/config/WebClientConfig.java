package com.example.ingestionservice.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configuration for WebClient instances.
 * 
 * CRITICAL: Each upstream gets its own client with its own timeouts.
 * Auth headers are added per request by the client classes, so a missing
 * credential surfaces as a fatal initialization error instead of a 401 loop.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024; // 16MB

    /**
     * WebClient for Jira API calls (search + identity lookups).
     * Timeout: 30 seconds (Jira can be slow)
     */
    @Bean("jiraWebClient")
    public WebClient jiraWebClient(@Value("${ingestion.jira.base-url:https://example.atlassian.net}") String baseUrl) {
        return build(baseUrl, 10000, 30);
    }

    /**
     * WebClient for Tempo API v4 (worklogs, team memberships).
     */
    @Bean("tempoWebClient")
    public WebClient tempoWebClient(@Value("${ingestion.tempo.base-url:https://api.tempo.io}") String baseUrl) {
        return build(baseUrl, 10000, 60);
    }

    /**
     * WebClient for Fireflies GraphQL API.
     */
    @Bean("firefliesWebClient")
    public WebClient firefliesWebClient(@Value("${ingestion.fireflies.base-url:https://api.fireflies.ai}") String baseUrl) {
        return build(baseUrl, 10000, 60);
    }

    @Bean("notionWebClient")
    public WebClient notionWebClient(@Value("${ingestion.notion.base-url:https://api.notion.com}") String baseUrl) {
        return build(baseUrl, 5000, 30);
    }

    @Bean("slackWebClient")
    public WebClient slackWebClient(@Value("${ingestion.slack.base-url:https://slack.com/api}") String baseUrl) {
        return build(baseUrl, 5000, 30);
    }

    /**
     * WebClient for the embedding API.
     * Timeout: 20 seconds per request (single input per call)
     */
    @Bean("embeddingWebClient")
    public WebClient embeddingWebClient(@Value("${ingestion.embedding.base-url:https://api.openai.com}") String baseUrl) {
        return build(baseUrl, 5000, 20);
    }

    /**
     * WebClient for the Pinecone index data plane.
     * Base URL is the index host, e.g. https://activity-index-abc123.svc.pinecone.io
     */
    @Bean("vectorStoreWebClient")
    public WebClient vectorStoreWebClient(@Value("${ingestion.vector.index-host:http://localhost:5080}") String baseUrl) {
        return build(baseUrl, 5000, 30);
    }

    private WebClient build(String baseUrl, int connectTimeoutMillis, int timeoutSeconds) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();
    }
}
