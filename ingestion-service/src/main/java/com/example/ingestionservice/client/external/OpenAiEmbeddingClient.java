package com.example.ingestionservice.client.external;

import com.example.ingestionservice.vector.EmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Embeddings via the OpenAI REST API.
 * 
 * Input is truncated to {@link EmbeddingService#MAX_INPUT_CHARS}. Blank input
 * yields an empty vector without a network call.
 */
@Component
@Slf4j
public class OpenAiEmbeddingClient implements EmbeddingService {

    public static final String UPSTREAM = "openai";
    private static final Duration TIMEOUT = Duration.ofSeconds(20);

    private final WebClient embeddingWebClient;
    private final String apiKey;
    private final String model;

    public OpenAiEmbeddingClient(@Qualifier("embeddingWebClient") WebClient embeddingWebClient,
                                 @Value("${ingestion.embedding.api-key:}") String apiKey,
                                 @Value("${ingestion.embedding.model:text-embedding-3-small}") String model) {
        this.embeddingWebClient = embeddingWebClient;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<Float> embed(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new ExternalApiException.SourceNotConfiguredException(UPSTREAM, "ingestion.embedding.api-key");
        }
        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;

        Map<String, Object> response = embeddingWebClient.post()
                .uri("/v1/embeddings")
                .header("Authorization", "Bearer " + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("model", model, "input", input))
                .retrieve()
                .onStatus(HttpStatusCode::isError, r -> UpstreamErrors.map(UPSTREAM, r))
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .timeout(TIMEOUT)
                .block();

        if (response == null) {
            return List.of();
        }
        List<Map<String, Object>> data = (List<Map<String, Object>>) response.get("data");
        if (data == null || data.isEmpty()) {
            return List.of();
        }
        List<Number> values = (List<Number>) data.get(0).get("embedding");
        if (values == null) {
            return List.of();
        }
        List<Float> embedding = new ArrayList<>(values.size());
        for (Number value : values) {
            embedding.add(value.floatValue());
        }
        return embedding;
    }
}
