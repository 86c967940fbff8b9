package com.example.ingestionservice.client.external;

import com.example.ingestionservice.vector.MetadataFilter;
import com.example.ingestionservice.vector.VectorDocument;
import com.example.ingestionservice.vector.VectorMatch;
import com.example.ingestionservice.vector.VectorStore;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pinecone data-plane client (REST).
 * 
 * - POST /vectors/upsert {vectors:[{id, values, metadata}], namespace}
 * - POST /query {vector, topK, filter, includeMetadata, namespace}
 */
@Component
@Slf4j
public class PineconeVectorStore implements VectorStore {

    public static final String UPSTREAM = "pinecone";
    private static final Duration TIMEOUT = Duration.ofSeconds(30);
    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
            new ParameterizedTypeReference<>() {};

    private final WebClient vectorStoreWebClient;
    private final String apiKey;
    private final String namespace;

    public PineconeVectorStore(@Qualifier("vectorStoreWebClient") WebClient vectorStoreWebClient,
                               @Value("${ingestion.vector.api-key:}") String apiKey,
                               @Value("${ingestion.vector.namespace:}") String namespace) {
        this.vectorStoreWebClient = vectorStoreWebClient;
        this.apiKey = apiKey;
        this.namespace = namespace;
    }

    @Override
    public int upsert(List<VectorDocument> documents) {
        requireConfigured();
        if (documents.isEmpty()) {
            return 0;
        }
        List<Map<String, Object>> vectors = new ArrayList<>(documents.size());
        for (VectorDocument document : documents) {
            Map<String, Object> vector = new LinkedHashMap<>();
            vector.put("id", document.getId());
            vector.put("values", document.getEmbedding());
            vector.put("metadata", document.getMetadata());
            vectors.add(vector);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vectors", vectors);
        if (namespace != null && !namespace.isBlank()) {
            body.put("namespace", namespace);
        }

        Map<String, Object> response = post("/vectors/upsert", body);
        Object upserted = response != null ? response.get("upsertedCount") : null;
        return upserted instanceof Number n ? n.intValue() : documents.size();
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<VectorMatch> query(List<Float> embedding, MetadataFilter filter, int topK) {
        requireConfigured();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vector", embedding);
        body.put("topK", topK);
        body.put("includeMetadata", true);
        if (filter != null && !filter.isEmpty()) {
            body.put("filter", filter.toMap());
        }
        if (namespace != null && !namespace.isBlank()) {
            body.put("namespace", namespace);
        }

        Map<String, Object> response = post("/query", body);
        List<VectorMatch> matches = new ArrayList<>();
        if (response == null || response.get("matches") == null) {
            return matches;
        }
        for (Map<String, Object> match : (List<Map<String, Object>>) response.get("matches")) {
            Object score = match.get("score");
            matches.add(VectorMatch.builder()
                    .id((String) match.get("id"))
                    .score(score instanceof Number n ? n.doubleValue() : 0.0)
                    .metadata((Map<String, Object>) match.getOrDefault("metadata", Map.of()))
                    .build());
        }
        return matches;
    }

    private Map<String, Object> post(String path, Map<String, Object> body) {
        return vectorStoreWebClient.post()
                .uri(path)
                .header("Api-Key", apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, r -> UpstreamErrors.map(UPSTREAM, r))
                .bodyToMono(JSON_MAP)
                .timeout(TIMEOUT)
                .block();
    }

    private void requireConfigured() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ExternalApiException.SourceNotConfiguredException(UPSTREAM, "ingestion.vector.api-key");
        }
    }
}
