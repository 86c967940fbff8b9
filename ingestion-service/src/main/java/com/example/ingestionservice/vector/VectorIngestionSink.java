package com.example.ingestionservice.vector;

import com.example.ingestionservice.client.external.ExternalApiException;
import com.example.ingestionservice.metrics.IngestionMetrics;
import com.example.ingestionservice.resolver.ResolvedRecord;
import com.example.ingestionservice.retry.RetryEnvelope;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Embeds resolved records and upserts them into the vector store.
 * 
 * CRITICAL DESIGN:
 * - Document id depends only on (source, natural key): re-ingesting overwrites
 * - Same id twice in one call → only the record with the latest timestamp is written
 * - Record that cannot form a document (no natural key) → skipped with a warning, the rest continue
 * - Embedding failure → record skipped with a warning, the rest continue
 * - Batches of {@code ingestion.vector.batch-size}; a failed batch is logged and NOT counted,
 *   later batches are still attempted
 * - Missing or rejected credentials abort the call: nothing after them could succeed
 */
@Component
@Slf4j
public class VectorIngestionSink {

    private final VectorStore vectorStore;
    private final EmbeddingService embeddingService;
    private final VectorDocumentFactory documentFactory;
    private final RetryEnvelope retryEnvelope;
    private final IngestionMetrics ingestionMetrics;
    @Getter
    private final int batchSize;

    public VectorIngestionSink(VectorStore vectorStore,
                               EmbeddingService embeddingService,
                               VectorDocumentFactory documentFactory,
                               RetryEnvelope retryEnvelope,
                               IngestionMetrics ingestionMetrics,
                               @Value("${ingestion.vector.batch-size:100}") int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        this.vectorStore = vectorStore;
        this.embeddingService = embeddingService;
        this.documentFactory = documentFactory;
        this.retryEnvelope = retryEnvelope;
        this.ingestionMetrics = ingestionMetrics;
        this.batchSize = batchSize;
    }

    public SinkResult upsert(List<ResolvedRecord> records) {
        SinkResult result = SinkResult.empty();
        if (records == null || records.isEmpty()) {
            return result;
        }

        List<VectorDocument> documents = latestPerId(records, result);

        List<VectorDocument> embedded = new ArrayList<>(documents.size());
        for (VectorDocument document : documents) {
            VectorDocument withEmbedding = ensureEmbedding(document, result);
            if (withEmbedding != null) {
                embedded.add(withEmbedding);
            }
        }

        for (int start = 0; start < embedded.size(); start += batchSize) {
            List<VectorDocument> batch = embedded.subList(start, Math.min(start + batchSize, embedded.size()));
            int batchNumber = start / batchSize + 1;
            try {
                retryEnvelope.execute("vector.upsert", () -> vectorStore.upsert(batch));
                result.setIngested(result.getIngested() + batch.size());
                log.debug("Upserted batch {} ({} documents)", batchNumber, batch.size());
            } catch (ExternalApiException.AuthenticationException | ExternalApiException.SourceNotConfiguredException e) {
                throw e;
            } catch (RuntimeException e) {
                result.setFailedBatches(result.getFailedBatches() + 1);
                result.getErrors().add("upsert batch " + batchNumber + ": " + e.getMessage());
                ingestionMetrics.recordUpsertBatchFailure();
                log.error("❌ Vector upsert batch {} failed ({} documents): {}", batchNumber, batch.size(), e.getMessage());
            }
        }

        log.info("Vector ingestion: received={}, ingested={}, invalid={}, embeddingFailures={}, failedBatches={}",
                records.size(), result.getIngested(), result.getInvalidDocuments(),
                result.getEmbeddingFailures(), result.getFailedBatches());
        return result;
    }

    /**
     * Embed free text and query the store, e.g. for retrieval over ingested activity.
     */
    public List<VectorMatch> query(String text, MetadataFilter filter, int topK) {
        List<Float> embedding = retryEnvelope.execute("embedding", () -> embeddingService.embed(text));
        if (embedding.isEmpty()) {
            return List.of();
        }
        return retryEnvelope.execute("vector.query", () -> vectorStore.query(embedding, filter, topK));
    }

    private List<VectorDocument> latestPerId(List<ResolvedRecord> records, SinkResult result) {
        Map<String, VectorDocument> byId = new LinkedHashMap<>();
        Map<String, Instant> timestamps = new LinkedHashMap<>();
        for (ResolvedRecord record : records) {
            if (!record.getIdentity().isResolved()) {
                continue;
            }
            VectorDocument document;
            try {
                document = documentFactory.create(record);
            } catch (IllegalArgumentException e) {
                result.setInvalidDocuments(result.getInvalidDocuments() + 1);
                log.warn("⚠️ Skipping {} record resolved to {}: {}",
                        record.getRecord().getSource().key(), record.getIdentity().getResolvedKey(), e.getMessage());
                continue;
            }
            Instant timestamp = record.getRecord().getTimestamp();
            VectorDocument existing = byId.get(document.getId());
            if (existing != null) {
                result.setCollapsedDuplicates(result.getCollapsedDuplicates() + 1);
                Instant existingTimestamp = timestamps.get(document.getId());
                if (existingTimestamp != null && timestamp != null && timestamp.isBefore(existingTimestamp)) {
                    continue;
                }
            }
            byId.put(document.getId(), document);
            timestamps.put(document.getId(), timestamp);
        }
        return new ArrayList<>(byId.values());
    }

    private VectorDocument ensureEmbedding(VectorDocument document, SinkResult result) {
        if (document.hasEmbedding()) {
            return document;
        }
        String text = document.getTitle() + "\n\n" + document.getContent();
        try {
            List<Float> embedding = retryEnvelope.execute("embedding", () -> embeddingService.embed(text));
            if (embedding == null || embedding.isEmpty()) {
                recordEmbeddingFailure(document, "empty embedding", result);
                return null;
            }
            return document.withEmbedding(embedding);
        } catch (ExternalApiException.AuthenticationException | ExternalApiException.SourceNotConfiguredException e) {
            throw e;
        } catch (RuntimeException e) {
            recordEmbeddingFailure(document, e.getMessage(), result);
            return null;
        }
    }

    private void recordEmbeddingFailure(VectorDocument document, String reason, SinkResult result) {
        result.setEmbeddingFailures(result.getEmbeddingFailures() + 1);
        ingestionMetrics.recordEmbeddingFailure();
        log.warn("⚠️ Skipping document id={}: no embedding ({})", document.getId(), reason);
    }
}
