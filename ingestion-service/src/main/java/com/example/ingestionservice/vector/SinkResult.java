package com.example.ingestionservice.vector;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one {@link VectorIngestionSink#upsert} call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SinkResult {

    private int ingested;
    private int embeddingFailures;
    private int failedBatches;
    private int collapsedDuplicates;
    private int invalidDocuments;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static SinkResult empty() {
        return SinkResult.builder().build();
    }
}
