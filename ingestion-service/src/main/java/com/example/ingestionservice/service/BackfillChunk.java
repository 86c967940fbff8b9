package com.example.ingestionservice.service;

import com.example.ingestionservice.record.Source;
import lombok.Getter;

import java.time.LocalDate;

@Getter
public class BackfillChunk {

    private final Source source;
    private final int index;
    private final LocalDate startDate;
    private final LocalDate endDate;

    public BackfillChunk(Source source, int index, LocalDate startDate, LocalDate endDate) {
        this.source = source;
        this.index = index;
        this.startDate = startDate;
        this.endDate = endDate;
    }

    /**
     * e.g. {@code tempo-chunk-01-2024-01-01_to_2024-01-30}. Stable for the same plan,
     * so re-running a chunked backfill skips chunks that already completed.
     */
    public String batchId() {
        return String.format("%s-chunk-%02d-%s_to_%s", source.key(), index, startDate, endDate);
    }

    public BackfillRequest toRequest() {
        return BackfillRequest.forDays(source, batchId(), startDate, endDate);
    }
}
