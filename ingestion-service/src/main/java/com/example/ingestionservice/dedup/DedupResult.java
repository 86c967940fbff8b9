package com.example.ingestionservice.dedup;

import com.example.ingestionservice.record.FirefliesTranscriptRecord;
import lombok.Getter;

import java.util.List;

@Getter
public class DedupResult {

    private final List<FirefliesTranscriptRecord> survivors;
    private final DedupStats stats;

    public DedupResult(List<FirefliesTranscriptRecord> survivors, DedupStats stats) {
        this.survivors = List.copyOf(survivors);
        this.stats = stats;
    }
}
