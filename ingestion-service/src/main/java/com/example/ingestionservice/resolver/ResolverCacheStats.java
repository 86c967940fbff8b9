package com.example.ingestionservice.resolver;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of one identity kind's cache, reported in the job result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolverCacheStats {

    private int entries;

    @JsonProperty("unresolved_entries")
    private int unresolvedEntries;

    private long hits;

    private long misses;

    @JsonProperty("lookup_failures")
    private long lookupFailures;
}
