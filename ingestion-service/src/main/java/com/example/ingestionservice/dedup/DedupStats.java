package com.example.ingestionservice.dedup;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DedupStats {

    @JsonProperty("total")
    private int total;

    @JsonProperty("exact_duplicates_removed")
    private int exactDuplicatesRemoved;

    @JsonProperty("fuzzy_duplicates_removed")
    private int fuzzyDuplicatesRemoved;

    @JsonProperty("final_count")
    private int finalCount;
}
