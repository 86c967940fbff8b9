package com.example.ingestionservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChunkedBackfillResult {

    private String source;
    private int totalChunks;
    private int completedChunks;
    private int skippedChunks;
    private int failedChunks;
    private int totalIngested;
    private boolean interrupted;

    @Builder.Default
    private List<BackfillResult> chunks = new ArrayList<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();
}
