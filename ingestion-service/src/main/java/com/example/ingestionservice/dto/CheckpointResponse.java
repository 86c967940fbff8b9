package com.example.ingestionservice.dto;

import com.example.ingestionservice.entity.BackfillCheckpoint;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CheckpointResponse {

    private String source;
    private String batchId;
    private LocalDate startDate;
    private LocalDate endDate;
    private String status;
    private Integer totalItems;
    private int processedItems;
    private int ingestedItems;
    private int skippedItems;
    private String errorMessage;
    private String correlationId;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static CheckpointResponse from(BackfillCheckpoint checkpoint) {
        return CheckpointResponse.builder()
                .source(checkpoint.getSource())
                .batchId(checkpoint.getBatchId())
                .startDate(checkpoint.getStartDate())
                .endDate(checkpoint.getEndDate())
                .status(checkpoint.getStatus().name())
                .totalItems(checkpoint.getTotalItems())
                .processedItems(checkpoint.getProcessedItems())
                .ingestedItems(checkpoint.getIngestedItems())
                .skippedItems(checkpoint.getSkippedItems())
                .errorMessage(checkpoint.getErrorMessage())
                .correlationId(checkpoint.getCorrelationId())
                .startedAt(checkpoint.getStartedAt())
                .completedAt(checkpoint.getCompletedAt())
                .createdAt(checkpoint.getCreatedAt())
                .updatedAt(checkpoint.getUpdatedAt())
                .build();
    }
}
