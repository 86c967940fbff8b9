package com.example.ingestionservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Body of POST /api/backfill/{source}. Exactly one of days_back or
 * from_date/to_date must be given.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillRequestDto {

    @JsonProperty("days_back")
    @Min(value = 1, message = "days_back must be >= 1")
    private Integer daysBack;

    @JsonProperty("from_date")
    private LocalDate fromDate;

    @JsonProperty("to_date")
    private LocalDate toDate;

    @JsonProperty("batch_id")
    @Size(max = 200, message = "batch_id must be at most 200 characters")
    private String batchId;
}
