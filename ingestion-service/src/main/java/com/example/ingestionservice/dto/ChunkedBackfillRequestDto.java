package com.example.ingestionservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChunkedBackfillRequestDto {

    @JsonProperty("months_back")
    @NotNull(message = "months_back is required")
    @Min(value = 1, message = "months_back must be >= 1")
    @Max(value = 36, message = "months_back must be <= 36")
    private Integer monthsBack;
}
