package com.example.ingestionservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskSubmissionResponse {

    @JsonProperty("task_id")
    private String taskId;

    private String status;

    private String source;

    @JsonProperty("batch_id")
    private String batchId;
}
