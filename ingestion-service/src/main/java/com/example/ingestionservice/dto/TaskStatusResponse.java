package com.example.ingestionservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * State of a submitted backfill task. result is a {@link BackfillResult} for a
 * single batch or a {@link ChunkedBackfillResult} for a chunked run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskStatusResponse {

    @JsonProperty("task_id")
    private String taskId;

    private String status;

    private String source;

    @JsonProperty("batch_id")
    private String batchId;

    @JsonProperty("submitted_at")
    private LocalDateTime submittedAt;

    @JsonProperty("finished_at")
    private LocalDateTime finishedAt;

    private Object result;

    private String error;
}
