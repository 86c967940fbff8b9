package com.example.ingestionservice.service;

import com.example.ingestionservice.dto.TaskStatusResponse;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * In-memory state of a submitted task. Written by the worker thread,
 * read by the status endpoint.
 */
@Getter
public class BackfillTask {

    public enum TaskStatus {
        RUNNING,
        COMPLETED,
        FAILED
    }

    private final String taskId;
    private final String source;
    private final String batchId;
    private final LocalDateTime submittedAt;
    private volatile TaskStatus status = TaskStatus.RUNNING;
    private volatile LocalDateTime finishedAt;
    private volatile Object result;
    private volatile String error;

    public BackfillTask(String taskId, String source, String batchId) {
        this.taskId = taskId;
        this.source = source;
        this.batchId = batchId;
        this.submittedAt = LocalDateTime.now();
    }

    public synchronized void complete(Object result) {
        this.result = result;
        this.finishedAt = LocalDateTime.now();
        this.status = TaskStatus.COMPLETED;
    }

    public synchronized void fail(String error) {
        this.error = error;
        this.finishedAt = LocalDateTime.now();
        this.status = TaskStatus.FAILED;
    }

    public boolean isFinished() {
        return status != TaskStatus.RUNNING;
    }

    public synchronized TaskStatusResponse toResponse() {
        return TaskStatusResponse.builder()
                .taskId(taskId)
                .status(status.name())
                .source(source)
                .batchId(batchId)
                .submittedAt(submittedAt)
                .finishedAt(finishedAt)
                .result(result)
                .error(error)
                .build();
    }
}
