package com.example.ingestionservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for resource not found errors (HTTP 404).
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    public static ResourceNotFoundException taskNotFound(String taskId) {
        return new ResourceNotFoundException("TASK_NOT_FOUND",
                String.format("Task %s not found", taskId));
    }

    public static ResourceNotFoundException checkpointNotFound(String source, String batchId) {
        return new ResourceNotFoundException("CHECKPOINT_NOT_FOUND",
                String.format("No checkpoint for source %s and batch %s", source, batchId));
    }
}
