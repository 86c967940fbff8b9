package com.example.ingestionservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for temporarily refused work (HTTP 503), e.g. executor queue full.
 */
public class ServiceUnavailableException extends BaseException {

    public ServiceUnavailableException(String code, String message) {
        super(code, message, HttpStatus.SERVICE_UNAVAILABLE);
    }

    public static ServiceUnavailableException queueFull() {
        return new ServiceUnavailableException("QUEUE_FULL",
                "Backfill queue is full, retry later");
    }
}
