package com.example.ingestionservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for invalid backfill requests.
 * Returns HTTP 400 BAD_REQUEST.
 */
public class BadRequestException extends BaseException {

    public BadRequestException(String code, String message) {
        super(code, message, HttpStatus.BAD_REQUEST);
    }

    public BadRequestException(String code, String message, String field) {
        super(code, message, HttpStatus.BAD_REQUEST, field);
    }

    public static BadRequestException unknownSource(String source) {
        return new BadRequestException("UNKNOWN_SOURCE",
                String.format("Unknown source: %s. Expected one of jira, tempo, fireflies, notion, slack", source),
                "source");
    }

    public static BadRequestException invalidRange(String message) {
        return new BadRequestException("INVALID_RANGE", message);
    }
}
