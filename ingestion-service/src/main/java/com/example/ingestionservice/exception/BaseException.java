package com.example.ingestionservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception class for errors reported to API callers.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final String code;
    private final HttpStatus status;
    private final String field;

    protected BaseException(String code, String message, HttpStatus status) {
        this(code, message, status, null);
    }

    protected BaseException(String code, String message, HttpStatus status, String field) {
        super(message);
        this.code = code;
        this.status = status;
        this.field = field;
    }
}
