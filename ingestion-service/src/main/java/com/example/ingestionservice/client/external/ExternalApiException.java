package com.example.ingestionservice.client.external;

import lombok.Getter;

/**
 * Failure of a call to an upstream API.
 * 
 * Carries the HTTP status when the upstream answered, so the retry envelope
 * can classify it. A null status means the call never got a response.
 */
@Getter
public class ExternalApiException extends RuntimeException {

    private final String upstream;
    private final Integer statusCode;

    public ExternalApiException(String upstream, Integer statusCode, String message) {
        super(message);
        this.upstream = upstream;
        this.statusCode = statusCode;
    }

    public ExternalApiException(String upstream, Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.upstream = upstream;
        this.statusCode = statusCode;
    }

    public boolean hasStatus() {
        return statusCode != null;
    }

    // Custom exceptions

    public static class RateLimitExceededException extends ExternalApiException {
        public RateLimitExceededException(String upstream) {
            super(upstream, 429, upstream + " rate limit exceeded");
        }
    }

    public static class AuthenticationException extends ExternalApiException {
        public AuthenticationException(String upstream, int statusCode) {
            super(upstream, statusCode, upstream + " credentials rejected (" + statusCode + ")");
        }
    }

    /**
     * Credentials for the upstream are not configured. Fatal for the batch.
     */
    public static class SourceNotConfiguredException extends ExternalApiException {
        public SourceNotConfiguredException(String upstream, String property) {
            super(upstream, null, upstream + " is not configured: missing " + property);
        }
    }
}
