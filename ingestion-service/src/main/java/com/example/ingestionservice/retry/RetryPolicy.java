package com.example.ingestionservice.retry;

import com.example.ingestionservice.client.external.ExternalApiException;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Decides whether a failed outbound call is worth another attempt.
 * 
 * ORDER MATTERS:
 * 1. Transport failures (connect error, timeout) anywhere in the cause chain → retriable
 * 2. Only for exceptions that carry an HTTP status → retriable iff status is configured
 * 3. Everything else → non-retriable, propagates on first failure
 */
@Component
@Getter
public class RetryPolicy {

    public static final String DEFAULT_RETRIABLE_STATUSES = "408,429,500,502,503,504";

    private final Set<Integer> retriableStatuses;

    public RetryPolicy(@Value("${ingestion.retry.retriable-statuses:" + DEFAULT_RETRIABLE_STATUSES + "}")
                       String retriableStatuses) {
        Set<Integer> statuses = Arrays.stream(retriableStatuses.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Integer::valueOf)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        this.retriableStatuses = Collections.unmodifiableSet(statuses);
    }

    public boolean isRetriable(Throwable throwable) {
        if (isTransportFailure(throwable)) {
            return true;
        }
        Integer status = statusOf(throwable);
        return status != null && retriableStatuses.contains(status);
    }

    private boolean isTransportFailure(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof WebClientRequestException
                    || current instanceof ConnectException
                    || current instanceof SocketTimeoutException
                    || current instanceof TimeoutException
                    || current instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private Integer statusOf(Throwable throwable) {
        if (throwable instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().value();
        }
        if (throwable instanceof ExternalApiException apiException && apiException.hasStatus()) {
            return apiException.getStatusCode();
        }
        return null;
    }
}
