package com.example.ingestionservice.retry;

import com.example.ingestionservice.metrics.IngestionMetrics;
import io.github.resilience4j.retry.RetryRegistry;

/**
 * Retry envelope with the production policy and zero backoff, for unit tests.
 */
public final class RetryTestSupport {

    private RetryTestSupport() {
    }

    public static RetryEnvelope noBackoff(IngestionMetrics metrics, int maxRetries) {
        return new RetryEnvelope(
                RetryRegistry.ofDefaults(),
                new RetryPolicy(RetryPolicy.DEFAULT_RETRIABLE_STATUSES),
                metrics,
                maxRetries,
                new BackoffIntervalFunction(0, 1.0, 0));
    }
}
