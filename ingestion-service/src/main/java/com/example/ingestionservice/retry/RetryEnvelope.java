package com.example.ingestionservice.retry;

import com.example.ingestionservice.metrics.IngestionMetrics;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Bounded retry with jittered exponential backoff around a single outbound call.
 * 
 * CRITICAL DESIGN:
 * - Every network call of the pipeline goes through here (fetch, lookup, embed, upsert, query)
 * - maxAttempts = maxRetries + 1
 * - Non-retriable failures propagate on the first attempt (see {@link RetryPolicy})
 * - On exhaustion the LAST failure is rethrown unchanged
 * - One Resilience4j Retry instance per operation name, shared config
 * 
 * Usage:
 * <pre>
 * String key = retryEnvelope.execute("jira.issue-key", () -> jiraClient.getIssueKey(id));
 * </pre>
 */
@Component
@Slf4j
public class RetryEnvelope {

    private final RetryRegistry retryRegistry;
    private final IngestionMetrics ingestionMetrics;
    @Getter
    private final RetryConfig retryConfig;
    @Getter
    private final int maxRetries;

    @Autowired
    public RetryEnvelope(RetryRegistry retryRegistry,
                         RetryPolicy retryPolicy,
                         IngestionMetrics ingestionMetrics,
                         @Value("${ingestion.retry.max-retries:3}") int maxRetries,
                         @Value("${ingestion.retry.base-delay-ms:1000}") long baseDelayMillis,
                         @Value("${ingestion.retry.factor:2.0}") double factor,
                         @Value("${ingestion.retry.max-delay-ms:60000}") long maxDelayMillis) {
        this(retryRegistry, retryPolicy, ingestionMetrics, maxRetries,
                new BackoffIntervalFunction(baseDelayMillis, factor, maxDelayMillis));
    }

    public RetryEnvelope(RetryRegistry retryRegistry,
                         RetryPolicy retryPolicy,
                         IngestionMetrics ingestionMetrics,
                         int maxRetries,
                         BackoffIntervalFunction intervalFunction) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        this.retryRegistry = retryRegistry;
        this.ingestionMetrics = ingestionMetrics;
        this.maxRetries = maxRetries;
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(maxRetries + 1)
                .intervalFunction(intervalFunction)
                .retryOnException(retryPolicy::isRetriable)
                .build();
    }

    public <T> T execute(String name, Supplier<T> operation) {
        return Retry.decorateSupplier(retry(name), operation).get();
    }

    public void run(String name, Runnable operation) {
        execute(name, () -> {
            operation.run();
            return null;
        });
    }

    private synchronized Retry retry(String name) {
        boolean registered = retryRegistry.find(name).isPresent();
        Retry retry = retryRegistry.retry(name, retryConfig);
        if (!registered) {
            registerEventLogging(retry);
        }
        return retry;
    }

    private void registerEventLogging(Retry retry) {
        int maxAttempts = retryConfig.getMaxAttempts();
        retry.getEventPublisher()
                .onRetry(event -> {
                    ingestionMetrics.recordRetryAttempt(event.getName());
                    log.warn("RETRY_ATTEMPT name={} attempt={}/{} wait={}ms error={}",
                            event.getName(), event.getNumberOfRetryAttempts(), maxAttempts,
                            event.getWaitInterval().toMillis(),
                            event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null);
                })
                .onSuccess(event -> log.info("RETRY_SUCCESS name={} attempts={}",
                        event.getName(), event.getNumberOfRetryAttempts()))
                .onError(event -> {
                    ingestionMetrics.recordRetryExhausted(event.getName());
                    log.error("RETRY_EXHAUSTED name={} attempts={} error={}",
                            event.getName(), event.getNumberOfRetryAttempts(),
                            event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null);
                })
                .onIgnoredError(event -> log.debug("RETRY_SKIPPED name={} non-retriable error={}",
                        event.getName(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null));
    }
}
