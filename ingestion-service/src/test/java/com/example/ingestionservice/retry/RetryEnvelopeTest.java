package com.example.ingestionservice.retry;

import com.example.ingestionservice.client.external.ExternalApiException;
import com.example.ingestionservice.metrics.IngestionMetrics;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Attempt counting of the retry envelope.
 * 
 * Backoff is zero so the tests never sleep.
 */
class RetryEnvelopeTest {

    private static final int MAX_RETRIES = 3;

    private SimpleMeterRegistry meterRegistry;
    private RetryEnvelope retryEnvelope;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        retryEnvelope = new RetryEnvelope(
                RetryRegistry.ofDefaults(),
                new RetryPolicy(RetryPolicy.DEFAULT_RETRIABLE_STATUSES),
                new IngestionMetrics(meterRegistry),
                MAX_RETRIES,
                new BackoffIntervalFunction(0, 1.0, 0));
    }

    @Test
    void testExecute_RetriableFailureEveryTime_AttemptsMaxRetriesPlusOneAndRethrowsLast() {
        // GIVEN
        AtomicInteger attempts = new AtomicInteger();

        // WHEN / THEN
        assertThatThrownBy(() -> retryEnvelope.execute("tempo.fetch", () -> {
            int n = attempts.incrementAndGet();
            throw new ExternalApiException("tempo", 503, "unavailable #" + n);
        }))
                .isInstanceOf(ExternalApiException.class)
                .hasMessage("unavailable #4");

        assertThat(attempts.get()).isEqualTo(MAX_RETRIES + 1);
    }

    @Test
    void testExecute_NonRetriableStatus_SingleAttempt() {
        // GIVEN
        AtomicInteger attempts = new AtomicInteger();

        // WHEN / THEN
        assertThatThrownBy(() -> retryEnvelope.execute("jira.fetch", () -> {
            attempts.incrementAndGet();
            throw new ExternalApiException("jira", 400, "bad request");
        })).isInstanceOf(ExternalApiException.class);

        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void testExecute_RejectedCredentials_NotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retryEnvelope.execute("jira.fetch", () -> {
            attempts.incrementAndGet();
            throw new ExternalApiException.AuthenticationException("jira", 401);
        })).isInstanceOf(ExternalApiException.AuthenticationException.class);

        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void testExecute_ProgrammingError_NotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retryEnvelope.execute("embedding", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("bug");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void testExecute_TransientThenSuccess_ReturnsValue() {
        // GIVEN: two rate-limit failures, then success
        AtomicInteger attempts = new AtomicInteger();

        // WHEN
        String result = retryEnvelope.execute("fireflies.fetch", () -> {
            if (attempts.incrementAndGet() <= 2) {
                throw new ExternalApiException.RateLimitExceededException("fireflies");
            }
            return "ok";
        });

        // THEN
        assertThat(result).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(meterRegistry.get("retry_attempts_total").tag("operation", "fireflies.fetch").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void testExecute_TimeoutInCauseChain_Retried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retryEnvelope.execute("vector.upsert", () -> {
            attempts.incrementAndGet();
            throw new RuntimeException("wrapped", new TimeoutException("read timed out"));
        })).isInstanceOf(RuntimeException.class);

        assertThat(attempts.get()).isEqualTo(MAX_RETRIES + 1);
    }

    @Test
    void testConstructor_NegativeMaxRetries_Rejected() {
        assertThatThrownBy(() -> new RetryEnvelope(
                RetryRegistry.ofDefaults(),
                new RetryPolicy(RetryPolicy.DEFAULT_RETRIABLE_STATUSES),
                new IngestionMetrics(meterRegistry),
                -1,
                new BackoffIntervalFunction(0, 1.0, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testExecute_ZeroRetries_SingleAttempt() {
        RetryEnvelope noRetry = new RetryEnvelope(
                RetryRegistry.ofDefaults(),
                new RetryPolicy(RetryPolicy.DEFAULT_RETRIABLE_STATUSES),
                new IngestionMetrics(meterRegistry),
                0,
                new BackoffIntervalFunction(0, 1.0, 0));
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> noRetry.execute("slack.fetch", () -> {
            attempts.incrementAndGet();
            throw new ExternalApiException("slack", 502, "bad gateway");
        })).isInstanceOf(ExternalApiException.class);

        assertThat(attempts.get()).isEqualTo(1);
    }
}
