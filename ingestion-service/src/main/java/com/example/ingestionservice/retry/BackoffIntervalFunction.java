package com.example.ingestionservice.retry;

import io.github.resilience4j.core.IntervalFunction;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Capped exponential backoff with ±25% jitter.
 * 
 * delay(n) = min(base * factor^n, max) * (1 + jitter), jitter uniform in [-0.25, 0.25],
 * where n = 0 before the first retry.
 */
public class BackoffIntervalFunction implements IntervalFunction {

    public static final double JITTER_FRACTION = 0.25;

    private final long baseDelayMillis;
    private final double factor;
    private final long maxDelayMillis;
    private final DoubleSupplier random;

    public BackoffIntervalFunction(long baseDelayMillis, double factor, long maxDelayMillis) {
        this(baseDelayMillis, factor, maxDelayMillis, () -> ThreadLocalRandom.current().nextDouble());
    }

    BackoffIntervalFunction(long baseDelayMillis, double factor, long maxDelayMillis, DoubleSupplier random) {
        if (baseDelayMillis < 0 || maxDelayMillis < 0 || factor < 1.0) {
            throw new IllegalArgumentException("Invalid backoff: base=" + baseDelayMillis
                    + ", factor=" + factor + ", max=" + maxDelayMillis);
        }
        this.baseDelayMillis = baseDelayMillis;
        this.factor = factor;
        this.maxDelayMillis = maxDelayMillis;
        this.random = random;
    }

    /**
     * @param numOfAttempts Resilience4j attempt number, 1 for the first failed call
     */
    @Override
    public Long apply(Integer numOfAttempts) {
        int retryIndex = Math.max(0, numOfAttempts - 1);
        double capped = Math.min(baseDelayMillis * Math.pow(factor, retryIndex), maxDelayMillis);
        double jitter = (random.getAsDouble() * 2.0 - 1.0) * JITTER_FRACTION;
        return Math.max(0L, Math.round(capped * (1.0 + jitter)));
    }
}
