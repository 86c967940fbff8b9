package com.example.ingestionservice.resolver;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.function.LongSupplier;

/**
 * Process-wide minimum interval between authoritative lookups.
 * 
 * CRITICAL DESIGN:
 * - ONE instance per process (Spring singleton), shared by every batch and every cache
 * - acquire() blocks the calling thread until minInterval has passed since the previous call
 * - synchronized: concurrent batches queue on the same timestamp
 * - Clock and sleeper are injectable so tests run without real sleeps
 */
@Component
@Slf4j
public class LookupThrottle {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    @Getter
    private final long minIntervalMillis;
    private final LongSupplier clockMillis;
    private final Sleeper sleeper;

    private long lastCallMillis = Long.MIN_VALUE;

    @Autowired
    public LookupThrottle(@Value("${ingestion.resolver.min-interval-ms:100}") long minIntervalMillis) {
        this(minIntervalMillis, System::currentTimeMillis, Thread::sleep);
    }

    public LookupThrottle(long minIntervalMillis, LongSupplier clockMillis, Sleeper sleeper) {
        if (minIntervalMillis < 0) {
            throw new IllegalArgumentException("minIntervalMillis must be >= 0");
        }
        this.minIntervalMillis = minIntervalMillis;
        this.clockMillis = clockMillis;
        this.sleeper = sleeper;
    }

    public synchronized void acquire() {
        long now = clockMillis.getAsLong();
        if (lastCallMillis != Long.MIN_VALUE) {
            long waitMillis = lastCallMillis + minIntervalMillis - now;
            if (waitMillis > 0) {
                try {
                    sleeper.sleep(waitMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for lookup throttle", e);
                }
                now = clockMillis.getAsLong();
            }
        }
        lastCallMillis = now;
    }
}
