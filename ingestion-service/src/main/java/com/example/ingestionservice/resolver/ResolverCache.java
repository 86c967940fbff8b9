package com.example.ingestionservice.resolver;

import com.example.ingestionservice.client.external.ExternalApiException;
import com.example.ingestionservice.metrics.IngestionMetrics;
import com.example.ingestionservice.retry.RetryEnvelope;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Memoized authoritative lookups for one job run.
 * 
 * CRITICAL DESIGN:
 * - One map per {@link IdentityKind}; an empty Optional is the "unresolved" sentinel
 * - A key, once stored (value or sentinel), is never looked up again in this run
 * - Miss → exactly one logical lookup: throttle before every attempt, retries via {@link RetryEnvelope}
 * - After retries are exhausted the sentinel is cached and the failure counted
 * - Rejected credentials are rethrown: every later lookup would fail the same way
 * - Never evicted, never persisted; discarded with the job
 * 
 * Not thread-safe. A cache belongs to exactly one batch, and a batch
 * processes its records sequentially.
 */
@Slf4j
public class ResolverCache {

    private static final int MAX_RECORDED_ERRORS = 20;

    // counter slots
    private static final int HITS = 0;
    private static final int MISSES = 1;
    private static final int FAILURES = 2;

    private final IdentityLookup identityLookup;
    private final LookupThrottle lookupThrottle;
    private final RetryEnvelope retryEnvelope;
    private final IngestionMetrics ingestionMetrics;

    private final Map<IdentityKind, Map<String, Optional<String>>> entries = new EnumMap<>(IdentityKind.class);
    private final Map<IdentityKind, long[]> counters = new EnumMap<>(IdentityKind.class);
    private final List<String> lookupErrors = new ArrayList<>();

    public ResolverCache(IdentityLookup identityLookup,
                         LookupThrottle lookupThrottle,
                         RetryEnvelope retryEnvelope,
                         IngestionMetrics ingestionMetrics) {
        this.identityLookup = identityLookup;
        this.lookupThrottle = lookupThrottle;
        this.retryEnvelope = retryEnvelope;
        this.ingestionMetrics = ingestionMetrics;
        for (IdentityKind kind : IdentityKind.values()) {
            entries.put(kind, new HashMap<>());
            counters.put(kind, new long[3]);
        }
    }

    /**
     * @return resolved value, or empty when unresolved (now or earlier in this run)
     */
    public Optional<String> resolve(IdentityKind kind, String rawId) {
        if (rawId == null || rawId.isBlank()) {
            return Optional.empty();
        }

        Map<String, Optional<String>> cache = entries.get(kind);
        Optional<String> cached = cache.get(rawId);
        if (cached != null) {
            counters.get(kind)[HITS]++;
            return cached;
        }

        counters.get(kind)[MISSES]++;
        Optional<String> result;
        try {
            result = retryEnvelope.execute("resolver." + kind.name().toLowerCase(Locale.ROOT), () -> {
                lookupThrottle.acquire();
                Optional<String> value = identityLookup.lookup(kind, rawId);
                return value != null ? value : Optional.<String>empty();
            });
        } catch (ExternalApiException.AuthenticationException | ExternalApiException.SourceNotConfiguredException e) {
            throw e;
        } catch (RuntimeException e) {
            counters.get(kind)[FAILURES]++;
            ingestionMetrics.recordLookupFailure();
            recordError(kind + " " + rawId + ": " + e.getMessage());
            log.warn("⚠️ Lookup failed, caching as unresolved: kind={}, rawId={}, error={}",
                    kind, rawId, e.getMessage());
            result = Optional.empty();
        }

        cache.put(rawId, result);
        return result;
    }

    public boolean contains(IdentityKind kind, String rawId) {
        return entries.get(kind).containsKey(rawId);
    }

    public long totalLookupFailures() {
        long total = 0;
        for (long[] c : counters.values()) {
            total += c[FAILURES];
        }
        return total;
    }

    public List<String> getLookupErrors() {
        return Collections.unmodifiableList(lookupErrors);
    }

    public Map<String, ResolverCacheStats> stats() {
        Map<String, ResolverCacheStats> stats = new HashMap<>();
        for (IdentityKind kind : IdentityKind.values()) {
            Map<String, Optional<String>> cache = entries.get(kind);
            long[] c = counters.get(kind);
            int unresolved = (int) cache.values().stream().filter(Optional::isEmpty).count();
            stats.put(kind.name().toLowerCase(Locale.ROOT), ResolverCacheStats.builder()
                    .entries(cache.size())
                    .unresolvedEntries(unresolved)
                    .hits(c[HITS])
                    .misses(c[MISSES])
                    .lookupFailures(c[FAILURES])
                    .build());
        }
        return stats;
    }

    private void recordError(String message) {
        if (lookupErrors.size() < MAX_RECORDED_ERRORS) {
            lookupErrors.add(message);
        }
    }
}
