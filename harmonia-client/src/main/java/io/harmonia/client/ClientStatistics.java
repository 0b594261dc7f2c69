package io.harmonia.client;

import io.harmonia.core.context.ExecutionContext;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/// Thread-safe counters of a {@link RateLimitedCacheClient}.
///
/// - `cache_hits` / `cache_misses`: lookups that did / did not find a cached response
/// - `outbound_calls`: attempts that reached the remote service, retries included
/// - `retries`: attempts after the first one
/// - `fallbacks`: responses served by the fallback
/// - `failures`: requests that ended with an exception
public final class ClientStatistics {

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong outboundCalls = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong fallbacks = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    void recordHit() {
        hits.incrementAndGet();
    }

    void recordMiss() {
        misses.incrementAndGet();
    }

    void recordOutboundCall() {
        outboundCalls.incrementAndGet();
    }

    void recordRetry() {
        retries.incrementAndGet();
    }

    void recordFallback() {
        fallbacks.incrementAndGet();
    }

    void recordFailure() {
        failures.incrementAndGet();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getOutboundCalls() {
        return outboundCalls.get();
    }

    public long getRetries() {
        return retries.get();
    }

    public long getFallbacks() {
        return fallbacks.get();
    }

    public long getFailures() {
        return failures.get();
    }

    /// @return hits divided by lookups, or 0 before the first lookup
    public double getHitRate() {
        long lookups = hits.get() + misses.get();
        return lookups == 0 ? 0.0 : (double) hits.get() / lookups;
    }

    /// Returns a point-in-time snapshot keyed by counter name.
    public Map<String, Object> toMap() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("cache_hits", getHits());
        snapshot.put("cache_misses", getMisses());
        snapshot.put("outbound_calls", getOutboundCalls());
        snapshot.put("retries", getRetries());
        snapshot.put("fallbacks", getFallbacks());
        snapshot.put("failures", getFailures());
        return snapshot;
    }

    /// Merges the current counters into the context's statistics under `key`.
    public void publishTo(ExecutionContext context, String key) {
        context.mergeStatistics(key, toMap());
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
