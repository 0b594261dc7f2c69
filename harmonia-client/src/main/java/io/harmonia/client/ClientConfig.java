package io.harmonia.client;

import java.time.Duration;
import java.util.Objects;

/// Settings of a {@link RateLimitedCacheClient}.
///
/// ### Default Values
/// - `requestsPerSecond`: `10`
/// - `maxConcurrency`: `4`
/// - `cacheTtl`: 60 minutes
/// - `maxCacheEntries`: `10000`
/// - `maxAttempts`: `3`
/// - `initialBackoff`: 1 second, doubling up to `maxBackoff` (30 seconds)
///
/// Instances are immutable; use {@link #builder()}.
public final class ClientConfig {

    private final double requestsPerSecond;
    private final int maxConcurrency;
    private final Duration cacheTtl;
    private final long maxCacheEntries;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double backoffFactor;

    private ClientConfig(Builder builder) {
        if (!(builder.requestsPerSecond > 0)) {
            throw new IllegalArgumentException("requestsPerSecond must be positive");
        }
        if (builder.maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        if (builder.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (builder.maxCacheEntries < 0) {
            throw new IllegalArgumentException("maxCacheEntries must not be negative");
        }
        Objects.requireNonNull(builder.cacheTtl, "cacheTtl must not be null");
        Objects.requireNonNull(builder.initialBackoff, "initialBackoff must not be null");
        Objects.requireNonNull(builder.maxBackoff, "maxBackoff must not be null");
        if (builder.initialBackoff.toMillis() < 1
                || builder.maxBackoff.compareTo(builder.initialBackoff) <= 0) {
            throw new IllegalArgumentException(
                    "initialBackoff must be at least 1 ms and shorter than maxBackoff");
        }
        if (!(builder.backoffFactor > 1)) {
            throw new IllegalArgumentException("backoffFactor must be greater than 1");
        }
        this.requestsPerSecond = builder.requestsPerSecond;
        this.maxConcurrency = builder.maxConcurrency;
        this.cacheTtl = builder.cacheTtl;
        this.maxCacheEntries = builder.maxCacheEntries;
        this.maxAttempts = builder.maxAttempts;
        this.initialBackoff = builder.initialBackoff;
        this.maxBackoff = builder.maxBackoff;
        this.backoffFactor = builder.backoffFactor;
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getRequestsPerSecond() {
        return requestsPerSecond;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public long getMaxCacheEntries() {
        return maxCacheEntries;
    }

    /// @return total attempts per request, including the first one
    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public double getBackoffFactor() {
        return backoffFactor;
    }

    @Override
    public String toString() {
        return "ClientConfig{rps="
                + requestsPerSecond
                + ", concurrency="
                + maxConcurrency
                + ", ttl="
                + cacheTtl
                + ", attempts="
                + maxAttempts
                + "}";
    }

    public static final class Builder {
        private double requestsPerSecond = 10;
        private int maxConcurrency = 4;
        private Duration cacheTtl = Duration.ofMinutes(60);
        private long maxCacheEntries = 10_000;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double backoffFactor = 2.0;

        private Builder() {}

        public Builder requestsPerSecond(double requestsPerSecond) {
            this.requestsPerSecond = requestsPerSecond;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        /// Upper bound on cached responses; `0` disables caching.
        public Builder maxCacheEntries(long maxCacheEntries) {
            this.maxCacheEntries = maxCacheEntries;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoff(Duration initialBackoff, Duration maxBackoff) {
            this.initialBackoff = initialBackoff;
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }
}
