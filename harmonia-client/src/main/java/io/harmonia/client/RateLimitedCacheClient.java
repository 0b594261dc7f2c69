package io.harmonia.client;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.RateLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.logging.Logger;
import net.jodah.failsafe.Failsafe;
import net.jodah.failsafe.FailsafeException;
import net.jodah.failsafe.RetryPolicy;

/// Shared client for operations that call external identifier services.
///
/// ### Request path
/// 1. The request is reduced to a {@link RequestKey}; a cached response within the
///    TTL is returned without any outbound call.
/// 2. On a miss, one load runs per key: concurrent identical requests wait for it
///    and share its response.
/// 3. Each attempt takes a concurrency permit and a rate-limiter token, then calls
///    the {@link RemoteCall}.
/// 4. Failures the {@link TransientFailureClassifier} accepts are retried with
///    exponential backoff up to `maxAttempts`. Other failures end the request at once.
/// 5. When the retries of a transient failure run out, the {@link FallbackCall}, if
///    any, is consulted.
///
/// Only successful, non-null remote responses are cached. Fallback answers and
/// failures never are.
///
/// @implNote Thread-safe. The cache, limiter and permits are shared by every thread
/// using the instance, such as the workers of one chunked step.
///
/// @param <Q> request type
/// @param <R> response type
public class RateLimitedCacheClient<Q, R> {

    private static final Logger logger = Logger.getLogger(RateLimitedCacheClient.class.getName());

    private final String name;
    private final ClientConfig config;
    private final RemoteCall<Q, R> remoteCall;
    private final FallbackCall<Q, R> fallbackCall;
    private final TransientFailureClassifier classifier;
    private final Function<? super Q, RequestKey> keyFunction;
    private final RateLimiter rateLimiter;
    private final Semaphore permits;
    private final Cache<String, Optional<R>> cache;
    private final ClientStatistics statistics = new ClientStatistics();

    private RateLimitedCacheClient(Builder<Q, R> builder) {
        this.name = builder.name;
        this.config = builder.config;
        this.remoteCall = Objects.requireNonNull(builder.remoteCall, "remoteCall required");
        this.fallbackCall = builder.fallbackCall;
        this.classifier = builder.classifier;
        this.keyFunction = builder.keyFunction;
        this.rateLimiter = RateLimiter.create(config.getRequestsPerSecond());
        this.permits = new Semaphore(config.getMaxConcurrency(), true);
        this.cache =
                CacheBuilder.newBuilder()
                        .expireAfterWrite(config.getCacheTtl().toMillis(), TimeUnit.MILLISECONDS)
                        .maximumSize(config.getMaxCacheEntries())
                        .ticker(builder.ticker)
                        .build();
    }

    public static <Q, R> Builder<Q, R> builder(RemoteCall<Q, R> remoteCall) {
        return new Builder<>(remoteCall);
    }

    /// Returns the response to a request.
    ///
    /// @param request the request, not null
    /// @return the response; null when the service (or fallback) has no answer
    /// @throws ClientCallException if the request failed and no fallback answered
    public R get(Q request) throws ClientCallException {
        Objects.requireNonNull(request, "request must not be null");
        RequestKey key = keyFunction.apply(request);

        Optional<R> cached = cache.getIfPresent(key.hash());
        if (cached != null) {
            statistics.recordHit();
            logger.fine(() -> name + " cache hit " + key);
            return cached.orElse(null);
        }
        statistics.recordMiss();

        AtomicInteger attempts = new AtomicInteger();
        try {
            Optional<R> loaded = cache.get(key.hash(), () -> fetch(request, attempts));
            if (loaded.isEmpty()) {
                cache.invalidate(key.hash());
            }
            return loaded.orElse(null);
        } catch (ExecutionException | UncheckedExecutionException | ExecutionError e) {
            return recover(request, key, unwrap(e), Math.max(1, attempts.get()));
        }
    }

    /// Returns responses for several requests, in request order.
    ///
    /// @throws ClientCallException on the first request that fails without a fallback
    public List<R> getAll(List<? extends Q> requests) throws ClientCallException {
        List<R> responses = new ArrayList<>(requests.size());
        for (Q request : requests) {
            responses.add(get(request));
        }
        return responses;
    }

    private Optional<R> fetch(Q request, AtomicInteger attempts) {
        RetryPolicy<R> retryPolicy =
                new RetryPolicy<R>()
                        .handleIf(failure -> classifier.isTransient(failure))
                        .withMaxAttempts(config.getMaxAttempts())
                        .withBackoff(
                                config.getInitialBackoff().toMillis(),
                                config.getMaxBackoff().toMillis(),
                                ChronoUnit.MILLIS,
                                config.getBackoffFactor())
                        .onRetry(
                                event -> {
                                    statistics.recordRetry();
                                    logger.warning(
                                            name
                                                    + " attempt "
                                                    + event.getAttemptCount()
                                                    + " failed ("
                                                    + event.getLastFailure()
                                                    + "); retrying");
                                });
        return Optional.ofNullable(Failsafe.with(retryPolicy).get(() -> callOnce(request, attempts)));
    }

    private R callOnce(Q request, AtomicInteger attempts) throws Exception {
        permits.acquire();
        try {
            rateLimiter.acquire();
            attempts.incrementAndGet();
            statistics.recordOutboundCall();
            return remoteCall.call(request);
        } finally {
            permits.release();
        }
    }

    private R recover(Q request, RequestKey key, Throwable failure, int attempts)
            throws ClientCallException {
        if (failure instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            statistics.recordFailure();
            throw new ClientCallException(name + " interrupted calling " + key, attempts, failure);
        }
        if (fallbackCall != null && classifier.isTransient(failure)) {
            logger.warning(
                    name + " giving up on " + key + " after " + attempts + " attempts; using fallback");
            try {
                R response = fallbackCall.fallback(request, failure);
                statistics.recordFallback();
                return response;
            } catch (Exception fallbackFailure) {
                fallbackFailure.addSuppressed(failure);
                statistics.recordFailure();
                throw new ClientCallException(
                        name + " fallback failed for " + key + ": " + fallbackFailure.getMessage(),
                        attempts,
                        fallbackFailure);
            }
        }
        statistics.recordFailure();
        logger.severe(name + " request " + key + " failed after " + attempts + " attempts: " + failure);
        throw new ClientCallException(
                name + " request failed after " + attempts + " attempts: " + failure.getMessage(),
                attempts,
                failure);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof ExecutionException
                        || current instanceof UncheckedExecutionException
                        || current instanceof ExecutionError
                        || current instanceof FailsafeException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /// Drops every cached response.
    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long cacheSize() {
        return cache.size();
    }

    public ClientStatistics getStatistics() {
        return statistics;
    }

    public String getName() {
        return name;
    }

    /// Fluent builder for {@link RateLimitedCacheClient}.
    public static final class Builder<Q, R> {
        private final RemoteCall<Q, R> remoteCall;
        private String name = "client";
        private ClientConfig config = ClientConfig.defaults();
        private FallbackCall<Q, R> fallbackCall;
        private TransientFailureClassifier classifier = TransientFailureClassifier.DEFAULT;
        private Function<? super Q, RequestKey> keyFunction = RequestKey::of;
        private Ticker ticker = Ticker.systemTicker();

        private Builder(RemoteCall<Q, R> remoteCall) {
            this.remoteCall = remoteCall;
        }

        /// Name used in log messages, e.g. the service being called.
        public Builder<Q, R> name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        public Builder<Q, R> config(ClientConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder<Q, R> fallback(FallbackCall<Q, R> fallbackCall) {
            this.fallbackCall = fallbackCall;
            return this;
        }

        public Builder<Q, R> classifier(TransientFailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /// Sets how requests map to cache keys; defaults to {@link RequestKey#of(Object)}.
        public Builder<Q, R> keyFunction(Function<? super Q, RequestKey> keyFunction) {
            this.keyFunction = Objects.requireNonNull(keyFunction, "keyFunction must not be null");
            return this;
        }

        /// Sets the time source of cache expiry.
        public Builder<Q, R> ticker(Ticker ticker) {
            this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
            return this;
        }

        public RateLimitedCacheClient<Q, R> build() {
            return new RateLimitedCacheClient<>(this);
        }
    }
}
