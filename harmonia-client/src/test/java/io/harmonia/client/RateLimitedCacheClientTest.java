package io.harmonia.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import com.google.common.base.Ticker;
import io.harmonia.core.context.ExecutionContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RateLimitedCacheClientTest {

    private static final ClientConfig FAST =
            ClientConfig.builder()
                    .requestsPerSecond(1000)
                    .maxConcurrency(4)
                    .cacheTtl(Duration.ofMinutes(10))
                    .maxAttempts(3)
                    .backoff(Duration.ofMillis(1), Duration.ofMillis(5))
                    .build();

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker =
            new Ticker() {
                @Override
                public long read() {
                    return nanos.get();
                }
            };

    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        calls = new AtomicInteger();
    }

    private RateLimitedCacheClient<String, String> client(RemoteCall<String, String> remote) {
        return RateLimitedCacheClient.builder(remote).name("uniprot").config(FAST).ticker(ticker).build();
    }

    private RemoteCall<String, String> echo() {
        return request -> {
            calls.incrementAndGet();
            return "mapped:" + request;
        };
    }

    // Fails with the given status `failures` times, then answers.
    private RemoteCall<String, String> failing(int failures, int status) {
        return request -> {
            if (calls.incrementAndGet() <= failures) {
                throw new ServiceException(status, "status " + status);
            }
            return "mapped:" + request;
        };
    }

    @Nested
    class Caching {

        @Test
        void shouldCallRemoteOnceForRepeatedRequest() throws Exception {
            RateLimitedCacheClient<String, String> client = client(echo());

            assertThat(client.get("P04637")).isEqualTo("mapped:P04637");
            assertThat(client.get("P04637")).isEqualTo("mapped:P04637");
            assertThat(client.get("P04637")).isEqualTo("mapped:P04637");

            ClientStatistics stats = client.getStatistics();
            assertThat(calls.get()).isEqualTo(1);
            assertThat(stats.getOutboundCalls()).isEqualTo(1);
            assertThat(stats.getMisses()).isEqualTo(1);
            assertThat(stats.getHits()).isEqualTo(2);
            assertThat(stats.getHitRate()).isCloseTo(2.0 / 3, offset(1e-9));
        }

        @Test
        void shouldShareEntriesAcrossMapOrderings() throws Exception {
            RateLimitedCacheClient<Map<String, Object>, String> client =
                    RateLimitedCacheClient.<Map<String, Object>, String>builder(
                                    request -> {
                                        calls.incrementAndGet();
                                        return "ok";
                                    })
                            .config(FAST)
                            .build();
            Map<String, Object> first = new LinkedHashMap<>();
            first.put("id", "P04637");
            first.put("from", "UniProtKB");
            Map<String, Object> second = new LinkedHashMap<>();
            second.put("from", "UniProtKB");
            second.put("id", "P04637");

            client.get(first);
            client.get(second);

            assertThat(calls.get()).isEqualTo(1);
        }

        @Test
        void shouldNotServeCachedAnswerForDifferentRequest() throws Exception {
            RateLimitedCacheClient<Map<String, Object>, String> client =
                    RateLimitedCacheClient.<Map<String, Object>, String>builder(
                                    request -> {
                                        calls.incrementAndGet();
                                        return "answer:" + request;
                                    })
                            .config(FAST)
                            .build();

            String first = client.get(Map.of("q", "TP53&species=mouse"));
            String second = client.get(Map.of("q", "TP53", "species", "mouse"));

            assertThat(second).isNotEqualTo(first);
            assertThat(calls.get()).isEqualTo(2);
        }

        @Test
        void shouldExpireEntriesAfterTtl() throws Exception {
            RateLimitedCacheClient<String, String> client = client(echo());

            client.get("P04637");
            nanos.addAndGet(TimeUnit.MINUTES.toNanos(9));
            client.get("P04637");
            nanos.addAndGet(TimeUnit.MINUTES.toNanos(2));
            client.get("P04637");

            assertThat(calls.get()).isEqualTo(2);
        }

        @Test
        void shouldNotCacheNullResponses() throws Exception {
            RateLimitedCacheClient<String, String> client =
                    client(
                            request -> {
                                calls.incrementAndGet();
                                return null;
                            });

            assertThat(client.get("unknown")).isNull();
            assertThat(client.get("unknown")).isNull();

            assertThat(calls.get()).isEqualTo(2);
            assertThat(client.cacheSize()).isZero();
        }

        @Test
        void shouldDropEverythingOnInvalidateAll() throws Exception {
            RateLimitedCacheClient<String, String> client = client(echo());
            client.getAll(List.of("a", "b"));

            client.invalidateAll();
            client.get("a");

            assertThat(calls.get()).isEqualTo(3);
        }

        @Test
        void shouldReturnBatchResponsesInRequestOrder() throws Exception {
            RateLimitedCacheClient<String, String> client = client(echo());

            assertThat(client.getAll(List.of("b", "a", "b")))
                    .containsExactly("mapped:b", "mapped:a", "mapped:b");
            assertThat(calls.get()).isEqualTo(2);
        }
    }

    @Nested
    class Retries {

        @Test
        void shouldRetryTransientFailuresAndCacheTheAnswer() throws Exception {
            RateLimitedCacheClient<String, String> client = client(failing(2, 503));

            assertThat(client.get("P04637")).isEqualTo("mapped:P04637");
            assertThat(client.get("P04637")).isEqualTo("mapped:P04637");

            assertThat(calls.get()).isEqualTo(3);
            assertThat(client.getStatistics().getRetries()).isEqualTo(2);
            assertThat(client.getStatistics().getOutboundCalls()).isEqualTo(3);
        }

        @Test
        void shouldFailAfterMaxAttemptsWithoutCaching() {
            RateLimitedCacheClient<String, String> client = client(failing(100, 502));

            assertThatThrownBy(() -> client.get("P04637"))
                    .isInstanceOfSatisfying(
                            ClientCallException.class,
                            e -> {
                                assertThat(e.getAttempts()).isEqualTo(3);
                                assertThat(e.getCause()).isInstanceOf(ServiceException.class);
                            });
            assertThatThrownBy(() -> client.get("P04637")).isInstanceOf(ClientCallException.class);

            assertThat(calls.get()).isEqualTo(6);
            assertThat(client.getStatistics().getFailures()).isEqualTo(2);
        }

        @Test
        void shouldNotRetryPermanentFailures() {
            RateLimitedCacheClient<String, String> client = client(failing(100, 400));

            assertThatThrownBy(() -> client.get("bad id"))
                    .isInstanceOf(ClientCallException.class)
                    .hasMessageContaining("after 1 attempts");
            assertThat(calls.get()).isEqualTo(1);
            assertThat(client.getStatistics().getRetries()).isZero();
        }

        @Test
        void shouldTreatRuntimeExceptionsAsPermanentByDefault() {
            RateLimitedCacheClient<String, String> client =
                    client(
                            request -> {
                                calls.incrementAndGet();
                                throw new IllegalArgumentException("malformed identifier");
                            });

            assertThatThrownBy(() -> client.get("x"))
                    .isInstanceOf(ClientCallException.class)
                    .hasRootCauseInstanceOf(IllegalArgumentException.class);
            assertThat(calls.get()).isEqualTo(1);
        }
    }

    @Nested
    class Fallbacks {

        @Test
        void shouldUseFallbackOnlyAfterRetriesAndNeverCacheIt() throws Exception {
            AtomicInteger fallbackCalls = new AtomicInteger();
            RateLimitedCacheClient<String, String> client =
                    RateLimitedCacheClient.builder(failing(100, 503))
                            .config(FAST)
                            .fallback(
                                    (request, failure) -> {
                                        fallbackCalls.incrementAndGet();
                                        assertThat(failure).isInstanceOf(ServiceException.class);
                                        return "local:" + request;
                                    })
                            .build();

            assertThat(client.get("P04637")).isEqualTo("local:P04637");
            assertThat(client.get("P04637")).isEqualTo("local:P04637");

            assertThat(calls.get()).isEqualTo(6);
            assertThat(fallbackCalls.get()).isEqualTo(2);
            assertThat(client.getStatistics().getFallbacks()).isEqualTo(2);
            assertThat(client.cacheSize()).isZero();
        }

        @Test
        void shouldSkipFallbackForPermanentFailures() {
            RateLimitedCacheClient<String, String> client =
                    RateLimitedCacheClient.builder(failing(100, 404))
                            .config(FAST)
                            .fallback((request, failure) -> "local")
                            .build();

            assertThatThrownBy(() -> client.get("P04637")).isInstanceOf(ClientCallException.class);
            assertThat(client.getStatistics().getFallbacks()).isZero();
        }

        @Test
        void shouldReportFailingFallback() {
            RateLimitedCacheClient<String, String> client =
                    RateLimitedCacheClient.builder(failing(100, 503))
                            .config(FAST)
                            .fallback(
                                    (request, failure) -> {
                                        throw new IllegalStateException("local index missing");
                                    })
                            .build();

            assertThatThrownBy(() -> client.get("P04637"))
                    .isInstanceOf(ClientCallException.class)
                    .hasMessageContaining("local index missing");
        }
    }

    @Nested
    class Concurrency {

        @Test
        void shouldShareOneLoadBetweenConcurrentIdenticalRequests() throws Exception {
            RateLimitedCacheClient<String, String> client =
                    client(
                            request -> {
                                calls.incrementAndGet();
                                Thread.sleep(200);
                                return "mapped:" + request;
                            });
            ExecutorService pool = Executors.newFixedThreadPool(5);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<String>> results = new ArrayList<>();
                for (int i = 0; i < 5; i++) {
                    results.add(
                            pool.submit(
                                    () -> {
                                        start.await();
                                        return client.get("P04637");
                                    }));
                }
                start.countDown();
                for (Future<String> result : results) {
                    assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("mapped:P04637");
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(calls.get()).isEqualTo(1);
        }

        @Test
        void shouldBoundRequestsInFlight() throws Exception {
            AtomicInteger inFlight = new AtomicInteger();
            AtomicInteger maxInFlight = new AtomicInteger();
            RateLimitedCacheClient<String, String> client =
                    RateLimitedCacheClient.<String, String>builder(
                                    request -> {
                                        int now = inFlight.incrementAndGet();
                                        maxInFlight.accumulateAndGet(now, Math::max);
                                        Thread.sleep(50);
                                        inFlight.decrementAndGet();
                                        return request;
                                    })
                            .config(
                                    ClientConfig.builder()
                                            .requestsPerSecond(1000)
                                            .maxConcurrency(2)
                                            .build())
                            .build();
            ExecutorService pool = Executors.newFixedThreadPool(6);
            try {
                List<Future<String>> results = new ArrayList<>();
                for (int i = 0; i < 6; i++) {
                    String id = "id-" + i;
                    results.add(pool.submit(() -> client.get(id)));
                }
                for (Future<String> result : results) {
                    result.get(5, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(maxInFlight.get()).isBetween(1, 2);
        }

        @Test
        void shouldThrottleToConfiguredRate() throws Exception {
            RateLimitedCacheClient<String, String> client =
                    RateLimitedCacheClient.builder(echo())
                            .config(ClientConfig.builder().requestsPerSecond(5).build())
                            .build();

            long started = System.nanoTime();
            client.getAll(List.of("a", "b", "c", "d", "e", "f"));
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertThat(elapsedMillis).isGreaterThanOrEqualTo(800);
        }
    }

    @Test
    void shouldPublishCountersIntoContextStatistics() throws Exception {
        RateLimitedCacheClient<String, String> client = client(echo());
        client.get("a");
        client.get("a");
        ExecutionContext context = ExecutionContext.builder().pipelineName("p").build();

        client.getStatistics().publishTo(context, "uniprot_client");

        assertThat(context.getStatistic("uniprot_client"))
                .contains(
                        Map.of(
                                "cache_hits", 1L,
                                "cache_misses", 1L,
                                "outbound_calls", 1L,
                                "retries", 0L,
                                "fallbacks", 0L,
                                "failures", 0L));
    }
}
