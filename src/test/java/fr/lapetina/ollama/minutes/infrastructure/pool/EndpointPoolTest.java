package fr.lapetina.ollama.minutes.infrastructure.pool;

import fr.lapetina.ollama.minutes.domain.model.EndpointStatus;
import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;
import fr.lapetina.ollama.minutes.domain.strategy.StrategyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class EndpointPoolTest {

    private LlmEndpoint primary;
    private LlmEndpoint secondary;
    private EndpointPool pool;

    static LlmEndpoint endpoint(String id, int priority, int maxConcurrent) {
        return LlmEndpoint.builder()
                .id(id)
                .baseUrl("http://" + id + ":11434")
                .modelName("llama3.1:8b")
                .priority(priority)
                .maxConcurrent(maxConcurrent)
                .initialStatus(EndpointStatus.HEALTHY)
                .build();
    }

    @BeforeEach
    void setUp() {
        primary = endpoint("primary", 9, 2);
        secondary = endpoint("secondary", 5, 2);
        pool = EndpointPool.builder("default")
                .strategy(StrategyType.HEALTH_BASED)
                .circuitBreakerThreshold(2)
                .circuitBreakerTimeout(Duration.ofMillis(100))
                .endpoint(primary)
                .endpoint(secondary)
                .build();
    }

    @Nested
    @DisplayName("acquire")
    class Acquire {

        @Test
        @DisplayName("should take a slot on the selected endpoint and release it on close")
        void shouldTakeAndReleaseSlot() {
            EndpointLease lease = pool.acquire();

            assertThat(lease.endpoint()).isSameAs(primary);
            assertThat(lease.poolId()).isEqualTo("default");
            assertThat(primary.getActiveConnections()).isEqualTo(1);

            lease.close();
            lease.close();

            assertThat(lease.isClosed()).isTrue();
            assertThat(primary.getActiveConnections()).isZero();
        }

        @Test
        @DisplayName("should move to the next endpoint when the best one is full")
        void shouldSkipFullEndpoint() {
            List<EndpointLease> leases = new ArrayList<>();
            leases.add(pool.acquire());
            leases.add(pool.acquire());

            EndpointLease third = pool.acquire();

            assertThat(third.endpoint()).isSameAs(secondary);
            leases.add(third);
            leases.forEach(EndpointLease::close);
        }

        @Test
        @DisplayName("should fail when every endpoint is disabled")
        void shouldFailWhenAllDisabled() {
            pool.setEndpointEnabled("primary", false);
            pool.setEndpointEnabled("secondary", false);

            assertThat(pool.hasAcquirableEndpoint()).isFalse();
            NoHealthyEndpointException thrown = catchThrowableOfType(() -> pool.acquire(), NoHealthyEndpointException.class);
            assertThat(thrown).isNotNull();
            assertThat(thrown.getPoolId()).isEqualTo("default");
        }

        @Test
        @DisplayName("should skip unhealthy and unknown endpoints")
        void shouldSkipUnroutableEndpoints() {
            pool.getRegistry().updateStatus(primary, EndpointStatus.UNHEALTHY);

            try (EndpointLease lease = pool.acquire()) {
                assertThat(lease.endpoint()).isSameAs(secondary);
            }

            pool.getRegistry().updateStatus(secondary, EndpointStatus.UNKNOWN);
            assertThatThrownBy(() -> pool.acquire()).isInstanceOf(NoHealthyEndpointException.class);
        }
    }

    @Nested
    @DisplayName("circuit breaker")
    class CircuitBreakerIntegration {

        private void failTwice(LlmEndpoint endpoint) {
            for (int i = 0; i < 2; i++) {
                try (EndpointLease lease = pool.acquire()) {
                    assertThat(lease.endpoint()).isSameAs(endpoint);
                    lease.recordFailure(LlmEndpoint.FailureKind.CONNECTION);
                }
            }
        }

        @Test
        @DisplayName("should exclude an endpoint with an open circuit, then let one trial through")
        void shouldExcludeThenTrial() throws InterruptedException {
            failTwice(primary);
            assertThat(pool.circuitBreaker(primary).getState()).isEqualTo(CircuitBreaker.State.OPEN);

            try (EndpointLease lease = pool.acquire()) {
                assertThat(lease.endpoint()).isSameAs(secondary);
            }

            Thread.sleep(150);

            try (EndpointLease trial = pool.acquire()) {
                assertThat(trial.endpoint()).isSameAs(primary);
                assertThat(pool.circuitBreaker(primary).getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
                trial.recordSuccess(Duration.ofMillis(20));
            }

            assertThat(pool.circuitBreaker(primary).getState()).isEqualTo(CircuitBreaker.State.CLOSED);
            assertThat(pool.circuitBreaker(primary).getFailureCount()).isZero();
        }

        @Test
        @DisplayName("should return the trial permit when a lease closes without an outcome")
        void shouldReturnAbandonedTrial() throws InterruptedException {
            failTwice(primary);
            Thread.sleep(150);

            EndpointLease abandoned = pool.acquire();
            assertThat(abandoned.endpoint()).isSameAs(primary);
            abandoned.close();

            try (EndpointLease retry = pool.acquire()) {
                assertThat(retry.endpoint()).isSameAs(primary);
            }
        }

        @Test
        @DisplayName("should keep the trial exclusive when a lease from before the opening closes without an outcome")
        void shouldKeepTrialWhenEarlierLeaseCloses() throws InterruptedException {
            LlmEndpoint only = endpoint("only", 5, 3);
            EndpointPool single = EndpointPool.builder("single")
                    .circuitBreakerThreshold(1)
                    .circuitBreakerTimeout(Duration.ofMillis(50))
                    .endpoint(only)
                    .build();

            EndpointLease earlier = single.acquire();
            assertThat(earlier.isTrial()).isFalse();
            try (EndpointLease failing = single.acquire()) {
                failing.recordFailure(LlmEndpoint.FailureKind.CONNECTION);
            }
            Thread.sleep(80);

            EndpointLease trial = single.acquire();
            assertThat(trial.isTrial()).isTrue();
            earlier.close();

            assertThat(single.hasAcquirableEndpoint()).isFalse();
            assertThatThrownBy(single::acquire).isInstanceOf(NoHealthyEndpointException.class);

            trial.recordSuccess(Duration.ofMillis(10));
            trial.close();
            assertThat(single.circuitBreaker(only).getState()).isEqualTo(CircuitBreaker.State.CLOSED);
            assertThat(only.getActiveConnections()).isZero();
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("should never exceed an endpoint's capacity under concurrent acquire and release")
        void shouldRespectCapacityUnderLoad() throws Exception {
            List<LlmEndpoint> endpoints = List.of(endpoint("a", 5, 2), endpoint("b", 5, 3), endpoint("c", 5, 1));
            EndpointPool.Builder builder = EndpointPool.builder("busy")
                    .strategy(StrategyType.LEAST_CONNECTIONS)
                    .circuitBreakerThreshold(1_000_000);
            endpoints.forEach(builder::endpoint);
            EndpointPool busy = builder.build();

            Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
            endpoints.forEach(e -> inFlight.put(e.getId(), new AtomicInteger()));
            Queue<String> violations = new ConcurrentLinkedQueue<>();
            AtomicInteger completed = new AtomicInteger();
            AtomicBoolean running = new AtomicBoolean(true);

            int workers = 12;
            ExecutorService executor = Executors.newFixedThreadPool(workers + 1);
            try {
                Future<?> sampler = executor.submit(() -> {
                    while (running.get()) {
                        for (LlmEndpoint e : endpoints) {
                            int active = e.getActiveConnections();
                            if (active < 0 || active > e.getMaxConcurrent()) {
                                violations.add(e.getId() + " active=" + active);
                            }
                        }
                        Thread.yield();
                    }
                });
                List<Future<?>> tasks = new ArrayList<>();
                for (int w = 0; w < workers; w++) {
                    int worker = w;
                    tasks.add(executor.submit(() -> {
                        for (int i = 0; i < 500; i++) {
                            EndpointLease lease;
                            try {
                                lease = busy.acquire();
                            } catch (NoHealthyEndpointException e) {
                                continue;
                            }
                            try (lease) {
                                LlmEndpoint held = lease.endpoint();
                                int holders = inFlight.get(held.getId()).incrementAndGet();
                                if (holders > held.getMaxConcurrent()) {
                                    violations.add(held.getId() + " holders=" + holders);
                                }
                                if ((worker + i) % 3 == 0) {
                                    lease.recordFailure(LlmEndpoint.FailureKind.OTHER);
                                } else {
                                    lease.recordSuccess(Duration.ofMillis(1));
                                }
                                inFlight.get(held.getId()).decrementAndGet();
                                completed.incrementAndGet();
                            }
                        }
                    }));
                }
                for (Future<?> task : tasks) {
                    task.get(30, TimeUnit.SECONDS);
                }
                running.set(false);
                sampler.get(5, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }

            assertThat(violations).isEmpty();
            assertThat(completed.get()).isPositive();
            assertThat(endpoints).allSatisfy(e -> assertThat(e.getActiveConnections()).isZero());
            assertThat(busy.snapshot().activeConnections()).isZero();
        }
    }

    @Nested
    @DisplayName("administration")
    class Administration {

        @Test
        @DisplayName("should reject duplicate endpoint ids")
        void shouldRejectDuplicates() {
            assertThat(pool.addEndpoint(endpoint("primary", 1, 1))).isFalse();
            assertThat(pool.addEndpoint(endpoint("tertiary", 1, 1))).isTrue();
            assertThat(pool.getEndpoints()).extracting(LlmEndpoint::getId)
                    .containsExactly("primary", "secondary", "tertiary");
        }

        @Test
        @DisplayName("should drop the circuit breaker of a removed endpoint")
        void shouldDropBreakerOnRemove() {
            assertThat(pool.findCircuitBreaker("secondary")).isPresent();

            assertThat(pool.removeEndpoint("secondary")).isTrue();

            assertThat(pool.findCircuitBreaker("secondary")).isEmpty();
            assertThat(pool.removeEndpoint("secondary")).isFalse();
        }

        @Test
        @DisplayName("should switch strategy at runtime")
        void shouldSwitchStrategy() {
            pool.setStrategy(StrategyType.LEAST_CONNECTIONS);

            assertThat(pool.getStrategyType()).isEqualTo(StrategyType.LEAST_CONNECTIONS);
            assertThat(pool.snapshot().strategy()).isEqualTo("least_connections");
        }

        @Test
        @DisplayName("should require at least one attempt")
        void shouldRejectZeroRetries() {
            assertThatThrownBy(() -> EndpointPool.builder("bad").maxRetries(0).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("snapshot should count endpoints by status")
    void shouldSnapshotStatusCounts() {
        pool.getRegistry().updateStatus(secondary, EndpointStatus.DEGRADED);
        EndpointLease lease = pool.acquire();

        PoolSnapshot snapshot = pool.snapshot();

        assertThat(snapshot.poolId()).isEqualTo("default");
        assertThat(snapshot.totalEndpoints()).isEqualTo(2);
        assertThat(snapshot.healthyEndpoints()).isEqualTo(1);
        assertThat(snapshot.degradedEndpoints()).isEqualTo(1);
        assertThat(snapshot.unhealthyEndpoints()).isZero();
        assertThat(snapshot.activeConnections()).isEqualTo(1);
        assertThat(snapshot.endpoints()).extracting(EndpointSnapshot::endpointId)
                .containsExactly("primary", "secondary");
        lease.close();
    }
}
