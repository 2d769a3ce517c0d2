package fr.lapetina.ollama.minutes.infrastructure.health;

import fr.lapetina.ollama.minutes.domain.model.EndpointStatus;
import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;
import fr.lapetina.ollama.minutes.infrastructure.http.OllamaHttpClient;
import fr.lapetina.ollama.minutes.infrastructure.pool.ConnectionPoolManager;
import fr.lapetina.ollama.minutes.infrastructure.pool.EndpointPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background health checker for LLM endpoints.
 *
 * Every interval, probes each enabled endpoint of every pool with health checks on.
 * Probes run concurrently and are isolated: a hanging or failing endpoint does not
 * delay the others. A probe answering within the slow-response budget marks the
 * endpoint HEALTHY, a slower one DEGRADED, a failed one UNHEALTHY. The probe timeout
 * must be longer than the slow-response budget, otherwise DEGRADED is unreachable.
 */
public final class EndpointHealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EndpointHealthChecker.class);

    private final ConnectionPoolManager poolManager;
    private final OllamaHttpClient httpClient;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final Duration probeTimeout;
    private final Duration slowResponseThreshold;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public EndpointHealthChecker(
            ConnectionPoolManager poolManager,
            OllamaHttpClient httpClient,
            Duration checkInterval,
            Duration probeTimeout,
            Duration slowResponseThreshold
    ) {
        if (probeTimeout.compareTo(slowResponseThreshold) <= 0) {
            throw new IllegalArgumentException("probeTimeout must exceed slowResponseThreshold: probeTimeout="
                    + probeTimeout + ", slowResponseThreshold=" + slowResponseThreshold);
        }
        this.poolManager = poolManager;
        this.httpClient = httpClient;
        this.checkInterval = checkInterval;
        this.probeTimeout = probeTimeout;
        this.slowResponseThreshold = slowResponseThreshold;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "endpoint-health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    public EndpointHealthChecker(ConnectionPoolManager poolManager, OllamaHttpClient httpClient) {
        this(poolManager, httpClient, Duration.ofSeconds(30), Duration.ofSeconds(30), Duration.ofSeconds(5));
    }

    /**
     * Starts the periodic health checking. The first cycle runs immediately.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runScheduledCycle,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health checker started with interval: {}", checkInterval);
        }
    }

    private void runScheduledCycle() {
        if (!running.get()) {
            return;
        }
        try {
            checkNow();
        } catch (RuntimeException e) {
            // An exception escaping here cancels the schedule
            log.error("Health check cycle failed", e);
        }
    }

    /**
     * Probes every enabled endpoint of every health-checked pool once.
     *
     * @return future completing when every probe has been applied
     */
    public CompletableFuture<Void> checkNow() {
        List<CompletableFuture<Void>> probes = new ArrayList<>();
        for (EndpointPool pool : poolManager.getPools()) {
            if (pool.isHealthCheckEnabled()) {
                probes.addAll(probePool(pool));
            }
        }
        log.debug("Health check cycle started: probes={}", probes.size());
        return CompletableFuture.allOf(probes.toArray(new CompletableFuture[0]));
    }

    /**
     * Probes the enabled endpoints of one pool, regardless of its health check flag.
     */
    public CompletableFuture<Void> checkPool(String poolId) {
        Optional<EndpointPool> pool = poolManager.getPool(poolId);
        if (pool.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.allOf(probePool(pool.get()).toArray(new CompletableFuture[0]));
    }

    private List<CompletableFuture<Void>> probePool(EndpointPool pool) {
        List<CompletableFuture<Void>> probes = new ArrayList<>();
        for (LlmEndpoint endpoint : pool.getRegistry().getEnabledEndpoints()) {
            probes.add(checkEndpoint(pool, endpoint));
        }
        return probes;
    }

    /**
     * Performs a health check on a single endpoint.
     */
    public CompletableFuture<Void> checkEndpoint(EndpointPool pool, LlmEndpoint endpoint) {
        long start = System.nanoTime();
        CompletableFuture<Boolean> probe;
        try {
            probe = httpClient.healthCheck(endpoint);
        } catch (RuntimeException e) {
            probe = CompletableFuture.failedFuture(e);
        }
        return probe
                .orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((healthy, ex) -> {
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                    EndpointStatus status = classify(healthy, ex, elapsed);
                    if (ex != null) {
                        log.warn("Health check failed: poolId={}, endpointId={}, error={}",
                                pool.getPoolId(), endpoint.getId(), ex.toString());
                    } else if (status == EndpointStatus.DEGRADED) {
                        log.info("Health check slow: poolId={}, endpointId={}, latencyMs={}",
                                pool.getPoolId(), endpoint.getId(), elapsed.toMillis());
                    }
                    pool.getRegistry().updateStatus(endpoint, status);
                    return null;
                });
    }

    EndpointStatus classify(Boolean healthy, Throwable error, Duration elapsed) {
        if (error != null || !Boolean.TRUE.equals(healthy)) {
            return EndpointStatus.UNHEALTHY;
        }
        return elapsed.compareTo(slowResponseThreshold) <= 0 ? EndpointStatus.HEALTHY : EndpointStatus.DEGRADED;
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Health checker stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
