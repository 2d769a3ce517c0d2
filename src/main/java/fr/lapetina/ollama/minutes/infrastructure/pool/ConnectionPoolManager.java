package fr.lapetina.ollama.minutes.infrastructure.pool;

import fr.lapetina.ollama.minutes.domain.model.GenerationRequest;
import fr.lapetina.ollama.minutes.domain.model.GenerationResponse;
import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;
import fr.lapetina.ollama.minutes.domain.strategy.StrategyType;
import fr.lapetina.ollama.minutes.infrastructure.concurrent.Sleeper;
import fr.lapetina.ollama.minutes.infrastructure.http.OllamaHttpClient;
import fr.lapetina.ollama.minutes.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Owns the endpoint pools and routes generate calls through them.
 *
 * One instance per client, constructed explicitly and passed to its users. Endpoint
 * state is guarded per endpoint and per circuit breaker; there is no manager-wide lock.
 */
public final class ConnectionPoolManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPoolManager.class);

    private final Map<String, EndpointPool> pools = new ConcurrentHashMap<>();
    private final OllamaHttpClient httpClient;
    private final MetricsRegistry metrics;
    private final Sleeper sleeper;
    private volatile String currentPoolId;

    public ConnectionPoolManager(
            List<EndpointPool> initialPools,
            String currentPoolId,
            OllamaHttpClient httpClient,
            MetricsRegistry metrics,
            Sleeper sleeper
    ) {
        this.httpClient = httpClient;
        this.metrics = metrics;
        this.sleeper = sleeper;
        for (EndpointPool pool : initialPools) {
            createPool(pool);
        }
        this.currentPoolId = currentPoolId;
        log.info("ConnectionPoolManager initialized: pools={}, currentPool={}", pools.keySet(), currentPoolId);
    }

    /**
     * Registers a pool.
     *
     * @return false if a pool with the same ID exists
     */
    public boolean createPool(EndpointPool pool) {
        if (pools.putIfAbsent(pool.getPoolId(), pool) != null) {
            log.warn("Pool already exists: poolId={}", pool.getPoolId());
            return false;
        }
        pool.getEndpoints().forEach(endpoint -> metrics.registerEndpoint(pool.getPoolId(), endpoint));
        pool.getRegistry().addListener(event -> {
            switch (event.type()) {
                case ADDED -> metrics.registerEndpoint(event.poolId(), event.endpoint());
                case REMOVED -> metrics.unregisterEndpoint(event.poolId(), event.endpoint().getId());
                default -> { }
            }
        });
        log.info("Pool created: poolId={}, strategy={}, endpoints={}",
                pool.getPoolId(), pool.getStrategyType().configName(), pool.getRegistry().size());
        return true;
    }

    public boolean removePool(String poolId) {
        EndpointPool removed = pools.remove(poolId);
        if (removed == null) {
            return false;
        }
        removed.getEndpoints().forEach(endpoint -> metrics.unregisterEndpoint(poolId, endpoint.getId()));
        log.info("Pool removed: poolId={}", poolId);
        return true;
    }

    public boolean setCurrentPool(String poolId) {
        if (!pools.containsKey(poolId)) {
            return false;
        }
        currentPoolId = poolId;
        log.info("Current pool changed: poolId={}", poolId);
        return true;
    }

    public String getCurrentPoolId() {
        return currentPoolId;
    }

    public Optional<EndpointPool> getPool(String poolId) {
        return Optional.ofNullable(pools.get(poolId));
    }

    public Collection<EndpointPool> getPools() {
        return List.copyOf(pools.values());
    }

    /**
     * Acquires an endpoint slot in the given pool, or the current pool when poolId is null.
     * Close the returned lease to release the slot.
     *
     * @throws NoHealthyEndpointException if no endpoint qualifies
     * @throws IllegalArgumentException   if the pool does not exist
     */
    public EndpointLease acquireEndpoint(String poolId) {
        return requirePool(poolId).acquire();
    }

    /**
     * Releases a slot acquired by {@link #acquireEndpoint(String)}. Idempotent.
     */
    public void releaseEndpoint(EndpointLease lease) {
        lease.close();
    }

    /**
     * Sends a generate request, failing over across the pool's endpoints.
     *
     * Each attempt acquires an endpoint, calls it and records the outcome on the endpoint
     * and its circuit breaker. Between attempts it sleeps {@code failoverBackoff × attempt}.
     * After {@code maxRetries} attempts the last failure is rethrown unchanged.
     *
     * @throws NoHealthyEndpointException if the last attempt found no endpoint
     */
    public GenerationResponse callWithFailover(GenerationRequest request, String poolId)
            throws IOException, InterruptedException {
        EndpointPool pool = requirePool(poolId);
        int maxAttempts = pool.getMaxRetries();
        Exception lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return attempt(pool, request);
            } catch (NoHealthyEndpointException e) {
                lastFailure = e;
                log.warn("Failover attempt found no endpoint: poolId={}, requestId={}, attempt={}/{}",
                        pool.getPoolId(), request.requestId(), attempt, maxAttempts);
            } catch (IOException | RuntimeException e) {
                lastFailure = e;
                log.warn("Failover attempt failed: poolId={}, requestId={}, attempt={}/{}, error={}",
                        pool.getPoolId(), request.requestId(), attempt, maxAttempts, e.toString());
            }
            if (attempt < maxAttempts) {
                sleeper.sleep(pool.getFailoverBackoff().multipliedBy(attempt));
            }
        }

        log.error("All failover attempts failed: poolId={}, requestId={}, attempts={}",
                pool.getPoolId(), request.requestId(), maxAttempts);
        if (lastFailure instanceof IOException io) {
            throw io;
        }
        throw (RuntimeException) lastFailure;
    }

    private GenerationResponse attempt(EndpointPool pool, GenerationRequest request)
            throws IOException, InterruptedException {
        try (EndpointLease lease = pool.acquire()) {
            LlmEndpoint endpoint = lease.endpoint();
            endpoint.recordRequestStart();
            long start = System.nanoTime();
            try {
                GenerationResponse response = httpClient.generate(endpoint, request);
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                lease.recordSuccess(elapsed);
                metrics.incrementRequestCount(pool.getPoolId(), endpoint.getId(), "success");
                metrics.recordLatency(pool.getPoolId(), endpoint.getId(), elapsed);
                log.debug("Generate call succeeded: poolId={}, endpointId={}, requestId={}, latencyMs={}",
                        pool.getPoolId(), endpoint.getId(), request.requestId(), elapsed.toMillis());
                return response;
            } catch (IOException | RuntimeException e) {
                lease.recordFailure(failureKind(e));
                metrics.incrementRequestCount(pool.getPoolId(), endpoint.getId(), "failure");
                throw e;
            }
        }
    }

    static LlmEndpoint.FailureKind failureKind(Throwable error) {
        if (error instanceof HttpConnectTimeoutException
                || error instanceof ConnectException
                || error instanceof UnknownHostException
                || error instanceof NoRouteToHostException) {
            return LlmEndpoint.FailureKind.CONNECTION;
        }
        if (error instanceof HttpTimeoutException
                || error instanceof SocketTimeoutException
                || error instanceof TimeoutException) {
            return LlmEndpoint.FailureKind.TIMEOUT;
        }
        if (error instanceof SocketException) {
            return LlmEndpoint.FailureKind.CONNECTION;
        }
        return LlmEndpoint.FailureKind.OTHER;
    }

    public boolean addEndpoint(String poolId, LlmEndpoint endpoint) {
        return getPool(poolId).map(pool -> pool.addEndpoint(endpoint)).orElse(false);
    }

    public boolean removeEndpoint(String poolId, String endpointId) {
        return getPool(poolId).map(pool -> pool.removeEndpoint(endpointId)).orElse(false);
    }

    public boolean enableEndpoint(String poolId, String endpointId) {
        return getPool(poolId).map(pool -> pool.setEndpointEnabled(endpointId, true)).orElse(false);
    }

    public boolean disableEndpoint(String poolId, String endpointId) {
        return getPool(poolId).map(pool -> pool.setEndpointEnabled(endpointId, false)).orElse(false);
    }

    public boolean setLoadBalancingStrategy(String poolId, StrategyType strategy) {
        Optional<EndpointPool> pool = getPool(poolId);
        pool.ifPresent(p -> p.setStrategy(strategy));
        return pool.isPresent();
    }

    /**
     * Snapshot of every pool, keyed by pool ID in ascending order. Reads only.
     */
    public Map<String, PoolSnapshot> getConnectionStats() {
        Map<String, PoolSnapshot> stats = new LinkedHashMap<>();
        pools.keySet().stream().sorted().forEach(id -> {
            EndpointPool pool = pools.get(id);
            if (pool != null) {
                stats.put(id, pool.snapshot());
            }
        });
        return stats;
    }

    private EndpointPool requirePool(String poolId) {
        String id = poolId != null ? poolId : currentPoolId;
        EndpointPool pool = id != null ? pools.get(id) : null;
        if (pool == null) {
            throw new IllegalArgumentException("Unknown pool: " + id);
        }
        return pool;
    }

    @Override
    public void close() {
        log.info("Shutting down ConnectionPoolManager: pools={}", pools.keySet());
        pools.clear();
    }
}
