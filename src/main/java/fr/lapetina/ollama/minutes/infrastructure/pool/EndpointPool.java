package fr.lapetina.ollama.minutes.infrastructure.pool;

import fr.lapetina.ollama.minutes.domain.model.EndpointStatus;
import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;
import fr.lapetina.ollama.minutes.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.ollama.minutes.domain.strategy.StrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A named group of endpoints sharing a load balancing strategy and failover policy.
 * Each endpoint gets its own circuit breaker.
 */
public final class EndpointPool {

    private static final Logger log = LoggerFactory.getLogger(EndpointPool.class);

    private final String poolId;
    private final EndpointRegistry registry;
    private final int maxRetries;
    private final int circuitBreakerThreshold;
    private final Duration circuitBreakerTimeout;
    private final Duration failoverBackoff;
    private final boolean healthCheckEnabled;
    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();

    private volatile LoadBalancingStrategy strategy;

    private EndpointPool(Builder builder) {
        this.poolId = Objects.requireNonNull(builder.poolId, "poolId is required");
        if (builder.maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1: " + builder.maxRetries);
        }
        this.registry = new EndpointRegistry(poolId);
        this.maxRetries = builder.maxRetries;
        this.circuitBreakerThreshold = builder.circuitBreakerThreshold;
        this.circuitBreakerTimeout = builder.circuitBreakerTimeout;
        this.failoverBackoff = builder.failoverBackoff;
        this.healthCheckEnabled = builder.healthCheckEnabled;
        this.strategy = builder.strategyType.create();
        registry.addListener(event -> {
            if (event.type() == EndpointRegistry.EndpointRegistryEvent.Type.REMOVED) {
                circuitBreakers.remove(event.endpoint().getId());
            }
            if (event.type() != EndpointRegistry.EndpointRegistryEvent.Type.STATUS_CHANGED) {
                strategy.reset();
            }
        });
        for (LlmEndpoint endpoint : builder.endpoints) {
            addEndpoint(endpoint);
        }
    }

    /**
     * Acquires a slot on one endpoint chosen by the current strategy.
     *
     * Candidates are filtered on enabled, routable status, free capacity and circuit
     * state. If a concurrent caller takes the last slot or the half-open trial between
     * filtering and acquisition, that endpoint is dropped and selection runs again.
     *
     * @throws NoHealthyEndpointException if no endpoint can be acquired
     */
    public EndpointLease acquire() {
        List<LlmEndpoint> candidates = new ArrayList<>();
        for (LlmEndpoint endpoint : registry.getEndpoints()) {
            if (endpoint.isAcquirable() && circuitBreaker(endpoint).isCallPermitted()) {
                candidates.add(endpoint);
            }
        }

        LoadBalancingStrategy current = strategy;
        while (!candidates.isEmpty()) {
            Optional<LlmEndpoint> selected = current.selectEndpoint(List.copyOf(candidates));
            if (selected.isEmpty()) {
                break;
            }
            LlmEndpoint endpoint = selected.get();
            if (endpoint.tryAcquire()) {
                CircuitBreaker breaker = circuitBreaker(endpoint);
                CircuitBreaker.Permit permit = breaker.acquirePermit();
                if (permit.granted()) {
                    log.debug("Endpoint acquired: poolId={}, endpointId={}, active={}, trial={}",
                            poolId, endpoint.getId(), endpoint.getActiveConnections(), permit.isTrial());
                    return new EndpointLease(poolId, endpoint, breaker, permit);
                }
                endpoint.release();
            }
            candidates.remove(endpoint);
        }

        log.warn("No healthy endpoint available: poolId={}, endpoints={}", poolId, registry.size());
        throw new NoHealthyEndpointException(poolId);
    }

    /**
     * Whether at least one endpoint would currently pass the acquire filter.
     */
    public boolean hasAcquirableEndpoint() {
        for (LlmEndpoint endpoint : registry.getEndpoints()) {
            if (endpoint.isAcquirable() && circuitBreaker(endpoint).isCallPermitted()) {
                return true;
            }
        }
        return false;
    }

    public boolean addEndpoint(LlmEndpoint endpoint) {
        if (!registry.register(endpoint)) {
            return false;
        }
        circuitBreaker(endpoint);
        return true;
    }

    public boolean removeEndpoint(String endpointId) {
        return registry.remove(endpointId).isPresent();
    }

    public boolean setEndpointEnabled(String endpointId, boolean enabled) {
        return registry.setEnabled(endpointId, enabled);
    }

    public void setStrategy(StrategyType type) {
        LoadBalancingStrategy previous = strategy;
        strategy = type.create();
        log.info("Load balancing strategy changed: poolId={}, {} -> {}",
                poolId, previous.getType().configName(), type.configName());
    }

    public CircuitBreaker circuitBreaker(LlmEndpoint endpoint) {
        return circuitBreakers.computeIfAbsent(endpoint.getId(),
                id -> new CircuitBreaker(id, circuitBreakerThreshold, circuitBreakerTimeout));
    }

    public Optional<CircuitBreaker> findCircuitBreaker(String endpointId) {
        return Optional.ofNullable(circuitBreakers.get(endpointId));
    }

    /**
     * Point-in-time view of this pool. Reads only; calling it twice with no activity
     * in between returns equal snapshots.
     */
    public PoolSnapshot snapshot() {
        List<EndpointSnapshot> endpoints = new ArrayList<>();
        int healthy = 0;
        int degraded = 0;
        int unhealthy = 0;
        int active = 0;
        for (LlmEndpoint endpoint : registry.getEndpoints()) {
            EndpointStatus status = endpoint.getStatus();
            switch (status) {
                case HEALTHY -> healthy++;
                case DEGRADED -> degraded++;
                case UNHEALTHY -> unhealthy++;
                case UNKNOWN -> { }
            }
            active += endpoint.getActiveConnections();
            CircuitBreakerSnapshot breaker = findCircuitBreaker(endpoint.getId())
                    .map(CircuitBreaker::snapshot)
                    .orElse(null);
            endpoints.add(new EndpointSnapshot(
                    endpoint.getId(),
                    endpoint.getBaseUrl().toString(),
                    endpoint.getModelName(),
                    status,
                    endpoint.isEnabled(),
                    endpoint.getPriority(),
                    endpoint.getActiveConnections(),
                    endpoint.getMaxConcurrent(),
                    endpoint.metrics(),
                    breaker
            ));
        }
        return new PoolSnapshot(
                poolId,
                strategy.getType().configName(),
                maxRetries,
                endpoints.size(),
                healthy,
                degraded,
                unhealthy,
                active,
                endpoints
        );
    }

    public String getPoolId() {
        return poolId;
    }

    public EndpointRegistry getRegistry() {
        return registry;
    }

    public List<LlmEndpoint> getEndpoints() {
        return registry.getEndpoints();
    }

    public StrategyType getStrategyType() {
        return strategy.getType();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getFailoverBackoff() {
        return failoverBackoff;
    }

    public boolean isHealthCheckEnabled() {
        return healthCheckEnabled;
    }

    public static Builder builder(String poolId) {
        return new Builder(poolId);
    }

    public static final class Builder {
        private final String poolId;
        private final List<LlmEndpoint> endpoints = new ArrayList<>();
        private StrategyType strategyType = StrategyType.HEALTH_BASED;
        private int maxRetries = 3;
        private int circuitBreakerThreshold = 5;
        private Duration circuitBreakerTimeout = Duration.ofSeconds(60);
        private Duration failoverBackoff = Duration.ofMillis(500);
        private boolean healthCheckEnabled = true;

        private Builder(String poolId) {
            this.poolId = poolId;
        }

        public Builder strategy(StrategyType strategyType) {
            this.strategyType = Objects.requireNonNull(strategyType);
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder circuitBreakerThreshold(int threshold) {
            this.circuitBreakerThreshold = threshold;
            return this;
        }

        public Builder circuitBreakerTimeout(Duration timeout) {
            this.circuitBreakerTimeout = Objects.requireNonNull(timeout);
            return this;
        }

        public Builder failoverBackoff(Duration backoff) {
            this.failoverBackoff = Objects.requireNonNull(backoff);
            return this;
        }

        public Builder healthCheckEnabled(boolean enabled) {
            this.healthCheckEnabled = enabled;
            return this;
        }

        public Builder endpoint(LlmEndpoint endpoint) {
            this.endpoints.add(endpoint);
            return this;
        }

        public Builder endpoints(List<LlmEndpoint> endpoints) {
            this.endpoints.addAll(endpoints);
            return this;
        }

        public EndpointPool build() {
            return new EndpointPool(this);
        }
    }
}
