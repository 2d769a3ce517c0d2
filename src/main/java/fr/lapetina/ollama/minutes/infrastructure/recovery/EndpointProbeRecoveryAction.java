package fr.lapetina.ollama.minutes.infrastructure.recovery;

import fr.lapetina.ollama.minutes.domain.recovery.ErrorInfo;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;
import fr.lapetina.ollama.minutes.infrastructure.health.EndpointHealthChecker;
import fr.lapetina.ollama.minutes.infrastructure.pool.ConnectionPoolManager;
import fr.lapetina.ollama.minutes.infrastructure.pool.EndpointPool;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Re-probes the pool the failed call used and reports success when at least one
 * endpoint is acquirable afterwards.
 *
 * The pool is read from the {@code poolId} context key, falling back to the current pool.
 */
public final class EndpointProbeRecoveryAction implements RecoveryAction {

    public static final String POOL_ID_KEY = "poolId";

    private final String id;
    private final ErrorType errorType;
    private final int priority;
    private final ConnectionPoolManager poolManager;
    private final EndpointHealthChecker healthChecker;
    private final Duration probeTimeout;

    public EndpointProbeRecoveryAction(
            String id,
            ErrorType errorType,
            int priority,
            ConnectionPoolManager poolManager,
            EndpointHealthChecker healthChecker,
            Duration probeTimeout
    ) {
        this.id = id;
        this.errorType = errorType;
        this.priority = priority;
        this.poolManager = poolManager;
        this.healthChecker = healthChecker;
        this.probeTimeout = probeTimeout;
    }

    public static EndpointProbeRecoveryAction networkProbe(
            ConnectionPoolManager poolManager, EndpointHealthChecker healthChecker, Duration probeTimeout) {
        return new EndpointProbeRecoveryAction("network_connectivity_probe", ErrorType.NETWORK, 9,
                poolManager, healthChecker, probeTimeout);
    }

    public static EndpointProbeRecoveryAction aiServiceProbe(
            ConnectionPoolManager poolManager, EndpointHealthChecker healthChecker, Duration probeTimeout) {
        return new EndpointProbeRecoveryAction("ai_service_health_probe", ErrorType.AI_SERVICE, 10,
                poolManager, healthChecker, probeTimeout);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String description() {
        return "Probe pool endpoints and check one is available";
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public ErrorType errorType() {
        return errorType;
    }

    @Override
    public boolean attempt(ErrorInfo errorInfo) throws Exception {
        Object contextPool = errorInfo.context().get(POOL_ID_KEY);
        String poolId = contextPool != null ? contextPool.toString() : poolManager.getCurrentPoolId();
        if (poolId == null) {
            return false;
        }
        // Probe a little past its own timeout so every probe has completed
        healthChecker.checkPool(poolId).get(probeTimeout.toMillis() + 1_000, TimeUnit.MILLISECONDS);
        return poolManager.getPool(poolId)
                .map(EndpointPool::hasAcquirableEndpoint)
                .orElse(false);
    }
}
