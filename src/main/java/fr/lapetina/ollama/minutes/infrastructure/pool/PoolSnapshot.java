package fr.lapetina.ollama.minutes.infrastructure.pool;

import java.util.List;

/**
 * Statistics of one pool as returned by {@link ConnectionPoolManager#getConnectionStats()}.
 */
public record PoolSnapshot(
        String poolId,
        String strategy,
        int maxRetries,
        int totalEndpoints,
        int healthyEndpoints,
        int degradedEndpoints,
        int unhealthyEndpoints,
        int activeConnections,
        List<EndpointSnapshot> endpoints
) {
    public PoolSnapshot {
        endpoints = List.copyOf(endpoints);
    }
}
