package fr.lapetina.ollama.minutes.infrastructure.pool;

import fr.lapetina.ollama.minutes.domain.model.EndpointMetrics;
import fr.lapetina.ollama.minutes.domain.model.EndpointStatus;

/**
 * Statistics of one endpoint within a {@link PoolSnapshot}.
 */
public record EndpointSnapshot(
        String endpointId,
        String url,
        String model,
        EndpointStatus status,
        boolean enabled,
        int priority,
        int activeConnections,
        int maxConcurrent,
        EndpointMetrics metrics,
        CircuitBreakerSnapshot circuitBreaker
) {
}
