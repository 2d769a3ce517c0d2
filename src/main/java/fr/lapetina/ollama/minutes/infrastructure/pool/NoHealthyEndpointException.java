package fr.lapetina.ollama.minutes.infrastructure.pool;

import fr.lapetina.ollama.minutes.domain.recovery.ClassifiedFailure;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;

/**
 * Thrown when a pool has no endpoint that is enabled, routable, below capacity
 * and not behind an open circuit.
 */
public final class NoHealthyEndpointException extends RuntimeException implements ClassifiedFailure {

    private final String poolId;

    public NoHealthyEndpointException(String poolId) {
        super("No healthy endpoint available in pool: " + poolId);
        this.poolId = poolId;
    }

    public String getPoolId() {
        return poolId;
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.AI_SERVICE;
    }
}
