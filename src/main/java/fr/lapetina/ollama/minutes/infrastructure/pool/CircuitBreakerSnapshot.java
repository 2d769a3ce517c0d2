package fr.lapetina.ollama.minutes.infrastructure.pool;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only copy of a circuit breaker's state for statistics.
 */
public record CircuitBreakerSnapshot(
        CircuitBreaker.State state,
        int failureCount,
        Instant lastFailureTime,
        Duration timeoutWindow
) {
}
