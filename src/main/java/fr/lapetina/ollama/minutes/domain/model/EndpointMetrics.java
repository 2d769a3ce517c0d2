package fr.lapetina.ollama.minutes.domain.model;

import java.time.Instant;

/**
 * Point-in-time copy of an endpoint's rolling metrics.
 */
public record EndpointMetrics(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        double successRate,
        double avgResponseTimeMs,
        long responseSamples,
        long connectionErrors,
        long timeoutErrors,
        Instant lastRequestTime,
        Instant lastHealthCheck
) {
}
