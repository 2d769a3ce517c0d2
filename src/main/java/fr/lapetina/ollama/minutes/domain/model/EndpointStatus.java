package fr.lapetina.ollama.minutes.domain.model;

/**
 * Health status of an LLM endpoint.
 *
 * HEALTHY: Liveness probe succeeded within the response-time budget
 * DEGRADED: Probe succeeded but was slow
 * UNHEALTHY: Probe failed or raised an error
 * UNKNOWN: Not probed yet
 */
public enum EndpointStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    UNKNOWN;

    /**
     * Whether an endpoint in this status may receive traffic.
     */
    public boolean isRoutable() {
        return this == HEALTHY || this == DEGRADED;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
