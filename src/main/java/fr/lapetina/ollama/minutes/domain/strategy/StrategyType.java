package fr.lapetina.ollama.minutes.domain.strategy;

import java.util.Locale;

/**
 * Closed set of load balancing policies.
 *
 * Adding a policy means adding a constant here; {@link #create()} is an exhaustive
 * switch, so the compiler flags any policy without an implementation.
 */
public enum StrategyType {
    ROUND_ROBIN,
    RANDOM,
    LEAST_CONNECTIONS,
    RESPONSE_TIME,
    HEALTH_BASED;

    /**
     * Creates a fresh strategy instance. Stateful strategies keep their state per instance,
     * so each pool gets its own.
     */
    public LoadBalancingStrategy create() {
        return switch (this) {
            case ROUND_ROBIN -> new RoundRobinStrategy();
            case RANDOM -> new RandomStrategy();
            case LEAST_CONNECTIONS -> new LeastConnectionsStrategy();
            case RESPONSE_TIME -> new ResponseTimeStrategy();
            case HEALTH_BASED -> new HealthBasedStrategy();
        };
    }

    /**
     * Name used in configuration and statistics, e.g. {@code round_robin}.
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a configuration name. Accepts {@code round_robin} and {@code round-robin}.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static StrategyType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Strategy name is required");
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown load balancing strategy: " + name, e);
        }
    }
}
