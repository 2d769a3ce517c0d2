package fr.lapetina.ollama.minutes.domain.strategy;

import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;

import java.util.List;
import java.util.Optional;

/**
 * Strategy interface for choosing an endpoint from a pool.
 *
 * The pool filters the candidates before calling the strategy: every candidate is
 * enabled, routable, below capacity and not behind an open circuit. Candidates are
 * passed in registration order.
 *
 * Implementations must be thread-safe; many callers select concurrently.
 */
public interface LoadBalancingStrategy {

    /**
     * Returns the type of this strategy.
     */
    StrategyType getType();

    /**
     * Selects an endpoint from the filtered candidates.
     *
     * @param candidates acquirable endpoints in registration order
     * @return Selected endpoint, or empty if the list is empty
     */
    Optional<LlmEndpoint> selectEndpoint(List<LlmEndpoint> candidates);

    /**
     * Resets any internal state. Called when the pool's endpoint set changes.
     */
    default void reset() {
        // Default no-op
    }
}
