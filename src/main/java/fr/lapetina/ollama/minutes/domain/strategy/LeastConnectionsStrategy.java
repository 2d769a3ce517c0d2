package fr.lapetina.ollama.minutes.domain.strategy;

import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;

import java.util.List;
import java.util.Optional;

/**
 * Selects the endpoint with the fewest active connections.
 * Ties go to the endpoint registered first.
 */
public final class LeastConnectionsStrategy implements LoadBalancingStrategy {

    @Override
    public StrategyType getType() {
        return StrategyType.LEAST_CONNECTIONS;
    }

    @Override
    public Optional<LlmEndpoint> selectEndpoint(List<LlmEndpoint> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        LlmEndpoint selected = null;
        int minActive = Integer.MAX_VALUE;

        for (LlmEndpoint endpoint : candidates) {
            int active = endpoint.getActiveConnections();
            // Strict comparison keeps the earliest registered endpoint on ties
            if (active < minActive) {
                minActive = active;
                selected = endpoint;
            }
        }

        return Optional.ofNullable(selected);
    }
}
