package fr.lapetina.ollama.minutes.domain.strategy;

import fr.lapetina.ollama.minutes.domain.model.EndpointStatus;
import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;

import java.util.List;
import java.util.Optional;

/**
 * Default strategy: prefer fully healthy endpoints, then priority.
 *
 * Among HEALTHY candidates the highest priority wins. Only when no candidate is HEALTHY
 * does the highest priority among the degraded ones win. A healthy endpoint therefore
 * beats a degraded one regardless of priority. Ties go to the endpoint registered first.
 */
public final class HealthBasedStrategy implements LoadBalancingStrategy {

    @Override
    public StrategyType getType() {
        return StrategyType.HEALTH_BASED;
    }

    @Override
    public Optional<LlmEndpoint> selectEndpoint(List<LlmEndpoint> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        LlmEndpoint bestHealthy = null;
        LlmEndpoint bestAny = null;

        for (LlmEndpoint endpoint : candidates) {
            if (bestAny == null || endpoint.getPriority() > bestAny.getPriority()) {
                bestAny = endpoint;
            }
            if (endpoint.getStatus() == EndpointStatus.HEALTHY
                    && (bestHealthy == null || endpoint.getPriority() > bestHealthy.getPriority())) {
                bestHealthy = endpoint;
            }
        }

        return Optional.of(bestHealthy != null ? bestHealthy : bestAny);
    }
}
