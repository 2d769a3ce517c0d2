package fr.lapetina.ollama.minutes.domain.strategy;

import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;

import java.util.List;
import java.util.Optional;

/**
 * Selects the endpoint with the lowest smoothed response time.
 *
 * Endpoints without a completed request count as infinitely slow, so they are picked
 * only when no measured endpoint is available. Ties go to the endpoint registered first.
 */
public final class ResponseTimeStrategy implements LoadBalancingStrategy {

    @Override
    public StrategyType getType() {
        return StrategyType.RESPONSE_TIME;
    }

    @Override
    public Optional<LlmEndpoint> selectEndpoint(List<LlmEndpoint> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        LlmEndpoint selected = candidates.get(0);
        double best = selected.getAverageResponseTimeMs();

        for (int i = 1; i < candidates.size(); i++) {
            LlmEndpoint endpoint = candidates.get(i);
            double avg = endpoint.getAverageResponseTimeMs();
            if (avg < best) {
                best = avg;
                selected = endpoint;
            }
        }

        return Optional.of(selected);
    }
}
