package fr.lapetina.ollama.minutes.domain.strategy;

import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Uniform random choice among the candidates.
 *
 * Thread-safe via ThreadLocalRandom.
 */
public final class RandomStrategy implements LoadBalancingStrategy {

    @Override
    public StrategyType getType() {
        return StrategyType.RANDOM;
    }

    @Override
    public Optional<LlmEndpoint> selectEndpoint(List<LlmEndpoint> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        int index = ThreadLocalRandom.current().nextInt(candidates.size());
        return Optional.of(candidates.get(index));
    }
}
