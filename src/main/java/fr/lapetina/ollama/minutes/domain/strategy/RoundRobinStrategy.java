package fr.lapetina.ollama.minutes.domain.strategy;

import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin over the filtered candidates.
 *
 * A monotonic counter modulo the candidate count, in registration order.
 * Thread-safe via atomic counter.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public StrategyType getType() {
        return StrategyType.ROUND_ROBIN;
    }

    @Override
    public Optional<LlmEndpoint> selectEndpoint(List<LlmEndpoint> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        int index = Math.floorMod(counter.getAndIncrement(), candidates.size());
        return Optional.of(candidates.get(index));
    }

    @Override
    public void reset() {
        counter.set(0);
    }
}
