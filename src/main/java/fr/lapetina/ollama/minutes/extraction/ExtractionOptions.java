package fr.lapetina.ollama.minutes.extraction;

import fr.lapetina.ollama.minutes.domain.recovery.RetryConfig;

import java.time.Duration;

/**
 * Per-run options. Null members fall back to the orchestrator's defaults.
 *
 * @param poolId        pool to route field requests through
 * @param textWindow    characters read by head and tail windowed fields
 * @param runTimeout    bound on the whole run; fields still running are cancelled and failed
 * @param retryOverride retry policy for every error type, instead of the per-type policies
 */
public record ExtractionOptions(
        String poolId,
        Integer textWindow,
        Duration runTimeout,
        RetryConfig retryOverride
) {
    public static ExtractionOptions defaults() {
        return new ExtractionOptions(null, null, null, null);
    }

    public ExtractionOptions withPool(String newPoolId) {
        return new ExtractionOptions(newPoolId, textWindow, runTimeout, retryOverride);
    }

    public ExtractionOptions withRunTimeout(Duration timeout) {
        return new ExtractionOptions(poolId, textWindow, timeout, retryOverride);
    }

    public ExtractionOptions withRetryOverride(RetryConfig config) {
        return new ExtractionOptions(poolId, textWindow, runTimeout, config);
    }
}
