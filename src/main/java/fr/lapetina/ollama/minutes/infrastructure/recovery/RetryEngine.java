package fr.lapetina.ollama.minutes.infrastructure.recovery;

import fr.lapetina.ollama.minutes.domain.recovery.ErrorInfo;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;
import fr.lapetina.ollama.minutes.domain.recovery.RetryConfig;
import fr.lapetina.ollama.minutes.infrastructure.concurrent.Sleeper;
import fr.lapetina.ollama.minutes.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Runs operations under the retry policy of the error type they fail with.
 *
 * On each failure the error is classified and checked against the policy. A retry is
 * preceded by the recovery actions for the type: if one succeeds the next attempt runs
 * immediately, otherwise the engine sleeps the computed delay. Terminal failures are
 * recorded in the {@link ErrorHistory} and rethrown unchanged.
 *
 * Interruption and cancellation are not failures: they propagate at once.
 */
public final class RetryEngine {

    private static final Logger log = LoggerFactory.getLogger(RetryEngine.class);

    private final ErrorClassifier classifier;
    private final RecoveryCoordinator recovery;
    private final ErrorHistory history;
    private final MetricsRegistry metrics;
    private final Sleeper sleeper;
    private final Map<ErrorType, RetryConfig> configs = new EnumMap<>(ErrorType.class);

    public RetryEngine(
            ErrorClassifier classifier,
            RecoveryCoordinator recovery,
            ErrorHistory history,
            MetricsRegistry metrics,
            Sleeper sleeper,
            Map<ErrorType, RetryConfig> overrides
    ) {
        this.classifier = classifier;
        this.recovery = recovery;
        this.history = history;
        this.metrics = metrics;
        this.sleeper = sleeper;
        for (ErrorType type : ErrorType.values()) {
            configs.put(type, overrides.getOrDefault(type, RetryConfig.defaultFor(type)));
        }
    }

    /**
     * Runs the operation with the per-type retry policies.
     */
    public <T> T handleWithRetry(RetryableOperation<T> operation, Map<String, Object> context) throws Exception {
        return handleWithRetry(operation, context, null);
    }

    /**
     * Runs the operation, retrying failures.
     *
     * @param override policy applied to every error type; null uses the per-type policies
     * @throws Exception the last failure, unchanged
     */
    public <T> T handleWithRetry(
            RetryableOperation<T> operation,
            Map<String, Object> context,
            RetryConfig override
    ) throws Exception {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return operation.execute();
            } catch (InterruptedException | CancellationException e) {
                throw e;
            } catch (Exception e) {
                ErrorInfo info = classifier.classify(e, context);
                metrics.incrementErrorCount(info.errorType());
                RetryConfig config = override != null ? override : configs.get(info.errorType());

                if (!config.shouldRetry(info) || attempt >= config.maxAttempts()) {
                    history.record(info);
                    log.error("Operation failed terminally: errorId={}, errorType={}, severity={}, attempts={}, context={}, error={}",
                            info.errorId(), info.errorType().wireName(), info.severity(), attempt, context, e.toString());
                    throw e;
                }

                metrics.incrementRetryCount(info.errorType());
                RecoveryOutcome outcome = recovery.attemptRecovery(info);
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Interrupted during recovery");
                }
                Duration delay = outcome.recovered() ? Duration.ZERO : config.computeDelay(attempt);
                log.warn("Attempt failed, retrying: errorId={}, errorType={}, attempt={}/{}, recovered={}, delayMs={}, error={}",
                        info.errorId(), info.errorType().wireName(), attempt, config.maxAttempts(),
                        outcome.recovered(), delay.toMillis(), e.toString());
                if (!delay.isZero()) {
                    sleeper.sleep(delay);
                }
            }
        }
    }

    public RetryConfig configFor(ErrorType type) {
        return configs.get(type);
    }

    public ErrorClassifier getClassifier() {
        return classifier;
    }

    public ErrorHistory getHistory() {
        return history;
    }
}
