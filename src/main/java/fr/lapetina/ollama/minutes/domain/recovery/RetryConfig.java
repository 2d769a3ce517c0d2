package fr.lapetina.ollama.minutes.domain.recovery;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy for one error type.
 *
 * @param maxAttempts total attempts including the first one
 * @param stopOn      exception types that are never retried under this policy
 */
public record RetryConfig(
        RetryStrategy strategy,
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double backoffFactor,
        boolean jitter,
        Set<Class<? extends Throwable>> stopOn
) {
    public RetryConfig {
        Objects.requireNonNull(strategy, "Strategy is required");
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative: " + maxAttempts);
        }
        baseDelay = baseDelay != null ? baseDelay : Duration.ZERO;
        maxDelay = maxDelay != null ? maxDelay : baseDelay;
        stopOn = stopOn != null ? Set.copyOf(stopOn) : Set.of();
    }

    public RetryConfig(
            RetryStrategy strategy,
            int maxAttempts,
            Duration baseDelay,
            Duration maxDelay,
            double backoffFactor,
            boolean jitter
    ) {
        this(strategy, maxAttempts, baseDelay, maxDelay, backoffFactor, jitter, Set.of());
    }

    public static RetryConfig noRetry() {
        return new RetryConfig(RetryStrategy.NO_RETRY, 0, Duration.ZERO, Duration.ZERO, 1.0, false);
    }

    /**
     * Built-in policy per error type.
     */
    public static RetryConfig defaultFor(ErrorType errorType) {
        return switch (errorType) {
            case NETWORK -> new RetryConfig(RetryStrategy.EXPONENTIAL_BACKOFF, 5,
                    Duration.ofSeconds(2), Duration.ofSeconds(120), 2.0, true);
            case TIMEOUT -> new RetryConfig(RetryStrategy.LINEAR_BACKOFF, 3,
                    Duration.ofSeconds(5), Duration.ofSeconds(30), 1.5, false);
            case AI_SERVICE -> new RetryConfig(RetryStrategy.EXPONENTIAL_BACKOFF, 4,
                    Duration.ofSeconds(3), Duration.ofSeconds(60), 2.5, true);
            case FILESYSTEM -> new RetryConfig(RetryStrategy.FIXED_DELAY, 2,
                    Duration.ofSeconds(1), Duration.ofSeconds(5), 2.0, false);
            case PROCESSING -> new RetryConfig(RetryStrategy.IMMEDIATE, 2,
                    Duration.ZERO, Duration.ZERO, 1.0, false);
            case RESOURCE -> new RetryConfig(RetryStrategy.LINEAR_BACKOFF, 3,
                    Duration.ofSeconds(10), Duration.ofSeconds(60), 2.0, false);
            case VALIDATION, USER -> noRetry();
            case UNKNOWN -> new RetryConfig(RetryStrategy.EXPONENTIAL_BACKOFF, 3,
                    Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, true);
        };
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     * The computed delay is clamped to {@code maxDelay}; jitter then scales it by a
     * uniform factor in [0.5, 1.5].
     */
    public Duration computeDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based: " + attempt);
        }
        double baseMs = baseDelay.toNanos() / 1_000_000.0;
        double delayMs = switch (strategy) {
            case IMMEDIATE, NO_RETRY -> 0.0;
            case FIXED_DELAY -> baseMs;
            case LINEAR_BACKOFF -> baseMs * attempt;
            case EXPONENTIAL_BACKOFF -> baseMs * Math.pow(backoffFactor, attempt - 1);
        };
        if (delayMs <= 0.0) {
            return Duration.ZERO;
        }

        delayMs = Math.min(delayMs, maxDelay.toNanos() / 1_000_000.0);

        if (jitter) {
            delayMs *= ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        }
        return Duration.ofNanos(Math.round(delayMs * 1_000_000.0));
    }

    /**
     * Whether an error may be retried under this policy, regardless of attempt budget.
     */
    public boolean shouldRetry(ErrorInfo errorInfo) {
        if (!errorInfo.recoverable() || strategy == RetryStrategy.NO_RETRY) {
            return false;
        }
        Class<? extends Throwable> type = errorInfo.exceptionType();
        if (type != null) {
            for (Class<? extends Throwable> stop : stopOn) {
                if (stop.isAssignableFrom(type)) {
                    return false;
                }
            }
        }
        return true;
    }
}
