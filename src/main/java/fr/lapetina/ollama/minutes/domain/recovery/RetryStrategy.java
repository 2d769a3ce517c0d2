package fr.lapetina.ollama.minutes.domain.recovery;

/**
 * How the delay between attempts grows.
 */
public enum RetryStrategy {
    EXPONENTIAL_BACKOFF,
    LINEAR_BACKOFF,
    FIXED_DELAY,
    IMMEDIATE,
    NO_RETRY
}
