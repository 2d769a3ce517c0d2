/**
 * Error taxonomy and retry policy types.
 *
 * <p>{@link fr.lapetina.ollama.minutes.domain.recovery.ErrorType} is total: every failure
 * classifies to exactly one type. Each type has a default
 * {@link fr.lapetina.ollama.minutes.domain.recovery.RetryConfig}; validation and user errors
 * are never retried.
 */
package fr.lapetina.ollama.minutes.domain.recovery;
