package fr.lapetina.ollama.minutes.infrastructure.recovery;

/**
 * An operation the retry engine may run more than once.
 */
@FunctionalInterface
public interface RetryableOperation<T> {

    T execute() throws Exception;
}
