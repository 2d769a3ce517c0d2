package fr.lapetina.ollama.minutes.domain.recovery;

/**
 * Implemented by exceptions that know their own error type.
 * The classifier trusts this over any type or message heuristic.
 */
public interface ClassifiedFailure {

    ErrorType errorType();
}
