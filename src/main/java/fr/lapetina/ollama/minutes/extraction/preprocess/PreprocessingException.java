package fr.lapetina.ollama.minutes.extraction.preprocess;

import fr.lapetina.ollama.minutes.domain.recovery.ClassifiedFailure;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;

/**
 * The transcript could not be preprocessed. Fails the whole extraction run.
 */
public class PreprocessingException extends RuntimeException implements ClassifiedFailure {

    public PreprocessingException(String message) {
        super(message);
    }

    public PreprocessingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.USER;
    }
}
