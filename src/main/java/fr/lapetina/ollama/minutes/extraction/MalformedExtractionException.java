package fr.lapetina.ollama.minutes.extraction;

import fr.lapetina.ollama.minutes.domain.recovery.ClassifiedFailure;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;

/**
 * The model's answer for a field could not be read into the field's schema.
 */
public class MalformedExtractionException extends RuntimeException implements ClassifiedFailure {

    private final ExtractionField field;

    public MalformedExtractionException(ExtractionField field, String message) {
        super(message);
        this.field = field;
    }

    public MalformedExtractionException(ExtractionField field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public ExtractionField getField() {
        return field;
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.PROCESSING;
    }
}
