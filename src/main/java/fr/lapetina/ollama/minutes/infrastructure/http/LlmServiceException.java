package fr.lapetina.ollama.minutes.infrastructure.http;

import fr.lapetina.ollama.minutes.domain.recovery.ClassifiedFailure;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;

import java.io.IOException;

/**
 * The LLM service answered, but not with a usable generate response.
 */
public class LlmServiceException extends IOException implements ClassifiedFailure {

    private final String endpointId;
    private final int statusCode;

    public LlmServiceException(String endpointId, int statusCode, String message) {
        super(message);
        this.endpointId = endpointId;
        this.statusCode = statusCode;
    }

    public LlmServiceException(String endpointId, String message, Throwable cause) {
        super(message, cause);
        this.endpointId = endpointId;
        this.statusCode = -1;
    }

    public String getEndpointId() {
        return endpointId;
    }

    /**
     * HTTP status, or -1 when the failure was not an HTTP error status.
     */
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.AI_SERVICE;
    }
}
