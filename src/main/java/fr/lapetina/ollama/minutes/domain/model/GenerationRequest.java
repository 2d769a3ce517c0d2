package fr.lapetina.ollama.minutes.domain.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A single generate call against the LLM service.
 * Immutable and thread-safe.
 *
 * @param model  model override; null means the endpoint's configured model
 * @param format response format hint passed to the service (e.g. {@code json}); may be null
 */
public record GenerationRequest(
        String requestId,
        String prompt,
        String model,
        String system,
        String format,
        Map<String, Object> options,
        Instant createdAt
) {
    public GenerationRequest {
        Objects.requireNonNull(prompt, "Prompt is required");
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        options = options != null ? Map.copyOf(options) : Map.of();
    }

    /**
     * Creates a plain prompt request using the endpoint's model.
     */
    public static GenerationRequest ofPrompt(String prompt) {
        return new GenerationRequest(null, prompt, null, null, null, null, null);
    }

    /**
     * Creates a request asking the service for a JSON document.
     */
    public static GenerationRequest ofJson(String prompt, Map<String, Object> options) {
        return new GenerationRequest(null, prompt, null, null, "json", options, null);
    }

    /**
     * Model to send to the given endpoint.
     */
    public String modelFor(LlmEndpoint endpoint) {
        return model != null ? model : endpoint.getModelName();
    }

    public GenerationRequest withModel(String newModel) {
        return new GenerationRequest(requestId, prompt, newModel, system, format, options, createdAt);
    }
}
