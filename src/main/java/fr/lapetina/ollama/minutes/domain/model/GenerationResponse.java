package fr.lapetina.ollama.minutes.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Response of a generate call. Only {@code content} is required by the extraction core;
 * the timing fields are kept for logging and metrics.
 */
public record GenerationResponse(
        String requestId,
        String model,
        String content,
        boolean done,
        String endpointId,
        Instant completedAt,
        Duration totalDuration,
        Duration loadDuration,
        int promptEvalCount,
        int evalCount,
        List<Integer> context
) {
    public GenerationResponse {
        Objects.requireNonNull(requestId, "Request ID is required");
        content = content != null ? content : "";
        if (completedAt == null) {
            completedAt = Instant.now();
        }
        context = context != null ? List.copyOf(context) : List.of();
    }

    /**
     * Creates a minimal completed response.
     */
    public static GenerationResponse of(String requestId, String model, String content, String endpointId) {
        return new GenerationResponse(
                requestId, model, content, true, endpointId,
                Instant.now(), null, null, 0, 0, null
        );
    }
}
