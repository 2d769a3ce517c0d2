package fr.lapetina.ollama.minutes.domain.recovery;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Classified failure. Created once per failure, never mutated, and used only for
 * retry decisions, logging and the error history.
 *
 * @param exceptionType class of the original exception, kept for stop-list checks
 * @param context       caller-supplied context (operation name, field, pool...)
 */
public record ErrorInfo(
        String errorId,
        ErrorType errorType,
        String message,
        Class<? extends Throwable> exceptionType,
        Severity severity,
        boolean recoverable,
        String suggestedAction,
        Map<String, Object> context,
        Instant timestamp
) {
    public ErrorInfo {
        Objects.requireNonNull(errorId, "Error ID is required");
        Objects.requireNonNull(errorType, "Error type is required");
        Objects.requireNonNull(severity, "Severity is required");
        message = message != null ? message : "";
        context = context != null ? Map.copyOf(context) : Map.of();
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
