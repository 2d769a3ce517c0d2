package fr.lapetina.ollama.minutes.extraction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import fr.lapetina.ollama.minutes.domain.minutes.MeetingMinutes;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one extraction run. Immutable.
 *
 * @param minutes      extracted minutes; null when {@code status} is FAILED
 * @param validation   null when {@code status} is FAILED
 * @param failedFields fields that exhausted their retries and hold their default
 * @param errorMessage set when {@code status} is FAILED
 */
public record ExtractionResult(
        String extractionId,
        ExtractionStatus status,
        MeetingMinutes minutes,
        ValidationReport validation,
        double confidenceScore,
        Set<ExtractionField> failedFields,
        Duration processingTime,
        Map<String, Object> metadata,
        String errorMessage
) {
    public ExtractionResult {
        failedFields = failedFields != null ? Set.copyOf(failedFields) : Set.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static ExtractionResult failed(String extractionId, String errorMessage, Duration processingTime) {
        return new ExtractionResult(extractionId, ExtractionStatus.FAILED, null, null, 0.0,
                Set.of(), processingTime, Map.of(), errorMessage);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return status != ExtractionStatus.FAILED;
    }

    /**
     * Short description: status, confidence, time, per-component counts and validation flags.
     */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("status", status.wireName());
        if (minutes == null) {
            summary.put("error", errorMessage);
            return summary;
        }
        summary.put("confidence_score", confidenceScore);
        summary.put("processing_time", processingTime.toMillis() / 1000.0);

        Map<String, Object> components = new LinkedHashMap<>();
        components.put("basic_info", minutes.basicInfo().isIdentified());
        components.put("attendees_count", minutes.attendees().size());
        components.put("agenda_items_count", minutes.agenda().size());
        components.put("action_items_count", minutes.actionItems().size());
        components.put("decisions_count", minutes.decisions().size());
        components.put("key_outcomes_count", minutes.keyOutcomes().size());
        summary.put("components", components);
        summary.put("validation_results", validation.asMap());
        return summary;
    }
}
