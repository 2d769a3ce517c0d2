package fr.lapetina.ollama.minutes.extraction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExtractionStatus {
    /** Every field validated */
    COMPLETED,
    /** The run finished but at least one field failed validation or extraction */
    VALIDATION_FAILED,
    /** The run itself failed; no minutes */
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
