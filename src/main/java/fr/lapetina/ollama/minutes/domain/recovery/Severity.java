package fr.lapetina.ollama.minutes.domain.recovery;

/**
 * Severity attached to a classified error.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
