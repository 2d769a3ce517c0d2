package fr.lapetina.ollama.minutes.domain.recovery;

import java.util.Locale;

/**
 * Error taxonomy for failed operations.
 * Every failure maps to exactly one type; {@link #UNKNOWN} covers the rest.
 */
public enum ErrorType {
    /** Connection refused, DNS, TLS and other transport failures */
    NETWORK,

    /** Per-call timeout exceeded */
    TIMEOUT,

    /** Invalid input or state; never retried */
    VALIDATION,

    /** LLM service returned an error or no endpoint can serve the call */
    AI_SERVICE,

    /** Missing files, permissions, disk */
    FILESYSTEM,

    /** Model output could not be processed */
    PROCESSING,

    /** Memory, threads or other local resources exhausted */
    RESOURCE,

    /** Caller supplied unusable data; never retried */
    USER,

    /** Anything not matched above */
    UNKNOWN;

    /**
     * Whether failures of this type may be retried at all.
     */
    public boolean isRecoverable() {
        return this != VALIDATION && this != USER;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
