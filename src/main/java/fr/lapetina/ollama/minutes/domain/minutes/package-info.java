/**
 * Structured meeting minutes produced by the extraction orchestrator.
 * All types are immutable records serialised with snake_case JSON names.
 */
package fr.lapetina.ollama.minutes.domain.minutes;
