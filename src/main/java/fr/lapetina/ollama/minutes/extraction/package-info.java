/**
 * Concurrent extraction of meeting minutes fields.
 *
 * <h2>Flow</h2>
 * <pre>
 * Preprocess → Fan out six field calls → Parse → Assemble → Validate → Score
 * </pre>
 *
 * <p>A field whose call fails after retries gets its default value and a failed
 * validation flag; the other fields keep their values.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ollama.minutes.extraction.ExtractionOrchestrator} - Runs one extraction</li>
 *   <li>{@link fr.lapetina.ollama.minutes.extraction.ExtractionField} - Prompt, text window and weight per field</li>
 *   <li>{@link fr.lapetina.ollama.minutes.extraction.ConfidenceScorer} - Validation and richness based score</li>
 * </ul>
 */
package fr.lapetina.ollama.minutes.extraction;
