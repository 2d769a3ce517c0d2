/**
 * Meeting minutes extraction core backed by a pool of Ollama LLM endpoints.
 *
 * <p>A transcript is cleaned, then six fields of the minutes are extracted concurrently,
 * each through its own LLM call. Calls are routed through named endpoint pools with
 * circuit breakers and failover, and wrapped in a retry engine that classifies failures
 * and runs recovery actions.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ollama.minutes.MinutesExtractorFactory} - Builds the fully wired core
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.ollama.minutes.api.MeetingMinutesService} - Extraction and pool administration</li>
 *   <li>{@link fr.lapetina.ollama.minutes.MeetingMinutesApplication} - Command line entry point</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (MinutesExtractorFactory factory = MinutesExtractorFactory.create("minutes-config.yaml").start()) {
 *     ExtractionResult result = factory.getService().extractMeetingMinutes(transcript);
 *     System.out.println(result.confidenceScore());
 * }
 * }</pre>
 *
 * @see fr.lapetina.ollama.minutes.MinutesExtractorFactory
 * @see fr.lapetina.ollama.minutes.extraction.ExtractionOrchestrator
 */
package fr.lapetina.ollama.minutes;
