/**
 * Domain model for the LLM endpoint pool.
 *
 * <ul>
 *   <li>{@link fr.lapetina.ollama.minutes.domain.model.LlmEndpoint} - Endpoint with mutable health and metrics</li>
 *   <li>{@link fr.lapetina.ollama.minutes.domain.model.EndpointStatus} - Health status reported by the probe</li>
 *   <li>{@link fr.lapetina.ollama.minutes.domain.model.GenerationRequest} - Immutable generate request</li>
 *   <li>{@link fr.lapetina.ollama.minutes.domain.model.GenerationResponse} - Immutable generate response</li>
 * </ul>
 */
package fr.lapetina.ollama.minutes.domain.model;
