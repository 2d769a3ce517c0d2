/**
 * YAML configuration loading.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ollama.minutes.infrastructure.config.MinutesConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.ollama.minutes.infrastructure.config.ConfigLoader} - Loads from file or classpath</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code pools} - Endpoint pools with strategy, retries and circuit breaker settings</li>
 *   <li>{@code currentPool} - Pool used when a call names none</li>
 *   <li>{@code healthCheck} - Probe interval and thresholds</li>
 *   <li>{@code http} - HTTP client settings</li>
 *   <li>{@code retry} - Error history size and retry policy overrides per error type</li>
 *   <li>{@code recovery} - Work directories and free disk threshold</li>
 *   <li>{@code extraction} - Parallelism, text window and run timeout</li>
 *   <li>{@code metrics} - Prometheus metric name prefix</li>
 * </ul>
 *
 * @see fr.lapetina.ollama.minutes.infrastructure.config.ConfigLoader
 */
package fr.lapetina.ollama.minutes.infrastructure.config;
