/**
 * Load balancing policies for choosing an endpoint within a pool.
 *
 * <table border="1">
 *   <tr><th>Strategy</th><th>Selection</th></tr>
 *   <tr><td>{@code round_robin}</td><td>Per-pool counter modulo candidate count</td></tr>
 *   <tr><td>{@code random}</td><td>Uniform choice</td></tr>
 *   <tr><td>{@code least_connections}</td><td>Fewest active connections</td></tr>
 *   <tr><td>{@code response_time}</td><td>Lowest smoothed response time</td></tr>
 *   <tr><td>{@code health_based}</td><td>Healthy first, then highest priority (default)</td></tr>
 * </table>
 *
 * <p>Strategies are a closed set: see {@link fr.lapetina.ollama.minutes.domain.strategy.StrategyType}.
 */
package fr.lapetina.ollama.minutes.domain.strategy;
