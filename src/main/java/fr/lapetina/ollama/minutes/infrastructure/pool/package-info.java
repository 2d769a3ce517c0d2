/**
 * Named pools of LLM endpoints.
 *
 * <p>Each pool owns an {@link fr.lapetina.ollama.minutes.infrastructure.pool.EndpointRegistry},
 * one {@link fr.lapetina.ollama.minutes.infrastructure.pool.CircuitBreaker} per endpoint and a
 * load balancing strategy. {@link fr.lapetina.ollama.minutes.infrastructure.pool.ConnectionPoolManager}
 * routes generate calls with failover across the endpoints of a pool.
 *
 * <p>Leases must be closed; closing releases the endpoint slot and any unused half-open permit.
 */
package fr.lapetina.ollama.minutes.infrastructure.pool;
