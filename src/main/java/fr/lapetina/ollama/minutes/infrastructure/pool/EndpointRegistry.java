package fr.lapetina.ollama.minutes.infrastructure.pool;

import fr.lapetina.ollama.minutes.domain.model.EndpointStatus;
import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Ordered registry of the endpoints of one pool.
 *
 * Registration order is preserved; it is the tie-break order of the load balancing
 * strategies. Reads are lock-free snapshots, writes are rare (administration).
 */
public final class EndpointRegistry {

    private static final Logger log = LoggerFactory.getLogger(EndpointRegistry.class);

    private final String poolId;
    private final List<LlmEndpoint> endpoints = new CopyOnWriteArrayList<>();
    private final List<Consumer<EndpointRegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    public EndpointRegistry(String poolId) {
        this.poolId = poolId;
    }

    /**
     * Registers a new endpoint.
     *
     * @return false if an endpoint with the same ID is already registered
     */
    public synchronized boolean register(LlmEndpoint endpoint) {
        if (find(endpoint.getId()).isPresent()) {
            log.warn("Endpoint already registered: poolId={}, endpointId={}", poolId, endpoint.getId());
            return false;
        }
        endpoints.add(endpoint);
        log.info("Endpoint registered: poolId={}, endpoint={}", poolId, endpoint);
        notifyListeners(new EndpointRegistryEvent(EndpointRegistryEvent.Type.ADDED, poolId, endpoint));
        return true;
    }

    /**
     * Removes an endpoint by ID.
     */
    public synchronized Optional<LlmEndpoint> remove(String endpointId) {
        Optional<LlmEndpoint> removed = find(endpointId);
        removed.ifPresent(endpoint -> {
            endpoints.remove(endpoint);
            log.info("Endpoint removed: poolId={}, endpoint={}", poolId, endpoint);
            notifyListeners(new EndpointRegistryEvent(EndpointRegistryEvent.Type.REMOVED, poolId, endpoint));
        });
        return removed;
    }

    public Optional<LlmEndpoint> find(String endpointId) {
        for (LlmEndpoint endpoint : endpoints) {
            if (endpoint.getId().equals(endpointId)) {
                return Optional.of(endpoint);
            }
        }
        return Optional.empty();
    }

    /**
     * All endpoints in registration order.
     */
    public List<LlmEndpoint> getEndpoints() {
        return List.copyOf(endpoints);
    }

    /**
     * Endpoints that are enabled, regardless of status.
     */
    public List<LlmEndpoint> getEnabledEndpoints() {
        return endpoints.stream()
                .filter(LlmEndpoint::isEnabled)
                .toList();
    }

    public boolean setEnabled(String endpointId, boolean enabled) {
        Optional<LlmEndpoint> endpoint = find(endpointId);
        endpoint.ifPresent(e -> {
            if (e.isEnabled() != enabled) {
                e.setEnabled(enabled);
                log.info("Endpoint {}: poolId={}, endpointId={}",
                        enabled ? "enabled" : "disabled", poolId, endpointId);
                notifyListeners(new EndpointRegistryEvent(EndpointRegistryEvent.Type.ENABLED_CHANGED, poolId, e));
            }
        });
        return endpoint.isPresent();
    }

    /**
     * Applies a probe result to an endpoint.
     */
    public void updateStatus(LlmEndpoint endpoint, EndpointStatus status) {
        EndpointStatus previous = endpoint.updateHealth(status);
        if (previous != status) {
            log.info("Endpoint status changed: poolId={}, endpointId={}, {} -> {}",
                    poolId, endpoint.getId(), previous, status);
            notifyListeners(new EndpointRegistryEvent(EndpointRegistryEvent.Type.STATUS_CHANGED, poolId, endpoint));
        }
    }

    public void addListener(Consumer<EndpointRegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<EndpointRegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(EndpointRegistryEvent event) {
        for (Consumer<EndpointRegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying registry listener: poolId={}", poolId, e);
            }
        }
    }

    public int size() {
        return endpoints.size();
    }

    public String getPoolId() {
        return poolId;
    }

    /**
     * Event for endpoint registry changes.
     */
    public record EndpointRegistryEvent(Type type, String poolId, LlmEndpoint endpoint) {
        public enum Type {
            ADDED,
            REMOVED,
            ENABLED_CHANGED,
            STATUS_CHANGED
        }
    }
}
