package fr.lapetina.ollama.minutes.infrastructure.http;

import fr.lapetina.ollama.minutes.domain.model.GenerationRequest;
import fr.lapetina.ollama.minutes.domain.model.GenerationResponse;
import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Stub HTTP client for testing: scripted generate responses and health probes, no network.
 */
public class StubOllamaHttpClient extends OllamaHttpClient {

    /**
     * Produces the content of a generate response, or throws to simulate a failed call.
     */
    @FunctionalInterface
    public interface Responder {
        String respond(LlmEndpoint endpoint, GenerationRequest request) throws IOException, InterruptedException;
    }

    private volatile Responder responder = (endpoint, request) -> "{}";
    private final List<String> calledEndpoints = new CopyOnWriteArrayList<>();
    private final List<GenerationRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Boolean> health = new ConcurrentHashMap<>();
    private final Map<String, Duration> probeDelays = new ConcurrentHashMap<>();

    public StubOllamaHttpClient() {
        super(Duration.ofSeconds(1), Duration.ofSeconds(1));
    }

    public void setResponder(Responder responder) {
        this.responder = responder;
    }

    /**
     * Sets a fixed content for every generate call.
     */
    public void setContent(String content) {
        this.responder = (endpoint, request) -> content;
    }

    /**
     * Makes every generate call fail with the given exception.
     */
    public void setFailure(IOException failure) {
        this.responder = (endpoint, request) -> {
            throw failure;
        };
    }

    public void setHealthy(String endpointId, boolean healthy) {
        health.put(endpointId, healthy);
    }

    public void setProbeDelay(String endpointId, Duration delay) {
        probeDelays.put(endpointId, delay);
    }

    public List<String> getCalledEndpoints() {
        return List.copyOf(calledEndpoints);
    }

    public List<GenerationRequest> getRequests() {
        return List.copyOf(requests);
    }

    @Override
    public GenerationResponse generate(LlmEndpoint endpoint, GenerationRequest request)
            throws IOException, InterruptedException {
        calledEndpoints.add(endpoint.getId());
        requests.add(request);
        String content = responder.respond(endpoint, request);
        return GenerationResponse.of(request.requestId(), request.modelFor(endpoint), content, endpoint.getId());
    }

    @Override
    public CompletableFuture<Boolean> healthCheck(LlmEndpoint endpoint) {
        boolean healthy = health.getOrDefault(endpoint.getId(), true);
        Duration delay = probeDelays.get(endpoint.getId());
        if (delay == null) {
            return CompletableFuture.completedFuture(healthy);
        }
        return CompletableFuture.supplyAsync(() -> healthy,
                CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
    }
}
