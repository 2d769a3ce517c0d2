package fr.lapetina.ollama.minutes.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.ollama.minutes.domain.model.GenerationRequest;
import fr.lapetina.ollama.minutes.domain.model.GenerationResponse;
import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP client for the Ollama generate API.
 *
 * Calls are blocking: the caller's worker thread waits on the response, and the
 * request carries the endpoint's configured timeout. Circuit breaking and failover
 * live in the pool, not here. Subclassed in tests to script responses.
 */
public class OllamaHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OllamaHttpClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration probeTimeout;

    public OllamaHttpClient(Duration connectTimeout, Duration probeTimeout) {
        this.probeTimeout = probeTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public OllamaHttpClient() {
        this(Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    /**
     * Sends a non-streaming generate request to the endpoint and waits for the answer.
     *
     * @throws java.net.http.HttpTimeoutException if the endpoint timeout elapses
     * @throws LlmServiceException                 on a non-2xx status or an unreadable body
     * @throws IOException                         on connection failures
     */
    public GenerationResponse generate(LlmEndpoint endpoint, GenerationRequest request)
            throws IOException, InterruptedException {
        URI uri = resolve(endpoint, "api/generate");
        String model = request.modelFor(endpoint);
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(endpoint.getTimeout())
                .header("Content-Type", "application/json")
                .header("X-Request-ID", request.requestId())
                .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(request, model)))
                .build();

        log.debug("Sending generate request: endpointId={}, requestId={}, model={}, uri={}",
                endpoint.getId(), request.requestId(), model, uri);

        Instant start = Instant.now();
        HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        Duration latency = Duration.between(start, Instant.now());
        int statusCode = response.statusCode();

        if (statusCode < 200 || statusCode >= 300) {
            String message = extractErrorMessage(response.body(), statusCode);
            log.warn("Generate request failed with HTTP error: endpointId={}, requestId={}, status={}, latencyMs={}",
                    endpoint.getId(), request.requestId(), statusCode, latency.toMillis());
            throw new LlmServiceException(endpoint.getId(), statusCode, message);
        }

        log.debug("Generate request successful: endpointId={}, requestId={}, status={}, latencyMs={}",
                endpoint.getId(), request.requestId(), statusCode, latency.toMillis());
        return parseResponse(endpoint, request, model, response.body());
    }

    String buildRequestBody(GenerationRequest request, String model) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", request.prompt());
        body.put("stream", false);
        if (request.system() != null) {
            body.put("system", request.system());
        }
        if (request.format() != null) {
            body.put("format", request.format());
        }
        if (!request.options().isEmpty()) {
            body.put("options", request.options());
        }
        return objectMapper.writeValueAsString(body);
    }

    GenerationResponse parseResponse(LlmEndpoint endpoint, GenerationRequest request, String model, String body)
            throws LlmServiceException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new LlmServiceException(endpoint.getId(), "Failed to parse generate response", e);
        }
        if (root == null || !root.isObject() || !root.hasNonNull("response")) {
            throw new LlmServiceException(endpoint.getId(), 200, "Generate response has no content");
        }

        List<Integer> context = new ArrayList<>();
        JsonNode contextNode = root.path("context");
        if (contextNode.isArray()) {
            contextNode.forEach(n -> context.add(n.asInt()));
        }

        return new GenerationResponse(
                request.requestId(),
                root.path("model").asText(model),
                root.get("response").asText(),
                root.path("done").asBoolean(true),
                endpoint.getId(),
                Instant.now(),
                nanos(root, "total_duration"),
                nanos(root, "load_duration"),
                root.path("prompt_eval_count").asInt(0),
                root.path("eval_count").asInt(0),
                context
        );
    }

    private static Duration nanos(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.canConvertToLong() ? Duration.ofNanos(node.asLong()) : null;
    }

    private String extractErrorMessage(String body, int statusCode) {
        String message = "HTTP " + statusCode;
        if (body == null || body.isBlank()) {
            return message;
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return message + ": " + error.asText();
            }
        } catch (IOException e) {
            log.debug("Error body is not JSON: status={}", statusCode);
        }
        return message;
    }

    /**
     * Liveness probe against {@code GET /api/version}.
     * Completes with false on a non-200 status or any error; never completes exceptionally.
     */
    public CompletableFuture<Boolean> healthCheck(LlmEndpoint endpoint) {
        URI uri = resolve(endpoint, "api/version");

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(probeTimeout)
                .GET()
                .build();

        log.debug("Health check started: endpointId={}, uri={}", endpoint.getId(), uri);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean healthy = response.statusCode() == 200;
                    if (healthy) {
                        log.debug("Health check passed: endpointId={}, status={}", endpoint.getId(), response.statusCode());
                    } else {
                        log.warn("Health check failed: endpointId={}, status={}", endpoint.getId(), response.statusCode());
                    }
                    return healthy;
                })
                .exceptionally(ex -> {
                    log.warn("Health check error: endpointId={}, error={}", endpoint.getId(), ex.getMessage());
                    return false;
                });
    }

    private static URI resolve(LlmEndpoint endpoint, String path) {
        String basePath = endpoint.getBaseUrl().toString();
        if (!basePath.endsWith("/")) {
            basePath += "/";
        }
        return URI.create(basePath + path);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public void close() {
        // HttpClient needs no explicit closing on Java 17
    }
}
