package fr.lapetina.ollama.minutes.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.ollama.minutes.domain.model.GenerationRequest;
import fr.lapetina.ollama.minutes.domain.model.GenerationResponse;
import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Exercises the client against a local JDK HttpServer standing in for Ollama.
 */
class OllamaHttpClientTest {

    private HttpServer server;
    private OllamaHttpClient client;
    private LlmEndpoint endpoint;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private volatile int generateStatus = 200;
    private volatile String generateBody;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/generate", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, generateStatus, generateBody);
        });
        server.createContext("/api/version", exchange -> respond(exchange, 200, "{\"version\":\"0.3.0\"}"));
        server.start();

        client = new OllamaHttpClient(Duration.ofSeconds(2), Duration.ofSeconds(2));
        endpoint = LlmEndpoint.builder()
                .id("local")
                .baseUrl("http://127.0.0.1:" + server.getAddress().getPort())
                .modelName("llama3.1:8b")
                .timeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    @DisplayName("should send a non-streaming JSON generate request and parse the answer")
    void shouldGenerate() throws Exception {
        generateBody = "{\"model\":\"llama3.1:8b\",\"response\":\"{\\\"title\\\":\\\"Sync\\\"}\",\"done\":true,"
                + "\"total_duration\":1500000000,\"eval_count\":42}";

        GenerationResponse response = client.generate(endpoint,
                GenerationRequest.ofJson("Extract the title", Map.of("temperature", 0.1)));

        assertThat(response.content()).isEqualTo("{\"title\":\"Sync\"}");
        assertThat(response.endpointId()).isEqualTo("local");
        assertThat(response.totalDuration()).isEqualTo(Duration.ofMillis(1500));
        assertThat(response.evalCount()).isEqualTo(42);

        JsonNode sent = client.getObjectMapper().readTree(lastBody.get());
        assertThat(sent.get("model").asText()).isEqualTo("llama3.1:8b");
        assertThat(sent.get("stream").asBoolean()).isFalse();
        assertThat(sent.get("format").asText()).isEqualTo("json");
        assertThat(sent.get("options").get("temperature").asDouble()).isEqualTo(0.1);
    }

    @Test
    @DisplayName("should raise LlmServiceException with the status on HTTP errors")
    void shouldRaiseOnHttpError() {
        generateStatus = 500;
        generateBody = "{\"error\":\"model not found\"}";

        LlmServiceException thrown = catchThrowableOfType(
                () -> client.generate(endpoint, GenerationRequest.ofPrompt("hello")), LlmServiceException.class);

        assertThat(thrown).isNotNull();
        assertThat(thrown.getStatusCode()).isEqualTo(500);
        assertThat(thrown.getMessage()).contains("model not found");
    }

    @Test
    @DisplayName("should raise LlmServiceException when the envelope has no content")
    void shouldRaiseOnMissingContent() {
        generateBody = "{\"done\":true}";

        LlmServiceException thrown = catchThrowableOfType(
                () -> client.generate(endpoint, GenerationRequest.ofPrompt("hello")), LlmServiceException.class);

        assertThat(thrown).isNotNull();
    }

    @Test
    @DisplayName("health check should report a live endpoint and never fail exceptionally")
    void shouldProbeHealth() throws Exception {
        assertThat(client.healthCheck(endpoint).get(5, TimeUnit.SECONDS)).isTrue();

        LlmEndpoint dead = LlmEndpoint.builder()
                .id("dead")
                .baseUrl("http://127.0.0.1:1")
                .modelName("llama3.1:8b")
                .build();
        assertThat(client.healthCheck(dead).get(5, TimeUnit.SECONDS)).isFalse();
    }
}
