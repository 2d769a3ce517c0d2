package fr.lapetina.ollama.minutes.infrastructure.recovery;

import fr.lapetina.ollama.minutes.domain.recovery.ErrorInfo;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;
import fr.lapetina.ollama.minutes.domain.recovery.Severity;
import fr.lapetina.ollama.minutes.extraction.ExtractionField;
import fr.lapetina.ollama.minutes.extraction.MalformedExtractionException;
import fr.lapetina.ollama.minutes.extraction.preprocess.PreprocessingException;
import fr.lapetina.ollama.minutes.infrastructure.http.LlmServiceException;
import fr.lapetina.ollama.minutes.infrastructure.pool.NoHealthyEndpointException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private ErrorClassifier classifier;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC);
        classifier = new ErrorClassifier(clock);
    }

    private ErrorType typeOf(Throwable error) {
        return classifier.classify(error, Map.of()).errorType();
    }

    @Nested
    @DisplayName("type based classification")
    class TypeBased {

        @Test
        @DisplayName("should classify transport failures as network")
        void shouldClassifyNetwork() {
            assertThat(typeOf(new ConnectException("Connection refused"))).isEqualTo(ErrorType.NETWORK);
            assertThat(typeOf(new UnknownHostException("gpu-1"))).isEqualTo(ErrorType.NETWORK);
            assertThat(typeOf(new HttpConnectTimeoutException("connect timed out"))).isEqualTo(ErrorType.NETWORK);
        }

        @Test
        @DisplayName("should classify call timeouts as timeout")
        void shouldClassifyTimeout() {
            assertThat(typeOf(new HttpTimeoutException("request timed out"))).isEqualTo(ErrorType.TIMEOUT);
            assertThat(typeOf(new SocketTimeoutException("Read timed out"))).isEqualTo(ErrorType.TIMEOUT);
        }

        @Test
        @DisplayName("should use the type declared by domain exceptions")
        void shouldUseDeclaredType() {
            assertThat(typeOf(new NoHealthyEndpointException("default"))).isEqualTo(ErrorType.AI_SERVICE);
            assertThat(typeOf(new LlmServiceException("gpu-1", 500, "model not loaded"))).isEqualTo(ErrorType.AI_SERVICE);
            assertThat(typeOf(new MalformedExtractionException(ExtractionField.DECISIONS, "not json")))
                    .isEqualTo(ErrorType.PROCESSING);
            assertThat(typeOf(new PreprocessingException("Transcript is empty"))).isEqualTo(ErrorType.USER);
        }

        @Test
        @DisplayName("should classify file system and resource failures")
        void shouldClassifyFileSystemAndResource() {
            assertThat(typeOf(new NoSuchFileException("/tmp/missing"))).isEqualTo(ErrorType.FILESYSTEM);
            assertThat(typeOf(new UncheckedIOException(new AccessDeniedException("/var/out"))))
                    .isEqualTo(ErrorType.FILESYSTEM);
            assertThat(typeOf(new RejectedExecutionException("queue full"))).isEqualTo(ErrorType.RESOURCE);
        }

        @Test
        @DisplayName("should classify illegal arguments as validation")
        void shouldClassifyValidation() {
            ErrorInfo info = classifier.classify(new IllegalArgumentException("bad input"), Map.of());

            assertThat(info.errorType()).isEqualTo(ErrorType.VALIDATION);
            assertThat(info.recoverable()).isFalse();
            assertThat(info.severity()).isEqualTo(Severity.LOW);
        }

        @Test
        @DisplayName("should unwrap future wrappers")
        void shouldUnwrapFutureWrappers() {
            Throwable wrapped = new CompletionException(new ExecutionException(new ConnectException("refused")));

            ErrorInfo info = classifier.classify(wrapped, Map.of());

            assertThat(info.errorType()).isEqualTo(ErrorType.NETWORK);
            assertThat(info.exceptionType()).isEqualTo(ConnectException.class);
        }
    }

    @Nested
    @DisplayName("message based classification")
    class MessageBased {

        @Test
        @DisplayName("should fall back to message keywords")
        void shouldUseKeywords() {
            assertThat(typeOf(new IllegalStateException("Ollama returned garbage"))).isEqualTo(ErrorType.AI_SERVICE);
            assertThat(typeOf(new IllegalStateException("network unreachable"))).isEqualTo(ErrorType.NETWORK);
        }

        @Test
        @DisplayName("should classify everything else as unknown")
        void shouldDefaultToUnknown() {
            assertThat(typeOf(new IllegalStateException("boom"))).isEqualTo(ErrorType.UNKNOWN);
            assertThat(typeOf(new NullPointerException())).isEqualTo(ErrorType.UNKNOWN);
        }
    }

    @Test
    @DisplayName("should build error info with id, context and suggestion")
    void shouldBuildErrorInfo() {
        ErrorInfo first = classifier.classify(new ConnectException("refused"), Map.of("field", "decisions"));
        ErrorInfo second = classifier.classify(new ConnectException("refused"), Map.of());

        assertThat(first.errorId()).isEqualTo("err_20240305_140709_0000");
        assertThat(second.errorId()).isEqualTo("err_20240305_140709_0001");
        assertThat(first.context()).containsEntry("field", "decisions");
        assertThat(first.suggestedAction()).isNotBlank();
        assertThat(first.timestamp()).isEqualTo(Instant.parse("2024-03-05T14:07:09Z"));
        assertThat(first.recoverable()).isTrue();
    }
}
