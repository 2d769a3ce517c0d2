package fr.lapetina.ollama.minutes.domain.recovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryConfigTest {

    private static ErrorInfo error(ErrorType type, Class<? extends Throwable> exceptionType) {
        return new ErrorInfo("err_test", type, "failure", exceptionType, Severity.MEDIUM,
                type.isRecoverable(), "none", Map.of(), Instant.now());
    }

    @Test
    @DisplayName("exponential backoff should double the delay per attempt")
    void shouldComputeExponentialDelays() {
        RetryConfig config = new RetryConfig(RetryStrategy.EXPONENTIAL_BACKOFF, 4,
                Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, false);

        assertThat(config.computeDelay(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.computeDelay(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.computeDelay(3)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("linear backoff should grow by the base delay")
    void shouldComputeLinearDelays() {
        RetryConfig config = RetryConfig.defaultFor(ErrorType.TIMEOUT);

        assertThat(config.computeDelay(1)).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.computeDelay(2)).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.computeDelay(3)).isEqualTo(Duration.ofSeconds(15));
    }

    @Test
    @DisplayName("delay should be clamped to the max delay")
    void shouldClampToMaxDelay() {
        RetryConfig config = new RetryConfig(RetryStrategy.EXPONENTIAL_BACKOFF, 10,
                Duration.ofSeconds(1), Duration.ofSeconds(5), 2.0, false);

        assertThat(config.computeDelay(8)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("jitter should keep the delay within half and one and a half times the base")
    void shouldApplyJitterWithinBounds() {
        RetryConfig config = new RetryConfig(RetryStrategy.FIXED_DELAY, 3,
                Duration.ofSeconds(2), Duration.ofSeconds(2), 1.0, true);

        for (int i = 0; i < 100; i++) {
            Duration delay = config.computeDelay(1);
            assertThat(delay).isBetween(Duration.ofSeconds(1), Duration.ofSeconds(3));
        }
    }

    @Test
    @DisplayName("immediate strategy should not wait")
    void shouldNotWaitForImmediate() {
        assertThat(RetryConfig.defaultFor(ErrorType.PROCESSING).computeDelay(1)).isZero();
    }

    @Test
    @DisplayName("attempts are 1-based")
    void shouldRejectAttemptZero() {
        assertThatThrownBy(() -> RetryConfig.defaultFor(ErrorType.NETWORK).computeDelay(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("validation and user errors should never be retried")
    void shouldNotRetryTerminalTypes() {
        assertThat(RetryConfig.defaultFor(ErrorType.VALIDATION).shouldRetry(
                error(ErrorType.VALIDATION, IllegalArgumentException.class))).isFalse();
        assertThat(RetryConfig.defaultFor(ErrorType.USER).maxAttempts()).isZero();

        // Even a permissive policy refuses a non-recoverable error
        RetryConfig permissive = RetryConfig.defaultFor(ErrorType.UNKNOWN);
        assertThat(permissive.shouldRetry(error(ErrorType.USER, IllegalStateException.class))).isFalse();
    }

    @Test
    @DisplayName("stop list should block matching exception types")
    void shouldHonourStopList() {
        RetryConfig config = new RetryConfig(RetryStrategy.IMMEDIATE, 3, Duration.ZERO, Duration.ZERO,
                1.0, false, Set.of(IOException.class));

        assertThat(config.shouldRetry(error(ErrorType.NETWORK, java.net.ConnectException.class))).isFalse();
        assertThat(config.shouldRetry(error(ErrorType.NETWORK, IllegalStateException.class))).isTrue();
    }

    @Test
    @DisplayName("every error type should have a default policy")
    void shouldHaveDefaultForEveryType() {
        for (ErrorType type : ErrorType.values()) {
            RetryConfig config = RetryConfig.defaultFor(type);
            assertThat(config).isNotNull();
            assertThat(config.maxAttempts() > 0).isEqualTo(type.isRecoverable());
        }
    }
}
