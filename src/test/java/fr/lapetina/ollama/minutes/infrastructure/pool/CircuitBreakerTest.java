package fr.lapetina.ollama.minutes.infrastructure.pool;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerTest {

    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        // Fast circuit breaker for testing: 3 failures, 100ms window
        circuitBreaker = new CircuitBreaker("test-endpoint", 3, Duration.ofMillis(100));
    }

    private void open() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
    }

    @Test
    @DisplayName("should start in CLOSED state")
    void shouldStartClosed() {
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.isCallPermitted()).isTrue();
        assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
    }

    @Test
    @DisplayName("should open after threshold failures")
    void shouldOpenAfterThresholdFailures() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);

        circuitBreaker.recordFailure(); // Third failure hits threshold

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.isCallPermitted()).isFalse();
        assertThat(circuitBreaker.tryAcquirePermission()).isFalse();
        assertThat(circuitBreaker.getLastFailureTime()).isNotNull();
    }

    @Test
    @DisplayName("should reset failure count on success")
    void shouldResetFailureCountOnSuccess() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertThat(circuitBreaker.getFailureCount()).isEqualTo(2);

        circuitBreaker.recordSuccess();

        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should hand out a single trial permit after the window")
    void shouldHandOutSingleTrialPermit() throws InterruptedException {
        open();
        Thread.sleep(150);

        assertThat(circuitBreaker.isCallPermitted()).isTrue();
        assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);

        // Trial in flight: nobody else gets in
        assertThat(circuitBreaker.isCallPermitted()).isFalse();
        assertThat(circuitBreaker.tryAcquirePermission()).isFalse();
    }

    @Test
    @DisplayName("should close after a successful trial")
    void shouldCloseAfterSuccessfulTrial() throws InterruptedException {
        open();
        Thread.sleep(150);
        circuitBreaker.tryAcquirePermission();

        circuitBreaker.recordSuccess();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should reopen on failure in HALF_OPEN")
    void shouldReopenOnFailureInHalfOpen() throws InterruptedException {
        open();
        Thread.sleep(150);
        circuitBreaker.tryAcquirePermission();

        circuitBreaker.recordFailure();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.isCallPermitted()).isFalse();
    }

    @Test
    @DisplayName("should return an abandoned trial permit")
    void shouldReturnAbandonedPermit() throws InterruptedException {
        open();
        Thread.sleep(150);
        CircuitBreaker.Permit trial = circuitBreaker.acquirePermit();

        circuitBreaker.releasePermission(trial);

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
    }

    @Test
    @DisplayName("should ignore releases from permits that do not hold the trial")
    void shouldIgnoreForeignRelease() throws InterruptedException {
        CircuitBreaker.Permit ordinary = circuitBreaker.acquirePermit();
        assertThat(ordinary.granted()).isTrue();
        assertThat(ordinary.isTrial()).isFalse();
        open();
        Thread.sleep(150);
        CircuitBreaker.Permit trial = circuitBreaker.acquirePermit();
        assertThat(trial.isTrial()).isTrue();

        circuitBreaker.releasePermission(ordinary);

        assertThat(circuitBreaker.isCallPermitted()).isFalse();
        assertThat(circuitBreaker.acquirePermit().granted()).isFalse();
    }

    @Test
    @DisplayName("should ignore the release of a superseded trial")
    void shouldIgnoreSupersededTrialRelease() throws InterruptedException {
        open();
        Thread.sleep(150);
        CircuitBreaker.Permit first = circuitBreaker.acquirePermit();
        circuitBreaker.recordFailure();
        Thread.sleep(150);
        CircuitBreaker.Permit second = circuitBreaker.acquirePermit();
        assertThat(second.isTrial()).isTrue();

        circuitBreaker.releasePermission(first);

        assertThat(circuitBreaker.tryAcquirePermission()).isFalse();
        circuitBreaker.releasePermission(second);
        assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
    }

    @Test
    @DisplayName("should allow forcing state")
    void shouldAllowForcingState() {
        circuitBreaker.forceState(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        circuitBreaker.forceState(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should expose a consistent snapshot")
    void shouldExposeSnapshot() {
        circuitBreaker.recordFailure();

        CircuitBreakerSnapshot snapshot = circuitBreaker.snapshot();

        assertThat(snapshot.state()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(snapshot.failureCount()).isEqualTo(1);
    }
}
