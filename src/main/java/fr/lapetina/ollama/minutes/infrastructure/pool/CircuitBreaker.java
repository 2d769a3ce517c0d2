package fr.lapetina.ollama.minutes.infrastructure.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-endpoint circuit breaker.
 *
 * States:
 * - CLOSED: Normal operation, every success resets the failure count
 * - OPEN: Failure count reached the threshold, calls rejected until the timeout window
 *   since the last failure has elapsed
 * - HALF_OPEN: Exactly one trial call allowed; success closes the circuit, failure
 *   re-opens it and restarts the window
 *
 * State changes are serialised on the breaker itself; breakers of different endpoints
 * never contend.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    /**
     * Outcome of a permission request. A trial permit carries the number of the HALF_OPEN
     * trial it was issued for, so only its holder can hand it back.
     */
    public record Permit(boolean granted, long trial) {

        static final Permit DENIED = new Permit(false, 0);
        static final Permit CALL = new Permit(true, 0);

        public boolean isTrial() {
            return trial != 0;
        }
    }

    private final String endpointId;
    private final int failureThreshold;
    private final Duration timeoutWindow;

    private State state = State.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private boolean trialInFlight;
    private long trialCounter;

    public CircuitBreaker(String endpointId, int failureThreshold, Duration timeoutWindow) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1: " + failureThreshold);
        }
        this.endpointId = endpointId;
        this.failureThreshold = failureThreshold;
        this.timeoutWindow = timeoutWindow;
    }

    public CircuitBreaker(String endpointId) {
        this(endpointId, 5, Duration.ofSeconds(60));
    }

    /**
     * Checks without side effects whether a call could currently be permitted.
     * Used to filter candidates before selection.
     */
    public synchronized boolean isCallPermitted() {
        return switch (state) {
            case CLOSED -> true;
            case OPEN -> windowElapsed();
            case HALF_OPEN -> !trialInFlight;
        };
    }

    /**
     * Takes permission for one call. In OPEN state with an elapsed window this moves the
     * breaker to HALF_OPEN and hands out its single trial permit.
     *
     * @return true if the call may proceed
     */
    public boolean tryAcquirePermission() {
        return acquirePermit().granted();
    }

    /**
     * Same as {@link #tryAcquirePermission()} but tells the caller whether it holds the
     * HALF_OPEN trial.
     */
    public synchronized Permit acquirePermit() {
        switch (state) {
            case CLOSED:
                return Permit.CALL;

            case OPEN:
                if (!windowElapsed()) {
                    return Permit.DENIED;
                }
                state = State.HALF_OPEN;
                log.info("Circuit breaker HALF_OPEN, trial call permitted: endpointId={}", endpointId);
                return startTrial();

            case HALF_OPEN:
                if (trialInFlight) {
                    return Permit.DENIED;
                }
                return startTrial();

            default:
                return Permit.DENIED;
        }
    }

    /**
     * Returns a trial permit whose call ended without an outcome (cancelled before completion).
     * Permits of ordinary calls, or of a trial that has since been superseded, are ignored.
     */
    public synchronized void releasePermission(Permit permit) {
        if (state == State.HALF_OPEN && trialInFlight && permit.isTrial() && permit.trial() == trialCounter) {
            trialInFlight = false;
        }
    }

    private Permit startTrial() {
        trialInFlight = true;
        trialCounter++;
        return new Permit(true, trialCounter);
    }

    /**
     * Records a successful call.
     */
    public synchronized void recordSuccess() {
        switch (state) {
            case CLOSED -> failureCount = 0;
            case HALF_OPEN -> {
                state = State.CLOSED;
                failureCount = 0;
                trialInFlight = false;
                log.info("Circuit breaker CLOSED after successful trial: endpointId={}", endpointId);
            }
            case OPEN -> {
                // A call admitted before the circuit opened; the window still has to elapse
            }
        }
    }

    /**
     * Records a failed call.
     */
    public synchronized void recordFailure() {
        lastFailureTime = Instant.now();
        failureCount++;

        switch (state) {
            case CLOSED -> {
                if (failureCount >= failureThreshold) {
                    state = State.OPEN;
                    log.warn("Circuit breaker OPENED: endpointId={}, failures={}", endpointId, failureCount);
                }
            }
            case HALF_OPEN -> {
                state = State.OPEN;
                trialInFlight = false;
                log.warn("Circuit breaker OPENED (half-open trial failed): endpointId={}", endpointId);
            }
            case OPEN -> {
                // Window restarts from this failure
            }
        }
    }

    /**
     * Forces the circuit to a specific state. For testing/admin use.
     */
    public synchronized void forceState(State newState) {
        State old = state;
        state = newState;
        trialInFlight = false;
        if (newState == State.CLOSED) {
            failureCount = 0;
        }
        if (newState == State.OPEN) {
            lastFailureTime = Instant.now();
        }
        log.info("Circuit breaker forced from {} to {}: endpointId={}", old, newState, endpointId);
    }

    /**
     * Current stored state. Does not perform the time-based OPEN to HALF_OPEN transition;
     * that happens when a permit is requested.
     */
    public synchronized State getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public String getEndpointId() {
        return endpointId;
    }

    public Duration getTimeoutWindow() {
        return timeoutWindow;
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(state, failureCount, lastFailureTime, timeoutWindow);
    }

    private boolean windowElapsed() {
        return lastFailureTime == null
                || Instant.now().isAfter(lastFailureTime.plus(timeoutWindow));
    }

    @Override
    public synchronized String toString() {
        return "CircuitBreaker{" +
                "endpointId='" + endpointId + '\'' +
                ", state=" + state +
                ", failures=" + failureCount +
                '}';
    }
}
