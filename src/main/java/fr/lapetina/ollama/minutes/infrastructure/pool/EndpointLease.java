package fr.lapetina.ollama.minutes.infrastructure.pool;

import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped acquisition of one endpoint slot.
 *
 * Use with try-with-resources: {@link #close()} returns the slot on every exit path,
 * including exceptions and interruption. A trial lease closed without a recorded
 * outcome also hands back the circuit breaker trial permit; other leases never touch it.
 */
public final class EndpointLease implements AutoCloseable {

    private final String poolId;
    private final LlmEndpoint endpoint;
    private final CircuitBreaker circuitBreaker;
    private final CircuitBreaker.Permit permit;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean outcomeRecorded;

    EndpointLease(String poolId, LlmEndpoint endpoint, CircuitBreaker circuitBreaker, CircuitBreaker.Permit permit) {
        this.poolId = poolId;
        this.endpoint = endpoint;
        this.circuitBreaker = circuitBreaker;
        this.permit = permit;
    }

    public LlmEndpoint endpoint() {
        return endpoint;
    }

    public String poolId() {
        return poolId;
    }

    /**
     * Records a successful call: metrics, EMA response time, breaker reset.
     */
    public void recordSuccess(Duration responseTime) {
        outcomeRecorded = true;
        endpoint.recordSuccess(responseTime);
        circuitBreaker.recordSuccess();
    }

    /**
     * Records a failed call: failure counters and breaker failure.
     */
    public void recordFailure(LlmEndpoint.FailureKind kind) {
        outcomeRecorded = true;
        endpoint.recordFailure(kind);
        circuitBreaker.recordFailure();
    }

    /**
     * Whether this lease carries the circuit breaker's HALF_OPEN trial.
     */
    public boolean isTrial() {
        return permit.isTrial();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            if (!outcomeRecorded && permit.isTrial()) {
                circuitBreaker.releasePermission(permit);
            }
            endpoint.release();
        }
    }
}
