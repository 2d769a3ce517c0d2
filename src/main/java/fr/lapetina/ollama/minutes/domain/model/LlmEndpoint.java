package fr.lapetina.ollama.minutes.domain.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One reachable instance of the LLM inference service.
 *
 * Connection counters and rolling metrics are guarded by a per-endpoint lock,
 * so acquire, release and metric updates on the same endpoint are applied atomically
 * with respect to each other. Different endpoints never share a lock.
 */
public final class LlmEndpoint {

    /** Smoothing factor for the response-time moving average. */
    static final double EMA_ALPHA = 0.1;

    public enum FailureKind {
        TIMEOUT,
        CONNECTION,
        OTHER
    }

    private final String id;
    private final URI baseUrl;
    private final String modelName;
    private final int priority;
    private final int maxConcurrent;
    private final Duration timeout;

    private final Object lock = new Object();
    private final AtomicReference<EndpointStatus> status;
    private volatile boolean enabled;

    // Guarded by lock
    private int activeConnections;
    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private long connectionErrors;
    private long timeoutErrors;
    private long responseSamples;
    private double emaResponseTimeMs;
    private Instant lastRequestTime;
    private Instant lastHealthCheck;

    private LlmEndpoint(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Endpoint ID is required");
        this.baseUrl = Objects.requireNonNull(builder.baseUrl, "Base URL is required");
        this.modelName = Objects.requireNonNull(builder.modelName, "Model name is required");
        if (builder.maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1: " + builder.maxConcurrent);
        }
        this.priority = Math.max(1, Math.min(10, builder.priority));
        this.maxConcurrent = builder.maxConcurrent;
        this.timeout = Objects.requireNonNull(builder.timeout, "Timeout is required");
        this.enabled = builder.enabled;
        this.status = new AtomicReference<>(builder.initialStatus);
    }

    public String getId() {
        return id;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    public String getModelName() {
        return modelName;
    }

    public int getPriority() {
        return priority;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public EndpointStatus getStatus() {
        return status.get();
    }

    /**
     * Updates the status from a health probe.
     *
     * @return the previous status
     */
    public EndpointStatus updateHealth(EndpointStatus newStatus) {
        synchronized (lock) {
            lastHealthCheck = Instant.now();
        }
        return status.getAndSet(newStatus);
    }

    public int getActiveConnections() {
        synchronized (lock) {
            return activeConnections;
        }
    }

    /**
     * Attempts to take a connection slot.
     * @return true if slot acquired, false if at capacity
     */
    public boolean tryAcquire() {
        synchronized (lock) {
            if (activeConnections >= maxConcurrent) {
                return false;
            }
            activeConnections++;
            return true;
        }
    }

    /**
     * Returns a connection slot. Never drops below zero.
     */
    public void release() {
        synchronized (lock) {
            if (activeConnections > 0) {
                activeConnections--;
            }
        }
    }

    /**
     * Whether this endpoint passes the static part of the acquire filter.
     * Circuit breaker state is checked by the pool.
     */
    public boolean isAcquirable() {
        if (!enabled || !status.get().isRoutable()) {
            return false;
        }
        synchronized (lock) {
            return activeConnections < maxConcurrent;
        }
    }

    public void recordRequestStart() {
        synchronized (lock) {
            totalRequests++;
            lastRequestTime = Instant.now();
        }
    }

    public void recordSuccess(Duration responseTime) {
        double sampleMs = responseTime.toNanos() / 1_000_000.0;
        synchronized (lock) {
            successfulRequests++;
            if (responseSamples == 0) {
                emaResponseTimeMs = sampleMs;
            } else {
                emaResponseTimeMs = EMA_ALPHA * sampleMs + (1 - EMA_ALPHA) * emaResponseTimeMs;
            }
            responseSamples++;
        }
    }

    public void recordFailure(FailureKind kind) {
        synchronized (lock) {
            failedRequests++;
            switch (kind) {
                case TIMEOUT -> timeoutErrors++;
                case CONNECTION -> connectionErrors++;
                case OTHER -> {
                    // counted in failedRequests only
                }
            }
        }
    }

    /**
     * Smoothed response time, or {@link Double#POSITIVE_INFINITY} when no request completed yet.
     */
    public double getAverageResponseTimeMs() {
        synchronized (lock) {
            return responseSamples == 0 ? Double.POSITIVE_INFINITY : emaResponseTimeMs;
        }
    }

    public EndpointMetrics metrics() {
        synchronized (lock) {
            double successRate = totalRequests > 0
                    ? (successfulRequests * 100.0) / totalRequests
                    : 0.0;
            return new EndpointMetrics(
                    totalRequests,
                    successfulRequests,
                    failedRequests,
                    successRate,
                    responseSamples == 0 ? 0.0 : emaResponseTimeMs,
                    responseSamples,
                    connectionErrors,
                    timeoutErrors,
                    lastRequestTime,
                    lastHealthCheck
            );
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LlmEndpoint that = (LlmEndpoint) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "LlmEndpoint{" +
                "id='" + id + '\'' +
                ", baseUrl=" + baseUrl +
                ", model=" + modelName +
                ", status=" + status.get() +
                ", active=" + getActiveConnections() +
                "/" + maxConcurrent +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private URI baseUrl;
        private String modelName;
        private int priority = 5;
        private int maxConcurrent = 5;
        private Duration timeout = Duration.ofSeconds(60);
        private boolean enabled = true;
        private EndpointStatus initialStatus = EndpointStatus.UNKNOWN;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder baseUrl(String url) {
            this.baseUrl = URI.create(url);
            return this;
        }

        public Builder baseUrl(URI url) {
            this.baseUrl = url;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder initialStatus(EndpointStatus status) {
            this.initialStatus = status;
            return this;
        }

        public LlmEndpoint build() {
            return new LlmEndpoint(this);
        }
    }
}
