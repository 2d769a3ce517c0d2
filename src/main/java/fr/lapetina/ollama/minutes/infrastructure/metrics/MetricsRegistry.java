package fr.lapetina.ollama.minutes.infrastructure.metrics;

import fr.lapetina.ollama.minutes.domain.model.EndpointStatus;
import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request counters and latency per endpoint
 * - Active connection and status gauges per endpoint
 * - Error, retry and recovery counters by error type
 * - Field extraction counters and run timers
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> recoveryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> fieldCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> extractionTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Meter>> endpointGauges = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("meeting_minutes");
    }

    /**
     * Counts one generate call against an endpoint by outcome ({@code success} or {@code failure}).
     */
    public void incrementRequestCount(String poolId, String endpointId, String outcome) {
        String key = poolId + ":" + endpointId + ":" + outcome;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_llm_requests_total")
                        .description("Total number of LLM generate calls")
                        .tag("pool", poolId)
                        .tag("endpoint", endpointId)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void recordLatency(String poolId, String endpointId, Duration latency) {
        String key = poolId + ":" + endpointId;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_llm_request_latency")
                        .description("LLM generate call latency")
                        .tag("pool", poolId)
                        .tag("endpoint", endpointId)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Registers active connection and status gauges for an endpoint.
     * Status values: 2 healthy, 1 degraded, 0 unhealthy, -1 unknown.
     */
    public void registerEndpoint(String poolId, LlmEndpoint endpoint) {
        String key = poolId + ":" + endpoint.getId();
        endpointGauges.computeIfAbsent(key, k -> List.of(
                Gauge.builder(prefix + "_endpoint_active_connections", endpoint, LlmEndpoint::getActiveConnections)
                        .description("Active connections per endpoint")
                        .tag("pool", poolId)
                        .tag("endpoint", endpoint.getId())
                        .register(registry),
                Gauge.builder(prefix + "_endpoint_status", endpoint, e -> statusValue(e.getStatus()))
                        .description("Endpoint status (2=HEALTHY, 1=DEGRADED, 0=UNHEALTHY, -1=UNKNOWN)")
                        .tag("pool", poolId)
                        .tag("endpoint", endpoint.getId())
                        .register(registry)
        ));
    }

    public void unregisterEndpoint(String poolId, String endpointId) {
        List<Meter> meters = endpointGauges.remove(poolId + ":" + endpointId);
        if (meters != null) {
            meters.forEach(registry::remove);
        }
    }

    private static double statusValue(EndpointStatus status) {
        return switch (status) {
            case HEALTHY -> 2;
            case DEGRADED -> 1;
            case UNHEALTHY -> 0;
            case UNKNOWN -> -1;
        };
    }

    /**
     * Counts a classified failure.
     */
    public void incrementErrorCount(ErrorType errorType) {
        errorCounters.computeIfAbsent(errorType.wireName(), k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of classified errors")
                        .tag("type", k)
                        .register(registry)
        ).increment();
    }

    public void incrementRetryCount(ErrorType errorType) {
        retryCounters.computeIfAbsent(errorType.wireName(), k ->
                Counter.builder(prefix + "_retries_total")
                        .description("Total number of retried attempts")
                        .tag("type", k)
                        .register(registry)
        ).increment();
    }

    public void incrementRecoveryCount(String actionId, boolean recovered) {
        String outcome = recovered ? "recovered" : "not_recovered";
        recoveryCounters.computeIfAbsent(actionId + ":" + outcome, k ->
                Counter.builder(prefix + "_recovery_actions_total")
                        .description("Total number of recovery action runs")
                        .tag("action", actionId)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void incrementFieldExtraction(String field, String outcome) {
        fieldCounters.computeIfAbsent(field + ":" + outcome, k ->
                Counter.builder(prefix + "_field_extractions_total")
                        .description("Total number of field extractions")
                        .tag("field", field)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void recordExtraction(String status, Duration duration) {
        extractionTimers.computeIfAbsent(status, k ->
                Timer.builder(prefix + "_extraction_duration")
                        .description("Meeting minutes extraction run duration")
                        .tag("status", status)
                        .register(registry)
        ).record(duration);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
