package fr.lapetina.ollama.minutes.api;

import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;
import fr.lapetina.ollama.minutes.domain.strategy.StrategyType;
import fr.lapetina.ollama.minutes.extraction.ExtractionOptions;
import fr.lapetina.ollama.minutes.extraction.ExtractionOrchestrator;
import fr.lapetina.ollama.minutes.extraction.ExtractionResult;
import fr.lapetina.ollama.minutes.extraction.preprocess.PreprocessingOptions;
import fr.lapetina.ollama.minutes.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ollama.minutes.infrastructure.pool.ConnectionPoolManager;
import fr.lapetina.ollama.minutes.infrastructure.pool.EndpointPool;
import fr.lapetina.ollama.minutes.infrastructure.pool.PoolSnapshot;
import fr.lapetina.ollama.minutes.infrastructure.recovery.ErrorHistory;

import java.time.Instant;
import java.util.Map;

/**
 * Caller-facing API: meeting minutes extraction and pool administration.
 */
public final class MeetingMinutesService {

    private final ExtractionOrchestrator orchestrator;
    private final ConnectionPoolManager poolManager;
    private final ErrorHistory errorHistory;
    private final MetricsRegistry metricsRegistry;

    public MeetingMinutesService(
            ExtractionOrchestrator orchestrator,
            ConnectionPoolManager poolManager,
            ErrorHistory errorHistory,
            MetricsRegistry metricsRegistry
    ) {
        this.orchestrator = orchestrator;
        this.poolManager = poolManager;
        this.errorHistory = errorHistory;
        this.metricsRegistry = metricsRegistry;
    }

    public ExtractionResult extractMeetingMinutes(String text) {
        return orchestrator.extract(text);
    }

    public ExtractionResult extractMeetingMinutes(
            String text,
            PreprocessingOptions preprocessingOptions,
            ExtractionOptions extractionOptions
    ) {
        return orchestrator.extract(text, preprocessingOptions, extractionOptions);
    }

    public boolean createPool(EndpointPool pool) {
        return poolManager.createPool(pool);
    }

    public boolean removePool(String poolId) {
        return poolManager.removePool(poolId);
    }

    public boolean setCurrentPool(String poolId) {
        return poolManager.setCurrentPool(poolId);
    }

    public boolean addEndpoint(String poolId, LlmEndpoint endpoint) {
        return poolManager.addEndpoint(poolId, endpoint);
    }

    public boolean removeEndpoint(String poolId, String endpointId) {
        return poolManager.removeEndpoint(poolId, endpointId);
    }

    public boolean enableEndpoint(String poolId, String endpointId) {
        return poolManager.enableEndpoint(poolId, endpointId);
    }

    public boolean disableEndpoint(String poolId, String endpointId) {
        return poolManager.disableEndpoint(poolId, endpointId);
    }

    /**
     * @param strategy configuration name, e.g. {@code round_robin}
     * @throws IllegalArgumentException if the strategy name is unknown
     */
    public boolean setLoadBalancingStrategy(String poolId, String strategy) {
        return poolManager.setLoadBalancingStrategy(poolId, StrategyType.fromName(strategy));
    }

    public Map<String, PoolSnapshot> getConnectionStats() {
        return poolManager.getConnectionStats();
    }

    public ErrorHistory.ErrorStatistics getErrorStatistics() {
        return errorHistory.statistics();
    }

    public ErrorHistory.ErrorReport getErrorReport(Instant from, Instant to) {
        return errorHistory.report(from, to);
    }

    /**
     * Request, retry, error, recovery and field extraction meters in Prometheus text format.
     */
    public String scrapeMetrics() {
        return metricsRegistry.scrape();
    }
}
