package fr.lapetina.ollama.minutes;

import fr.lapetina.ollama.minutes.api.MeetingMinutesService;
import fr.lapetina.ollama.minutes.domain.model.EndpointStatus;
import fr.lapetina.ollama.minutes.domain.model.LlmEndpoint;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;
import fr.lapetina.ollama.minutes.domain.recovery.RetryConfig;
import fr.lapetina.ollama.minutes.domain.recovery.RetryStrategy;
import fr.lapetina.ollama.minutes.domain.strategy.StrategyType;
import fr.lapetina.ollama.minutes.extraction.ConfidenceScorer;
import fr.lapetina.ollama.minutes.extraction.ExtractionOrchestrator;
import fr.lapetina.ollama.minutes.extraction.FieldParser;
import fr.lapetina.ollama.minutes.extraction.MinutesValidator;
import fr.lapetina.ollama.minutes.extraction.preprocess.RegexTextPreprocessor;
import fr.lapetina.ollama.minutes.extraction.preprocess.TextPreprocessor;
import fr.lapetina.ollama.minutes.infrastructure.concurrent.Sleeper;
import fr.lapetina.ollama.minutes.infrastructure.config.ConfigLoader;
import fr.lapetina.ollama.minutes.infrastructure.config.MinutesConfig;
import fr.lapetina.ollama.minutes.infrastructure.health.EndpointHealthChecker;
import fr.lapetina.ollama.minutes.infrastructure.http.OllamaHttpClient;
import fr.lapetina.ollama.minutes.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ollama.minutes.infrastructure.pool.ConnectionPoolManager;
import fr.lapetina.ollama.minutes.infrastructure.pool.EndpointPool;
import fr.lapetina.ollama.minutes.infrastructure.recovery.CreateDirectoriesRecoveryAction;
import fr.lapetina.ollama.minutes.infrastructure.recovery.DiskSpaceRecoveryAction;
import fr.lapetina.ollama.minutes.infrastructure.recovery.EndpointProbeRecoveryAction;
import fr.lapetina.ollama.minutes.infrastructure.recovery.ErrorClassifier;
import fr.lapetina.ollama.minutes.infrastructure.recovery.ErrorHistory;
import fr.lapetina.ollama.minutes.infrastructure.recovery.FreeMemoryRecoveryAction;
import fr.lapetina.ollama.minutes.infrastructure.recovery.RecoveryCoordinator;
import fr.lapetina.ollama.minutes.infrastructure.recovery.RetryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for creating a fully-wired extraction core from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (MinutesExtractorFactory factory = MinutesExtractorFactory.create("minutes-config.yaml").start()) {
 *     ExtractionResult result = factory.getService().extractMeetingMinutes(transcript);
 * }
 * }</pre>
 */
public class MinutesExtractorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MinutesExtractorFactory.class);

    private final MinutesConfig config;
    private final MetricsRegistry metricsRegistry;
    private final OllamaHttpClient httpClient;
    private final ConnectionPoolManager poolManager;
    private final EndpointHealthChecker healthChecker;
    private final ErrorHistory errorHistory;
    private final RetryEngine retryEngine;
    private final ExecutorService extractionExecutor;
    private final ExtractionOrchestrator orchestrator;
    private final MeetingMinutesService service;

    protected MinutesExtractorFactory(
            MinutesConfig config,
            OllamaHttpClient httpClientOverride,
            TextPreprocessor preprocessorOverride,
            Sleeper sleeper
    ) {
        this.config = config;

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Allow HTTP client override for testing
        this.httpClient = httpClientOverride != null ? httpClientOverride : new OllamaHttpClient(
                Duration.ofMillis(config.getHttp().getConnectTimeoutMs()),
                Duration.ofMillis(config.getHealthCheck().getProbeTimeoutMs())
        );

        this.poolManager = new ConnectionPoolManager(
                createPools(config),
                config.getCurrentPool(),
                httpClient,
                metricsRegistry,
                sleeper
        );

        Duration probeTimeout = Duration.ofMillis(config.getHealthCheck().getProbeTimeoutMs());
        this.healthChecker = new EndpointHealthChecker(
                poolManager,
                httpClient,
                Duration.ofMillis(config.getHealthCheck().getIntervalMs()),
                probeTimeout,
                Duration.ofMillis(config.getHealthCheck().getSlowResponseMs())
        );

        RecoveryCoordinator recovery = new RecoveryCoordinator(metricsRegistry);
        recovery.register(EndpointProbeRecoveryAction.networkProbe(poolManager, healthChecker, probeTimeout));
        recovery.register(EndpointProbeRecoveryAction.aiServiceProbe(poolManager, healthChecker, probeTimeout));
        List<Path> workDirectories = config.getRecovery().getWorkDirectories().stream().map(Path::of).toList();
        recovery.register(new DiskSpaceRecoveryAction(workDirectories, config.getRecovery().getMinFreeDiskMb() * 1024 * 1024));
        recovery.register(new CreateDirectoriesRecoveryAction(workDirectories));
        recovery.register(new FreeMemoryRecoveryAction());

        this.errorHistory = new ErrorHistory(
                config.getRetry().getHistoryCapacity(),
                config.getRetry().getHistoryRetentionDays());
        this.retryEngine = new RetryEngine(
                new ErrorClassifier(),
                recovery,
                errorHistory,
                metricsRegistry,
                sleeper,
                retryOverrides(config)
        );

        MinutesConfig.ExtractionConfig extraction = config.getExtraction();
        this.extractionExecutor = Executors.newFixedThreadPool(extraction.getParallelism(), new WorkerThreadFactory());
        this.orchestrator = new ExtractionOrchestrator(
                preprocessorOverride != null ? preprocessorOverride : new RegexTextPreprocessor(),
                poolManager,
                retryEngine,
                new FieldParser(),
                new MinutesValidator(),
                new ConfidenceScorer(),
                metricsRegistry,
                extractionExecutor,
                extraction.getPoolId(),
                extraction.getTextWindow(),
                Duration.ofMillis(extraction.getRunTimeoutMs())
        );

        this.service = new MeetingMinutesService(orchestrator, poolManager, errorHistory, metricsRegistry);

        log.info("MinutesExtractorFactory initialized: pools={}, currentPool={}, parallelism={}",
                config.getPools().size(), config.getCurrentPool(), extraction.getParallelism());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static MinutesExtractorFactory create(String configPath) {
        log.info("Initializing MinutesExtractorFactory from config: {}", configPath);
        return new MinutesExtractorFactory(new ConfigLoader(configPath).load(), null, null, Sleeper.SYSTEM);
    }

    /**
     * Creates a factory from a configuration built in code.
     */
    public static MinutesExtractorFactory create(MinutesConfig config) {
        return new MinutesExtractorFactory(config, null, null, Sleeper.SYSTEM);
    }

    /**
     * Creates a factory from the default configuration (minutes-config.yaml).
     */
    public static MinutesExtractorFactory create() {
        return create(ConfigLoader.DEFAULT_CONFIG);
    }

    /**
     * Starts the background health checker. Its first cycle runs immediately.
     */
    public MinutesExtractorFactory start() {
        healthChecker.start();
        log.info("Extraction core started");
        return this;
    }

    static List<EndpointPool> createPools(MinutesConfig config) {
        List<EndpointPool> pools = new ArrayList<>();
        for (MinutesConfig.PoolConfig poolConfig : config.getPools()) {
            EndpointPool.Builder builder = EndpointPool.builder(poolConfig.getId())
                    .strategy(StrategyType.fromName(poolConfig.getStrategy()))
                    .maxRetries(poolConfig.getMaxRetries())
                    .circuitBreakerThreshold(poolConfig.getCircuitBreakerThreshold())
                    .circuitBreakerTimeout(Duration.ofMillis(poolConfig.getCircuitBreakerTimeoutMs()))
                    .failoverBackoff(Duration.ofMillis(poolConfig.getFailoverBackoffMs()))
                    .healthCheckEnabled(poolConfig.isHealthCheckEnabled());
            for (MinutesConfig.EndpointConfig endpointConfig : poolConfig.getEndpoints()) {
                builder.endpoint(createEndpoint(endpointConfig));
            }
            pools.add(builder.build());
        }
        return pools;
    }

    static LlmEndpoint createEndpoint(MinutesConfig.EndpointConfig endpointConfig) {
        LlmEndpoint.Builder builder = LlmEndpoint.builder()
                .id(endpointConfig.getId())
                .baseUrl(endpointConfig.getUrl())
                .modelName(endpointConfig.getModel())
                .priority(endpointConfig.getPriority())
                .maxConcurrent(endpointConfig.getMaxConcurrent())
                .timeout(Duration.ofMillis(endpointConfig.getTimeoutMs()))
                .enabled(endpointConfig.isEnabled());
        if (endpointConfig.getInitialStatus() != null) {
            builder.initialStatus(EndpointStatus.valueOf(endpointConfig.getInitialStatus().toUpperCase(Locale.ROOT)));
        }
        return builder.build();
    }

    static Map<ErrorType, RetryConfig> retryOverrides(MinutesConfig config) {
        Map<ErrorType, RetryConfig> overrides = new EnumMap<>(ErrorType.class);
        for (MinutesConfig.RetryOverride override : config.getRetry().getOverrides()) {
            ErrorType type = ErrorType.valueOf(override.getErrorType().toUpperCase(Locale.ROOT));
            overrides.put(type, new RetryConfig(
                    RetryStrategy.valueOf(override.getStrategy().toUpperCase(Locale.ROOT)),
                    override.getMaxAttempts(),
                    Duration.ofMillis(override.getBaseDelayMs()),
                    Duration.ofMillis(override.getMaxDelayMs()),
                    override.getBackoffFactor(),
                    override.isJitter()
            ));
        }
        return overrides;
    }

    public MeetingMinutesService getService() {
        return service;
    }

    public ExtractionOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public ConnectionPoolManager getPoolManager() {
        return poolManager;
    }

    public EndpointHealthChecker getHealthChecker() {
        return healthChecker;
    }

    public RetryEngine getRetryEngine() {
        return retryEngine;
    }

    public ErrorHistory getErrorHistory() {
        return errorHistory;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public OllamaHttpClient getHttpClient() {
        return httpClient;
    }

    public MinutesConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        log.info("Shutting down MinutesExtractorFactory...");

        try {
            healthChecker.close();
        } catch (Exception e) {
            log.warn("Error closing health checker", e);
        }

        extractionExecutor.shutdownNow();
        try {
            if (!extractionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Extraction workers did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        try {
            poolManager.close();
        } catch (Exception e) {
            log.warn("Error closing pool manager", e);
        }

        try {
            httpClient.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("MinutesExtractorFactory shut down");
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "extraction-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
