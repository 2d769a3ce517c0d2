package fr.lapetina.ollama.minutes.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the extraction core.
 * Designed to be populated from YAML.
 */
public class MinutesConfig {

    private List<PoolConfig> pools = new ArrayList<>();
    private String currentPool = "default";
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private HttpConfig http = new HttpConfig();
    private RetryConfig retry = new RetryConfig();
    private RecoveryConfig recovery = new RecoveryConfig();
    private ExtractionConfig extraction = new ExtractionConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public List<PoolConfig> getPools() { return pools; }
    public void setPools(List<PoolConfig> pools) { this.pools = pools; }

    public String getCurrentPool() { return currentPool; }
    public void setCurrentPool(String currentPool) { this.currentPool = currentPool; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public HttpConfig getHttp() { return http; }
    public void setHttp(HttpConfig http) { this.http = http; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public RecoveryConfig getRecovery() { return recovery; }
    public void setRecovery(RecoveryConfig recovery) { this.recovery = recovery; }

    public ExtractionConfig getExtraction() { return extraction; }
    public void setExtraction(ExtractionConfig extraction) { this.extraction = extraction; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * A named pool of endpoints.
     */
    public static class PoolConfig {
        private String id;
        private String strategy = "health_based";
        private int maxRetries = 3;
        private int circuitBreakerThreshold = 5;
        private long circuitBreakerTimeoutMs = 60_000;
        private long failoverBackoffMs = 500;
        private boolean healthCheckEnabled = true;
        private List<EndpointConfig> endpoints = new ArrayList<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public int getCircuitBreakerThreshold() { return circuitBreakerThreshold; }
        public void setCircuitBreakerThreshold(int circuitBreakerThreshold) { this.circuitBreakerThreshold = circuitBreakerThreshold; }

        public long getCircuitBreakerTimeoutMs() { return circuitBreakerTimeoutMs; }
        public void setCircuitBreakerTimeoutMs(long circuitBreakerTimeoutMs) { this.circuitBreakerTimeoutMs = circuitBreakerTimeoutMs; }

        public long getFailoverBackoffMs() { return failoverBackoffMs; }
        public void setFailoverBackoffMs(long failoverBackoffMs) { this.failoverBackoffMs = failoverBackoffMs; }

        public boolean isHealthCheckEnabled() { return healthCheckEnabled; }
        public void setHealthCheckEnabled(boolean healthCheckEnabled) { this.healthCheckEnabled = healthCheckEnabled; }

        public List<EndpointConfig> getEndpoints() { return endpoints; }
        public void setEndpoints(List<EndpointConfig> endpoints) { this.endpoints = endpoints; }
    }

    /**
     * Individual LLM endpoint configuration.
     */
    public static class EndpointConfig {
        private String id;
        private String url;
        private String model;
        private int priority = 5;
        private int maxConcurrent = 5;
        private long timeoutMs = 60_000;
        private boolean enabled = true;
        private String initialStatus;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getInitialStatus() { return initialStatus; }
        public void setInitialStatus(String initialStatus) { this.initialStatus = initialStatus; }
    }

    /**
     * Background health check configuration.
     */
    public static class HealthCheckConfig {
        private long intervalMs = 30_000;
        private long probeTimeoutMs = 30_000;
        private long slowResponseMs = 5_000;

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }

        public long getSlowResponseMs() { return slowResponseMs; }
        public void setSlowResponseMs(long slowResponseMs) { this.slowResponseMs = slowResponseMs; }
    }

    /**
     * HTTP client configuration.
     */
    public static class HttpConfig {
        private long connectTimeoutMs = 10_000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Retry configuration: history size and retention, and per error type policy overrides.
     */
    public static class RetryConfig {
        private int historyCapacity = 100;
        private int historyRetentionDays = 7;
        private List<RetryOverride> overrides = new ArrayList<>();

        public int getHistoryCapacity() { return historyCapacity; }
        public void setHistoryCapacity(int historyCapacity) { this.historyCapacity = historyCapacity; }

        public int getHistoryRetentionDays() { return historyRetentionDays; }
        public void setHistoryRetentionDays(int historyRetentionDays) { this.historyRetentionDays = historyRetentionDays; }

        public List<RetryOverride> getOverrides() { return overrides; }
        public void setOverrides(List<RetryOverride> overrides) { this.overrides = overrides; }
    }

    /**
     * Retry policy for one error type.
     */
    public static class RetryOverride {
        private String errorType;
        private String strategy = "exponential_backoff";
        private int maxAttempts = 3;
        private long baseDelayMs = 1_000;
        private long maxDelayMs = 30_000;
        private double backoffFactor = 2.0;
        private boolean jitter = true;

        public String getErrorType() { return errorType; }
        public void setErrorType(String errorType) { this.errorType = errorType; }

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

        public double getBackoffFactor() { return backoffFactor; }
        public void setBackoffFactor(double backoffFactor) { this.backoffFactor = backoffFactor; }

        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }
    }

    /**
     * Recovery action configuration.
     */
    public static class RecoveryConfig {
        private List<String> workDirectories = new ArrayList<>();
        private long minFreeDiskMb = 100;

        public List<String> getWorkDirectories() { return workDirectories; }
        public void setWorkDirectories(List<String> workDirectories) { this.workDirectories = workDirectories; }

        public long getMinFreeDiskMb() { return minFreeDiskMb; }
        public void setMinFreeDiskMb(long minFreeDiskMb) { this.minFreeDiskMb = minFreeDiskMb; }
    }

    /**
     * Extraction run configuration.
     */
    public static class ExtractionConfig {
        private String poolId;
        private int parallelism = 6;
        private int textWindow = 2000;
        private long runTimeoutMs = 0;

        public String getPoolId() { return poolId; }
        public void setPoolId(String poolId) { this.poolId = poolId; }

        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }

        public int getTextWindow() { return textWindow; }
        public void setTextWindow(int textWindow) { this.textWindow = textWindow; }

        public long getRunTimeoutMs() { return runTimeoutMs; }
        public void setRunTimeoutMs(long runTimeoutMs) { this.runTimeoutMs = runTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "meeting_minutes";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
