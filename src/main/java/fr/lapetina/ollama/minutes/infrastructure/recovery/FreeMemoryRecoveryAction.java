package fr.lapetina.ollama.minutes.infrastructure.recovery;

import fr.lapetina.ollama.minutes.domain.recovery.ErrorInfo;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Requests a garbage collection and succeeds if heap usage is then below the limit.
 */
public final class FreeMemoryRecoveryAction implements RecoveryAction {

    private static final Logger log = LoggerFactory.getLogger(FreeMemoryRecoveryAction.class);

    private final double maxUsedRatio;
    private final Runtime runtime;

    public FreeMemoryRecoveryAction(double maxUsedRatio, Runtime runtime) {
        this.maxUsedRatio = maxUsedRatio;
        this.runtime = runtime;
    }

    public FreeMemoryRecoveryAction() {
        this(0.9, Runtime.getRuntime());
    }

    @Override
    public String id() {
        return "release_memory";
    }

    @Override
    public String description() {
        return "Release cached memory";
    }

    @Override
    public int priority() {
        return 8;
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.RESOURCE;
    }

    @Override
    public boolean attempt(ErrorInfo errorInfo) {
        runtime.gc();
        long used = runtime.totalMemory() - runtime.freeMemory();
        double ratio = (double) used / runtime.maxMemory();
        log.info("Memory after collection: usedBytes={}, maxBytes={}, ratio={}", used, runtime.maxMemory(),
                String.format("%.2f", ratio));
        return ratio < maxUsedRatio;
    }
}
