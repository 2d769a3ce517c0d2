package fr.lapetina.ollama.minutes.infrastructure.recovery;

import fr.lapetina.ollama.minutes.domain.recovery.ErrorInfo;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;
import fr.lapetina.ollama.minutes.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs the recovery actions registered for an error type, highest priority first,
 * until one reports success.
 *
 * This is the only place where recovery action failures are swallowed: they are
 * logged and counted, never propagated.
 */
public final class RecoveryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

    private final Map<ErrorType, List<RecoveryAction>> actions = new EnumMap<>(ErrorType.class);
    private final MetricsRegistry metrics;

    public RecoveryCoordinator(MetricsRegistry metrics) {
        this.metrics = metrics;
        for (ErrorType type : ErrorType.values()) {
            actions.put(type, new CopyOnWriteArrayList<>());
        }
    }

    public void register(RecoveryAction action) {
        List<RecoveryAction> list = actions.get(action.errorType());
        synchronized (list) {
            List<RecoveryAction> sorted = new ArrayList<>(list);
            sorted.add(action);
            sorted.sort(Comparator.comparingInt(RecoveryAction::priority).reversed());
            list.clear();
            list.addAll(sorted);
        }
        log.info("Recovery action registered: id={}, errorType={}, priority={}",
                action.id(), action.errorType().wireName(), action.priority());
    }

    public List<RecoveryAction> actionsFor(ErrorType type) {
        return List.copyOf(actions.get(type));
    }

    /**
     * Tries the actions for the error's type in priority order.
     * An interrupt stops the sequence; the interrupt flag is restored.
     */
    public RecoveryOutcome attemptRecovery(ErrorInfo errorInfo) {
        List<RecoveryAction> candidates = actions.get(errorInfo.errorType());
        int tried = 0;
        for (RecoveryAction action : candidates) {
            tried++;
            boolean recovered;
            try {
                recovered = action.attempt(errorInfo);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Recovery interrupted: errorId={}, action={}", errorInfo.errorId(), action.id());
                return RecoveryOutcome.notRecovered(tried);
            } catch (Exception e) {
                log.warn("Recovery action failed: errorId={}, action={}, error={}",
                        errorInfo.errorId(), action.id(), e.toString());
                recovered = false;
            }
            metrics.incrementRecoveryCount(action.id(), recovered);
            if (recovered) {
                log.info("Recovery action succeeded: errorId={}, errorType={}, action={}",
                        errorInfo.errorId(), errorInfo.errorType().wireName(), action.id());
                return new RecoveryOutcome(true, action.id(), tried);
            }
        }
        return RecoveryOutcome.notRecovered(tried);
    }
}
