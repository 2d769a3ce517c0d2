package fr.lapetina.ollama.minutes.infrastructure.recovery;

import fr.lapetina.ollama.minutes.domain.recovery.ErrorInfo;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;

/**
 * Best-effort automated fix tried before backing off.
 *
 * Implementations may throw; the {@link RecoveryCoordinator} logs the failure and moves
 * on to the next action.
 */
public interface RecoveryAction {

    String id();

    String description();

    /**
     * Higher runs first.
     */
    int priority();

    ErrorType errorType();

    /**
     * @return true if the condition behind the error is believed fixed
     */
    boolean attempt(ErrorInfo errorInfo) throws Exception;
}
