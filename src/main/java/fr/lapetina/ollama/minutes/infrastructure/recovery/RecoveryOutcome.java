package fr.lapetina.ollama.minutes.infrastructure.recovery;

/**
 * Result of running the recovery actions for one error.
 *
 * @param actionId       action that reported success, null if none did
 * @param actionsTried   number of actions run
 */
public record RecoveryOutcome(boolean recovered, String actionId, int actionsTried) {

    public static RecoveryOutcome notRecovered(int actionsTried) {
        return new RecoveryOutcome(false, null, actionsTried);
    }
}
