package com.portos.core.recovery;

/**
 * Result of executing a recovery strategy.
 *
 * @param success           whether the strategy produced a way forward
 * @param strategy          the executed strategy
 * @param action            what the caller should do next
 * @param message           human-readable summary
 * @param rescheduleAfterMs delay before rescheduling ({@link RecoveryAction#RESCHEDULE} only)
 * @param maxChunkSize      chunk size for {@link RecoveryAction#DECOMPOSE_TASK}
 * @param originalError     the failure message ({@link RecoveryAction#CREATE_INVESTIGATION} only)
 */
public record RecoveryOutcome(
    boolean success,
    RecoveryStrategy strategy,
    RecoveryAction action,
    String message,
    Long rescheduleAfterMs,
    Integer maxChunkSize,
    String originalError
) {

    public static RecoveryOutcome of(RecoveryStrategy strategy, RecoveryAction action, String message) {
        return new RecoveryOutcome(true, strategy, action, message, null, null, null);
    }

    public static RecoveryOutcome manualIntervention(String message) {
        return new RecoveryOutcome(false, RecoveryStrategy.MANUAL, RecoveryAction.REQUIRE_MANUAL,
                message, null, null, null);
    }

    public boolean requiresManualIntervention() {
        return action == RecoveryAction.REQUIRE_MANUAL;
    }

    public boolean useFallback() {
        return action == RecoveryAction.USE_FALLBACK;
    }

    public boolean useHeavyModel() {
        return action == RecoveryAction.ESCALATE_MODEL;
    }

    public boolean skipped() {
        return action == RecoveryAction.SKIP_TASK;
    }
}
