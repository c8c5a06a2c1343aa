package com.portos.core.model;

import com.portos.core.recovery.ErrorCategory;
import com.portos.core.recovery.RecoveryOutcome;

/**
 * What a wrapped tool call hands back to its caller.
 *
 * @param success       whether the tool eventually produced output
 * @param output        tool output (success only)
 * @param error         last failure message (failure only)
 * @param executionId   id of the tracked execution, null if it could not be started
 * @param errorCategory classification of the last failure (failure only)
 * @param recovery      the last recovery instruction, e.g. use a fallback provider or
 *                      require manual intervention (failure only)
 */
public record ExecutionResult(
    boolean success,
    Object output,
    String error,
    String executionId,
    ErrorCategory errorCategory,
    RecoveryOutcome recovery
) {

    public static ExecutionResult success(String executionId, Object output) {
        return new ExecutionResult(true, output, null, executionId, null, null);
    }

    public static ExecutionResult failure(String executionId, String error,
                                          ErrorCategory category, RecoveryOutcome recovery) {
        return new ExecutionResult(false, null, error, executionId, category, recovery);
    }

    public boolean requiresManualIntervention() {
        return recovery != null && recovery.requiresManualIntervention();
    }
}
