package com.portos.core.recovery;

import java.util.List;

/**
 * Result of classifying a failure. Derived on demand, never persisted.
 *
 * @param category            matched category, {@link ErrorCategory#UNKNOWN} when nothing matched
 * @param message             error message truncated to 500 characters
 * @param code                error or status code, if the failure carried one
 * @param matchedPatterns     pattern sources of the matched category
 * @param suggestedStrategies candidate strategies, most preferred first
 * @param cooldownMs          base cooldown for the category
 * @param severity            severity of the category
 * @param recoverable         false exactly when the first suggested strategy is {@link RecoveryStrategy#MANUAL}
 * @param context             task/agent/provider context the error was raised in
 */
public record ErrorAnalysis(
    ErrorCategory category,
    String message,
    String code,
    List<String> matchedPatterns,
    List<RecoveryStrategy> suggestedStrategies,
    long cooldownMs,
    Severity severity,
    boolean recoverable,
    RecoveryContext context
) {

    public RecoveryStrategy primaryStrategy() {
        return suggestedStrategies.isEmpty() ? RecoveryStrategy.RETRY : suggestedStrategies.get(0);
    }
}
