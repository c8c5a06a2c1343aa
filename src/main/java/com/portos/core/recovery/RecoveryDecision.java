package com.portos.core.recovery;

/**
 * Strategy chosen by {@link RecoveryStrategySelector#select}.
 *
 * @param strategy      what to do
 * @param reason        short explanation for logs and the dashboard
 * @param params        strategy parameters
 * @param attemptNumber 1-based number of this attempt for the ledger key
 * @param maxAttempts   attempts allowed before the selector forces {@link RecoveryStrategy#MANUAL}
 */
public record RecoveryDecision(
    RecoveryStrategy strategy,
    String reason,
    RecoveryParams params,
    int attemptNumber,
    int maxAttempts
) {}
