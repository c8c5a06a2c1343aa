package com.portos.core.recovery;

/**
 * Parameters attached to a selected strategy. Only the fields relevant to the strategy are set.
 *
 * @param delayMs               backoff before retrying or rescheduling (retry/defer)
 * @param requiresApproval      set when attempts are exhausted and a human must sign off
 * @param suggestHeavyModel     escalate to a more capable model
 * @param suggestSmallerContext split the input
 * @param maxChunkSize          chunk size for decomposition
 * @param useFallbackProvider   route the next attempt to a fallback provider
 */
public record RecoveryParams(
    Long delayMs,
    boolean requiresApproval,
    boolean suggestHeavyModel,
    boolean suggestSmallerContext,
    Integer maxChunkSize,
    boolean useFallbackProvider
) {
    public static final RecoveryParams NONE = new RecoveryParams(null, false, false, false, null, false);

    public static RecoveryParams delay(long delayMs) {
        return new RecoveryParams(delayMs, false, false, false, null, false);
    }

    public static RecoveryParams approvalRequired() {
        return new RecoveryParams(null, true, false, false, null, false);
    }

    public static RecoveryParams heavyModel() {
        return new RecoveryParams(null, false, true, false, null, false);
    }

    public static RecoveryParams smallerContext(int maxChunkSize) {
        return new RecoveryParams(null, false, false, true, maxChunkSize, false);
    }

    public static RecoveryParams fallbackProvider() {
        return new RecoveryParams(null, false, false, false, null, true);
    }
}
