package com.portos.core.recovery;

/**
 * Who and what was running when an error occurred. Every field is nullable.
 */
public record RecoveryContext(
    String taskId,
    String agentId,
    String provider,
    String model
) {
    public static final RecoveryContext EMPTY = new RecoveryContext(null, null, null, null);
}
