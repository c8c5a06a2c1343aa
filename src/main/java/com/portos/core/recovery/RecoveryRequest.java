package com.portos.core.recovery;

/**
 * Identity of the work a recovery decision is being made for.
 *
 * @param taskId        task identifier (nullable)
 * @param agentId       agent identifier (nullable)
 * @param attemptNumber caller's own attempt counter, informational only
 */
public record RecoveryRequest(String taskId, String agentId, int attemptNumber) {

    public static RecoveryRequest forTask(String taskId) {
        return new RecoveryRequest(taskId, null, 1);
    }

    public static RecoveryRequest forAgent(String agentId) {
        return new RecoveryRequest(null, agentId, 1);
    }

    /** Ledger key this request counts attempts against. */
    public String ledgerKey() {
        return RecoveryAttemptLedger.keyFor(taskId, agentId);
    }
}
