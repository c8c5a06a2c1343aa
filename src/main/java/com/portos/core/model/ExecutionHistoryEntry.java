package com.portos.core.model;

import java.time.Instant;

/**
 * Immutable projection of a completed execution kept in the bounded history.
 *
 * @param success true when the execution ended without an outstanding error
 */
public record ExecutionHistoryEntry(
    String id,
    String toolId,
    String agentId,
    Instant startedAt,
    Instant completedAt,
    Long durationMs,
    boolean success,
    int recoveryAttempts
) {}
