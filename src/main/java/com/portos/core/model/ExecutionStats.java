package com.portos.core.model;

import java.util.Map;

/**
 * Snapshot statistics of the execution table and history.
 *
 * @param activeExecutions  executions still held in the live table (including recently ended ones)
 * @param byState           live executions per state
 * @param historySize       entries in the bounded history
 * @param recentSuccessRate success share of the most recent history window, 1.0 when empty
 * @param avgDurationMs     mean duration over the same window
 */
public record ExecutionStats(
    int activeExecutions,
    Map<ExecutionState, Integer> byState,
    int historySize,
    double recentSuccessRate,
    long avgDurationMs
) {}
