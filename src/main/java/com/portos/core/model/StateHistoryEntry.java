package com.portos.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of an execution's append-only state history.
 */
public record StateHistoryEntry(ExecutionState state, Instant timestamp, Map<String, Object> data) {}
