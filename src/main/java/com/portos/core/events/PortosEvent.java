package com.portos.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the orchestration core, consumed by the dashboard and logging layers.
 *
 * @param eventType event type (e.g. "tool:stateChange", "recovery:executed", "provider:status:changed")
 * @param subjectId the execution, task or provider this event is about (nullable)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PortosEvent(
    String eventType,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
