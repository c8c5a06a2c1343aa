package com.portos.core.recovery;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Concrete instruction produced by executing a {@link RecoveryStrategy}.
 */
public enum RecoveryAction {
    RETRY_NOW,
    RESCHEDULE,
    USE_FALLBACK,
    ESCALATE_MODEL,
    DECOMPOSE_TASK,
    CREATE_INVESTIGATION,
    SKIP_TASK,
    REQUIRE_MANUAL;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
