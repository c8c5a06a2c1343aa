package com.portos.core.recovery;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Remedial action chosen after a classified failure.
 */
public enum RecoveryStrategy {
    /** Simple retry with backoff. */
    RETRY("retry"),
    /** Use a more powerful model. */
    ESCALATE("escalate"),
    /** Switch to the fallback provider. */
    FALLBACK("fallback"),
    /** Break the task into smaller parts. */
    DECOMPOSE("decompose"),
    /** Reschedule for later. */
    DEFER("defer"),
    /** Create an investigation task. */
    INVESTIGATE("investigate"),
    /** Skip and move on. */
    SKIP("skip"),
    /** Require human intervention. */
    MANUAL("manual");

    private final String value;

    RecoveryStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static RecoveryStrategy fromValue(String value) {
        for (RecoveryStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(value) || strategy.name().equalsIgnoreCase(value)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown recovery strategy: " + value);
    }
}
