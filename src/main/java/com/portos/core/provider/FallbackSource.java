package com.portos.core.provider;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which tier of the fallback chain produced a fallback provider.
 */
public enum FallbackSource {
    /** The task's own fallback provider. */
    TASK,
    /** The fallback configured on the primary provider. */
    PROVIDER,
    /** The system-wide priority list. */
    SYSTEM;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
