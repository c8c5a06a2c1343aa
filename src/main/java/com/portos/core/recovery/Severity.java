package com.portos.core.recovery;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    LOW, MEDIUM, HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
