package com.portos.core.classifier;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Confidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
