package com.portos.core.classifier;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ComplexityLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
