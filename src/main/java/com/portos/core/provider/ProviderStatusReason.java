package com.portos.core.provider;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a provider is (un)available. Unrecognised persisted values read as {@link #NETWORK_ERROR}
 * so an unavailable provider stays unavailable.
 */
public enum ProviderStatusReason {
    OK("ok"),
    USAGE_LIMIT("usage-limit"),
    RATE_LIMIT("rate-limit"),
    AUTH_ERROR("auth-error"),
    NETWORK_ERROR("network-error");

    private final String value;

    ProviderStatusReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ProviderStatusReason fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ProviderStatusReason reason : values()) {
            if (reason.value.equals(value) || reason.name().equals(value)) {
                return reason;
            }
        }
        return NETWORK_ERROR;
    }
}
