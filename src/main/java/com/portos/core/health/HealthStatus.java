package com.portos.core.health;

import java.util.Map;

public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }
}
