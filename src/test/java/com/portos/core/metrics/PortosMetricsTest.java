package com.portos.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PortosMetricsTest {

    private SimpleMeterRegistry registry;
    private PortosMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PortosMetrics(registry);
    }

    @Test
    @DisplayName("recordToolExecution counts by result and times by tool")
    void recordToolExecution() {
        metrics.recordToolExecution("shell", true, 120);
        metrics.recordToolExecution("shell", false, 80);
        metrics.recordToolExecution("shell", true, 100);

        var success = registry.find("portos.tool.executions").tag("tool", "shell").tag("result", "success").counter();
        var failure = registry.find("portos.tool.executions").tag("tool", "shell").tag("result", "failure").counter();
        var timer = registry.find("portos.tool.duration").tag("tool", "shell").timer();

        assertNotNull(success);
        assertNotNull(failure);
        assertNotNull(timer);
        assertEquals(2.0, success.count());
        assertEquals(1.0, failure.count());
        assertEquals(3, timer.count());
    }

    @Test
    @DisplayName("recordRejectedTransition tags from and to states")
    void recordRejectedTransition() {
        metrics.recordRejectedTransition("idle", "end");

        var counter = registry.find("portos.tool.transitions.rejected")
                .tag("from", "idle").tag("to", "end").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordRecovery tags strategy, category and outcome")
    void recordRecovery() {
        metrics.recordRecovery("retry", "network", true);

        var counter = registry.find("portos.recovery.executions")
                .tag("strategy", "retry").tag("category", "network").tag("success", "true").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordProviderStatusChange and recordClassification create counters")
    void providerAndClassifierCounters() {
        metrics.recordProviderStatusChange("usage-limit");
        metrics.recordClassification("typo-fix", true);

        assertNotNull(registry.find("portos.provider.status.changes").tag("reason", "usage-limit").counter());
        assertNotNull(registry.find("portos.classifier.decisions")
                .tag("category", "typo-fix").tag("auto_approve", "true").counter());
    }
}
