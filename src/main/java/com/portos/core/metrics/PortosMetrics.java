package com.portos.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for tool execution, recovery and provider routing.
 */
@Service
public class PortosMetrics {

    private final MeterRegistry registry;

    public PortosMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordToolExecution(String toolId, boolean success, long ms) {
        Counter.builder("portos.tool.executions")
                .tag("tool", toolId)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
        Timer.builder("portos.tool.duration")
                .tag("tool", toolId)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a transition request that the state table refused.
     *
     * @param fromState current state of the execution
     * @param toState   requested target state
     */
    public void recordRejectedTransition(String fromState, String toState) {
        Counter.builder("portos.tool.transitions.rejected")
                .description("State transitions refused by the execution state machine")
                .tag("from", fromState)
                .tag("to", toState)
                .register(registry)
                .increment();
    }

    public void recordRecovery(String strategy, String category, boolean success) {
        Counter.builder("portos.recovery.executions")
                .tag("strategy", strategy)
                .tag("category", category)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordProviderStatusChange(String reason) {
        Counter.builder("portos.provider.status.changes")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordClassification(String category, boolean autoApprove) {
        Counter.builder("portos.classifier.decisions")
                .tag("category", category)
                .tag("auto_approve", String.valueOf(autoApprove))
                .register(registry)
                .increment();
    }
}
