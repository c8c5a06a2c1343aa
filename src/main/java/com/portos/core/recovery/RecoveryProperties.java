package com.portos.core.recovery;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "portos.recovery")
public class RecoveryProperties {

    private int maxAttempts = 3;
    private long attemptResetMs = 3_600_000;
    private long maxBackoffMs = 300_000;
    private long defaultBackoffMs = 5_000;
    private int historySize = 200;
    private int statsWindow = 100;

    /**
     * Per-category strategy lists replacing the built-in defaults, keyed by category value
     * (e.g. {@code auth: [manual]} routes authentication failures straight to a human).
     */
    private Map<String, List<String>> strategyOverrides = new LinkedHashMap<>();

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public long getAttemptResetMs() { return attemptResetMs; }
    public void setAttemptResetMs(long attemptResetMs) { this.attemptResetMs = attemptResetMs; }
    public long getMaxBackoffMs() { return maxBackoffMs; }
    public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }
    public long getDefaultBackoffMs() { return defaultBackoffMs; }
    public void setDefaultBackoffMs(long defaultBackoffMs) { this.defaultBackoffMs = defaultBackoffMs; }
    public int getHistorySize() { return historySize; }
    public void setHistorySize(int historySize) { this.historySize = historySize; }
    public int getStatsWindow() { return statsWindow; }
    public void setStatsWindow(int statsWindow) { this.statsWindow = statsWindow; }
    public Map<String, List<String>> getStrategyOverrides() { return strategyOverrides; }
    public void setStrategyOverrides(Map<String, List<String>> strategyOverrides) {
        this.strategyOverrides = strategyOverrides;
    }

    /**
     * Resolves {@link #strategyOverrides} into typed form. Unknown names fail fast.
     */
    public Map<ErrorCategory, List<RecoveryStrategy>> resolvedOverrides() {
        Map<ErrorCategory, List<RecoveryStrategy>> resolved = new EnumMap<>(ErrorCategory.class);
        if (strategyOverrides == null) {
            return resolved;
        }
        strategyOverrides.forEach((category, strategies) -> {
            if (strategies == null || strategies.isEmpty()) {
                return;
            }
            var list = new ArrayList<RecoveryStrategy>();
            for (String s : strategies) {
                list.add(RecoveryStrategy.fromValue(s));
            }
            resolved.put(ErrorCategory.fromValue(category), List.copyOf(list));
        });
        return resolved;
    }
}
