package com.portos.core.execution;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "portos.execution")
public class ExecutionProperties {

    /** Tool invocations per wrapped call, including the first. */
    private int maxAttempts = 3;
    /** Recoveries allowed on a single execution before {@code recover} refuses. */
    private int maxRecoveryAttempts = 3;
    private int historySize = 1000;
    private int statsWindow = 100;
    private long evictionDelayMs = 60_000;
    private long staleAfterMs = 3_600_000;
    private long cleanupIntervalMs = 300_000;
    private int toolThreads = 8;

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public int getMaxRecoveryAttempts() { return maxRecoveryAttempts; }
    public void setMaxRecoveryAttempts(int maxRecoveryAttempts) { this.maxRecoveryAttempts = maxRecoveryAttempts; }
    public int getHistorySize() { return historySize; }
    public void setHistorySize(int historySize) { this.historySize = historySize; }
    public int getStatsWindow() { return statsWindow; }
    public void setStatsWindow(int statsWindow) { this.statsWindow = statsWindow; }
    public long getEvictionDelayMs() { return evictionDelayMs; }
    public void setEvictionDelayMs(long evictionDelayMs) { this.evictionDelayMs = evictionDelayMs; }
    public long getStaleAfterMs() { return staleAfterMs; }
    public void setStaleAfterMs(long staleAfterMs) { this.staleAfterMs = staleAfterMs; }
    public long getCleanupIntervalMs() { return cleanupIntervalMs; }
    public void setCleanupIntervalMs(long cleanupIntervalMs) { this.cleanupIntervalMs = cleanupIntervalMs; }
    public int getToolThreads() { return toolThreads; }
    public void setToolThreads(int toolThreads) { this.toolThreads = toolThreads; }
}
