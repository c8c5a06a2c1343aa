package com.portos.core.execution;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new ExecutionProperties();
        assertEquals(3, props.getMaxAttempts());
        assertEquals(3, props.getMaxRecoveryAttempts());
        assertEquals(1000, props.getHistorySize());
        assertEquals(100, props.getStatsWindow());
        assertEquals(60_000, props.getEvictionDelayMs());
        assertEquals(3_600_000, props.getStaleAfterMs());
        assertEquals(300_000, props.getCleanupIntervalMs());
        assertEquals(8, props.getToolThreads());
    }
}
