package com.portos.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setExecution puts executionId, toolId and agentId in MDC")
    void setExecution() {
        MdcContext.setExecution("exec-1", "shell", "agent-7");
        assertEquals("exec-1", MDC.get("executionId"));
        assertEquals("shell", MDC.get("toolId"));
        assertEquals("agent-7", MDC.get("agentId"));
    }

    @Test
    @DisplayName("clear removes all portos MDC keys")
    void clear() {
        MdcContext.setExecution("exec-1", "shell", "agent-7");
        MdcContext.setProvider("codex");
        MdcContext.clear();
        assertNull(MDC.get("executionId"));
        assertNull(MDC.get("toolId"));
        assertNull(MDC.get("agentId"));
        assertNull(MDC.get("providerId"));
    }
}
