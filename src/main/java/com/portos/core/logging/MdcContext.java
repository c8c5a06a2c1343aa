package com.portos.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing PortOS-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setExecution(String executionId, String toolId, String agentId) {
        MDC.put("executionId", executionId);
        MDC.put("toolId", toolId);
        MDC.put("agentId", agentId);
    }

    public static void setProvider(String providerId) {
        MDC.put("providerId", providerId);
    }

    public static void clear() {
        MDC.remove("executionId");
        MDC.remove("toolId");
        MDC.remove("agentId");
        MDC.remove("providerId");
    }
}
