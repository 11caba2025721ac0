package com.foreman.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Foreman-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setTask(String sessionId, String taskId, String role) {
        MDC.put("sessionId", sessionId);
        MDC.put("taskId", taskId);
        MDC.put("role", role);
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("role");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("taskId");
        MDC.remove("role");
    }
}
