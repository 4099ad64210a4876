package com.taskweaver.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing TaskWeaver-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPlan(String planId) {
        MDC.put("planId", planId);
    }

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("planId");
        MDC.remove("taskId");
    }
}
