package com.labelloop.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing labelloop-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setAssignment(String taskId, String annotatorId) {
        MDC.put("taskId", taskId);
        MDC.put("annotatorId", annotatorId);
    }

    public static void setBatch(String batchId) {
        MDC.put("batchId", batchId);
    }

    public static void clearBatch() {
        MDC.remove("batchId");
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("annotatorId");
        MDC.remove("batchId");
    }
}
