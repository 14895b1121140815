package com.driftwatch.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Driftwatch MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setStage(String runId, String stage) {
        MDC.put("runId", runId);
        MDC.put("stage", stage);
    }

    public static void clearStage() {
        MDC.remove("stage");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("stage");
    }
}
