package com.hypecycle.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing classification-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId, String keyword) {
        MDC.put("runId", runId);
        MDC.put("keyword", keyword);
    }

    public static void setSource(String runId, String keyword, String source) {
        setRun(runId, keyword);
        MDC.put("source", source);
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("keyword");
        MDC.remove("source");
    }
}
