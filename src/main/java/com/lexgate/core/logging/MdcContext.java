package com.lexgate.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Lexgate-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setFile(String runId, String tfId, String file) {
        MDC.put("runId", runId);
        MDC.put("tfId", tfId);
        MDC.put("file", file);
    }

    public static void clearFile() {
        MDC.remove("tfId");
        MDC.remove("file");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("tfId");
        MDC.remove("file");
    }
}
