package com.conductor.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing conductor-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setJob(String jobId, String project, String command) {
        MDC.put("jobId", jobId);
        MDC.put("project", project);
        MDC.put("command", command);
    }

    public static void setProject(String project) {
        MDC.put("project", project);
    }

    public static void clear() {
        MDC.remove("jobId");
        MDC.remove("project");
        MDC.remove("command");
    }
}
