package com.conductor.core.error;

/**
 * An auxiliary process is already alive for the project.
 */
public class AlreadyRunningException extends ConductorException {

    public static final String CODE = "ALREADY_RUNNING";

    private final long pid;

    public AlreadyRunningException(String project, long pid) {
        super(CODE, Origin.REQUEST, "Project %s is already running (PID %d)".formatted(project, pid));
        this.pid = pid;
        withContext(null, project, null);
    }

    public long getPid() {
        return pid;
    }
}
