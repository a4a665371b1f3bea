package com.conductor.core.error;

/**
 * Base class for failures raised by the orchestration core.
 *
 * <p>Carries the project, command and job the failure belongs to when known,
 * and an {@link Origin} telling callers whether the request, the host or the
 * agent was at fault.
 */
public class ConductorException extends RuntimeException {

    public enum Origin {
        /** The caller asked for something that cannot be done. */
        REQUEST,
        /** Git, filesystem or process plumbing failed. */
        INFRASTRUCTURE,
        /** The agent ran but did not do its job. */
        AGENT
    }

    private final Origin origin;
    private final String code;
    private String project;
    private String command;
    private String jobId;

    public ConductorException(String code, Origin origin, String message) {
        super(message);
        this.code = code;
        this.origin = origin;
    }

    public ConductorException(String code, Origin origin, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.origin = origin;
    }

    /**
     * Attaches job context. Null arguments leave existing values untouched.
     */
    public ConductorException withContext(String jobId, String project, String command) {
        if (jobId != null) this.jobId = jobId;
        if (project != null) this.project = project;
        if (command != null) this.command = command;
        return this;
    }

    public Origin getOrigin() { return origin; }

    /** Stable machine-readable code, e.g. {@code CLONE_FAILED}. */
    public String getCode() { return code; }

    public String getProject() { return project; }
    public String getCommand() { return command; }
    public String getJobId() { return jobId; }
}
