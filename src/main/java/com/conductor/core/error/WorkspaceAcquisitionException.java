package com.conductor.core.error;

/**
 * A worktree could not be added to the canonical clone.
 */
public class WorkspaceAcquisitionException extends ConductorException {

    public static final String CODE = "WORKSPACE_UNAVAILABLE";

    public WorkspaceAcquisitionException(String message) {
        super(CODE, Origin.INFRASTRUCTURE, message);
    }

    public WorkspaceAcquisitionException(String message, Throwable cause) {
        super(CODE, Origin.INFRASTRUCTURE, message, cause);
    }
}
