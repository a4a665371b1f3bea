package com.conductor.core.error;

/**
 * {@code feedback} was requested but there is no earlier feat/fix/plan branch to resume.
 */
public class NoActiveSessionException extends ConductorException {

    public static final String CODE = "NO_ACTIVE_SESSION";

    public NoActiveSessionException(String project, String sessionRef) {
        super(CODE, Origin.REQUEST, sessionRef == null
                ? "No active session for project " + project + ". Run /feat, /fix or /plan first."
                : "Session " + sessionRef + " not found for project " + project);
        withContext(null, project, "feedback");
    }
}
