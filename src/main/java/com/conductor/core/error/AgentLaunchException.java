package com.conductor.core.error;

/**
 * The agent process could not be spawned.
 */
public class AgentLaunchException extends ConductorException {

    public static final String CODE = "AGENT_LAUNCH_FAILED";

    public AgentLaunchException(String message) {
        super(CODE, Origin.INFRASTRUCTURE, message);
    }

    public AgentLaunchException(String message, Throwable cause) {
        super(CODE, Origin.INFRASTRUCTURE, message, cause);
    }
}
