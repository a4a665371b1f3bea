package com.conductor.core.error;

/**
 * The agent ran past the job timeout and was killed.
 */
public class TimeoutExceededException extends ConductorException {

    public static final String CODE = "TIMEOUT";

    public TimeoutExceededException(String message) {
        super(CODE, Origin.AGENT, message);
    }
}
