package com.conductor.core.error;

/**
 * The agent exited cleanly but never wrote its summary file.
 */
public class MissingOutputException extends ConductorException {

    public static final String CODE = "MISSING_OUTPUT";

    public MissingOutputException(String message) {
        super(CODE, Origin.AGENT, message);
    }
}
