package com.conductor.core.error;

/**
 * The canonical clone of a project could not be created.
 */
public class CloneException extends ConductorException {

    public static final String CODE = "CLONE_FAILED";

    public CloneException(String message) {
        super(CODE, Origin.INFRASTRUCTURE, message);
    }

    public CloneException(String message, Throwable cause) {
        super(CODE, Origin.INFRASTRUCTURE, message, cause);
    }
}
