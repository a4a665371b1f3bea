package com.conductor.core.error;

/**
 * No project with the given name is configured.
 */
public class UnknownProjectException extends ConductorException {

    public static final String CODE = "UNKNOWN_PROJECT";

    public UnknownProjectException(String message) {
        super(CODE, Origin.REQUEST, message);
    }
}
