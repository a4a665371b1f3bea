package com.conductor.core.model;

/**
 * A caller's request to run one command against one project.
 *
 * @param project     project name
 * @param command     command to run
 * @param argument    free-form task text; empty for {@code init}
 * @param requesterId opaque id of whoever asked, echoed back with the result
 * @param sessionRef  job id of the session to resume for {@code feedback}; nullable
 */
public record JobRequest(
    String project,
    CommandKind command,
    String argument,
    String requesterId,
    String sessionRef
) {

    public JobRequest {
        argument = argument == null ? "" : argument;
    }

    public JobRequest(String project, CommandKind command, String argument) {
        this(project, command, argument, null, null);
    }
}
