package com.conductor.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * A fully resolved agent command line.
 *
 * @param command     executable followed by its arguments
 * @param workingDir  directory the agent runs in
 * @param environment variables added to the inherited environment
 */
public record AgentInvocation(List<String> command, Path workingDir, Map<String, String> environment) {

    public AgentInvocation {
        command = List.copyOf(command);
        environment = Map.copyOf(environment);
    }
}
