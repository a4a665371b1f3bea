package com.conductor.engine;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Turns a prompt into the command line of a specific agent CLI.
 */
public interface AgentCommandFactory {

    String OUTPUT_FILE_ENV = "CONDUCTOR_OUTPUT_FILE";
    String JOB_ID_ENV = "CONDUCTOR_JOB_ID";

    /**
     * @param jobId           id of the job the agent works for
     * @param prompt          user-level prompt
     * @param rules           rule text appended to the agent's system prompt; may be empty
     * @param workingDir      directory the agent runs in
     * @param outputFile      file the agent should write its summary to
     * @param resumeSessionId agent conversation to continue, null to start a new one
     */
    AgentInvocation create(String jobId, String prompt, String rules, Path workingDir, Path outputFile,
                           String resumeSessionId);

    /**
     * Extracts the agent's conversation id from one line of its output.
     */
    default Optional<String> sessionIdFrom(String outputLine) {
        return Optional.empty();
    }
}
