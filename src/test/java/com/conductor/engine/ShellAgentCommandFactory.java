package com.conductor.engine;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * Stands in for the agent CLI with a shell script. The script sees the output
 * file in {@code $CONDUCTOR_OUTPUT_FILE} and runs in the job's working directory.
 * A resumed conversation id is exported as {@code $CONDUCTOR_RESUME_SESSION}; the
 * script reports its own id the way the agent does, with a JSON result line.
 */
public class ShellAgentCommandFactory implements AgentCommandFactory {

    public static final String RESUME_SESSION_ENV = "CONDUCTOR_RESUME_SESSION";

    private volatile String script;
    private volatile String lastPrompt;
    private volatile String lastRules;
    private volatile Path lastWorkingDir;
    private volatile String lastResumeSessionId;

    public ShellAgentCommandFactory(String script) {
        this.script = script;
    }

    public void setScript(String script) {
        this.script = script;
    }

    @Override
    public AgentInvocation create(String jobId, String prompt, String rules, Path workingDir, Path outputFile,
                                  String resumeSessionId) {
        this.lastPrompt = prompt;
        this.lastRules = rules;
        this.lastWorkingDir = workingDir;
        this.lastResumeSessionId = resumeSessionId;
        var env = new HashMap<String, String>();
        env.put(OUTPUT_FILE_ENV, outputFile.toString());
        env.put(JOB_ID_ENV, jobId);
        if (resumeSessionId != null) {
            env.put(RESUME_SESSION_ENV, resumeSessionId);
        }
        return new AgentInvocation(List.of("sh", "-c", script), workingDir, env);
    }

    @Override
    public Optional<String> sessionIdFrom(String outputLine) {
        return ClaudeCliCommandFactory.sessionIdOf(outputLine);
    }

    public String lastPrompt() {
        return lastPrompt;
    }

    public String lastRules() {
        return lastRules;
    }

    public Path lastWorkingDir() {
        return lastWorkingDir;
    }

    public String lastResumeSessionId() {
        return lastResumeSessionId;
    }
}
