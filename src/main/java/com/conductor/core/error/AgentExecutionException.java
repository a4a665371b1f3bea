package com.conductor.core.error;

/**
 * The agent exited with a non-zero code without producing a summary.
 */
public class AgentExecutionException extends ConductorException {

    public static final String CODE = "AGENT_FAILED";

    private final int exitCode;
    private final String outputTail;

    public AgentExecutionException(int exitCode, String outputTail) {
        super(CODE, Origin.AGENT, buildMessage(exitCode, outputTail));
        this.exitCode = exitCode;
        this.outputTail = outputTail;
    }

    public int getExitCode() { return exitCode; }

    /** Last lines of the agent's combined output, possibly empty. */
    public String getOutputTail() { return outputTail; }

    private static String buildMessage(int exitCode, String outputTail) {
        if (outputTail == null || outputTail.isBlank()) {
            return "Agent exited with code " + exitCode;
        }
        return "Agent exited with code " + exitCode + ":\n" + outputTail;
    }
}
