package com.conductor.core.model;

import com.conductor.core.error.ConductorException;

import java.nio.file.Path;
import java.time.Duration;

/**
 * What the execution engine reports for one run.
 *
 * @param state       terminal state
 * @param summaryPath summary file, present only for {@link JobState#COMPLETED}
 * @param detail      short human-readable cause
 * @param error       failure, null unless the state is FAILED or TIMED_OUT
 * @param elapsed     wall time spent running the agent
 * @param agentSessionId conversation id the agent reported, null when it reported none
 */
public record JobOutcome(
    JobState state,
    Path summaryPath,
    String detail,
    ConductorException error,
    Duration elapsed,
    String agentSessionId
) {

    public JobOutcome {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Outcome state must be terminal: " + state);
        }
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public JobOutcome(JobState state, Path summaryPath, String detail, ConductorException error, Duration elapsed) {
        this(state, summaryPath, detail, error, elapsed, null);
    }

    public JobOutcome withAgentSession(String sessionId) {
        return new JobOutcome(state, summaryPath, detail, error, elapsed, sessionId);
    }

    public static JobOutcome completed(Path summaryPath, String detail, Duration elapsed) {
        return new JobOutcome(JobState.COMPLETED, summaryPath, detail, null, elapsed);
    }

    public static JobOutcome failed(ConductorException error, Duration elapsed) {
        return new JobOutcome(JobState.FAILED, null, error.getMessage(), error, elapsed);
    }

    public static JobOutcome cancelled(String reason, Duration elapsed) {
        return new JobOutcome(JobState.CANCELLED, null, reason, null, elapsed);
    }

    public static JobOutcome timedOut(ConductorException error, Duration elapsed) {
        return new JobOutcome(JobState.TIMED_OUT, null, error.getMessage(), error, elapsed);
    }
}
