package com.conductor.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralised Micrometer metrics for job execution and process supervision.
 */
public class ConductorMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger activeWorktrees = new AtomicInteger();
    private final AtomicInteger runningProcesses = new AtomicInteger();

    public ConductorMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("conductor.worktrees.active", activeWorktrees, AtomicInteger::get)
                .description("Worktrees currently attached to a job")
                .register(registry);
        Gauge.builder("conductor.processes.running", runningProcesses, AtomicInteger::get)
                .description("Supervised auxiliary processes currently alive")
                .register(registry);
    }

    public void recordJobSubmitted(String command) {
        Counter.builder("conductor.jobs.submitted")
                .tag("command", command)
                .register(registry)
                .increment();
    }

    /**
     * Records a job reaching a terminal state.
     *
     * @param command lower-case command name
     * @param state   terminal state name, e.g. {@code COMPLETED}
     * @param elapsed time the agent ran
     */
    public void recordJobResult(String command, String state, Duration elapsed) {
        Counter.builder("conductor.jobs.total")
                .tag("command", command)
                .tag("state", state)
                .register(registry)
                .increment();
        Timer.builder("conductor.jobs.duration")
                .tag("command", command)
                .register(registry)
                .record(elapsed);
    }

    /**
     * Records worktree lifecycle operations.
     *
     * @param operation "clone", "acquire" or "release"
     * @param success   whether the operation succeeded
     */
    public void recordWorktreeOperation(String operation, boolean success) {
        Counter.builder("conductor.worktree.operations")
                .description("Git worktree lifecycle operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void setActiveWorktrees(int count) {
        activeWorktrees.set(count);
    }

    public void recordProcessStarted(String project) {
        Counter.builder("conductor.processes.started")
                .tag("project", project)
                .register(registry)
                .increment();
    }

    /**
     * @param requested true when the exit followed a stop request, false when the process died on its own
     */
    public void recordProcessExited(String project, boolean requested) {
        Counter.builder("conductor.processes.exited")
                .tag("project", project)
                .tag("requested", String.valueOf(requested))
                .register(registry)
                .increment();
    }

    public void setRunningProcesses(int count) {
        runningProcesses.set(count);
    }
}
