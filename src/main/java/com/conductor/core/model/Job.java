package com.conductor.core.model;

import com.conductor.core.error.ConductorException;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * A unit of work tracked by the registry.
 *
 * <p>Identity fields are immutable. Lifecycle fields change only through the
 * transition methods, which hold the job's own monitor, so concurrent callers
 * (worker thread, cancel requests, status readers) always see a consistent state.
 */
public class Job {

    private final String id;
    private final String project;
    private final CommandKind command;
    private final String argument;
    private final String requesterId;
    private final String sessionRef;
    private final Instant submittedAt;
    private final CancelToken cancelToken = new CancelToken();

    private JobState state = JobState.PENDING;
    private Instant startedAt;
    private Instant completedAt;
    private Workspace workspace;
    private Path resultSummaryPath;
    private String detail;
    private ConductorException failure;
    private String summaryText;
    private boolean resultCollected;

    public Job(String id, JobRequest request) {
        this(id, request, Instant.now());
    }

    public Job(String id, JobRequest request, Instant submittedAt) {
        this.id = id;
        this.project = request.project();
        this.command = request.command();
        this.argument = request.argument();
        this.requesterId = request.requesterId();
        this.sessionRef = request.sessionRef();
        this.submittedAt = submittedAt;
    }

    public String id() { return id; }
    public String project() { return project; }
    public CommandKind command() { return command; }
    public String argument() { return argument; }
    public String requesterId() { return requesterId; }
    public String sessionRef() { return sessionRef; }
    public Instant submittedAt() { return submittedAt; }
    public CancelToken cancelToken() { return cancelToken; }

    public synchronized JobState state() { return state; }
    public synchronized Instant startedAt() { return startedAt; }
    public synchronized Instant completedAt() { return completedAt; }
    public synchronized Workspace workspace() { return workspace; }
    public synchronized Path resultSummaryPath() { return resultSummaryPath; }
    public synchronized String detail() { return detail; }
    public synchronized ConductorException failure() { return failure; }

    public synchronized boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * Time spent running so far, or total run time once terminal. Zero while pending.
     */
    public synchronized Duration elapsed() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        Instant end = completedAt != null ? completedAt : Instant.now();
        return Duration.between(startedAt, end);
    }

    /**
     * @return false if the job was no longer pending
     */
    public synchronized boolean markRunning() {
        if (!state.canTransitionTo(JobState.RUNNING)) {
            return false;
        }
        state = JobState.RUNNING;
        startedAt = Instant.now();
        return true;
    }

    /**
     * Moves the job to a terminal state. A second terminal transition is rejected.
     *
     * @return false if the transition was not allowed from the current state
     */
    public synchronized boolean markTerminal(JobOutcome outcome) {
        if (!state.canTransitionTo(outcome.state())) {
            return false;
        }
        state = outcome.state();
        completedAt = Instant.now();
        if (startedAt == null) {
            startedAt = completedAt;
        }
        resultSummaryPath = outcome.summaryPath();
        detail = outcome.detail();
        failure = outcome.error();
        return true;
    }

    /**
     * Cancels the job only if no worker has claimed it yet.
     *
     * @return true if the job moved from PENDING to CANCELLED
     */
    public synchronized boolean cancelIfPending(String reason) {
        if (state != JobState.PENDING) {
            return false;
        }
        return markTerminal(JobOutcome.cancelled(reason, Duration.ZERO));
    }

    public synchronized void attachWorkspace(Workspace workspace) {
        this.workspace = workspace;
    }

    public synchronized void detachWorkspace() {
        this.workspace = null;
    }

    public synchronized boolean hasWorkspace() {
        return workspace != null;
    }

    public synchronized boolean isResultCollected() {
        return resultCollected;
    }

    /** Summary text cached by the first read of the result, if any. */
    public synchronized String summaryText() {
        return summaryText;
    }

    /**
     * Caches the summary text read from the result file and forgets the file.
     */
    public synchronized void recordCollected(String text) {
        this.summaryText = text;
        this.resultCollected = true;
        this.resultSummaryPath = null;
    }

    /**
     * Builds the caller-facing result from the current state.
     */
    public synchronized JobResult toResult() {
        String error = null;
        if (state != JobState.COMPLETED && state.isTerminal()) {
            error = failure != null ? failure.getMessage() : detail;
        }
        return new JobResult(id, project, command, requesterId, state, summaryText, error);
    }

    @Override
    public String toString() {
        return "Job[" + id + " " + project + " /" + command.label() + " " + state() + "]";
    }
}
