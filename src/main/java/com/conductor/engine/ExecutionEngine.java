package com.conductor.engine;

import com.conductor.core.config.ConductorProperties;
import com.conductor.core.config.ProjectCatalog;
import com.conductor.core.error.AgentExecutionException;
import com.conductor.core.error.AgentLaunchException;
import com.conductor.core.error.BranchNotFoundException;
import com.conductor.core.error.ConductorException;
import com.conductor.core.error.MissingOutputException;
import com.conductor.core.error.NoActiveSessionException;
import com.conductor.core.error.TimeoutExceededException;
import com.conductor.core.logging.MdcContext;
import com.conductor.core.metrics.ConductorMetrics;
import com.conductor.core.model.CommandKind;
import com.conductor.core.model.Job;
import com.conductor.core.model.JobOutcome;
import com.conductor.core.model.JobState;
import com.conductor.core.model.Project;
import com.conductor.core.model.SessionLink;
import com.conductor.core.model.Workspace;
import com.conductor.core.model.WorkspaceMode;
import com.conductor.core.util.LogRingBuffer;
import com.conductor.core.util.ProcessTrees;
import com.conductor.jobs.JobRegistry;
import com.conductor.jobs.SessionLinkStore;
import com.conductor.workspace.WorktreeManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one job from acquisition to terminal state.
 *
 * <p>Order of a job's life: claim (PENDING to RUNNING), acquire a workspace, run
 * the agent, record any session link, release the workspace, then the terminal
 * transition. The workspace is always released before the job becomes terminal,
 * so a job observed as finished never holds a worktree.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    static final String CLAUDE_MD = "CLAUDE.md";
    static final String INIT_COMMIT_MESSAGE = "Add CLAUDE.md documentation for codebase architecture";
    private static final Duration DRAIN_JOIN_TIMEOUT = Duration.ofSeconds(5);

    private final WorktreeManager worktrees;
    private final JobRegistry registry;
    private final SessionLinkStore sessions;
    private final ProjectCatalog catalog;
    private final AgentCommandFactory commandFactory;
    private final PromptBuilder promptBuilder;
    private final ConductorProperties properties;
    private final ConductorMetrics metrics;

    public ExecutionEngine(WorktreeManager worktrees, JobRegistry registry, SessionLinkStore sessions,
                           ProjectCatalog catalog, AgentCommandFactory commandFactory,
                           PromptBuilder promptBuilder, ConductorProperties properties,
                           ConductorMetrics metrics) {
        this.worktrees = worktrees;
        this.registry = registry;
        this.sessions = sessions;
        this.catalog = catalog;
        this.commandFactory = commandFactory;
        this.promptBuilder = promptBuilder;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Task body scheduled on the job pool. Never throws; every failure ends up in
     * the job's terminal state.
     */
    public void execute(Job job) {
        MdcContext.setJob(job.id(), job.project(), job.command().label());
        try {
            if (!registry.markRunning(job.id())) {
                log.info("Job {} was cancelled before it started", job.id());
                return;
            }
            JobOutcome outcome = executeClaimed(job);
            if (outcome.error() != null) {
                outcome.error().withContext(job.id(), job.project(), job.command().label());
            }
            if (outcome.state() != JobState.COMPLETED) {
                discardOutput(job.id());
            }
            if (!registry.markTerminal(job.id(), outcome)) {
                log.warn("Job {} already terminal, dropping outcome {}", job.id(), outcome.state());
                return;
            }
            if (metrics != null) {
                metrics.recordJobResult(job.command().label(), outcome.state().name(), outcome.elapsed());
            }
        } finally {
            MdcContext.clear();
        }
    }

    private JobOutcome executeClaimed(Job job) {
        Workspace workspace = null;
        JobOutcome outcome;
        boolean deleteBranch = false;
        try {
            if (job.cancelToken().isCancelled()) {
                return JobOutcome.cancelled(job.cancelToken().reason(), Duration.ZERO);
            }
            Project project = catalog.require(job.project());
            SessionLink resumed = job.command().workspacePolicy() == CommandKind.WorkspacePolicy.SESSION_BRANCH
                    ? resolveSession(job)
                    : null;

            Optional<Workspace> acquired;
            try {
                acquired = worktrees.acquire(project, workspaceMode(job, resumed));
            } catch (BranchNotFoundException e) {
                forgetSession(resumed, e.getBranch());
                throw e;
            }
            if (acquired.isPresent()) {
                workspace = acquired.get();
                job.attachWorkspace(workspace);
            }
            if (job.cancelToken().isCancelled()) {
                outcome = JobOutcome.cancelled(job.cancelToken().reason(), Duration.ZERO);
            } else if (job.command() == CommandKind.INIT && workspace != null
                    && Files.exists(workspace.path().resolve(CLAUDE_MD))) {
                outcome = skipInit(job, project);
            } else {
                outcome = run(job, workspace, promptBuilder.rules(job.command()), agentTimeout(),
                        resumed != null ? resumed.agentSessionId() : null);
            }

            if (workspace != null && workspace.createdBranch()) {
                deleteBranch = afterRun(job, workspace, outcome);
            } else if (resumed != null) {
                afterFeedback(resumed, outcome);
            }
        } catch (ConductorException e) {
            log.warn("Job {} failed: {}", job.id(), e.getMessage());
            outcome = JobOutcome.failed(e, job.elapsed());
        } catch (RuntimeException e) {
            log.error("Job {} failed unexpectedly", job.id(), e);
            var error = new ConductorException("INTERNAL_ERROR", ConductorException.Origin.INFRASTRUCTURE,
                    "Internal error: " + e.getMessage(), e);
            outcome = JobOutcome.failed(error, job.elapsed());
        } finally {
            if (workspace != null) {
                worktrees.release(workspace, deleteBranch);
                job.detachWorkspace();
            }
        }
        return outcome;
    }

    public JobOutcome run(Job job, Workspace workspace, String rules, Duration timeout) {
        return run(job, workspace, rules, timeout, null);
    }

    /**
     * Runs the agent in the workspace (or the neutral directory when there is none)
     * and waits for exit, cancellation or timeout, whichever comes first. Only a
     * completed run leaves its output file behind.
     *
     * @param resumeSessionId agent conversation to continue, null for a fresh one
     */
    public JobOutcome run(Job job, Workspace workspace, String rules, Duration timeout, String resumeSessionId) {
        JobOutcome outcome = runAgent(job, workspace, rules, timeout, resumeSessionId);
        if (outcome.state() != JobState.COMPLETED) {
            discardOutput(job.id());
        }
        return outcome;
    }

    private JobOutcome runAgent(Job job, Workspace workspace, String rules, Duration timeout,
                                String resumeSessionId) {
        Path workingDir = workspace != null ? workspace.path() : neutralDir();
        Path outputFile = outputFileFor(job.id());
        Project project = catalog.require(job.project());

        try {
            Files.createDirectories(outputFile.getParent());
            Files.deleteIfExists(outputFile);
        } catch (IOException e) {
            return JobOutcome.failed(new AgentLaunchException(
                    "Cannot prepare output file " + outputFile, e), Duration.ZERO);
        }

        String prompt = promptBuilder.prompt(job, project, workingDir, outputFile);
        AgentInvocation invocation = commandFactory.create(job.id(), prompt, rules, workingDir, outputFile,
                resumeSessionId);
        if (resumeSessionId != null) {
            log.info("Job {} resumes agent session {}", job.id(), resumeSessionId);
        }

        Instant start = Instant.now();
        Process process;
        try {
            var builder = new ProcessBuilder(invocation.command())
                    .directory(invocation.workingDir().toFile())
                    .redirectErrorStream(true);
            builder.environment().putAll(invocation.environment());
            process = builder.start();
            process.getOutputStream().close();
        } catch (IOException e) {
            log.error("Could not start agent for job {}: {}", job.id(), e.getMessage());
            return JobOutcome.failed(new AgentLaunchException(
                    "Could not start agent " + invocation.command().get(0) + ": " + e.getMessage(), e), Duration.ZERO);
        }
        log.info("Agent for job {} started (PID {}) in {}", job.id(), process.pid(), workingDir);

        var tail = new LogRingBuffer(Math.max(1, properties.getAgent().getOutputTailLines()));
        var agentSession = new AtomicReference<String>();
        Thread drainer = new Thread(() -> drain(process.getInputStream(), tail, agentSession, job.id()),
                "conductor-agent-out-" + job.id());
        drainer.setDaemon(true);
        drainer.start();

        CompletableFuture<Process> exit = process.onExit();
        CompletableFuture<String> cancel = job.cancelToken().asFuture();
        try {
            CompletableFuture.anyOf(exit, cancel).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Job {} timed out after {} minutes, terminating agent", job.id(), timeout.toMinutes());
            terminate(process, drainer);
            return JobOutcome.timedOut(new TimeoutExceededException(
                    "Execution timed out after " + timeout.toMinutes() + " minutes"), elapsedSince(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminate(process, drainer);
            return JobOutcome.cancelled("interrupted", elapsedSince(start));
        } catch (ExecutionException e) {
            terminate(process, drainer);
            return JobOutcome.failed(new AgentLaunchException(
                    "Failed waiting for agent: " + e.getCause(), e.getCause()), elapsedSince(start));
        }

        if (!exit.isDone()) {
            log.info("Job {} cancelled ({}), terminating agent", job.id(), cancel.getNow(null));
            terminate(process, drainer);
            return JobOutcome.cancelled(job.cancelToken().reason(), elapsedSince(start));
        }

        Duration elapsed = elapsedSince(start);
        int exitCode = process.exitValue();
        joinDrainer(drainer);
        log.info("Agent for job {} exited with code {} after {}s", job.id(), exitCode, elapsed.toSeconds());

        if (job.command() == CommandKind.INIT) {
            return finishInit(job, project, workspace, exitCode, tail, outputFile, elapsed);
        }

        if (Files.exists(outputFile)) {
            if (exitCode != 0) {
                log.warn("Agent for job {} exited with code {} but wrote its output", job.id(), exitCode);
            }
            appendExecutionTime(outputFile, elapsed);
            return JobOutcome.completed(outputFile, "exit code " + exitCode, elapsed)
                    .withAgentSession(agentSession.get());
        }
        if (exitCode == 0) {
            return JobOutcome.failed(new MissingOutputException(
                    "Output file was not created: " + outputFile), elapsed);
        }
        return JobOutcome.failed(new AgentExecutionException(exitCode, String.join("\n", tail.tail(tail.capacity()))),
                elapsed);
    }

    public Path outputFileFor(String jobId) {
        return Path.of(properties.getWorkspace().getScratchRoot()).resolve("outputs").resolve(jobId + ".txt");
    }

    /**
     * Deletes the job's output file. A file left by a cancelled, timed-out or failed
     * agent must not be mistaken for a result.
     */
    private void discardOutput(String jobId) {
        Path outputFile = outputFileFor(jobId);
        try {
            if (Files.deleteIfExists(outputFile)) {
                log.debug("Discarded partial output {}", outputFile);
            }
        } catch (IOException e) {
            log.warn("Could not delete partial output {}: {}", outputFile, e.getMessage());
        }
    }

    private SessionLink resolveSession(Job job) {
        return sessions.resolve(job.project(), job.sessionRef())
                .orElseThrow(() -> new NoActiveSessionException(job.project(), job.sessionRef()));
    }

    private WorkspaceMode workspaceMode(Job job, SessionLink resumed) {
        CommandKind command = job.command();
        return switch (command.workspacePolicy()) {
            case NONE -> WorkspaceMode.NONE;
            case NEW_BRANCH, DEFAULT_BRANCH -> new WorkspaceMode.NewBranch(command.branchPrefix(), job.id());
            case SESSION_BRANCH -> new WorkspaceMode.ExistingBranch(resumed.branchName());
        };
    }

    /**
     * Decides the fate of a branch created for the job.
     *
     * @return true if the branch should be deleted on release
     */
    private boolean afterRun(Job job, Workspace workspace, JobOutcome outcome) {
        if (job.command() == CommandKind.INIT) {
            return true;
        }
        boolean hasCommits = worktrees.hasNewCommits(workspace);
        if (hasCommits && outcome.state() == JobState.COMPLETED && job.command().recordsSession()) {
            sessions.record(new SessionLink(job.project(), job.id(), job.command(), workspace.branch(),
                    outcome.agentSessionId(), Instant.now()));
        }
        if (!hasCommits) {
            log.info("Branch {} has no new commits, deleting it", workspace.branch());
        }
        return !hasCommits;
    }

    /**
     * Points the session at the conversation the feedback run ended in, so the next
     * feedback continues from there.
     */
    private void afterFeedback(SessionLink resumed, JobOutcome outcome) {
        String agentSession = outcome.agentSessionId();
        if (outcome.state() == JobState.COMPLETED && agentSession != null
                && !agentSession.equals(resumed.agentSessionId())) {
            sessions.updateAgentSession(resumed.project(), resumed.jobId(), agentSession);
        }
    }

    private void forgetSession(SessionLink link, String branch) {
        if (link != null && link.branchName().equals(branch)) {
            log.info("Branch {} is gone, forgetting session {}", branch, link.jobId());
            sessions.remove(link);
        }
    }

    private JobOutcome skipInit(Job job, Project project) {
        String summary = CLAUDE_MD + " already exists in " + project.name() + ", skipped /init.";
        return writeSummary(job, summary, Duration.ZERO);
    }

    private JobOutcome finishInit(Job job, Project project, Workspace workspace, int exitCode,
                                  LogRingBuffer tail, Path outputFile, Duration elapsed) {
        if (workspace == null || !Files.exists(workspace.path().resolve(CLAUDE_MD))) {
            if (exitCode != 0) {
                return JobOutcome.failed(new AgentExecutionException(exitCode,
                        String.join("\n", tail.tail(tail.capacity()))), elapsed);
            }
            return JobOutcome.failed(new MissingOutputException("/init did not create " + CLAUDE_MD), elapsed);
        }
        boolean pushed = worktrees.commitAndPush(workspace, CLAUDE_MD, INIT_COMMIT_MESSAGE, project.defaultBranch());
        String summary = pushed
                ? CLAUDE_MD + " initialized and pushed to " + project.defaultBranch() + "."
                : CLAUDE_MD + " initialized, but it could not be pushed to " + project.defaultBranch()
                        + ". Check the repository credentials.";
        if (!pushed) {
            log.warn("Could not push {} for {}", CLAUDE_MD, project.name());
        }
        return writeSummary(job, summary, elapsed);
    }

    private JobOutcome writeSummary(Job job, String summary, Duration elapsed) {
        Path outputFile = outputFileFor(job.id());
        try {
            Files.createDirectories(outputFile.getParent());
            Files.writeString(outputFile, summary, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return JobOutcome.failed(new AgentLaunchException("Cannot write " + outputFile, e), elapsed);
        }
        appendExecutionTime(outputFile, elapsed);
        return JobOutcome.completed(outputFile, summary, elapsed);
    }

    private void appendExecutionTime(Path outputFile, Duration elapsed) {
        String line = String.format(Locale.ROOT, "%n%nExecution time: %.2f minutes", elapsed.toMillis() / 60000.0);
        try {
            Files.writeString(outputFile, line, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Could not append execution time to {}: {}", outputFile, e.getMessage());
        }
    }

    private void terminate(Process process, Thread drainer) {
        Duration grace = Duration.ofSeconds(properties.getAgent().getKillGraceSeconds());
        if (!ProcessTrees.terminate(process.toHandle(), grace)) {
            log.warn("Some processes of agent {} survived termination", process.pid());
        }
        joinDrainer(drainer);
    }

    private void joinDrainer(Thread drainer) {
        try {
            drainer.join(DRAIN_JOIN_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (drainer.isAlive()) {
            log.warn("Agent output is still open after exit; a detached child may be holding it");
        }
    }

    private void drain(InputStream stream, LogRingBuffer tail, AtomicReference<String> agentSession, String jobId) {
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                tail.add(line);
                commandFactory.sessionIdFrom(line).ifPresent(agentSession::set);
                log.debug("agent[{}]: {}", jobId, line);
            }
        } catch (IOException e) {
            log.debug("Agent output of job {} closed: {}", jobId, e.getMessage());
        }
    }

    private Path neutralDir() {
        return Path.of(properties.getWorkspace().getNeutralDir());
    }

    private Duration agentTimeout() {
        return Duration.ofMinutes(properties.getAgent().getTimeoutMinutes());
    }

    private static Duration elapsedSince(Instant start) {
        return Duration.between(start, Instant.now());
    }
}
