package com.conductor.jobs;

import com.conductor.core.config.ProjectCatalog;
import com.conductor.core.error.AlreadyRunningException;
import com.conductor.core.error.ConductorException;
import com.conductor.core.error.NoActiveSessionException;
import com.conductor.core.events.ConductorEvent;
import com.conductor.core.events.EventBus;
import com.conductor.core.metrics.ConductorMetrics;
import com.conductor.core.model.CommandKind;
import com.conductor.core.model.Job;
import com.conductor.core.model.JobHandle;
import com.conductor.core.model.JobOutcome;
import com.conductor.core.model.JobRequest;
import com.conductor.core.model.JobResult;
import com.conductor.core.model.JobState;
import com.conductor.core.model.Project;
import com.conductor.core.util.OutputText;
import com.conductor.engine.ExecutionEngine;
import com.conductor.supervisor.ProcessSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Submission path for jobs: validates requests, registers jobs, runs them on a
 * fixed-size pool and hands results back to callers.
 *
 * <p>{@link #submit} returns as soon as the job is registered. Results are either
 * polled with {@link #collectResult} or pushed to callbacks when the job finishes.
 */
public class JobService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRegistry registry;
    private final ExecutionEngine engine;
    private final ProjectCatalog catalog;
    private final SessionLinkStore sessions;
    private final ProcessSupervisor supervisor;
    private final EventBus eventBus;
    private final ConductorMetrics metrics;
    private final int maxSummaryChars;
    private final ExecutorService pool;
    private final List<Consumer<JobResult>> resultListeners = new CopyOnWriteArrayList<>();

    public JobService(JobRegistry registry, ExecutionEngine engine, ProjectCatalog catalog,
                      SessionLinkStore sessions, ProcessSupervisor supervisor, EventBus eventBus,
                      ConductorMetrics metrics, int maxParallel, int maxSummaryChars) {
        this.registry = registry;
        this.engine = engine;
        this.catalog = catalog;
        this.sessions = sessions;
        this.supervisor = supervisor;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxSummaryChars = maxSummaryChars;
        this.pool = Executors.newFixedThreadPool(Math.max(1, maxParallel), namedThreads("conductor-job-"));
        eventBus.subscribeAll(this::onEvent);
    }

    /**
     * Registers and schedules a job.
     *
     * @throws com.conductor.core.error.UnknownProjectException if the project is not configured
     * @throws NoActiveSessionException if {@code feedback} has no session to resume; no job is created
     */
    public JobHandle submit(JobRequest request) {
        return submit(request, null);
    }

    /**
     * Like {@link #submit(JobRequest)}, delivering the result to {@code callback}
     * once the job is terminal.
     */
    public JobHandle submit(JobRequest request, Consumer<JobResult> callback) {
        validate(request);
        Job job = registry.create(request);
        if (callback != null) {
            eventBus.subscribe(job.id(), event -> {
                if (ConductorEvent.JOB_FINISHED.equals(event.eventType())) {
                    collectResult(job.id()).ifPresent(callback);
                    eventBus.unsubscribeJob(job.id());
                }
            });
        }
        if (metrics != null) {
            metrics.recordJobSubmitted(job.command().label());
        }
        try {
            pool.execute(() -> engine.execute(job));
        } catch (RejectedExecutionException e) {
            log.error("Job pool rejected job {}", job.id());
            registry.markRunning(job.id());
            registry.markTerminal(job.id(), JobOutcome.failed(new ConductorException(
                    "REJECTED", ConductorException.Origin.INFRASTRUCTURE, "Job pool is shut down"), Duration.ZERO));
        }
        return new JobHandle(job.id());
    }

    public boolean cancel(String jobId) {
        return registry.cancel(jobId, "cancelled by request");
    }

    /**
     * Cancels every unfinished job of a project.
     *
     * @return ids of the jobs that were signalled
     */
    public List<String> cancelProject(String project) {
        catalog.require(project);
        return cancelAll(registry.listByProject(project));
    }

    public List<String> cancelAll() {
        return cancelAll(registry.listActive());
    }

    /**
     * Returns the job's result. The first read after completion loads the summary
     * file, caches its text on the job and deletes the file.
     *
     * @return empty if the job is unknown
     */
    public Optional<JobResult> collectResult(String jobId) {
        Optional<Job> found = registry.get(jobId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Job job = found.get();
        synchronized (job) {
            if (job.isTerminal() && !job.isResultCollected()) {
                job.recordCollected(readSummary(job.resultSummaryPath()));
            }
            return Optional.of(job.toResult());
        }
    }

    /**
     * Registers a listener for the result of every job.
     */
    public EventBus.Subscription onResult(Consumer<JobResult> listener) {
        resultListeners.add(listener);
        return () -> resultListeners.remove(listener);
    }

    @Override
    public void close() {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Job pool did not terminate within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void validate(JobRequest request) {
        if (request.command() == null) {
            throw new IllegalArgumentException("Command is required");
        }
        catalog.require(request.project());
        if (request.command() == CommandKind.FEEDBACK
                && sessions.resolve(request.project(), request.sessionRef()).isEmpty()) {
            throw new NoActiveSessionException(request.project(), request.sessionRef());
        }
        if (request.command() != CommandKind.INIT && request.argument().isBlank()) {
            throw new IllegalArgumentException("/" + request.command().label() + " needs a task description");
        }
    }

    private List<String> cancelAll(List<Job> jobs) {
        var cancelled = new ArrayList<String>();
        for (Job job : jobs) {
            if (registry.cancel(job.id(), "cancelled by request")) {
                cancelled.add(job.id());
            }
        }
        return cancelled;
    }

    private void onEvent(ConductorEvent event) {
        if (!ConductorEvent.JOB_FINISHED.equals(event.eventType())) {
            return;
        }
        Optional<Job> job = registry.get(event.jobId());
        if (job.isEmpty()) {
            return;
        }
        if (!resultListeners.isEmpty()) {
            collectResult(event.jobId()).ifPresent(result -> {
                for (Consumer<JobResult> listener : resultListeners) {
                    try {
                        listener.accept(result);
                    } catch (RuntimeException e) {
                        log.warn("Result listener failed for job {}: {}", event.jobId(), e.getMessage(), e);
                    }
                }
            });
        }
        if (job.get().command() == CommandKind.INIT && job.get().state() == JobState.COMPLETED) {
            startAfterInit(job.get().project());
        }
    }

    private void startAfterInit(String projectName) {
        Project project = catalog.find(projectName).orElse(null);
        if (project == null || !project.hasUpCommand() || supervisor.get(projectName).isPresent()) {
            return;
        }
        try {
            supervisor.start(project);
        } catch (AlreadyRunningException e) {
            log.debug("{} started concurrently", projectName);
        } catch (ConductorException e) {
            log.warn("Could not start {} after init: {}", projectName, e.getMessage());
        }
    }

    private String readSummary(Path path) {
        if (path == null) {
            return null;
        }
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            Files.deleteIfExists(path);
            return OutputText.truncate(text, maxSummaryChars);
        } catch (NoSuchFileException e) {
            log.warn("Summary file {} disappeared before it was read", path);
            return null;
        } catch (IOException e) {
            log.warn("Could not read summary file {}: {}", path, e.getMessage());
            return null;
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
