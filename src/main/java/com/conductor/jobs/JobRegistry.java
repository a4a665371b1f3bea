package com.conductor.jobs;

import com.conductor.core.events.ConductorEvent;
import com.conductor.core.events.EventBus;
import com.conductor.core.model.CommandKind;
import com.conductor.core.model.Job;
import com.conductor.core.model.JobOutcome;
import com.conductor.core.model.JobRequest;
import com.conductor.core.model.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Authoritative in-memory table of active and recently finished jobs.
 *
 * <p>Transitions of a single job are guarded by the job's own lock; creation,
 * listing and eviction hold the registry lock. Lifecycle events are published on
 * the {@link EventBus} after each successful transition.
 */
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final Object lock = new Object();
    private final Map<String, Job> jobs = new HashMap<>();
    private final int retentionPerProject;
    private final Duration retention;
    private final EventBus eventBus;
    private final Clock clock;

    public JobRegistry(int retentionPerProject, Duration retention, EventBus eventBus) {
        this(retentionPerProject, retention, eventBus, Clock.systemUTC());
    }

    public JobRegistry(int retentionPerProject, Duration retention, EventBus eventBus, Clock clock) {
        this.retentionPerProject = retentionPerProject;
        this.retention = retention;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public Job create(String project, CommandKind command, String argument) {
        return create(new JobRequest(project, command, argument));
    }

    public Job create(JobRequest request) {
        Job job;
        synchronized (lock) {
            String id;
            do {
                id = UUID.randomUUID().toString().substring(0, 8);
            } while (jobs.containsKey(id));
            job = new Job(id, request);
            jobs.put(id, job);
            evict(request.project());
        }
        log.info("Registered job {} for {} /{}", job.id(), job.project(), job.command().label());
        publish(ConductorEvent.JOB_SUBMITTED, job, Map.of("command", job.command().label()));
        return job;
    }

    /**
     * @return false if the job is unknown or no longer pending
     */
    public boolean markRunning(String id) {
        Job job = get(id).orElse(null);
        if (job == null || !job.markRunning()) {
            return false;
        }
        publish(ConductorEvent.JOB_STARTED, job, Map.of("command", job.command().label()));
        return true;
    }

    public boolean markTerminal(String id, JobState state, Path summaryPath) {
        JobOutcome outcome = switch (state) {
            case COMPLETED -> JobOutcome.completed(summaryPath, "completed", null);
            case CANCELLED -> JobOutcome.cancelled("cancelled", null);
            case FAILED, TIMED_OUT -> new JobOutcome(state, null, state.name().toLowerCase(Locale.ROOT), null, null);
            case PENDING, RUNNING -> throw new IllegalArgumentException("Not a terminal state: " + state);
        };
        return markTerminal(id, outcome);
    }

    /**
     * Records the job's terminal state. Exactly one terminal transition succeeds per job.
     *
     * @return false if the job is unknown or already terminal
     */
    public boolean markTerminal(String id, JobOutcome outcome) {
        Job job = get(id).orElse(null);
        if (job == null || !job.markTerminal(outcome)) {
            return false;
        }
        finished(job, outcome);
        return true;
    }

    private void finished(Job job, JobOutcome outcome) {
        String id = job.id();
        log.info("Job {} finished: {} ({})", id, outcome.state(), outcome.detail());
        var payload = new HashMap<String, Object>();
        payload.put("command", job.command().label());
        payload.put("state", outcome.state().name());
        payload.put("elapsedMs", outcome.elapsed().toMillis());
        if (job.requesterId() != null) {
            payload.put("requesterId", job.requesterId());
        }
        publish(ConductorEvent.JOB_FINISHED, job, payload);
        synchronized (lock) {
            evict(job.project());
        }
    }

    /**
     * Fires the job's cancel token. A job still waiting in the queue is finalised
     * as cancelled at once; a running job is left to its worker, which observes the
     * token and terminates the agent.
     *
     * @return false if the job is unknown or already terminal
     */
    public boolean cancel(String id, String reason) {
        Job job = get(id).orElse(null);
        if (job == null || job.isTerminal()) {
            return false;
        }
        job.cancelToken().cancel(reason);
        log.info("Cancellation requested for job {}: {}", id, reason);
        if (job.cancelIfPending(job.cancelToken().reason())) {
            finished(job, JobOutcome.cancelled(job.cancelToken().reason(), Duration.ZERO));
        }
        return true;
    }

    public boolean cancel(String id) {
        return cancel(id, "cancelled");
    }

    public Optional<Job> get(String id) {
        synchronized (lock) {
            return Optional.ofNullable(jobs.get(id));
        }
    }

    public List<Job> listByProject(String project) {
        synchronized (lock) {
            return jobs.values().stream()
                    .filter(job -> job.project().equals(project))
                    .sorted(Comparator.comparing(Job::submittedAt))
                    .toList();
        }
    }

    public List<Job> listActive() {
        synchronized (lock) {
            return jobs.values().stream()
                    .filter(job -> !job.isTerminal())
                    .sorted(Comparator.comparing(Job::submittedAt))
                    .toList();
        }
    }

    public List<Job> listAll() {
        synchronized (lock) {
            return jobs.values().stream()
                    .sorted(Comparator.comparing(Job::submittedAt))
                    .toList();
        }
    }

    public int size() {
        synchronized (lock) {
            return jobs.size();
        }
    }

    // Caller holds the registry lock.
    private void evict(String project) {
        Instant cutoff = clock.instant().minus(retention);
        List<Job> finished = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (job.project().equals(project) && job.isTerminal() && !job.hasWorkspace()) {
                finished.add(job);
            }
        }
        finished.sort(Comparator.comparing(Job::completedAt).reversed());

        for (int i = 0; i < finished.size(); i++) {
            Job job = finished.get(i);
            if (i >= retentionPerProject || job.completedAt().isBefore(cutoff)) {
                jobs.remove(job.id());
                deleteUnreadOutput(job);
                log.debug("Evicted job {} of {}", job.id(), project);
            }
        }
    }

    private void deleteUnreadOutput(Job job) {
        Path summary = job.resultSummaryPath();
        if (summary == null || job.isResultCollected()) {
            return;
        }
        try {
            Files.deleteIfExists(summary);
        } catch (IOException e) {
            log.warn("Could not delete output file {} of evicted job {}: {}", summary, job.id(), e.getMessage());
        }
    }

    private void publish(String type, Job job, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(ConductorEvent.of(type, job.id(), job.project(), payload));
        }
    }
}
