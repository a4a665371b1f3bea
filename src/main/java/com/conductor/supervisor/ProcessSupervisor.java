package com.conductor.supervisor;

import com.conductor.core.error.AlreadyRunningException;
import com.conductor.core.error.ConductorException;
import com.conductor.core.events.ConductorEvent;
import com.conductor.core.events.EventBus;
import com.conductor.core.logging.MdcContext;
import com.conductor.core.metrics.ConductorMetrics;
import com.conductor.core.model.AuxiliaryProcess;
import com.conductor.core.model.Project;
import com.conductor.core.util.LogRingBuffer;
import com.conductor.core.util.ProcessTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps at most one long-running auxiliary process (a dev server, usually) per project.
 *
 * <p>Output of each process goes to a bounded ring buffer and to the
 * {@code conductor.aux} logger. Processes that exit on their own are noticed
 * through {@link Process#onExit()} and, as a backstop, by a periodic reaper sweep.
 * The log of an exited process stays readable until the project is started again.
 */
public class ProcessSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);
    private static final Logger auxLog = LoggerFactory.getLogger("conductor.aux");

    public static final int DEFAULT_TAIL_LINES = 50;
    public static final int MAX_TAIL_LINES = 200;

    /**
     * How the last process of a project ended.
     */
    public record ExitInfo(long pid, int exitCode, Instant exitedAt) {}

    private static final class Supervised {
        final AuxiliaryProcess info;
        final Process process;
        volatile boolean stopRequested;
        boolean exitHandled;

        Supervised(AuxiliaryProcess info, Process process) {
            this.info = info;
            this.process = process;
        }
    }

    private final String shell;
    private final int logCapacity;
    private final Duration stopGrace;
    private final Duration downTimeout;
    private final EventBus eventBus;
    private final ConductorMetrics metrics;

    private final ConcurrentHashMap<String, Object> projectLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Supervised> processes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, LogRingBuffer> logs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ExitInfo> lastExits = new ConcurrentHashMap<>();
    private final ScheduledExecutorService reaper;

    public ProcessSupervisor(String shell, int logCapacity, Duration stopGrace, Duration downTimeout,
                             Duration reaperInterval, EventBus eventBus, ConductorMetrics metrics) {
        this.shell = shell;
        this.logCapacity = logCapacity;
        this.stopGrace = stopGrace;
        this.downTimeout = downTimeout;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.reaper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "conductor-reaper");
            thread.setDaemon(true);
            return thread;
        });
        reaper.scheduleWithFixedDelay(this::reap, reaperInterval.toMillis(), reaperInterval.toMillis(),
                TimeUnit.MILLISECONDS);
    }

    /**
     * Starts the project's up command.
     *
     * @throws AlreadyRunningException if a live process already exists for the project
     * @throws ConductorException      if the project has no up command or the shell cannot be spawned
     */
    public AuxiliaryProcess start(Project project) {
        if (!project.hasUpCommand()) {
            throw new ConductorException("NO_UP_COMMAND", ConductorException.Origin.REQUEST,
                    "No up command configured for project " + project.name());
        }
        synchronized (lockFor(project.name())) {
            Supervised existing = processes.get(project.name());
            if (existing != null) {
                if (existing.process.isAlive()) {
                    throw new AlreadyRunningException(project.name(), existing.info.pid());
                }
                handleExit(project.name(), existing);
            }

            var buffer = new LogRingBuffer(logCapacity);
            Process process;
            try {
                process = new ProcessBuilder(shell, "-c", project.upCommand())
                        .directory(project.workDir().toFile())
                        .redirectErrorStream(true)
                        .start();
                process.getOutputStream().close();
            } catch (IOException e) {
                throw new ConductorException("PROCESS_LAUNCH_FAILED", ConductorException.Origin.INFRASTRUCTURE,
                        "Could not start " + project.name() + ": " + e.getMessage(), e)
                        .withContext(null, project.name(), "up");
            }

            var info = new AuxiliaryProcess(project.name(), process.pid(), project.upCommand(), Instant.now());
            var supervised = new Supervised(info, process);
            logs.put(project.name(), buffer);
            lastExits.remove(project.name());
            processes.put(project.name(), supervised);

            Thread reader = new Thread(() -> pump(project.name(), process.getInputStream(), buffer),
                    "conductor-aux-" + project.name());
            reader.setDaemon(true);
            reader.start();
            process.onExit().thenRun(() -> handleExit(project.name(), supervised));

            log.info("Started {} (PID {}): {}", project.name(), info.pid(), project.upCommand());
            if (metrics != null) {
                metrics.recordProcessStarted(project.name());
                metrics.setRunningProcesses(processes.size());
            }
            publish(ConductorEvent.PROCESS_STARTED, project.name(), Map.of("pid", info.pid()));
            return info;
        }
    }

    /**
     * Stops the project's process tree, then runs its down command if one is configured.
     *
     * @return false if nothing was running
     */
    public boolean stop(Project project) {
        Supervised supervised;
        synchronized (lockFor(project.name())) {
            supervised = processes.get(project.name());
            if (supervised == null) {
                return false;
            }
            supervised.stopRequested = true;
            try {
                log.info("Stopping {} (PID {})", project.name(), supervised.info.pid());
                if (!ProcessTrees.terminate(supervised.process.toHandle(), stopGrace)) {
                    log.warn("Some processes of {} survived termination", project.name());
                }
            } finally {
                handleExit(project.name(), supervised);
            }
        }
        if (project.hasDownCommand()) {
            runDownCommand(project);
        }
        return true;
    }

    /**
     * Last {@code lines} lines of the project's output, clamped to 1..{@value #MAX_TAIL_LINES}.
     */
    public List<String> tailLog(String project, int lines) {
        LogRingBuffer buffer = logs.get(project);
        if (buffer == null) {
            return List.of();
        }
        return buffer.tail(clampLines(lines));
    }

    /**
     * The project's process, if it is alive. A process found dead is recorded as
     * exited before this returns, so {@link #lastExit} already reports it.
     */
    public Optional<AuxiliaryProcess> get(String project) {
        Supervised supervised = processes.get(project);
        if (supervised == null) {
            return Optional.empty();
        }
        if (!supervised.process.isAlive()) {
            handleExit(project, supervised);
            return Optional.empty();
        }
        return Optional.of(supervised.info);
    }

    public List<AuxiliaryProcess> list() {
        reap();
        return processes.values().stream()
                .map(s -> s.info)
                .sorted(Comparator.comparing(AuxiliaryProcess::project))
                .toList();
    }

    /**
     * How the project's last process ended, until it is started again.
     */
    public Optional<ExitInfo> lastExit(String project) {
        Supervised supervised = processes.get(project);
        if (supervised != null && !supervised.process.isAlive()) {
            handleExit(project, supervised);
        }
        return Optional.ofNullable(lastExits.get(project));
    }

    /**
     * Starts every project that has an up command and is not already running.
     *
     * @return the processes started
     */
    public List<AuxiliaryProcess> startAll(Collection<Project> projects) {
        var started = new ArrayList<AuxiliaryProcess>();
        for (Project project : projects) {
            if (!project.hasUpCommand() || get(project.name()).isPresent()) {
                continue;
            }
            try {
                started.add(start(project));
            } catch (ConductorException e) {
                log.warn("Could not start {} on boot: {}", project.name(), e.getMessage());
            }
        }
        log.info("Started {} of {} project(s)", started.size(), projects.size());
        return started;
    }

    @Override
    public void close() {
        reaper.shutdownNow();
        for (Map.Entry<String, Supervised> entry : processes.entrySet()) {
            Supervised supervised = entry.getValue();
            supervised.stopRequested = true;
            ProcessTrees.terminate(supervised.process.toHandle(), stopGrace);
            handleExit(entry.getKey(), supervised);
        }
    }

    static int clampLines(int lines) {
        return Math.max(1, Math.min(MAX_TAIL_LINES, lines));
    }

    void reap() {
        for (Map.Entry<String, Supervised> entry : processes.entrySet()) {
            if (!entry.getValue().process.isAlive()) {
                handleExit(entry.getKey(), entry.getValue());
            }
        }
    }

    /**
     * Records the exit and drops the live record. The exit info is written before
     * the record is removed, so a reader never sees a project with neither.
     */
    private void handleExit(String project, Supervised supervised) {
        int exitCode;
        synchronized (supervised) {
            if (supervised.exitHandled) {
                return;
            }
            supervised.exitHandled = true;
            exitCode = supervised.process.isAlive() ? -1 : supervised.process.exitValue();
            lastExits.put(project, new ExitInfo(supervised.info.pid(), exitCode, Instant.now()));
            processes.remove(project, supervised);
        }
        if (supervised.stopRequested) {
            log.info("{} (PID {}) stopped", project, supervised.info.pid());
        } else {
            log.warn("{} (PID {}) exited with code {}", project, supervised.info.pid(), exitCode);
        }
        if (metrics != null) {
            metrics.recordProcessExited(project, supervised.stopRequested);
            metrics.setRunningProcesses(processes.size());
        }
        publish(ConductorEvent.PROCESS_EXITED, project, Map.of(
                "pid", supervised.info.pid(),
                "exitCode", exitCode,
                "requested", supervised.stopRequested));
    }

    private void runDownCommand(Project project) {
        log.info("Running down command for {}: {}", project.name(), project.downCommand());
        try {
            Process process = new ProcessBuilder(shell, "-c", project.downCommand())
                    .directory(project.workDir().toFile())
                    .redirectErrorStream(true)
                    .start();
            process.getOutputStream().close();
            LogRingBuffer buffer = logs.computeIfAbsent(project.name(), k -> new LogRingBuffer(logCapacity));
            Thread reader = new Thread(() -> pump(project.name(), process.getInputStream(), buffer),
                    "conductor-down-" + project.name());
            reader.setDaemon(true);
            reader.start();
            if (!process.waitFor(downTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Down command of {} still running after {}s, killing it", project.name(),
                        downTimeout.toSeconds());
                ProcessTrees.terminate(process.toHandle(), stopGrace);
            } else if (process.exitValue() != 0) {
                log.warn("Down command of {} exited with code {}", project.name(), process.exitValue());
            }
        } catch (IOException e) {
            log.warn("Could not run down command of {}: {}", project.name(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while running down command of {}", project.name());
        }
    }

    private static void pump(String project, InputStream stream, LogRingBuffer buffer) {
        MdcContext.setProject(project);
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                buffer.add(line);
                auxLog.info("[{}] {}", project, line);
            }
        } catch (IOException e) {
            log.debug("Output of {} closed: {}", project, e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    private Object lockFor(String project) {
        return projectLocks.computeIfAbsent(project, k -> new Object());
    }

    private void publish(String type, String project, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(ConductorEvent.of(type, null, project, payload));
        }
    }
}
