package com.conductor.status;

import com.conductor.core.config.ProjectCatalog;
import com.conductor.core.model.Job;
import com.conductor.core.model.JobState;
import com.conductor.core.model.Project;
import com.conductor.core.util.OutputText;
import com.conductor.jobs.JobRegistry;
import com.conductor.supervisor.ProcessSupervisor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only view over the job registry and the process supervisor.
 */
public class StatusReporter {

    static final String EMPTY_MESSAGE = "No running queries or processes.";

    private final JobRegistry registry;
    private final ProcessSupervisor supervisor;
    private final ProjectCatalog catalog;
    private final int previewChars;

    public StatusReporter(JobRegistry registry, ProcessSupervisor supervisor, ProjectCatalog catalog,
                          int previewChars) {
        this.registry = registry;
        this.supervisor = supervisor;
        this.catalog = catalog;
        this.previewChars = previewChars;
    }

    public StatusReport snapshot() {
        Set<String> names = new LinkedHashSet<>();
        catalog.all().stream().map(Project::name).forEach(names::add);
        registry.listActive().forEach(job -> names.add(job.project()));

        var projects = new ArrayList<ProjectStatus>();
        for (String name : names) {
            List<ActiveJobView> jobs = registry.listByProject(name).stream()
                    .filter(job -> !job.isTerminal())
                    .map(this::toView)
                    .toList();
            ProcessView process = processView(name);
            if (!jobs.isEmpty() || process != null) {
                projects.add(new ProjectStatus(name, jobs, process));
            }
        }
        return new StatusReport(Instant.now(), projects);
    }

    /**
     * Renders the report as chat text.
     */
    public String render(StatusReport report) {
        if (report.isEmpty()) {
            return EMPTY_MESSAGE;
        }
        var lines = new ArrayList<String>();
        if (report.hasActiveJobs()) {
            lines.add("Running Claude queries:");
            for (ProjectStatus project : report.projects()) {
                for (ActiveJobView job : project.activeJobs()) {
                    lines.add("  [%s] %s /%s: %s (%s)".formatted(job.id(), project.project(),
                            job.command().label(), OutputText.preview(job.argument(), previewChars),
                            job.state() == JobState.PENDING
                                    ? "queued" : minutes(job.elapsed())));
                }
            }
            lines.add("");
            lines.add("Use /cancel <project> to cancel all, or /cancel <project> <id> for specific query");
        }
        var running = new ArrayList<String>();
        var exited = new ArrayList<String>();
        for (ProjectStatus project : report.projects()) {
            ProcessView process = project.process();
            if (process == null) {
                continue;
            }
            if (process.running()) {
                running.add("  - %s (PID: %d, up %s)".formatted(project.project(), process.pid(),
                        minutes(process.uptime())));
            } else {
                exited.add("  - %s (PID: %d, exited with code %d)".formatted(project.project(), process.pid(),
                        process.exitCode()));
            }
        }
        section(lines, "Running background processes:", running);
        section(lines, "Recently exited processes:", exited);
        return String.join("\n", lines).strip();
    }

    private static void section(List<String> lines, String header, List<String> entries) {
        if (entries.isEmpty()) {
            return;
        }
        lines.add("");
        lines.add(header);
        lines.addAll(entries);
    }

    public String renderSnapshot() {
        return render(snapshot());
    }

    private ActiveJobView toView(Job job) {
        return new ActiveJobView(job.id(), job.command(), job.argument(), job.state(), job.elapsed());
    }

    private ProcessView processView(String project) {
        var running = supervisor.get(project);
        if (running.isPresent()) {
            return new ProcessView(running.get().pid(), true, null, running.get().uptime());
        }
        return supervisor.lastExit(project)
                .map(exit -> new ProcessView(exit.pid(), false, exit.exitCode(), null))
                .orElse(null);
    }

    private static String minutes(Duration duration) {
        return String.format(Locale.ROOT, "%.1fm", duration.toMillis() / 60000.0);
    }
}
