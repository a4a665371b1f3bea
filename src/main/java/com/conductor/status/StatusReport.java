package com.conductor.status;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of all projects that have active jobs or a known auxiliary process.
 */
public record StatusReport(Instant takenAt, List<ProjectStatus> projects) {

    public boolean isEmpty() {
        return projects.isEmpty();
    }

    public boolean hasActiveJobs() {
        return projects.stream().anyMatch(p -> !p.activeJobs().isEmpty());
    }

    public boolean hasProcesses() {
        return projects.stream().anyMatch(p -> p.process() != null);
    }
}
