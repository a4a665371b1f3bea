package com.conductor.core;

import com.conductor.core.config.ProjectCatalog;
import com.conductor.core.events.EventBus;
import com.conductor.jobs.JobRegistry;
import com.conductor.jobs.JobService;
import com.conductor.jobs.SessionLinkStore;
import com.conductor.status.StatusReporter;
import com.conductor.supervisor.ProcessSupervisor;
import com.conductor.workspace.WorktreeManager;

/**
 * Everything a request handler needs, built once at startup.
 */
public record OrchestratorContext(
    ProjectCatalog projects,
    JobService jobs,
    JobRegistry registry,
    SessionLinkStore sessions,
    WorktreeManager worktrees,
    ProcessSupervisor supervisor,
    StatusReporter status,
    EventBus events
) {}
