package com.conductor.core.config;

import com.conductor.core.OrchestratorContext;
import com.conductor.core.events.EventBus;
import com.conductor.core.metrics.ConductorMetrics;
import com.conductor.engine.AgentCommandFactory;
import com.conductor.engine.ClaudeCliCommandFactory;
import com.conductor.engine.ExecutionEngine;
import com.conductor.engine.PromptBuilder;
import com.conductor.jobs.JobRegistry;
import com.conductor.jobs.JobService;
import com.conductor.jobs.SessionLinkStore;
import com.conductor.status.StatusReporter;
import com.conductor.supervisor.ProcessSupervisor;
import com.conductor.workspace.GitWorkspaceManager;
import com.conductor.workspace.WorktreeManager;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Builds the orchestration components from {@link ConductorProperties}.
 * The components themselves are plain classes with no Spring dependency.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    public ProjectCatalog projectCatalog(ConductorProperties properties) {
        return ProjectCatalog.fromProperties(properties);
    }

    @Bean
    public ConductorMetrics conductorMetrics(MeterRegistry meterRegistry) {
        return new ConductorMetrics(meterRegistry);
    }

    @Bean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    public GitWorkspaceManager gitWorkspaceManager(ConductorProperties properties) {
        var workspace = properties.getWorkspace();
        return new GitWorkspaceManager(Duration.ofSeconds(workspace.getGitTimeoutSeconds()),
                Duration.ofMinutes(workspace.getCloneTimeoutMinutes()));
    }

    @Bean
    public WorktreeManager worktreeManager(GitWorkspaceManager git, ConductorProperties properties,
                                           @Autowired(required = false) ConductorMetrics metrics) {
        return new WorktreeManager(git, Path.of(properties.getWorkspace().getWorktreeBase()), metrics);
    }

    @Bean
    public JobRegistry jobRegistry(ConductorProperties properties, EventBus eventBus) {
        var jobs = properties.getJobs();
        return new JobRegistry(jobs.getRetentionPerProject(), Duration.ofMinutes(jobs.getRetentionMinutes()), eventBus);
    }

    @Bean
    public SessionLinkStore sessionLinkStore() {
        return new SessionLinkStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentCommandFactory agentCommandFactory(ConductorProperties properties) {
        var agent = properties.getAgent();
        return new ClaudeCliCommandFactory(agent.getExecutable(), agent.getModel(), agent.getPermissionMode());
    }

    @Bean
    public ExecutionEngine executionEngine(WorktreeManager worktrees, JobRegistry registry, SessionLinkStore sessions,
                                           ProjectCatalog catalog, AgentCommandFactory commandFactory,
                                           ConductorProperties properties,
                                           @Autowired(required = false) ConductorMetrics metrics) {
        return new ExecutionEngine(worktrees, registry, sessions, catalog, commandFactory,
                new PromptBuilder(properties.getRules()), properties, metrics);
    }

    @Bean(destroyMethod = "close")
    public ProcessSupervisor processSupervisor(ConductorProperties properties, EventBus eventBus,
                                               @Autowired(required = false) ConductorMetrics metrics) {
        var supervisor = properties.getSupervisor();
        return new ProcessSupervisor(supervisor.getShell(), supervisor.getLogCapacity(),
                Duration.ofSeconds(supervisor.getStopGraceSeconds()),
                Duration.ofSeconds(supervisor.getDownTimeoutSeconds()),
                Duration.ofMillis(supervisor.getReaperIntervalMs()), eventBus, metrics);
    }

    @Bean(destroyMethod = "close")
    public JobService jobService(JobRegistry registry, ExecutionEngine engine, ProjectCatalog catalog,
                                 SessionLinkStore sessions, ProcessSupervisor supervisor, EventBus eventBus,
                                 ConductorProperties properties,
                                 @Autowired(required = false) ConductorMetrics metrics) {
        return new JobService(registry, engine, catalog, sessions, supervisor, eventBus, metrics,
                properties.getJobs().getMaxParallel(), properties.getDisplay().getMaxSummaryChars());
    }

    @Bean
    public StatusReporter statusReporter(JobRegistry registry, ProcessSupervisor supervisor, ProjectCatalog catalog,
                                         ConductorProperties properties) {
        return new StatusReporter(registry, supervisor, catalog, properties.getDisplay().getPromptPreviewChars());
    }

    @Bean
    public OrchestratorContext orchestratorContext(ProjectCatalog catalog, JobService jobs, JobRegistry registry,
                                                   SessionLinkStore sessions, WorktreeManager worktrees,
                                                   ProcessSupervisor supervisor, StatusReporter status,
                                                   EventBus eventBus) {
        return new OrchestratorContext(catalog, jobs, registry, sessions, worktrees, supervisor, status, eventBus);
    }
}
