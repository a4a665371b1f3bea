package com.conductor.dispatch.api;

import com.conductor.core.OrchestratorContext;
import com.conductor.core.config.ProjectCatalog;
import com.conductor.jobs.JobRegistry;
import com.conductor.jobs.JobService;
import com.conductor.status.StatusReporter;
import com.conductor.supervisor.ProcessSupervisor;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * Assembles the request-handler context from the mocked components of a web slice test.
 */
@TestConfiguration
class ControllerTestConfig {

    @Bean
    OrchestratorContext orchestratorContext(ProjectCatalog projects, JobService jobs, JobRegistry registry,
                                            ProcessSupervisor supervisor, StatusReporter status) {
        return new OrchestratorContext(projects, jobs, registry, null, null, supervisor, status, null);
    }
}
