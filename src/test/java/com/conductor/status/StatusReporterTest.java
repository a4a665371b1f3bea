package com.conductor.status;

import com.conductor.core.config.ProjectCatalog;
import com.conductor.core.events.EventBus;
import com.conductor.core.model.AuxiliaryProcess;
import com.conductor.core.model.CommandKind;
import com.conductor.core.model.Job;
import com.conductor.core.model.JobOutcome;
import com.conductor.core.model.Project;
import com.conductor.jobs.JobRegistry;
import com.conductor.supervisor.ProcessSupervisor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StatusReporterTest {

    @Mock
    private ProcessSupervisor supervisor;

    private JobRegistry registry;
    private StatusReporter reporter;

    @BeforeEach
    void setUp() {
        registry = new JobRegistry(20, Duration.ofHours(1), new EventBus());
        var catalog = new ProjectCatalog(List.of(
                new Project("alpha", "u", Path.of("/srv/alpha")),
                new Project("beta", "u", Path.of("/srv/beta"))));
        reporter = new StatusReporter(registry, supervisor, catalog, 20);
        lenient().when(supervisor.get(anyString())).thenReturn(Optional.empty());
        lenient().when(supervisor.lastExit(anyString())).thenReturn(Optional.empty());
    }

    @Test
    void emptyWhenNothingIsActive() {
        Job done = registry.create("alpha", CommandKind.ASK, "q");
        registry.markRunning(done.id());
        registry.markTerminal(done.id(), JobOutcome.completed(null, "ok", Duration.ZERO));

        StatusReport report = reporter.snapshot();

        assertTrue(report.isEmpty());
        assertEquals("No running queries or processes.", reporter.render(report));
    }

    @Test
    void listsActiveJobsWithPreviewAndQueueState() {
        Job running = registry.create("alpha", CommandKind.FEAT, "add a login form with email and password");
        registry.markRunning(running.id());
        Job queued = registry.create("beta", CommandKind.ASK, "short");

        String text = reporter.renderSnapshot();

        assertTrue(text.startsWith("Running Claude queries:"));
        assertTrue(text.contains("  [" + running.id() + "] alpha /feat: add a login form wit... (0.0m)"));
        assertTrue(text.contains("  [" + queued.id() + "] beta /ask: short (queued)"));
        assertTrue(text.contains("Use /cancel <project> to cancel all"));
        assertFalse(text.contains("background processes"));
    }

    @Test
    void listsRunningAndExitedProcesses() {
        when(supervisor.get("alpha")).thenReturn(Optional.of(
                new AuxiliaryProcess("alpha", 4242, "npm run dev", Instant.now().minusSeconds(90))));
        when(supervisor.lastExit("beta")).thenReturn(Optional.of(
                new ProcessSupervisor.ExitInfo(777, 1, Instant.now())));

        StatusReport report = reporter.snapshot();
        String text = reporter.render(report);

        assertTrue(report.hasProcesses());
        assertFalse(report.hasActiveJobs());
        assertEquals("""
                Running background processes:
                  - alpha (PID: 4242, up 1.5m)

                Recently exited processes:
                  - beta (PID: 777, exited with code 1)""", text);
    }

    @Test
    void exitedProcessIsNeverListedAsRunning() {
        when(supervisor.lastExit("beta")).thenReturn(Optional.of(
                new ProcessSupervisor.ExitInfo(777, 0, Instant.now())));

        String text = reporter.renderSnapshot();

        assertFalse(text.contains("Running background processes:"));
        assertTrue(text.startsWith("Recently exited processes:"));
        assertTrue(text.contains("  - beta (PID: 777, exited with code 0)"));
    }

    @Test
    void snapshotGroupsByProject() {
        registry.create("alpha", CommandKind.ASK, "1");
        registry.create("alpha", CommandKind.ASK, "2");

        StatusReport report = reporter.snapshot();

        assertEquals(1, report.projects().size());
        ProjectStatus alpha = report.projects().get(0);
        assertEquals("alpha", alpha.project());
        assertEquals(2, alpha.activeJobs().size());
        assertNull(alpha.process());
    }
}
