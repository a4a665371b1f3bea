package com.conductor.supervisor;

import com.conductor.core.error.AlreadyRunningException;
import com.conductor.core.error.ConductorException;
import com.conductor.core.events.ConductorEvent;
import com.conductor.core.events.EventBus;
import com.conductor.core.metrics.ConductorMetrics;
import com.conductor.core.model.AuxiliaryProcess;
import com.conductor.core.model.Project;
import com.conductor.testsupport.Await;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessSupervisorTest {

    @TempDir
    Path tempDir;

    private List<ConductorEvent> events;
    private SimpleMeterRegistry meterRegistry;
    private ProcessSupervisor supervisor;

    @BeforeEach
    void setUp() {
        var eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
        meterRegistry = new SimpleMeterRegistry();
        supervisor = new ProcessSupervisor("sh", 100, Duration.ofSeconds(1), Duration.ofSeconds(10),
                Duration.ofMillis(100), eventBus, new ConductorMetrics(meterRegistry));
    }

    @AfterEach
    void tearDown() {
        supervisor.close();
    }

    private Project project(String name, String up) {
        return project(name, up, null);
    }

    private Project project(String name, String up, String down) {
        return new Project(name, "https://example.com/" + name + ".git", tempDir, "main", up, down, null);
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        void capturesOutputIntoTheLogTail() {
            Project alpha = project("alpha", "echo starting; echo listening on 3000; sleep 30");

            AuxiliaryProcess process = supervisor.start(alpha);

            assertTrue(process.pid() > 0);
            Await.until(() -> supervisor.tailLog("alpha", 10).size() == 2, "output captured");
            assertEquals(List.of("starting", "listening on 3000"), supervisor.tailLog("alpha", 10));
            assertEquals(List.of("listening on 3000"), supervisor.tailLog("alpha", 1));
            assertTrue(supervisor.get("alpha").isPresent());
            assertEquals(1.0, meterRegistry.get("conductor.processes.running").gauge().value());
        }

        @Test
        @DisplayName("a second start while running is refused and the first keeps running")
        void secondStartIsRefused() {
            Project alpha = project("alpha", "sleep 30");
            AuxiliaryProcess first = supervisor.start(alpha);

            var e = assertThrows(AlreadyRunningException.class, () -> supervisor.start(alpha));

            assertEquals(first.pid(), e.getPid());
            assertEquals(first.pid(), supervisor.get("alpha").orElseThrow().pid());
            assertEquals(1, supervisor.list().size());
        }

        @Test
        void projectWithoutUpCommandCannotStart() {
            var e = assertThrows(ConductorException.class, () -> supervisor.start(project("alpha", null)));
            assertEquals("NO_UP_COMMAND", e.getCode());
        }

        @Test
        void canRestartAfterTheProcessExited() {
            Project alpha = project("alpha", "echo once");
            supervisor.start(alpha);
            Await.until(() -> supervisor.get("alpha").isEmpty(), "process exited");

            assertNotNull(supervisor.start(project("alpha", "sleep 30")));
            assertTrue(supervisor.get("alpha").isPresent());
        }

        @Test
        void startAllSkipsProjectsWithoutUpCommandOrAlreadyRunning() {
            supervisor.start(project("alpha", "sleep 30"));

            var started = supervisor.startAll(List.of(
                    project("alpha", "sleep 30"),
                    project("beta", "sleep 30"),
                    project("gamma", null)));

            assertEquals(1, started.size());
            assertEquals("beta", started.get(0).project());
            assertEquals(2, supervisor.list().size());
        }
    }

    @Nested
    @DisplayName("exit detection")
    class ExitDetection {

        @Test
        void selfExitIsNoticedAndRecorded() {
            supervisor.start(project("alpha", "echo crashing; exit 7"));

            Await.until(() -> supervisor.get("alpha").isEmpty(), Duration.ofSeconds(5), "exit noticed");

            var exit = supervisor.lastExit("alpha").orElseThrow();
            assertEquals(7, exit.exitCode());
            assertTrue(supervisor.list().isEmpty());
            Await.until(() -> supervisor.tailLog("alpha", 5).contains("crashing"), "log kept after exit");
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals(ConductorEvent.PROCESS_EXITED)
                    && Boolean.FALSE.equals(e.payload().get("requested"))));
        }

        @Test
        @DisplayName("a dead process is reported as exited on the first read, without waiting for the reaper")
        void deadProcessHasExitInfoAsSoonAsItIsNotRunning() {
            var slowReaper = new ProcessSupervisor("sh", 100, Duration.ofSeconds(1), Duration.ofSeconds(10),
                    Duration.ofHours(1), null, null);
            try {
                long pid = slowReaper.start(project("alpha", "exit 5")).pid();
                Await.until(() -> slowReaper.get("alpha").isEmpty(), "process gone");

                var exit = slowReaper.lastExit("alpha").orElseThrow();
                assertEquals(pid, exit.pid());
                assertEquals(5, exit.exitCode());
                assertTrue(slowReaper.list().isEmpty());
            } finally {
                slowReaper.close();
            }
        }

        @Test
        void reapIsIdempotent() {
            supervisor.start(project("alpha", "exit 0"));
            Await.until(() -> supervisor.lastExit("alpha").isPresent(), "exit recorded");

            supervisor.reap();
            supervisor.reap();

            long exits = events.stream().filter(e -> e.eventType().equals(ConductorEvent.PROCESS_EXITED)).count();
            assertEquals(1, exits);
        }
    }

    @Nested
    @DisplayName("stop")
    class Stop {

        @Test
        void stopsTheWholeTree() throws Exception {
            Path pidFile = tempDir.resolve("child.pid");
            supervisor.start(project("alpha", "sleep 60 & echo $! > " + pidFile + "; wait"));
            Await.until(() -> Files.exists(pidFile) && !readQuietly(pidFile).isBlank(), "child started");
            long childPid = Long.parseLong(readQuietly(pidFile).strip());

            assertTrue(supervisor.stop(project("alpha", "unused")));

            assertTrue(supervisor.get("alpha").isEmpty());
            assertFalse(ProcessHandle.of(childPid).map(ProcessHandle::isAlive).orElse(false));
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals(ConductorEvent.PROCESS_EXITED)
                    && Boolean.TRUE.equals(e.payload().get("requested"))));
        }

        @Test
        void stopWithoutProcessReportsNothingRunning() {
            assertFalse(supervisor.stop(project("alpha", "sleep 30")));
        }

        @Test
        void downCommandRunsAfterStop() {
            Path marker = tempDir.resolve("down-ran");
            Project alpha = project("alpha", "sleep 30", "touch " + marker);
            supervisor.start(alpha);

            supervisor.stop(alpha);

            assertTrue(Files.exists(marker));
        }
    }

    @Test
    void tailLinesAreClamped() {
        assertEquals(1, ProcessSupervisor.clampLines(0));
        assertEquals(1, ProcessSupervisor.clampLines(-5));
        assertEquals(50, ProcessSupervisor.clampLines(50));
        assertEquals(ProcessSupervisor.MAX_TAIL_LINES, ProcessSupervisor.clampLines(10_000));
    }

    @Test
    void unknownProjectHasEmptyLog() {
        assertTrue(supervisor.tailLog("nobody", 10).isEmpty());
        assertTrue(supervisor.lastExit("nobody").isEmpty());
    }

    private static String readQuietly(Path file) {
        try {
            return Files.readString(file);
        } catch (Exception e) {
            return "";
        }
    }
}
