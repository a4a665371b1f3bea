package com.conductor.jobs;

import com.conductor.core.events.ConductorEvent;
import com.conductor.core.events.EventBus;
import com.conductor.core.model.CommandKind;
import com.conductor.core.model.Job;
import com.conductor.core.model.JobOutcome;
import com.conductor.core.model.JobRequest;
import com.conductor.core.model.JobState;
import com.conductor.core.model.Workspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobRegistryTest {

    @TempDir
    Path tempDir;

    private EventBus eventBus;
    private List<ConductorEvent> events;
    private JobRegistry registry;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
        registry = new JobRegistry(3, Duration.ofHours(1), eventBus);
    }

    private void complete(Job job) {
        pause();
        registry.markRunning(job.id());
        registry.markTerminal(job.id(), JobOutcome.completed(null, "ok", Duration.ofSeconds(1)));
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        void assignsShortHexIdsAndPublishesSubmission() {
            Job job = registry.create("alpha", CommandKind.ASK, "q");

            assertTrue(job.id().matches("[0-9a-f]{8}"));
            assertEquals(JobState.PENDING, job.state());
            assertEquals(ConductorEvent.JOB_SUBMITTED, events.get(0).eventType());
            assertEquals(job.id(), events.get(0).jobId());
        }

        @Test
        void concurrentCreatesYieldUniqueIds() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<String>> futures = new ArrayList<>();
                for (int i = 0; i < 200; i++) {
                    futures.add(pool.submit(() -> registry.create("alpha", CommandKind.ASK, "q").id()));
                }
                Set<String> ids = new HashSet<>();
                for (Future<String> f : futures) {
                    ids.add(f.get(5, TimeUnit.SECONDS));
                }
                assertEquals(200, ids.size());
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("transitions")
    class Transitions {

        @Test
        void markTerminalSucceedsOnce() {
            Job job = registry.create("alpha", CommandKind.ASK, "q");
            assertTrue(registry.markRunning(job.id()));

            assertTrue(registry.markTerminal(job.id(), JobState.COMPLETED, tempDir.resolve("out.txt")));
            assertFalse(registry.markTerminal(job.id(), JobState.FAILED, null));

            assertEquals(JobState.COMPLETED, job.state());
            long finished = events.stream().filter(e -> e.eventType().equals(ConductorEvent.JOB_FINISHED)).count();
            assertEquals(1, finished);
        }

        @Test
        void finishedEventCarriesStateAndRequester() {
            Job job = registry.create(new JobRequest("alpha", CommandKind.FIX, "x", "u7", null));
            complete(job);

            ConductorEvent finished = events.get(events.size() - 1);
            assertEquals(ConductorEvent.JOB_FINISHED, finished.eventType());
            assertEquals("COMPLETED", finished.payload().get("state"));
            assertEquals("u7", finished.payload().get("requesterId"));
            assertEquals(1000L, finished.payload().get("elapsedMs"));
        }

        @Test
        void unknownJobsAreIgnored() {
            assertFalse(registry.markRunning("nope"));
            assertFalse(registry.markTerminal("nope", JobState.FAILED, null));
            assertFalse(registry.cancel("nope"));
        }

        @Test
        void nonTerminalStateIsRejected() {
            Job job = registry.create("alpha", CommandKind.ASK, "q");
            assertThrows(IllegalArgumentException.class, () -> registry.markTerminal(job.id(), JobState.RUNNING, null));
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        void pendingJobIsCancelledImmediately() {
            Job job = registry.create("alpha", CommandKind.FEAT, "x");

            assertTrue(registry.cancel(job.id(), "user"));

            assertEquals(JobState.CANCELLED, job.state());
            assertTrue(job.cancelToken().isCancelled());
            assertFalse(registry.markRunning(job.id()));
        }

        @Test
        void runningJobIsOnlySignalled() {
            Job job = registry.create("alpha", CommandKind.FEAT, "x");
            registry.markRunning(job.id());

            assertTrue(registry.cancel(job.id(), "user"));

            assertEquals(JobState.RUNNING, job.state());
            assertEquals("user", job.cancelToken().reason());
        }

        @Test
        void terminalJobCannotBeCancelled() {
            Job job = registry.create("alpha", CommandKind.ASK, "q");
            complete(job);

            assertFalse(registry.cancel(job.id()));
            assertEquals(JobState.COMPLETED, job.state());
        }
    }

    @Nested
    @DisplayName("listing")
    class Listing {

        @Test
        void listsByProjectAndActive() {
            Job a1 = registry.create("alpha", CommandKind.ASK, "1");
            Job a2 = registry.create("alpha", CommandKind.ASK, "2");
            Job b1 = registry.create("beta", CommandKind.ASK, "3");
            complete(a2);

            assertEquals(List.of(a1.id(), a2.id()), registry.listByProject("alpha").stream().map(Job::id).toList());
            assertEquals(Set.of(a1.id(), b1.id()), new HashSet<>(registry.listActive().stream().map(Job::id).toList()));
            assertEquals(3, registry.size());
        }
    }

    @Nested
    @DisplayName("retention")
    class Retention {

        @Test
        void keepsOnlyNewestFinishedJobsPerProject() {
            List<Job> jobs = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                Job job = registry.create("alpha", CommandKind.ASK, "q" + i);
                complete(job);
                jobs.add(job);
            }
            Job active = registry.create("alpha", CommandKind.ASK, "still running");
            Job other = registry.create("beta", CommandKind.ASK, "other project");
            complete(other);

            assertEquals(3, registry.listByProject("alpha").stream().filter(Job::isTerminal).count());
            assertTrue(registry.get(active.id()).isPresent());
            assertTrue(registry.get(other.id()).isPresent());
            assertTrue(registry.get(jobs.get(4).id()).isPresent());
            assertTrue(registry.get(jobs.get(0).id()).isEmpty());
        }

        @Test
        void evictsFinishedJobsOlderThanRetentionWindow() {
            var clock = new MutableClock(Instant.now());
            var timed = new JobRegistry(100, Duration.ofMinutes(10), eventBus, clock);
            Job old = timed.create("alpha", CommandKind.ASK, "old");
            timed.markRunning(old.id());
            timed.markTerminal(old.id(), JobOutcome.completed(null, "ok", Duration.ZERO));

            clock.advance(Duration.ofMinutes(11));
            timed.create("alpha", CommandKind.ASK, "new");

            assertTrue(timed.get(old.id()).isEmpty());
        }

        @Test
        void neverEvictsJobsHoldingAWorkspace() {
            Job holder = registry.create("alpha", CommandKind.FEAT, "x");
            registry.markRunning(holder.id());
            holder.attachWorkspace(new Workspace(tempDir, "alpha", "feat-x", "origin/main", Instant.now(), true));
            registry.markTerminal(holder.id(), JobOutcome.cancelled("stop", Duration.ZERO));
            for (int i = 0; i < 5; i++) {
                complete(registry.create("alpha", CommandKind.ASK, "q" + i));
            }

            assertTrue(registry.get(holder.id()).isPresent());
        }

        @Test
        void evictionDeletesUnreadOutput() throws Exception {
            var tiny = new JobRegistry(1, Duration.ofHours(1), eventBus);
            Path output = Files.writeString(tempDir.resolve("first.txt"), "summary");
            Job first = tiny.create("alpha", CommandKind.ASK, "1");
            tiny.markRunning(first.id());
            tiny.markTerminal(first.id(), JobOutcome.completed(output, "ok", Duration.ZERO));

            pause();
            Job second = tiny.create("alpha", CommandKind.ASK, "2");
            tiny.markRunning(second.id());
            tiny.markTerminal(second.id(), JobOutcome.completed(null, "ok", Duration.ZERO));

            assertTrue(tiny.get(first.id()).isEmpty());
            assertFalse(Files.exists(output));
        }
    }

    // Keeps completion timestamps strictly ordered.
    private static void pause() {
        try {
            Thread.sleep(2);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public Instant instant() {
            return now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
