package com.twinforge.core.engine;

import com.twinforge.core.events.EventBus;
import com.twinforge.core.events.RunEvent;
import com.twinforge.core.events.RunEventType;
import com.twinforge.core.model.RunConfig;
import com.twinforge.core.model.RunSnapshot;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.model.Target;
import com.twinforge.core.model.TargetStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RunRegistryTest {

    private EventBus eventBus;
    private RunRegistry registry;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        registry = new RunRegistry(eventBus);
    }

    private RunSnapshot snapshot(String runId) {
        return registry.snapshot(runId).orElseThrow();
    }

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        @DisplayName("a new run starts CREATED with the configured budget")
        void created() {
            registry.register("R-1", "Build a todo app", RunConfig.defaults().withMaxIterations(4));

            RunSnapshot s = snapshot("R-1");
            assertEquals(RunStatus.CREATED, s.status());
            assertEquals("Build a todo app", s.goal());
            assertEquals(4, s.maxIterations());
            assertEquals(0, s.iteration());
        }

        @Test
        @DisplayName("the same id cannot be registered twice")
        void duplicate() {
            registry.register("R-1", "goal", RunConfig.defaults());
            assertThrows(IllegalStateException.class, () -> registry.register("R-1", "goal", RunConfig.defaults()));
        }

        @Test
        @DisplayName("lists runs newest first")
        void newestFirst() throws InterruptedException {
            registry.register("R-1", "a", RunConfig.defaults());
            Thread.sleep(5);
            registry.register("R-2", "b", RunConfig.defaults());

            assertEquals(List.of("R-2", "R-1"), registry.snapshots().stream().map(RunSnapshot::runId).toList());
        }

        @Test
        @DisplayName("unknown runs have no snapshot")
        void unknown() {
            assertTrue(registry.snapshot("nope").isEmpty());
            assertFalse(registry.requestStop("nope"));
        }
    }

    @Nested
    @DisplayName("event tracking")
    class EventTracking {

        @BeforeEach
        void register() {
            registry.register("R-1", "goal", RunConfig.defaults());
        }

        @Test
        @DisplayName("phase events move the run status")
        void phases() {
            eventBus.publish(RunEvent.of(RunEventType.PLANNING_STARTED, "R-1", "", Map.of("iteration", 1)));
            assertEquals(RunStatus.PLANNING, snapshot("R-1").status());
            assertEquals(1, snapshot("R-1").iteration());

            eventBus.publish(RunEvent.of(RunEventType.BUILD_STARTED, "R-1", "", Map.of("iteration", 1)));
            assertEquals(RunStatus.RUNNING, snapshot("R-1").status());

            eventBus.publish(RunEvent.of(RunEventType.JUDGING_STARTED, "R-1", "", Map.of("iteration", 1)));
            assertEquals(RunStatus.JUDGING, snapshot("R-1").status());

            eventBus.publish(RunEvent.of(RunEventType.REPLANNING_STARTED, "R-1", "", Map.of("iteration", 1)));
            assertEquals(RunStatus.REPLANNING, snapshot("R-1").status());
        }

        @Test
        @DisplayName("target events record progress and diagnostics")
        void targets() {
            eventBus.publish(RunEvent.forTarget(RunEventType.TARGET_CODING, "R-1", Target.BACKEND, "",
                    Map.of("subIteration", 2, "maxSubIterations", 3)));
            eventBus.publish(RunEvent.forTarget(RunEventType.TARGET_FAILED, "R-1", Target.BACKEND, "",
                    Map.of("subIteration", 3, "maxSubIterations", 3, "diagnostics", List.of("Empty files: [a]"),
                            "fileCount", 2)));
            eventBus.publish(RunEvent.forTarget(RunEventType.TARGET_SKIPPED, "R-1", Target.FRONTEND, "", Map.of()));

            var backend = snapshot("R-1").targets().get(Target.BACKEND);
            assertEquals(TargetStatus.FAILED_EXHAUSTED, backend.status());
            assertEquals(3, backend.subIteration());
            assertEquals(List.of("Empty files: [a]"), backend.diagnostics());
            assertEquals(2, backend.fileCount());
            assertFalse(snapshot("R-1").targets().get(Target.FRONTEND).required());
        }

        @Test
        @DisplayName("the judgment payload becomes the snapshot judgment")
        void judgment() {
            eventBus.publish(RunEvent.of(RunEventType.JUDGMENT_RESULT, "R-1", "Paths differ",
                    Map.of("iteration", 1, "compatible", false, "issues", List.of("wrong path"),
                            "recommendations", List.of(), "summary", "Paths differ")));

            var judgment = snapshot("R-1").judgment();
            assertFalse(judgment.compatible());
            assertEquals(List.of("wrong path"), judgment.issues());
            assertEquals("Paths differ", judgment.summary());
        }

        @Test
        @DisplayName("a terminal status is never left")
        void terminalSticks() {
            eventBus.publish(RunEvent.of(RunEventType.RUN_STOPPED, "R-1", "Stopped by request",
                    Map.of("reason", "Stopped by request during build")));
            eventBus.publish(RunEvent.of(RunEventType.PLANNING_STARTED, "R-1", "", Map.of("iteration", 2)));
            registry.markFailed("R-1", "late failure");

            RunSnapshot s = snapshot("R-1");
            assertEquals(RunStatus.STOPPED, s.status());
            assertEquals("stopped", s.finalStatus());
            assertEquals("Stopped by request during build", s.stopReason());
            assertFalse(registry.requestStop("R-1"));
        }

        @Test
        @DisplayName("delivery keeps the reported final status")
        void delivered() {
            eventBus.publish(RunEvent.of(RunEventType.RUN_DELIVERED, "R-1", "",
                    Map.of("iteration", 2, "finalStatus", "partial")));

            assertEquals(RunStatus.DELIVERED, snapshot("R-1").status());
            assertEquals("partial", snapshot("R-1").finalStatus());
        }

        @Test
        @DisplayName("markFailed records the reason as an error")
        void markFailed() {
            registry.markFailed("R-1", "graph crashed");

            RunSnapshot s = snapshot("R-1");
            assertEquals(RunStatus.FAILED, s.status());
            assertEquals(List.of("graph crashed"), s.errors());
        }
    }

    @Nested
    @DisplayName("stop requests")
    class StopRequests {

        @Test
        @DisplayName("cancel the run's token")
        void cancelsToken() {
            var handle = registry.register("R-1", "goal", RunConfig.defaults());

            assertTrue(registry.requestStop("R-1"));
            assertTrue(handle.token().isCancelled());
            assertSame(handle.token(), registry.tokenFor("R-1"));
        }

        @Test
        @DisplayName("a repeated request is still accepted while the run is active")
        void repeated() {
            registry.register("R-1", "goal", RunConfig.defaults());
            registry.requestStop("R-1");
            assertTrue(registry.requestStop("R-1"));
        }
    }

    @Nested
    @DisplayName("retention")
    class Retention {

        @Test
        @DisplayName("evicts the oldest finished runs beyond the cap and keeps active ones")
        void evictsOldestFinished() throws InterruptedException {
            var bus = new EventBus();
            var bounded = new RunRegistry(bus, 1);
            bounded.register("R-1", "goal", RunConfig.defaults());
            bounded.register("R-2", "goal", RunConfig.defaults());
            bounded.register("R-3", "goal", RunConfig.defaults());

            bus.publish(RunEvent.of(RunEventType.RUN_DELIVERED, "R-1", "done", Map.of()));
            TimeUnit.MILLISECONDS.sleep(5);
            bus.publish(RunEvent.of(RunEventType.RUN_STOPPED, "R-2", "stopped", Map.of()));

            assertTrue(bounded.snapshot("R-1").isEmpty());
            assertEquals(RunStatus.STOPPED, bounded.snapshot("R-2").orElseThrow().status());
            assertEquals(RunStatus.CREATED, bounded.snapshot("R-3").orElseThrow().status());
        }

        @Test
        @DisplayName("runs failed outside the graph count as finished")
        void markFailedEvicts() throws InterruptedException {
            var bounded = new RunRegistry(new EventBus(), 1);
            bounded.register("R-1", "goal", RunConfig.defaults());
            bounded.register("R-2", "goal", RunConfig.defaults());

            bounded.markFailed("R-1", "boom");
            TimeUnit.MILLISECONDS.sleep(5);
            bounded.markFailed("R-2", "boom");

            assertEquals(List.of("R-2"), bounded.snapshots().stream().map(RunSnapshot::runId).toList());
        }
    }
}
