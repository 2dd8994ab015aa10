package com.twinforge.core.nodes;

import com.twinforge.core.collaborator.CancellationToken;
import com.twinforge.core.collaborator.CollaboratorException;
import com.twinforge.core.collaborator.CollaboratorInvoker;
import com.twinforge.core.collaborator.PlanningCollaborator;
import com.twinforge.core.engine.RunRegistry;
import com.twinforge.core.events.EventBus;
import com.twinforge.core.events.RunEvent;
import com.twinforge.core.events.RunEventType;
import com.twinforge.core.metrics.TwinforgeMetrics;
import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.Contract;
import com.twinforge.core.model.Endpoint;
import com.twinforge.core.model.JudgmentResult;
import com.twinforge.core.model.RunConfig;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.model.SubsystemOutcome;
import com.twinforge.core.model.Target;
import com.twinforge.core.model.TargetStatus;
import com.twinforge.core.model.VerificationResult;
import com.twinforge.core.planning.ContractCoverageChecker;
import com.twinforge.core.state.RunState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

class JudgeCompatibilityNodeTest {

    private static final Contract CONTRACT = new Contract(null,
            List.of(new Endpoint("GET", "/api/todos", null, null, null)), List.of(), null, null);

    private ExecutorService pool;
    private PlanningCollaborator judge;
    private TwinforgeMetrics metrics;
    private EventBus eventBus;
    private RunRegistry registry;
    private JudgeCompatibilityNode node;
    private final List<RunEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        judge = mock(PlanningCollaborator.class);
        metrics = mock(TwinforgeMetrics.class);
        eventBus = new EventBus();
        eventBus.subscribe("R-1", events::add);
        registry = new RunRegistry(eventBus);
        registry.register("R-1", "goal", RunConfig.defaults());
        node = new JudgeCompatibilityNode(judge, new ContractCoverageChecker(),
                new CollaboratorInvoker(pool, null), registry, eventBus, metrics);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static SubsystemOutcome passed(Target target, String code) {
        return new SubsystemOutcome(target, true, TargetStatus.PASSED, 1, 2,
                new ArtifactSet(Map.of("app", code)), VerificationResult.pass(), List.of(), 1L, false);
    }

    private static SubsystemOutcome exhausted(Target target, String diagnostic) {
        return new SubsystemOutcome(target, true, TargetStatus.FAILED_EXHAUSTED, 2, 2, ArtifactSet.empty(),
                VerificationResult.fail(diagnostic), List.of(), 1L, false);
    }

    private static RunState state(int iteration, SubsystemOutcome backend, SubsystemOutcome frontend) {
        var data = new HashMap<String, Object>();
        data.put("runId", "R-1");
        data.put("iteration", iteration);
        data.put("contract", CONTRACT);
        if (backend != null) {
            data.put(RunState.outcomeKey(Target.BACKEND), backend);
        }
        if (frontend != null) {
            data.put(RunState.outcomeKey(Target.FRONTEND), frontend);
        }
        return new RunState(data);
    }

    @Nested
    @DisplayName("judge")
    class Judge {

        @Test
        @DisplayName("an exhausted target is incompatible without asking the judge")
        void exhaustedTarget() {
            JudgmentResult result = node.judge(state(0, exhausted(Target.BACKEND, "Empty files: [main.py]"),
                    passed(Target.FRONTEND, "/api/todos")), new CancellationToken("R-1"));

            assertFalse(result.compatible());
            assertEquals(List.of("backend exhausted 2 sub-iteration(s): Empty files: [main.py]"), result.issues());
            verifyNoInteractions(judge);
        }

        @Test
        @DisplayName("a single required target that passed needs no cross-check")
        void singleTarget() {
            JudgmentResult result = node.judge(state(0, passed(Target.BACKEND, "/api/todos"),
                    SubsystemOutcome.skipped(Target.FRONTEND)), new CancellationToken("R-1"));

            assertTrue(result.compatible());
            verifyNoInteractions(judge);
        }

        @Test
        @DisplayName("two passed targets are judged by the collaborator")
        void judged() {
            when(judge.judge(eq(CONTRACT), anyMap())).thenReturn(JudgmentResult.compatible("fine"));

            JudgmentResult result = node.judge(state(0, passed(Target.BACKEND, "/api/todos"),
                    passed(Target.FRONTEND, "fetch('/api/todos')")), new CancellationToken("R-1"));

            assertTrue(result.compatible());
            assertEquals("fine", result.summary());
        }

        @Test
        @DisplayName("coverage gaps override a compatible verdict")
        void coverageGap() {
            when(judge.judge(any(), anyMap())).thenReturn(JudgmentResult.compatible("fine"));

            JudgmentResult result = node.judge(state(0, passed(Target.BACKEND, "/api/todos"),
                    passed(Target.FRONTEND, "fetch('/todos')")), new CancellationToken("R-1"));

            assertFalse(result.compatible());
            assertEquals(List.of("Frontend does not call GET /api/todos"), result.issues());
            assertTrue(result.summary().startsWith("Coverage check found 1 missing endpoint(s)."));
        }

        @Test
        @DisplayName("a failing judgment call counts as incompatible")
        void judgeError() {
            when(judge.judge(any(), anyMap())).thenThrow(new CollaboratorException("rate limited"));

            JudgmentResult result = node.judge(state(0, passed(Target.BACKEND, "/api/todos"),
                    passed(Target.FRONTEND, "/api/todos")), new CancellationToken("R-1"));

            assertFalse(result.compatible());
            assertEquals(List.of("Judgment failed: rate limited"), result.issues());
        }
    }

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        @DisplayName("counts the iteration and publishes the verdict")
        void countsIteration() {
            Map<String, Object> updates = node.apply(state(1, exhausted(Target.BACKEND, "Missing files: none"),
                    SubsystemOutcome.skipped(Target.FRONTEND)));

            assertEquals(2, updates.get("iteration"));
            assertEquals(RunStatus.JUDGING.name(), updates.get("status"));
            assertFalse(((JudgmentResult) updates.get("judgment")).compatible());
            assertEquals(List.of("iteration 2: backend exhausted 2 sub-iteration(s): Missing files: none"),
                    updates.get("errors"));
            assertEquals(List.of(RunEventType.JUDGING_STARTED, RunEventType.JUDGMENT_RESULT),
                    events.stream().map(RunEvent::type).toList());
            assertEquals(2, events.get(1).intValue("iteration", 0));
            verify(metrics).recordJudgment(false);
        }

        @Test
        @DisplayName("a stopped run is not judged")
        void stopped() {
            registry.requestStop("R-1");

            Map<String, Object> updates = node.apply(state(0, passed(Target.BACKEND, ""), null));

            assertEquals(RunStatus.STOPPED.name(), updates.get("status"));
            assertEquals("Stopped by request during judging", updates.get("stopReason"));
            assertTrue(events.isEmpty());
        }
    }
}
