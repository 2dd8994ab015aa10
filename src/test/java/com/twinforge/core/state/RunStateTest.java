package com.twinforge.core.state;

import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.Contract;
import com.twinforge.core.model.FailureKind;
import com.twinforge.core.model.RunConfig;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.model.SubsystemOutcome;
import com.twinforge.core.model.Target;
import com.twinforge.core.model.TargetStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunStateTest {

    @Test
    @DisplayName("an empty state falls back to defaults")
    void defaults() {
        var state = new RunState(Map.of());

        assertEquals(RunStatus.CREATED, state.status());
        assertEquals(0, state.iteration());
        assertEquals(RunConfig.defaults(), state.runConfig());
        assertEquals(Contract.empty(), state.contract());
        assertTrue(state.outcomes().isEmpty());
        assertTrue(state.judgment().isEmpty());
        assertTrue(state.failureKind().isEmpty());
        assertTrue(state.feedback().isEmpty());
        assertFalse(state.requires(Target.BACKEND));
    }

    @Test
    @DisplayName("reads typed values back")
    void typedValues() {
        var backend = new SubsystemOutcome(Target.BACKEND, true, TargetStatus.PASSED, 1, 2,
                ArtifactSet.empty(), null, List.of(), 5L, false);
        var state = new RunState(Map.of(
                "runId", "R-1",
                "status", RunStatus.JUDGING.name(),
                "iteration", 3,
                "runConfig", RunConfig.defaults().withMaxIterations(7),
                "needsBackend", true,
                "failureKind", FailureKind.CODEGEN_FAIL.name(),
                RunState.outcomeKey(Target.BACKEND), backend));

        assertEquals("R-1", state.runId());
        assertEquals(RunStatus.JUDGING, state.status());
        assertEquals(3, state.iteration());
        assertEquals(7, state.maxIterations());
        assertTrue(state.requires(Target.BACKEND));
        assertFalse(state.requires(Target.FRONTEND));
        assertEquals(FailureKind.CODEGEN_FAIL, state.failureKind().orElseThrow());
        assertEquals(Map.of(Target.BACKEND, backend), state.outcomes());
        assertEquals("backendOutcome", RunState.outcomeKey(Target.BACKEND));
    }
}
