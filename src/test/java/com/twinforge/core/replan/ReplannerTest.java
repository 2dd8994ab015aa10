package com.twinforge.core.replan;

import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.FailureKind;
import com.twinforge.core.model.JudgmentResult;
import com.twinforge.core.model.SubsystemOutcome;
import com.twinforge.core.model.Target;
import com.twinforge.core.model.TargetStatus;
import com.twinforge.core.model.VerificationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ReplannerTest {

    private final Replanner replanner = new Replanner(new FailureClassifier());

    private static SubsystemOutcome passed(Target target) {
        return new SubsystemOutcome(target, true, TargetStatus.PASSED, 1, 2, ArtifactSet.empty(),
                VerificationResult.pass(), List.of(VerificationResult.pass()), 10L, false);
    }

    private static SubsystemOutcome exhausted(Target target, List<String> diagnostics) {
        var last = VerificationResult.fail(diagnostics);
        return new SubsystemOutcome(target, true, TargetStatus.FAILED_EXHAUSTED, 2, 2, ArtifactSet.empty(),
                last, List.of(VerificationResult.fail("first"), last), 10L, false);
    }

    @Test
    @DisplayName("feedback lists issues, recommendations, reason and previous plan in order")
    void incompatibleFeedback() {
        var judgment = new JudgmentResult(false, List.of("Frontend calls /todos, backend serves /api/todos"),
                List.of("Prefix every call with /api"), "Paths differ");

        ReplanDecision decision = replanner.replan("Todo app", judgment,
                Map.of(Target.BACKEND, passed(Target.BACKEND), Target.FRONTEND, passed(Target.FRONTEND)));

        assertEquals(FailureKind.INCOMPATIBLE, decision.kind());
        assertFalse(decision.stop());
        assertEquals(List.of(
                "COMPATIBILITY ISSUE: Frontend calls /todos, backend serves /api/todos",
                "RECOMMENDATION: Prefix every call with /api",
                "FAILURE REASON: " + FailureKind.INCOMPATIBLE.reason(),
                "PREVIOUS PLAN: Todo app"), decision.feedback());
    }

    @Test
    @DisplayName("exhausted targets contribute their last diagnostics")
    void exhaustedTarget() {
        var judgment = JudgmentResult.incompatible(List.of("backend exhausted its budget"), "");

        ReplanDecision decision = replanner.replan("", judgment, Map.of(
                Target.BACKEND, exhausted(Target.BACKEND, List.of("Empty files: [main.py]", "JSON syntax errors: []")),
                Target.FRONTEND, passed(Target.FRONTEND)));

        assertEquals(FailureKind.CODEGEN_FAIL, decision.kind());
        assertTrue(decision.feedback().contains(
                "TARGET EXHAUSTED: backend failed verification 2 time(s): Empty files: [main.py]; JSON syntax errors: []"));
        assertTrue(decision.feedback().stream().noneMatch(line -> line.startsWith("PREVIOUS PLAN")));
    }

    @Test
    @DisplayName("a permission failure stops the run")
    void permissionStops() {
        ReplanDecision decision = replanner.replan("Todo app", JudgmentResult.incompatible(List.of(), ""),
                Map.of(Target.FRONTEND, exhausted(Target.FRONTEND, List.of("EACCES: permission denied"))));

        assertEquals(FailureKind.PERMISSION_DENIED, decision.kind());
        assertTrue(decision.stop());
        assertEquals(FailureKind.PERMISSION_DENIED.reason(), decision.reason());
    }

    @Test
    @DisplayName("caps the number of issues and recommendations")
    void caps() {
        List<String> many = IntStream.rangeClosed(1, 9).mapToObj(i -> "item " + i).collect(Collectors.toList());

        ReplanDecision decision = replanner.replan("p", new JudgmentResult(false, many, many, ""), Map.of());

        assertEquals(Replanner.MAX_ISSUES,
                decision.feedback().stream().filter(l -> l.startsWith("COMPATIBILITY ISSUE")).count());
        assertEquals(Replanner.MAX_RECOMMENDATIONS,
                decision.feedback().stream().filter(l -> l.startsWith("RECOMMENDATION")).count());
    }

    @Test
    @DisplayName("skipped targets are ignored")
    void skippedIgnored() {
        ReplanDecision decision = replanner.replan("p", JudgmentResult.incompatible(List.of("x"), ""),
                Map.of(Target.FRONTEND, SubsystemOutcome.skipped(Target.FRONTEND)));

        assertTrue(decision.feedback().stream().noneMatch(l -> l.startsWith("TARGET EXHAUSTED")));
    }
}
