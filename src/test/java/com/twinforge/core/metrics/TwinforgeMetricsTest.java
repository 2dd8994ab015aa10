package com.twinforge.core.metrics;

import com.twinforge.core.model.Target;
import com.twinforge.core.model.TargetStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TwinforgeMetricsTest {

    private SimpleMeterRegistry registry;
    private TwinforgeMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TwinforgeMetrics(registry);
    }

    @Test
    @DisplayName("recordPlanningDuration creates a timer")
    void recordPlanningDuration() {
        metrics.recordPlanningDuration(1500);
        var timer = registry.find("twinforge.planning.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordSubsystemDuration tags the target")
    void recordSubsystemDuration() {
        metrics.recordSubsystemDuration(Target.FRONTEND, 250);
        var timer = registry.find("twinforge.subsystem.duration").tag("target", "frontend").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordSubIterations tags target and outcome")
    void recordSubIterations() {
        metrics.recordSubIterations(Target.BACKEND, TargetStatus.FAILED_EXHAUSTED, 3);
        var summary = registry.find("twinforge.subsystem.sub_iterations")
                .tag("target", "backend")
                .tag("outcome", "failed_exhausted")
                .summary();
        assertNotNull(summary);
        assertEquals(3.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordJudgment increments the matching counter")
    void recordJudgment() {
        metrics.recordJudgment(true);
        metrics.recordJudgment(false);
        metrics.recordJudgment(false);

        assertEquals(1.0, registry.find("twinforge.judgments").tag("result", "compatible").counter().count());
        assertEquals(2.0, registry.find("twinforge.judgments").tag("result", "incompatible").counter().count());
    }

    @Test
    @DisplayName("recordCollaboratorFailure counts by collaborator and kind")
    void recordCollaboratorFailure() {
        metrics.recordCollaboratorFailure("generation", "timeout");
        var counter = registry.find("twinforge.collaborator.failures")
                .tag("collaborator", "generation").tag("kind", "timeout").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("run results, replans and iteration depth are recorded")
    void recordRunLevelMetrics() {
        metrics.recordRunResult("DELIVERED");
        metrics.incrementReplans("INCOMPATIBLE");
        metrics.recordIterationDepth(2);

        assertEquals(1.0, registry.find("twinforge.runs.total").tag("status", "DELIVERED").counter().count());
        assertEquals(1.0, registry.find("twinforge.replans.total").tag("kind", "INCOMPATIBLE").counter().count());
        assertEquals(2.0, registry.find("twinforge.iteration.depth").summary().totalAmount());
    }
}
