package com.twinforge.core.metrics;

import com.twinforge.core.model.Target;
import com.twinforge.core.model.TargetStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Twinforge run execution.
 */
@Service
public class TwinforgeMetrics {

    private final MeterRegistry registry;

    public TwinforgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("twinforge.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSubsystemDuration(Target target, long ms) {
        Timer.builder("twinforge.subsystem.duration")
                .tag("target", target.wireName())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records how many Coding/Verifying cycles a target needed and how it ended.
     */
    public void recordSubIterations(Target target, TargetStatus outcome, int cycles) {
        DistributionSummary.builder("twinforge.subsystem.sub_iterations")
                .description("Coding/Verifying cycles per target per iteration")
                .tag("target", target.wireName())
                .tag("outcome", outcome.name().toLowerCase())
                .register(registry)
                .record(cycles);
    }

    public void recordJudgment(boolean compatible) {
        Counter.builder("twinforge.judgments")
                .tag("result", compatible ? "compatible" : "incompatible")
                .register(registry)
                .increment();
    }

    /**
     * @param kind "timeout", "error" or "cancelled"
     */
    public void recordCollaboratorFailure(String collaborator, String kind) {
        Counter.builder("twinforge.collaborator.failures")
                .description("Collaborator calls that did not return a result")
                .tag("collaborator", collaborator)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordIterationDepth(int depth) {
        DistributionSummary.builder("twinforge.iteration.depth")
                .register(registry)
                .record(depth);
    }

    public void recordRunResult(String status) {
        Counter.builder("twinforge.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void incrementReplans(String failureKind) {
        Counter.builder("twinforge.replans.total")
                .tag("kind", failureKind)
                .register(registry)
                .increment();
    }
}
