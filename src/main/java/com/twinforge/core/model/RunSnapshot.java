package com.twinforge.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of a run, built from the event stream and the final state.
 */
public record RunSnapshot(
    String runId,
    String goal,
    RunStatus status,
    int iteration,
    int maxIterations,
    Map<Target, TargetSnapshot> targets,
    JudgmentResult judgment,
    String finalStatus,
    String stopReason,
    List<String> errors,
    Instant createdAt,
    Instant updatedAt
) {

    public RunSnapshot {
        targets = targets == null ? Map.of() : Map.copyOf(targets);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Per-target progress inside the current iteration.
     */
    public record TargetSnapshot(
        Target target,
        boolean required,
        TargetStatus status,
        int subIteration,
        int maxSubIterations,
        List<String> diagnostics,
        int fileCount
    ) {
        public TargetSnapshot {
            diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        }
    }
}
