package com.twinforge.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.twinforge.core.model.JudgmentResult;
import com.twinforge.core.model.RunSnapshot;

import java.util.List;

/**
 * JSON view of a run snapshot.
 */
public record RunResponse(
    @JsonProperty("run_id") String runId,
    String goal,
    String status,
    int iteration,
    @JsonProperty("max_iterations") int maxIterations,
    List<TargetResponse> targets,
    JudgmentResponse judgment,
    @JsonProperty("final_status") String finalStatus,
    @JsonProperty("stop_reason") String stopReason,
    List<String> errors,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt
) {

    public record TargetResponse(
        String target,
        boolean required,
        String status,
        @JsonProperty("sub_iteration") int subIteration,
        @JsonProperty("max_sub_iterations") int maxSubIterations,
        @JsonProperty("file_count") int fileCount,
        List<String> diagnostics
    ) {}

    public record JudgmentResponse(
        boolean compatible,
        List<String> issues,
        List<String> recommendations,
        String summary
    ) {}

    public static RunResponse from(RunSnapshot snapshot) {
        var targets = snapshot.targets().values().stream()
                .sorted((a, b) -> a.target().compareTo(b.target()))
                .map(t -> new TargetResponse(t.target().wireName(), t.required(), t.status().name(),
                        t.subIteration(), t.maxSubIterations(), t.fileCount(), t.diagnostics()))
                .toList();
        JudgmentResult j = snapshot.judgment();
        return new RunResponse(
                snapshot.runId(),
                snapshot.goal(),
                snapshot.status().name(),
                snapshot.iteration(),
                snapshot.maxIterations(),
                targets,
                j == null ? null : new JudgmentResponse(j.compatible(), j.issues(), j.recommendations(), j.summary()),
                snapshot.finalStatus(),
                snapshot.stopReason(),
                snapshot.errors(),
                snapshot.createdAt().toString(),
                snapshot.updatedAt().toString());
    }

}
