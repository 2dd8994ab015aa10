package com.twinforge.core.subsystem;

import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.ContractSlice;
import com.twinforge.core.model.Target;

import java.util.List;

/**
 * Everything one Subsystem Runner needs for one top-level iteration. Built by the
 * coordinator before the fan-out; the runner never sees the other target's assignment.
 *
 * @param required       false when the plan does not need this target
 * @param runFeedback    replanning feedback from the previous iteration
 * @param priorArtifacts artifacts from the previous iteration, the starting point for refinement
 * @param iteration      1-based top-level iteration this assignment belongs to
 */
public record SubsystemAssignment(
    String runId,
    Target target,
    boolean required,
    String goal,
    String planText,
    ContractSlice slice,
    List<String> runFeedback,
    ArtifactSet priorArtifacts,
    int iteration,
    int maxSubIterations
) {

    public SubsystemAssignment {
        runFeedback = runFeedback == null ? List.of() : List.copyOf(runFeedback);
        priorArtifacts = priorArtifacts == null ? ArtifactSet.empty() : priorArtifacts;
    }
}
