package com.twinforge.core.collaborator;

import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.ContractSlice;
import com.twinforge.core.model.Target;

import java.util.List;

/**
 * Input for one generation call.
 *
 * @param runFeedback    structured feedback from the previous top-level iteration's replanning
 * @param diagnostics    diagnostics of the previous sub-iteration of this target (empty on the first)
 * @param priorArtifacts artifact set to refine, empty when starting from scratch
 * @param subIteration   1-based cycle number within the target's budget
 */
public record GenerationRequest(
    String runId,
    Target target,
    String goal,
    String planText,
    ContractSlice slice,
    List<String> runFeedback,
    List<String> diagnostics,
    ArtifactSet priorArtifacts,
    int iteration,
    int subIteration
) {

    public GenerationRequest {
        runFeedback = runFeedback == null ? List.of() : List.copyOf(runFeedback);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        priorArtifacts = priorArtifacts == null ? ArtifactSet.empty() : priorArtifacts;
    }

    public boolean hasFeedback() {
        return !runFeedback.isEmpty() || !diagnostics.isEmpty();
    }
}
