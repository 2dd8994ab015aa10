package com.twinforge.core.collaborator;

import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.Contract;
import com.twinforge.core.model.JudgmentResult;
import com.twinforge.core.model.PlanResult;
import com.twinforge.core.model.Target;

import java.util.List;
import java.util.Map;

/**
 * Turns a goal into a plan and contract, and judges cross-target compatibility.
 * Both operations are pure with respect to run state.
 */
public interface PlanningCollaborator {

    /**
     * @param goal     the natural-language goal
     * @param feedback replanning feedback lines, empty on the first iteration
     * @throws CollaboratorException on failure or an unusable plan
     */
    PlanResult plan(String goal, List<String> feedback);

    /**
     * @param contract          the contract both targets were built against
     * @param artifactsByTarget the final artifact set of every required target
     * @throws CollaboratorException on failure
     */
    JudgmentResult judge(Contract contract, Map<Target, ArtifactSet> artifactsByTarget);
}
