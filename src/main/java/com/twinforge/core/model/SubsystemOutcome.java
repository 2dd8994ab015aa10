package com.twinforge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Final sub-state a Subsystem Runner hands back at the join point.
 * Runners never write shared run state; the coordinator merges these after the join.
 *
 * @param required            false when the target was skipped for this iteration
 * @param status              terminal status, or the last active status when cancelled
 * @param subIterations       Coding/Verifying cycles performed
 * @param artifacts           latest artifact set, or the prior one if generation never succeeded
 * @param lastVerification    result of the last cycle, null if none ran
 * @param verificationHistory every cycle's result, oldest first
 * @param cancelled           true when the runner stopped because of a stop request
 */
public record SubsystemOutcome(
    Target target,
    boolean required,
    TargetStatus status,
    int subIterations,
    int maxSubIterations,
    ArtifactSet artifacts,
    VerificationResult lastVerification,
    List<VerificationResult> verificationHistory,
    long durationMs,
    boolean cancelled
) implements Serializable {

    public SubsystemOutcome {
        artifacts = artifacts == null ? ArtifactSet.empty() : artifacts;
        verificationHistory = verificationHistory == null ? List.of() : List.copyOf(verificationHistory);
    }

    /**
     * A target the plan does not need. Reported as trivially satisfied.
     */
    public static SubsystemOutcome skipped(Target target) {
        return new SubsystemOutcome(target, false, TargetStatus.PASSED, 0, 0,
                ArtifactSet.empty(), null, List.of(), 0L, false);
    }

    public boolean passed() {
        return status == TargetStatus.PASSED && !cancelled;
    }

    public boolean exhausted() {
        return status == TargetStatus.FAILED_EXHAUSTED;
    }

    public List<String> lastDiagnostics() {
        return lastVerification == null ? List.of() : lastVerification.diagnostics();
    }
}
