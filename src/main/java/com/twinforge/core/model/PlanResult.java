package com.twinforge.core.model;

import java.io.Serializable;

/**
 * What the planner hands back to the run controller.
 */
public record PlanResult(
    String summary,
    String planText,
    Contract contract,
    boolean needsBackend,
    boolean needsFrontend
) implements Serializable {

    public PlanResult {
        summary = summary == null ? "" : summary;
        planText = planText == null ? "" : planText;
        contract = contract == null ? Contract.empty() : contract;
    }

    public boolean requires(Target target) {
        return target == Target.BACKEND ? needsBackend : needsFrontend;
    }
}
