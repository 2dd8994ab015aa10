package com.twinforge.core.replan;

import com.twinforge.core.model.FailureKind;

import java.util.List;

/**
 * What the replanner decided after a rejected iteration.
 *
 * @param stop     true when another iteration cannot help and the run must fail
 * @param feedback ordered lines handed to the planner and every generation call of the next iteration
 */
public record ReplanDecision(FailureKind kind, boolean stop, String reason, List<String> feedback) {

    public ReplanDecision {
        feedback = feedback == null ? List.of() : List.copyOf(feedback);
    }
}
