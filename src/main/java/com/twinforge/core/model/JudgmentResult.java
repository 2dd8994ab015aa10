package com.twinforge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Cross-target compatibility verdict for one top-level iteration.
 *
 * @param compatible      true when the targets interoperate per the contract
 * @param issues          incompatibility descriptions referencing the contract
 * @param recommendations suggested fixes, forwarded to the next iteration
 * @param summary         one-paragraph human readable verdict
 */
public record JudgmentResult(
    boolean compatible,
    List<String> issues,
    List<String> recommendations,
    String summary
) implements Serializable {

    public JudgmentResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        summary = summary == null ? "" : summary;
    }

    public static JudgmentResult compatible(String summary) {
        return new JudgmentResult(true, List.of(), List.of(), summary);
    }

    public static JudgmentResult incompatible(List<String> issues, String summary) {
        return new JudgmentResult(false, issues, List.of(), summary);
    }
}
