package com.twinforge.core.planning;

import com.twinforge.core.model.JudgmentResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured output of the compatibility review prompt.
 */
public record JudgeResponse(
    boolean compatible,
    EndpointAnalysis endpointAnalysis,
    List<String> issues,
    List<String> recommendations,
    String summary
) {

    public record EndpointAnalysis(
        List<String> backendImplements,
        List<String> frontendCalls,
        List<String> missingInBackend,
        List<String> missingInFrontend
    ) {}

    /**
     * Endpoints the model reports as missing count as issues even when it forgot to list them,
     * and make the verdict incompatible.
     */
    public JudgmentResult toJudgmentResult() {
        var allIssues = new ArrayList<String>(issues == null ? List.of() : issues);
        boolean missing = false;
        if (endpointAnalysis != null) {
            if (endpointAnalysis.missingInBackend() != null) {
                for (String endpoint : endpointAnalysis.missingInBackend()) {
                    allIssues.add("Backend does not implement " + endpoint);
                    missing = true;
                }
            }
            if (endpointAnalysis.missingInFrontend() != null) {
                for (String endpoint : endpointAnalysis.missingInFrontend()) {
                    allIssues.add("Frontend does not call " + endpoint);
                    missing = true;
                }
            }
        }
        return new JudgmentResult(compatible && !missing, allIssues, recommendations, summary);
    }
}
