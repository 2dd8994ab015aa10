package com.twinforge.core.planning;

import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.Contract;
import com.twinforge.core.model.Endpoint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic half of the compatibility judgment: the backend must reference every
 * contract endpoint path and the frontend every endpoint it is expected to call.
 */
@Component
public class ContractCoverageChecker {

    public Coverage check(Contract contract, ArtifactSet backend, ArtifactSet frontend) {
        String backendCode = backend.joinedContent();
        String frontendCode = frontend.joinedContent();
        List<String> missingInBackend = contract.endpoints().stream()
                .filter(e -> !backendCode.contains(e.path()))
                .map(Endpoint::signature)
                .toList();
        List<String> missingInFrontend = contract.frontendEndpoints().stream()
                .filter(e -> !frontendCode.contains(e.path()))
                .map(Endpoint::signature)
                .toList();
        return new Coverage(missingInBackend, missingInFrontend);
    }

    public record Coverage(List<String> missingInBackend, List<String> missingInFrontend) {

        public boolean complete() {
            return missingInBackend.isEmpty() && missingInFrontend.isEmpty();
        }

        public List<String> issues() {
            var issues = new ArrayList<String>();
            missingInBackend.forEach(e -> issues.add("Backend does not implement " + e));
            missingInFrontend.forEach(e -> issues.add("Frontend does not call " + e));
            return issues;
        }
    }
}
