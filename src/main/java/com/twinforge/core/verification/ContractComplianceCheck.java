package com.twinforge.core.verification;

import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.ContractSlice;
import com.twinforge.core.model.Endpoint;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Every endpoint in the target's contract slice must be referenced by its path somewhere
 * in the generated files. The backend slice lists every endpoint; the frontend slice
 * lists the ones it calls.
 */
@Component
@Order(60)
public class ContractComplianceCheck implements VerificationCheck {

    @Override
    public String name() {
        return "contract_compliance";
    }

    @Override
    public CheckVerdict check(ArtifactSet artifacts, ContractSlice slice) {
        if (slice == null || slice.endpoints().isEmpty()) {
            return CheckVerdict.ok(name(), "No endpoints to check");
        }
        String code = artifacts.joinedContent();
        List<String> missing = slice.endpoints().stream()
                .filter(e -> !code.contains(e.path()))
                .map(Endpoint::signature)
                .toList();
        if (!missing.isEmpty()) {
            return CheckVerdict.fail(name(), "Endpoints missing from " + slice.target().wireName()
                    + " code: " + missing);
        }
        return CheckVerdict.ok(name(), "All " + slice.endpoints().size() + " endpoints referenced");
    }
}
