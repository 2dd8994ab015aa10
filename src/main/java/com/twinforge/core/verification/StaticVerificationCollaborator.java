package com.twinforge.core.verification;

import com.twinforge.core.collaborator.VerificationCollaborator;
import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.ContractSlice;
import com.twinforge.core.model.Target;
import com.twinforge.core.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every applicable {@link VerificationCheck} in order and collects the failing reasons
 * as diagnostics. All checks run even after a failure so the next generation attempt sees
 * every problem at once.
 */
@Service
public class StaticVerificationCollaborator implements VerificationCollaborator {

    private static final Logger log = LoggerFactory.getLogger(StaticVerificationCollaborator.class);

    private final List<VerificationCheck> checks;

    public StaticVerificationCollaborator(List<VerificationCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    @Override
    public VerificationResult verify(Target target, ArtifactSet artifacts, ContractSlice slice) {
        var diagnostics = new ArrayList<String>();
        for (VerificationCheck check : checks) {
            if (!check.appliesTo(target)) {
                continue;
            }
            CheckVerdict verdict = check.check(artifacts, slice);
            if (!verdict.ok()) {
                log.info("Check {} failed for {}: {}", verdict.name(), target.wireName(), verdict.reason());
                diagnostics.add(verdict.reason());
            } else {
                log.debug("Check {} passed for {}: {}", verdict.name(), target.wireName(), verdict.reason());
            }
        }
        return diagnostics.isEmpty() ? VerificationResult.pass() : VerificationResult.fail(diagnostics);
    }
}
