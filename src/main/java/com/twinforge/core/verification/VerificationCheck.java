package com.twinforge.core.verification;

import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.ContractSlice;
import com.twinforge.core.model.Target;

/**
 * One static check run against a generated artifact set.
 */
public interface VerificationCheck {

    String name();

    default boolean appliesTo(Target target) {
        return true;
    }

    CheckVerdict check(ArtifactSet artifacts, ContractSlice slice);
}
