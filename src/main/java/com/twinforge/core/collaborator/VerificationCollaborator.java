package com.twinforge.core.collaborator;

import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.ContractSlice;
import com.twinforge.core.model.Target;
import com.twinforge.core.model.VerificationResult;

/**
 * Checks a generated artifact set and reports pass/fail with diagnostics.
 */
public interface VerificationCollaborator {

    /**
     * @throws CollaboratorException if verification itself could not run
     */
    VerificationResult verify(Target target, ArtifactSet artifacts, ContractSlice slice);
}
