package com.twinforge.core.collaborator;

import com.twinforge.core.model.ArtifactSet;

/**
 * Produces a set of files for one target. One implementation per provider,
 * selected by {@code twinforge.generation.provider}.
 */
public interface GenerationCollaborator {

    /**
     * Generates (or refines) the target's artifacts.
     * Must be safe to call again after a timeout.
     *
     * @param request target, contract slice, feedback and prior artifacts
     * @return the complete artifact set for this sub-iteration
     * @throws CollaboratorException if no usable artifacts were produced
     */
    ArtifactSet generate(GenerationRequest request);

    /**
     * Short provider name used in logs and metrics.
     */
    default String providerName() {
        return getClass().getSimpleName();
    }
}
