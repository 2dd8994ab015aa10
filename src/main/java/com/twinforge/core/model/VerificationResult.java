package com.twinforge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of verifying one artifact set.
 *
 * @param passed      true when every check succeeded
 * @param diagnostics ordered messages describing what failed (empty when passed)
 */
public record VerificationResult(boolean passed, List<String> diagnostics) implements Serializable {

    public VerificationResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static VerificationResult pass() {
        return new VerificationResult(true, List.of());
    }

    public static VerificationResult fail(List<String> diagnostics) {
        return new VerificationResult(false, diagnostics);
    }

    public static VerificationResult fail(String diagnostic) {
        return new VerificationResult(false, List.of(diagnostic));
    }
}
