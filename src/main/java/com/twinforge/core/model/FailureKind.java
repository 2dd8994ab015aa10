package com.twinforge.core.model;

/**
 * Failure categories the replanner distinguishes, each with its strategy.
 */
public enum FailureKind {
    PERMISSION_DENIED(true, Severity.CRITICAL, "Permission error - requires manual intervention"),
    TESTS_FAIL(false, Severity.MEDIUM, "Tests failed - fix the failing behaviour and keep the tests"),
    LINT_FAIL(false, Severity.LOW, "Lint errors - clean up style and static analysis findings"),
    BUILD_FAIL(false, Severity.HIGH, "Build failed - check dependencies and build configuration"),
    DEPLOY_FAIL(false, Severity.HIGH, "Deployment failed - check runtime configuration"),
    CODEGEN_FAIL(false, Severity.MEDIUM, "Code generation incomplete - regenerate missing or empty files"),
    REFACTOR_FAIL(false, Severity.HIGH, "Refactoring broke existing behaviour - restore it"),
    VERIFY_FAIL(false, Severity.LOW, "Verification failed - address the reported diagnostics"),
    INCOMPATIBLE(false, Severity.MEDIUM, "Backend and frontend disagree on the contract - align them"),
    PLANNING_FAILED(true, Severity.CRITICAL, "Planning failed");

    public enum Severity { LOW, MEDIUM, HIGH, CRITICAL }

    private final boolean stop;
    private final Severity severity;
    private final String reason;

    FailureKind(boolean stop, Severity severity, String reason) {
        this.stop = stop;
        this.severity = severity;
        this.reason = reason;
    }

    /** True when replanning cannot help and the run must end. */
    public boolean stopsRun() {
        return stop || severity == Severity.CRITICAL;
    }

    public Severity severity() {
        return severity;
    }

    public String reason() {
        return reason;
    }
}
