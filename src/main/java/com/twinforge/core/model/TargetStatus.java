package com.twinforge.core.model;

public enum TargetStatus {
    PENDING,
    CODING,
    VERIFYING,
    PASSED,
    FAILED_EXHAUSTED;

    public boolean isTerminal() {
        return this == PASSED || this == FAILED_EXHAUSTED;
    }
}
