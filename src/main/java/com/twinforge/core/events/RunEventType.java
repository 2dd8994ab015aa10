package com.twinforge.core.events;

/**
 * Transition events the engine emits, with their wire names.
 */
public enum RunEventType {
    RUN_CREATED("run.created"),
    PLANNING_STARTED("planning.started"),
    PLANNING_COMPLETED("planning.completed"),
    BUILD_STARTED("build.started"),
    TARGET_CODING("target.coding"),
    TARGET_VERIFYING("target.verifying"),
    TARGET_PASSED("target.passed"),
    TARGET_FAILED("target.failed"),
    TARGET_SKIPPED("target.skipped"),
    JUDGING_STARTED("judging.started"),
    JUDGMENT_RESULT("judgment.result"),
    REPLANNING_STARTED("replanning.started"),
    RUN_DELIVERED("run.delivered"),
    RUN_FAILED("run.failed"),
    RUN_STOPPED("run.stopped");

    private final String wireName;

    RunEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == RUN_DELIVERED || this == RUN_FAILED || this == RUN_STOPPED;
    }
}
