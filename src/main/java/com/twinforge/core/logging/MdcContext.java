package com.twinforge.core.logging;

import com.twinforge.core.model.Target;
import org.slf4j.MDC;

/**
 * Utility for managing Twinforge-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setTarget(String runId, Target target) {
        MDC.put("runId", runId);
        MDC.put("target", target.wireName());
    }

    public static void setIteration(String runId, int iteration) {
        MDC.put("runId", runId);
        MDC.put("iteration", String.valueOf(iteration));
    }

    public static void clearTarget() {
        MDC.remove("target");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("target");
        MDC.remove("iteration");
    }
}
