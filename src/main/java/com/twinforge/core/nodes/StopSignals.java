package com.twinforge.core.nodes;

import com.twinforge.core.model.RunStatus;

import java.util.Map;

/**
 * State update shared by every node that observes a stop request.
 */
final class StopSignals {

    static final String STOP_REASON = "Stopped by request";

    private StopSignals() {}

    static Map<String, Object> stopped(String phase) {
        return Map.of(
                "status", RunStatus.STOPPED.name(),
                "stopReason", STOP_REASON + " during " + phase);
    }
}
