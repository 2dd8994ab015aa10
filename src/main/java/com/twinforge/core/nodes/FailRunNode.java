package com.twinforge.core.nodes;

import com.twinforge.core.events.EventBus;
import com.twinforge.core.events.RunEvent;
import com.twinforge.core.events.RunEventType;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Terminal failure. Reached on a planning failure, a stopping failure kind, or when the
 * iteration budget runs out; the accumulated diagnostics travel with the event.
 */
@Component
public class FailRunNode {

    private static final Logger log = LoggerFactory.getLogger(FailRunNode.class);

    static final int MAX_REPORTED_DIAGNOSTICS = 20;

    private final EventBus eventBus;

    public FailRunNode(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(RunState state) {
        String reason = state.stopReason().isBlank()
                ? "Iteration budget exhausted after " + state.iteration() + " of " + state.maxIterations()
                        + " iteration(s) without a compatible result"
                : state.stopReason();
        List<String> errors = state.errors();
        List<String> diagnostics = errors.size() <= MAX_REPORTED_DIAGNOSTICS
                ? errors
                : errors.subList(errors.size() - MAX_REPORTED_DIAGNOSTICS, errors.size());

        log.error("Run {} failed: {}", state.runId(), reason);
        eventBus.publish(RunEvent.of(RunEventType.RUN_FAILED, state.runId(), reason,
                Map.of("iteration", state.iteration(),
                        "reason", reason,
                        "failureKind", state.failureKind().map(Enum::name).orElse(""),
                        "diagnostics", List.copyOf(diagnostics))));
        return Map.of(
                "status", RunStatus.FAILED.name(),
                "finalStatus", "failed",
                "stopReason", reason);
    }
}
