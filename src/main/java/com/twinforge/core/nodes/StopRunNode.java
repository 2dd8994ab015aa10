package com.twinforge.core.nodes;

import com.twinforge.core.events.EventBus;
import com.twinforge.core.events.RunEvent;
import com.twinforge.core.events.RunEventType;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class StopRunNode {

    private static final Logger log = LoggerFactory.getLogger(StopRunNode.class);

    private final EventBus eventBus;

    public StopRunNode(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(RunState state) {
        String reason = state.stopReason().isBlank() ? StopSignals.STOP_REASON : state.stopReason();
        log.info("Run {} stopped: {}", state.runId(), reason);
        eventBus.publish(RunEvent.of(RunEventType.RUN_STOPPED, state.runId(), reason,
                Map.of("iteration", state.iteration(), "reason", reason)));
        return Map.of(
                "status", RunStatus.STOPPED.name(),
                "finalStatus", "stopped",
                "stopReason", reason);
    }
}
