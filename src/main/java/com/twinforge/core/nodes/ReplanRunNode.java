package com.twinforge.core.nodes;

import com.twinforge.core.engine.RunRegistry;
import com.twinforge.core.events.EventBus;
import com.twinforge.core.events.RunEvent;
import com.twinforge.core.events.RunEventType;
import com.twinforge.core.metrics.TwinforgeMetrics;
import com.twinforge.core.model.JudgmentResult;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.replan.ReplanDecision;
import com.twinforge.core.replan.Replanner;
import com.twinforge.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a rejected iteration into feedback for the next planning call, or ends the run
 * when the failure kind makes another iteration pointless.
 */
@Component
public class ReplanRunNode {

    private static final Logger log = LoggerFactory.getLogger(ReplanRunNode.class);

    private final Replanner replanner;
    private final RunRegistry registry;
    private final EventBus eventBus;
    private final TwinforgeMetrics metrics;

    public ReplanRunNode(Replanner replanner, RunRegistry registry, EventBus eventBus,
                         @Autowired(required = false) TwinforgeMetrics metrics) {
        this.replanner = replanner;
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(RunState state) {
        String runId = state.runId();
        if (registry.tokenFor(runId).isCancelled()) {
            return StopSignals.stopped("replanning");
        }
        JudgmentResult judgment = state.judgment()
                .orElseGet(() -> JudgmentResult.incompatible(List.of(), "No judgment recorded"));

        eventBus.publish(RunEvent.of(RunEventType.REPLANNING_STARTED, runId,
                "Replanning after iteration " + state.iteration(),
                Map.of("iteration", state.iteration(), "issueCount", judgment.issues().size())));

        ReplanDecision decision = replanner.replan(state.planSummary(), judgment, state.outcomes());
        if (metrics != null) {
            metrics.incrementReplans(decision.kind().name());
        }

        var updates = new HashMap<String, Object>();
        updates.put("failureKind", decision.kind().name());
        if (decision.stop()) {
            log.warn("Replanning stopped the run: {} ({})", decision.reason(), decision.kind());
            updates.put("status", RunStatus.FAILED.name());
            updates.put("stopReason", "Replanning stopped: " + decision.reason());
            return updates;
        }
        updates.put("status", RunStatus.PLANNING.name());
        updates.put("feedback", decision.feedback());
        updates.put("history", List.of("iteration " + state.iteration() + ": replanned as " + decision.kind()));
        return updates;
    }
}
