package com.twinforge.core.nodes;

import com.twinforge.core.collaborator.CancellationToken;
import com.twinforge.core.collaborator.PlanningFailedException;
import com.twinforge.core.collaborator.RunCancelledException;
import com.twinforge.core.engine.RunRegistry;
import com.twinforge.core.events.EventBus;
import com.twinforge.core.events.RunEvent;
import com.twinforge.core.events.RunEventType;
import com.twinforge.core.logging.MdcContext;
import com.twinforge.core.model.FailureKind;
import com.twinforge.core.model.PlanResult;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.planning.Planner;
import com.twinforge.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Plans the next top-level iteration, passing along any feedback from the replanner.
 * A planning failure ends the run.
 */
@Component
public class PlanRunNode {

    private static final Logger log = LoggerFactory.getLogger(PlanRunNode.class);

    private final Planner planner;
    private final RunRegistry registry;
    private final EventBus eventBus;

    public PlanRunNode(Planner planner, RunRegistry registry, EventBus eventBus) {
        this.planner = planner;
        this.registry = registry;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(RunState state) {
        String runId = state.runId();
        int iteration = state.iteration() + 1;
        CancellationToken token = registry.tokenFor(runId);
        if (token.isCancelled()) {
            return StopSignals.stopped("planning");
        }
        MdcContext.setIteration(runId, iteration);

        List<String> feedback = state.feedback();
        log.info("Planning iteration {}/{} ({} feedback line(s))", iteration, state.maxIterations(), feedback.size());
        eventBus.publish(RunEvent.of(RunEventType.PLANNING_STARTED, runId,
                "Planning iteration " + iteration,
                Map.of("iteration", iteration, "feedbackCount", feedback.size())));

        PlanResult plan;
        try {
            plan = planner.plan(state.goal(), feedback, state.runConfig(), token);
        } catch (RunCancelledException e) {
            return StopSignals.stopped("planning");
        } catch (PlanningFailedException e) {
            log.error("Planning failed in iteration {}: {}", iteration, e.getMessage());
            return Map.of(
                    "status", RunStatus.FAILED.name(),
                    "failureKind", FailureKind.PLANNING_FAILED.name(),
                    "stopReason", e.getMessage(),
                    "errors", List.of(e.getMessage()));
        }

        eventBus.publish(RunEvent.of(RunEventType.PLANNING_COMPLETED, runId, plan.summary(),
                Map.of("iteration", iteration,
                        "needsBackend", plan.needsBackend(),
                        "needsFrontend", plan.needsFrontend(),
                        "endpointCount", plan.contract().endpoints().size())));

        var updates = new HashMap<String, Object>();
        updates.put("status", RunStatus.RUNNING.name());
        updates.put("planSummary", plan.summary());
        updates.put("planText", plan.planText());
        updates.put("contract", plan.contract());
        updates.put("needsBackend", plan.needsBackend());
        updates.put("needsFrontend", plan.needsFrontend());
        updates.put("history", List.of("iteration " + iteration + ": planned - " + plan.summary()));
        return updates;
    }
}
