package com.twinforge.core.nodes;

import com.twinforge.core.collaborator.CancellationToken;
import com.twinforge.core.engine.RunRegistry;
import com.twinforge.core.events.EventBus;
import com.twinforge.core.events.RunEvent;
import com.twinforge.core.events.RunEventType;
import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.RunConfig;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.model.SubsystemOutcome;
import com.twinforge.core.model.Target;
import com.twinforge.core.state.RunState;
import com.twinforge.core.subsystem.ParallelCoordinator;
import com.twinforge.core.subsystem.SubsystemAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds every required target for the current iteration through the {@link ParallelCoordinator}
 * and merges the joined outcomes into run state.
 * <p>
 * Each target starts from the artifacts it ended the previous iteration with.
 */
@Component
public class ParallelBuildNode {

    private static final Logger log = LoggerFactory.getLogger(ParallelBuildNode.class);

    private final ParallelCoordinator coordinator;
    private final RunRegistry registry;
    private final EventBus eventBus;

    public ParallelBuildNode(ParallelCoordinator coordinator, RunRegistry registry, EventBus eventBus) {
        this.coordinator = coordinator;
        this.registry = registry;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(RunState state) {
        String runId = state.runId();
        int iteration = state.iteration() + 1;
        RunConfig config = state.runConfig();
        CancellationToken token = registry.tokenFor(runId);
        if (token.isCancelled()) {
            return StopSignals.stopped("build");
        }

        var assignments = new ArrayList<SubsystemAssignment>();
        for (Target target : Target.values()) {
            ArtifactSet prior = state.outcome(target).map(SubsystemOutcome::artifacts).orElse(ArtifactSet.empty());
            assignments.add(new SubsystemAssignment(runId, target, state.requires(target), state.goal(),
                    state.planText(), state.contract().sliceFor(target), state.feedback(), prior,
                    iteration, config.maxSubIterations(target)));
        }
        List<String> required = Arrays.stream(Target.values())
                .filter(state::requires)
                .map(Target::wireName)
                .toList();
        log.info("Building {} ({})", required, config.parallel() ? "parallel" : "sequential");
        eventBus.publish(RunEvent.of(RunEventType.BUILD_STARTED, runId,
                "Building " + String.join(" and ", required),
                Map.of("iteration", iteration, "targets", required, "parallel", config.parallel())));

        Map<Target, SubsystemOutcome> outcomes = coordinator.runAll(assignments, config, token);

        var updates = new HashMap<String, Object>();
        outcomes.forEach((target, outcome) -> updates.put(RunState.outcomeKey(target), outcome));
        boolean stopped = token.isCancelled() || outcomes.values().stream().anyMatch(SubsystemOutcome::cancelled);
        if (stopped) {
            updates.putAll(StopSignals.stopped("build"));
            return updates;
        }
        updates.put("status", RunStatus.JUDGING.name());
        updates.put("history", List.of("iteration " + iteration + ": built " + outcomes.values().stream()
                .filter(SubsystemOutcome::required)
                .map(o -> o.target().wireName() + "=" + o.status() + " in " + o.subIterations())
                .toList()));
        return updates;
    }
}
