package com.twinforge.core.nodes;

import com.twinforge.core.collaborator.CancellationToken;
import com.twinforge.core.collaborator.CollaboratorException;
import com.twinforge.core.collaborator.CollaboratorInvoker;
import com.twinforge.core.collaborator.PlanningCollaborator;
import com.twinforge.core.collaborator.RunCancelledException;
import com.twinforge.core.engine.RunRegistry;
import com.twinforge.core.events.EventBus;
import com.twinforge.core.events.RunEvent;
import com.twinforge.core.events.RunEventType;
import com.twinforge.core.metrics.TwinforgeMetrics;
import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.Contract;
import com.twinforge.core.model.JudgmentResult;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.model.SubsystemOutcome;
import com.twinforge.core.model.Target;
import com.twinforge.core.planning.ContractCoverageChecker;
import com.twinforge.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Judges whether the joined targets of this iteration work together, and counts the iteration.
 * <p>
 * An exhausted required target makes the iteration incompatible without looking at content.
 * A single passed target is accepted as is. Two passed targets must satisfy both the
 * deterministic coverage check and the judgment collaborator; a failing judgment call counts
 * as incompatible.
 */
@Component
public class JudgeCompatibilityNode {

    private static final Logger log = LoggerFactory.getLogger(JudgeCompatibilityNode.class);

    private final PlanningCollaborator judge;
    private final ContractCoverageChecker coverageChecker;
    private final CollaboratorInvoker invoker;
    private final RunRegistry registry;
    private final EventBus eventBus;
    private final TwinforgeMetrics metrics;

    public JudgeCompatibilityNode(PlanningCollaborator judge, ContractCoverageChecker coverageChecker,
                                  CollaboratorInvoker invoker, RunRegistry registry, EventBus eventBus,
                                  @Autowired(required = false) TwinforgeMetrics metrics) {
        this.judge = judge;
        this.coverageChecker = coverageChecker;
        this.invoker = invoker;
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(RunState state) {
        String runId = state.runId();
        int iteration = state.iteration() + 1;
        CancellationToken token = registry.tokenFor(runId);
        if (token.isCancelled()) {
            return StopSignals.stopped("judging");
        }
        eventBus.publish(RunEvent.of(RunEventType.JUDGING_STARTED, runId,
                "Judging iteration " + iteration, Map.of("iteration", iteration)));

        JudgmentResult judgment;
        try {
            judgment = judge(state, token);
        } catch (RunCancelledException e) {
            return StopSignals.stopped("judging");
        }

        log.info("Iteration {} judged {}: {}", iteration,
                judgment.compatible() ? "compatible" : "incompatible", judgment.summary());
        if (metrics != null) {
            metrics.recordJudgment(judgment.compatible());
        }
        eventBus.publish(RunEvent.of(RunEventType.JUDGMENT_RESULT, runId, judgment.summary(),
                Map.of("iteration", iteration,
                        "compatible", judgment.compatible(),
                        "issues", judgment.issues(),
                        "recommendations", judgment.recommendations(),
                        "summary", judgment.summary())));

        var updates = new HashMap<String, Object>();
        updates.put("judgment", judgment);
        updates.put("iteration", iteration);
        updates.put("status", RunStatus.JUDGING.name());
        updates.put("history", List.of("iteration " + iteration + ": "
                + (judgment.compatible() ? "compatible" : "incompatible (" + judgment.issues().size() + " issue(s))")));
        if (!judgment.compatible()) {
            var errors = new ArrayList<String>();
            judgment.issues().forEach(issue -> errors.add("iteration " + iteration + ": " + issue));
            updates.put("errors", errors);
        }
        return updates;
    }

    JudgmentResult judge(RunState state, CancellationToken token) {
        Map<Target, SubsystemOutcome> outcomes = state.outcomes();
        var required = outcomes.values().stream().filter(SubsystemOutcome::required).toList();

        var exhausted = required.stream().filter(o -> !o.passed()).toList();
        if (!exhausted.isEmpty()) {
            var issues = new ArrayList<String>();
            for (SubsystemOutcome o : exhausted) {
                issues.add(o.target().wireName() + " exhausted " + o.subIterations() + " sub-iteration(s): "
                        + String.join("; ", o.lastDiagnostics()));
            }
            return JudgmentResult.incompatible(issues,
                    "Not judged: " + exhausted.stream().map(o -> o.target().wireName()).toList()
                            + " did not pass verification");
        }
        if (required.size() == 1) {
            return JudgmentResult.compatible("Only " + required.get(0).target().wireName()
                    + " was required and it passed verification; no cross-check needed");
        }

        Contract contract = state.contract();
        var artifacts = new EnumMap<Target, ArtifactSet>(Target.class);
        required.forEach(o -> artifacts.put(o.target(), o.artifacts()));
        var coverage = coverageChecker.check(contract, artifacts.get(Target.BACKEND), artifacts.get(Target.FRONTEND));

        JudgmentResult reviewed;
        try {
            reviewed = invoker.invoke("judgment", "judge compatibility",
                    () -> judge.judge(contract, artifacts), state.runConfig().collaboratorTimeout(), token);
        } catch (RunCancelledException e) {
            throw e;
        } catch (CollaboratorException e) {
            log.warn("Judgment call failed, treating iteration as incompatible: {}", e.getMessage());
            reviewed = JudgmentResult.incompatible(List.of("Judgment failed: " + e.getMessage()),
                    "Compatibility could not be judged");
        }

        if (coverage.complete()) {
            return reviewed;
        }
        var issues = new ArrayList<>(coverage.issues());
        issues.addAll(reviewed.issues());
        return new JudgmentResult(false, issues, reviewed.recommendations(),
                "Coverage check found " + coverage.issues().size() + " missing endpoint(s). " + reviewed.summary());
    }
}
