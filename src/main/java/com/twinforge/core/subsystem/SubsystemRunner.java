package com.twinforge.core.subsystem;

import com.twinforge.core.collaborator.CancellationToken;
import com.twinforge.core.collaborator.CollaboratorException;
import com.twinforge.core.collaborator.CollaboratorInvoker;
import com.twinforge.core.collaborator.GenerationCollaborator;
import com.twinforge.core.collaborator.GenerationRequest;
import com.twinforge.core.collaborator.RunCancelledException;
import com.twinforge.core.collaborator.VerificationCollaborator;
import com.twinforge.core.events.EventBus;
import com.twinforge.core.events.RunEvent;
import com.twinforge.core.events.RunEventType;
import com.twinforge.core.metrics.TwinforgeMetrics;
import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.RunConfig;
import com.twinforge.core.model.SubsystemOutcome;
import com.twinforge.core.model.TargetStatus;
import com.twinforge.core.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the bounded Coding/Verifying loop for one target.
 * <p>
 * Every cycle starts in CODING and increments the sub-iteration counter. A generation error
 * or a failed verification ends the cycle; the loop goes back to CODING with the diagnostics
 * while the counter is below the target's maximum, and stops in FAILED_EXHAUSTED once it
 * reaches it. A passing verification stops in PASSED. The stop flag is checked before every
 * collaborator call.
 * <p>
 * All loop state is local to one {@link #run} invocation. The result is handed back as a
 * {@link SubsystemOutcome}; nothing here writes run state.
 */
@Service
public class SubsystemRunner {

    private static final Logger log = LoggerFactory.getLogger(SubsystemRunner.class);

    private final GenerationCollaborator generation;
    private final VerificationCollaborator verification;
    private final CollaboratorInvoker invoker;
    private final EventBus eventBus;
    private final TwinforgeMetrics metrics;

    public SubsystemRunner(GenerationCollaborator generation, VerificationCollaborator verification,
                           CollaboratorInvoker invoker, EventBus eventBus,
                           @Autowired(required = false) TwinforgeMetrics metrics) {
        this.generation = generation;
        this.verification = verification;
        this.invoker = invoker;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public SubsystemOutcome run(SubsystemAssignment assignment, RunConfig config, CancellationToken token) {
        var target = assignment.target();
        int max = assignment.maxSubIterations();
        long start = System.currentTimeMillis();

        TargetStatus state = TargetStatus.CODING;
        int subIteration = 0;
        ArtifactSet artifacts = assignment.priorArtifacts();
        List<String> diagnostics = List.of();
        VerificationResult last = null;
        var history = new ArrayList<VerificationResult>();

        log.info("Starting {} with budget of {} sub-iteration(s) using {} generation",
                target.wireName(), max, generation.providerName());
        try {
            while (!state.isTerminal()) {
                token.throwIfCancelled();
                switch (state) {
                    case CODING -> {
                        subIteration++;
                        publish(RunEventType.TARGET_CODING, assignment, subIteration,
                                "Coding " + target.wireName() + " (" + subIteration + "/" + max + ")", Map.of());
                        var request = new GenerationRequest(assignment.runId(), target, assignment.goal(),
                                assignment.planText(), assignment.slice(), assignment.runFeedback(), diagnostics,
                                artifacts, assignment.iteration(), subIteration);
                        try {
                            artifacts = invoker.invoke("generation", "generate " + target.wireName(),
                                    () -> generation.generate(request), config.collaboratorTimeout(), token);
                            state = TargetStatus.VERIFYING;
                        } catch (RunCancelledException e) {
                            throw e;
                        } catch (CollaboratorException e) {
                            log.warn("Generation failed for {} in sub-iteration {}: {}",
                                    target.wireName(), subIteration, e.getMessage());
                            last = VerificationResult.fail(e.getMessage());
                            history.add(last);
                            diagnostics = last.diagnostics();
                            state = subIteration >= max ? TargetStatus.FAILED_EXHAUSTED : TargetStatus.CODING;
                        }
                    }
                    case VERIFYING -> {
                        publish(RunEventType.TARGET_VERIFYING, assignment, subIteration,
                                "Verifying " + artifacts.size() + " " + target.wireName() + " file(s)",
                                Map.of("fileCount", artifacts.size()));
                        final ArtifactSet toVerify = artifacts;
                        VerificationResult result;
                        try {
                            result = invoker.invoke("verification", "verify " + target.wireName(),
                                    () -> verification.verify(target, toVerify, assignment.slice()),
                                    config.collaboratorTimeout(), token);
                        } catch (RunCancelledException e) {
                            throw e;
                        } catch (CollaboratorException e) {
                            log.warn("Verification call failed for {}: {}", target.wireName(), e.getMessage());
                            result = VerificationResult.fail(e.getMessage());
                        }
                        last = result;
                        history.add(result);
                        if (result.passed()) {
                            state = TargetStatus.PASSED;
                        } else {
                            log.info("{} failed verification in sub-iteration {}/{}: {}",
                                    target.wireName(), subIteration, max, result.diagnostics());
                            diagnostics = result.diagnostics();
                            state = subIteration >= max ? TargetStatus.FAILED_EXHAUSTED : TargetStatus.CODING;
                        }
                    }
                    default -> throw new IllegalStateException("Unexpected runner state " + state);
                }
            }
        } catch (RunCancelledException e) {
            log.info("{} stopped in state {} after {} sub-iteration(s)", target.wireName(), state, subIteration);
            return new SubsystemOutcome(target, true, state, subIteration, max, artifacts, last, history,
                    System.currentTimeMillis() - start, true);
        }

        long durationMs = System.currentTimeMillis() - start;
        if (metrics != null) {
            metrics.recordSubsystemDuration(target, durationMs);
            metrics.recordSubIterations(target, state, subIteration);
        }

        var payload = new HashMap<String, Object>();
        payload.put("fileCount", artifacts.size());
        payload.put("diagnostics", last == null ? List.of() : last.diagnostics());
        if (state == TargetStatus.PASSED) {
            log.info("{} passed after {} sub-iteration(s)", target.wireName(), subIteration);
            publish(RunEventType.TARGET_PASSED, assignment, subIteration,
                    target.wireName() + " passed verification", payload);
        } else {
            log.warn("{} exhausted its {} sub-iteration(s)", target.wireName(), max);
            publish(RunEventType.TARGET_FAILED, assignment, subIteration,
                    target.wireName() + " failed after " + subIteration + " sub-iteration(s)", payload);
        }
        return new SubsystemOutcome(target, true, state, subIteration, max, artifacts, last, history,
                durationMs, false);
    }

    private void publish(RunEventType type, SubsystemAssignment assignment, int subIteration,
                         String message, Map<String, Object> extra) {
        var payload = new HashMap<String, Object>(extra);
        payload.put("iteration", assignment.iteration());
        payload.put("subIteration", subIteration);
        payload.put("maxSubIterations", assignment.maxSubIterations());
        eventBus.publish(RunEvent.forTarget(type, assignment.runId(), assignment.target(), message, payload));
    }
}
