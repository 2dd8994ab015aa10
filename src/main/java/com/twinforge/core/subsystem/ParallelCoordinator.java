package com.twinforge.core.subsystem;

import com.twinforge.core.collaborator.CancellationToken;
import com.twinforge.core.config.ExecutorConfig;
import com.twinforge.core.events.EventBus;
import com.twinforge.core.events.RunEvent;
import com.twinforge.core.events.RunEventType;
import com.twinforge.core.logging.MdcContext;
import com.twinforge.core.model.RunConfig;
import com.twinforge.core.model.SubsystemOutcome;
import com.twinforge.core.model.Target;
import com.twinforge.core.model.TargetStatus;
import com.twinforge.core.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Fans the required targets of one iteration out to {@link SubsystemRunner}s and joins them.
 * <p>
 * In parallel mode every required runner starts at once and the join waits for all of them;
 * in sequential mode they run one after another on the caller's thread. Targets the plan
 * does not need are reported as skipped. Retry policy lives entirely inside the runners.
 */
@Service
public class ParallelCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ParallelCoordinator.class);

    private final SubsystemRunner runner;
    private final ExecutorService executor;
    private final EventBus eventBus;

    public ParallelCoordinator(SubsystemRunner runner,
                               @Qualifier(ExecutorConfig.SUBSYSTEM_EXECUTOR) ExecutorService executor,
                               EventBus eventBus) {
        this.runner = runner;
        this.executor = executor;
        this.eventBus = eventBus;
    }

    /**
     * @return one outcome per assignment, keyed by target, available only once every
     *         required runner has reached a terminal state or stopped
     */
    public Map<Target, SubsystemOutcome> runAll(List<SubsystemAssignment> assignments, RunConfig config,
                                                CancellationToken token) {
        var outcomes = new EnumMap<Target, SubsystemOutcome>(Target.class);
        var required = new ArrayList<SubsystemAssignment>();
        for (SubsystemAssignment assignment : assignments) {
            if (assignment.required()) {
                required.add(assignment);
            } else {
                log.info("Skipping {}: not required by the plan", assignment.target().wireName());
                eventBus.publish(RunEvent.forTarget(RunEventType.TARGET_SKIPPED, assignment.runId(),
                        assignment.target(), assignment.target().wireName() + " not required",
                        Map.of("iteration", assignment.iteration())));
                outcomes.put(assignment.target(), SubsystemOutcome.skipped(assignment.target()));
            }
        }

        if (config.parallel() && required.size() > 1) {
            runParallel(required, config, token).forEach(o -> outcomes.put(o.target(), o));
        } else {
            for (SubsystemAssignment assignment : required) {
                outcomes.put(assignment.target(), runSequential(assignment, config, token));
            }
        }
        log.info("Join complete: {}", outcomes.values().stream()
                .map(o -> o.target().wireName() + "=" + o.status() + (o.cancelled() ? "(stopped)" : ""))
                .toList());
        return outcomes;
    }

    private List<SubsystemOutcome> runParallel(List<SubsystemAssignment> required, RunConfig config,
                                               CancellationToken token) {
        var futures = new ArrayList<CompletableFuture<SubsystemOutcome>>();
        for (SubsystemAssignment assignment : required) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                MdcContext.setTarget(assignment.runId(), assignment.target());
                try {
                    return runner.run(assignment, config, token);
                } catch (Exception e) {
                    log.error("Runner for {} failed unexpectedly: {}", assignment.target().wireName(),
                            e.getMessage(), e);
                    return errorOutcome(assignment, e.getMessage());
                } finally {
                    MdcContext.clear();
                }
            }, executor));
        }

        // Full join: no outcome is read before every runner has finished
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private SubsystemOutcome runSequential(SubsystemAssignment assignment, RunConfig config,
                                           CancellationToken token) {
        if (token.isCancelled()) {
            return cancelledOutcome(assignment);
        }
        MdcContext.setTarget(assignment.runId(), assignment.target());
        try {
            return runner.run(assignment, config, token);
        } catch (Exception e) {
            log.error("Runner for {} failed unexpectedly: {}", assignment.target().wireName(), e.getMessage(), e);
            return errorOutcome(assignment, e.getMessage());
        } finally {
            MdcContext.clearTarget();
        }
    }

    private static SubsystemOutcome errorOutcome(SubsystemAssignment assignment, String message) {
        var result = VerificationResult.fail("Subsystem runner error: " + message);
        return new SubsystemOutcome(assignment.target(), true, TargetStatus.FAILED_EXHAUSTED, 0,
                assignment.maxSubIterations(), assignment.priorArtifacts(), result, List.of(result), 0L, false);
    }

    private static SubsystemOutcome cancelledOutcome(SubsystemAssignment assignment) {
        return new SubsystemOutcome(assignment.target(), true, TargetStatus.PENDING, 0,
                assignment.maxSubIterations(), assignment.priorArtifacts(), null, List.of(), 0L, true);
    }
}
