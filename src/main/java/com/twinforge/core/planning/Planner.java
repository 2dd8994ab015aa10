package com.twinforge.core.planning;

import com.twinforge.core.collaborator.CancellationToken;
import com.twinforge.core.collaborator.CollaboratorException;
import com.twinforge.core.collaborator.CollaboratorInvoker;
import com.twinforge.core.collaborator.PlanningCollaborator;
import com.twinforge.core.collaborator.PlanningFailedException;
import com.twinforge.core.collaborator.RunCancelledException;
import com.twinforge.core.metrics.TwinforgeMetrics;
import com.twinforge.core.model.PlanResult;
import com.twinforge.core.model.RunConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Produces the plan and contract for one top-level iteration.
 * <p>
 * A failed or timed-out planning call raises {@link PlanningFailedException}, and so does a
 * plan that needs neither target, whichever collaborator produced it. With
 * {@link RunConfig#planningAttempts()} above one, the call is retried with exponential
 * backoff first; a stop request interrupts the wait.
 */
@Service
public class Planner {

    private static final Logger log = LoggerFactory.getLogger(Planner.class);

    private final PlanningCollaborator collaborator;
    private final CollaboratorInvoker invoker;
    private final TwinforgeMetrics metrics;

    public Planner(PlanningCollaborator collaborator, CollaboratorInvoker invoker,
                   @Autowired(required = false) TwinforgeMetrics metrics) {
        this.collaborator = collaborator;
        this.invoker = invoker;
        this.metrics = metrics;
    }

    /**
     * @param feedback replanning feedback, empty on the first iteration
     * @throws PlanningFailedException when every attempt failed
     * @throws RunCancelledException   when a stop was requested
     */
    public PlanResult plan(String goal, List<String> feedback, RunConfig config, CancellationToken token) {
        List<String> input = feedback == null ? List.of() : List.copyOf(feedback);
        Duration backoff = config.planningBackoff();
        CollaboratorException lastError = null;
        long start = System.currentTimeMillis();

        for (int attempt = 1; attempt <= config.planningAttempts(); attempt++) {
            if (attempt > 1) {
                log.info("Retrying planning in {} ms (attempt {}/{})", backoff.toMillis(), attempt,
                        config.planningAttempts());
                awaitBackoff(backoff, token);
                backoff = backoff.multipliedBy(2);
            }
            try {
                PlanResult result = invoker.invoke("planning", "plan",
                        () -> requireTarget(collaborator.plan(goal, input)), config.collaboratorTimeout(), token);
                if (metrics != null) {
                    metrics.recordPlanningDuration(System.currentTimeMillis() - start);
                }
                return result;
            } catch (RunCancelledException e) {
                throw e;
            } catch (CollaboratorException e) {
                lastError = e;
                log.warn("Planning attempt {}/{} failed: {}", attempt, config.planningAttempts(), e.getMessage());
            }
        }
        throw new PlanningFailedException("Planning failed after " + config.planningAttempts()
                + " attempt(s): " + lastError.getMessage(), config.planningAttempts(), lastError);
    }

    private static PlanResult requireTarget(PlanResult result) {
        if (result == null) {
            throw new CollaboratorException("Planning returned no plan");
        }
        if (!result.needsBackend() && !result.needsFrontend()) {
            throw new CollaboratorException("Plan requires neither a backend nor a frontend");
        }
        return result;
    }

    private static void awaitBackoff(Duration backoff, CancellationToken token) {
        if (backoff.isZero()) {
            token.throwIfCancelled();
            return;
        }
        var latch = new CountDownLatch(1);
        CancellationToken.Registration registration = token.onCancel(latch::countDown);
        try {
            latch.await(backoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException(token.runId());
        } finally {
            registration.remove();
        }
        token.throwIfCancelled();
    }
}
