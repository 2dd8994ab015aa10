package com.twinforge.core.engine;

import com.twinforge.core.collaborator.CancellationToken;
import com.twinforge.core.events.EventBus;
import com.twinforge.core.events.RunEvent;
import com.twinforge.core.model.JudgmentResult;
import com.twinforge.core.model.RunConfig;
import com.twinforge.core.model.RunSnapshot;
import com.twinforge.core.model.RunSnapshot.TargetSnapshot;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.model.Target;
import com.twinforge.core.model.TargetStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory status store for runs.
 * <p>
 * Holds the cancellation token of every known run and a {@link RunSnapshot} rebuilt from the
 * event stream. Snapshot updates for one run are serialized; once a run reaches a terminal
 * status, later events cannot move it out of it. Only the most recently finished runs are
 * kept; older finished runs are evicted.
 */
@Component
public class RunRegistry {

    private static final Logger log = LoggerFactory.getLogger(RunRegistry.class);

    static final int DEFAULT_MAX_FINISHED_RUNS = 200;

    private final ConcurrentHashMap<String, RunHandle> runs = new ConcurrentHashMap<>();
    private final int maxFinishedRuns;

    @Autowired
    public RunRegistry(EventBus eventBus) {
        this(eventBus, DEFAULT_MAX_FINISHED_RUNS);
    }

    RunRegistry(EventBus eventBus, int maxFinishedRuns) {
        this.maxFinishedRuns = maxFinishedRuns;
        eventBus.subscribeAll(this::onEvent);
    }

    /**
     * Registers a new run in CREATED state and returns its handle.
     */
    public RunHandle register(String runId, String goal, RunConfig config) {
        var now = Instant.now();
        var snapshot = new RunSnapshot(runId, goal, RunStatus.CREATED, 0, config.maxIterations(),
                Map.of(), null, "", "", List.of(), now, now);
        var handle = new RunHandle(runId, new CancellationToken(runId), snapshot);
        RunHandle existing = runs.putIfAbsent(runId, handle);
        if (existing != null) {
            throw new IllegalStateException("Run " + runId + " is already registered");
        }
        return handle;
    }

    /**
     * Token of the given run. Unknown runs get a handle on first use so that a stop request
     * can still reach them.
     */
    public CancellationToken tokenFor(String runId) {
        return runs.computeIfAbsent(runId, id -> {
            var now = Instant.now();
            return new RunHandle(id, new CancellationToken(id), new RunSnapshot(id, "", RunStatus.CREATED,
                    0, RunConfig.defaults().maxIterations(), Map.of(), null, "", "", List.of(), now, now));
        }).token();
    }

    /**
     * Requests a stop.
     *
     * @return false if the run is unknown or already terminal
     */
    public boolean requestStop(String runId) {
        RunHandle handle = runs.get(runId);
        if (handle == null || handle.snapshot().status().isTerminal()) {
            return false;
        }
        if (handle.token().cancel()) {
            log.info("Stop requested for run {}", runId);
        }
        return true;
    }

    public Optional<RunSnapshot> snapshot(String runId) {
        RunHandle handle = runs.get(runId);
        return handle == null ? Optional.empty() : Optional.of(handle.snapshot());
    }

    /** Every known run, newest first. */
    public List<RunSnapshot> snapshots() {
        return runs.values().stream()
                .map(RunHandle::snapshot)
                .sorted(Comparator.comparing(RunSnapshot::createdAt).reversed())
                .toList();
    }

    /**
     * Forces a terminal FAILED status, for failures that escaped the graph.
     */
    public void markFailed(String runId, String reason) {
        RunHandle handle = runs.get(runId);
        if (handle == null) {
            return;
        }
        handle.update(s -> {
            if (s.status().isTerminal()) {
                return s;
            }
            var errors = new ArrayList<>(s.errors());
            errors.add(reason);
            return copy(s, RunStatus.FAILED, s.iteration(), s.targets(), s.judgment(), "failed", reason, errors);
        });
        evictFinished();
    }

    void onEvent(RunEvent event) {
        RunHandle handle = runs.get(event.runId());
        if (handle == null) {
            log.debug("Ignoring {} for unregistered run {}", event.eventType(), event.runId());
            return;
        }
        handle.update(s -> s.status().isTerminal() ? s : apply(s, event));
        if (event.type().isTerminal()) {
            evictFinished();
        }
    }

    private void evictFinished() {
        List<RunHandle> finished = runs.values().stream()
                .filter(h -> h.snapshot().status().isTerminal())
                .sorted(Comparator.comparing(h -> h.snapshot().updatedAt()))
                .toList();
        for (int i = 0; i < finished.size() - maxFinishedRuns; i++) {
            RunHandle handle = finished.get(i);
            if (runs.remove(handle.runId(), handle)) {
                log.debug("Evicted finished run {}", handle.runId());
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static RunSnapshot apply(RunSnapshot s, RunEvent event) {
        var targets = new EnumMap<Target, TargetSnapshot>(Target.class);
        targets.putAll(s.targets());
        int iteration = event.intValue("iteration", s.iteration());
        return switch (event.type()) {
            case RUN_CREATED -> s;
            case PLANNING_STARTED -> copy(s, RunStatus.PLANNING, iteration, targets, s.judgment(),
                    s.finalStatus(), s.stopReason(), s.errors());
            case PLANNING_COMPLETED, BUILD_STARTED -> copy(s, RunStatus.RUNNING, iteration, targets, s.judgment(),
                    s.finalStatus(), s.stopReason(), s.errors());
            case TARGET_CODING, TARGET_VERIFYING, TARGET_PASSED, TARGET_FAILED -> {
                TargetStatus status = switch (event.type()) {
                    case TARGET_CODING -> TargetStatus.CODING;
                    case TARGET_VERIFYING -> TargetStatus.VERIFYING;
                    case TARGET_PASSED -> TargetStatus.PASSED;
                    default -> TargetStatus.FAILED_EXHAUSTED;
                };
                TargetSnapshot previous = targets.get(event.target());
                Object rawDiagnostics = event.payload().get("diagnostics");
                List<String> diagnostics = rawDiagnostics instanceof List<?> l
                        ? (List<String>) l
                        : previous == null ? List.of() : previous.diagnostics();
                int fileCount = event.intValue("fileCount", previous == null ? 0 : previous.fileCount());
                targets.put(event.target(), new TargetSnapshot(event.target(), true, status,
                        event.intValue("subIteration", 0), event.intValue("maxSubIterations", 0),
                        diagnostics, fileCount));
                yield copy(s, RunStatus.RUNNING, iteration, targets, s.judgment(),
                        s.finalStatus(), s.stopReason(), s.errors());
            }
            case TARGET_SKIPPED -> {
                targets.put(event.target(), new TargetSnapshot(event.target(), false, TargetStatus.PASSED,
                        0, 0, List.of(), 0));
                yield copy(s, s.status(), iteration, targets, s.judgment(), s.finalStatus(), s.stopReason(), s.errors());
            }
            case JUDGING_STARTED -> copy(s, RunStatus.JUDGING, iteration, targets, s.judgment(),
                    s.finalStatus(), s.stopReason(), s.errors());
            case JUDGMENT_RESULT -> {
                Object issues = event.payload().get("issues");
                Object recommendations = event.payload().get("recommendations");
                var judgment = new JudgmentResult(Boolean.TRUE.equals(event.payload().get("compatible")),
                        issues instanceof List<?> l ? (List<String>) l : List.of(),
                        recommendations instanceof List<?> r ? (List<String>) r : List.of(),
                        String.valueOf(event.payload().getOrDefault("summary", "")));
                yield copy(s, RunStatus.JUDGING, iteration, targets, judgment, s.finalStatus(), s.stopReason(), s.errors());
            }
            case REPLANNING_STARTED -> copy(s, RunStatus.REPLANNING, iteration, targets, s.judgment(),
                    s.finalStatus(), s.stopReason(), s.errors());
            case RUN_DELIVERED -> copy(s, RunStatus.DELIVERED, iteration, targets, s.judgment(),
                    String.valueOf(event.payload().getOrDefault("finalStatus", "success")), s.stopReason(), s.errors());
            case RUN_FAILED -> {
                Object diagnostics = event.payload().get("diagnostics");
                List<String> errors = diagnostics instanceof List<?> l ? (List<String>) l : s.errors();
                yield copy(s, RunStatus.FAILED, iteration, targets, s.judgment(), "failed",
                        String.valueOf(event.payload().getOrDefault("reason", event.message())), errors);
            }
            case RUN_STOPPED -> copy(s, RunStatus.STOPPED, iteration, targets, s.judgment(), "stopped",
                    String.valueOf(event.payload().getOrDefault("reason", event.message())), s.errors());
        };
    }

    private static RunSnapshot copy(RunSnapshot s, RunStatus status, int iteration, Map<Target, TargetSnapshot> targets,
                                    JudgmentResult judgment, String finalStatus, String stopReason, List<String> errors) {
        return new RunSnapshot(s.runId(), s.goal(), status, iteration, s.maxIterations(), targets, judgment,
                finalStatus, stopReason, errors, s.createdAt(), Instant.now());
    }

    /**
     * Registry entry for one run.
     */
    public static final class RunHandle {

        private final String runId;
        private final CancellationToken token;
        private volatile RunSnapshot snapshot;

        RunHandle(String runId, CancellationToken token, RunSnapshot snapshot) {
            this.runId = runId;
            this.token = token;
            this.snapshot = snapshot;
        }

        public String runId() {
            return runId;
        }

        public CancellationToken token() {
            return token;
        }

        public RunSnapshot snapshot() {
            return snapshot;
        }

        private synchronized void update(UnaryOperator<RunSnapshot> change) {
            snapshot = change.apply(snapshot);
        }
    }
}
