package com.twinforge.core.engine;

import com.twinforge.core.config.ExecutorConfig;
import com.twinforge.core.events.EventBus;
import com.twinforge.core.events.RunEvent;
import com.twinforge.core.events.RunEventType;
import com.twinforge.core.graph.TwinforgeGraph;
import com.twinforge.core.logging.MdcContext;
import com.twinforge.core.metrics.TwinforgeMetrics;
import com.twinforge.core.model.RunConfig;
import com.twinforge.core.model.RunSnapshot;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.state.RunState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Control surface of the engine: starts runs, stops them and reports their status.
 * <p>
 * A run is one invocation of the compiled {@link TwinforgeGraph}. Iterations inside a run
 * are strictly sequential; independent runs execute concurrently on the run executor.
 */
@Service
public class RunEngine {

    private static final Logger log = LoggerFactory.getLogger(RunEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final TwinforgeGraph graph;
    private final RunRegistry registry;
    private final EventBus eventBus;
    private final ExecutorService runExecutor;
    private final TwinforgeMetrics metrics;

    public RunEngine(TwinforgeGraph graph, RunRegistry registry, EventBus eventBus,
                     @Qualifier(ExecutorConfig.RUN_EXECUTOR) ExecutorService runExecutor,
                     @Autowired(required = false) TwinforgeMetrics metrics) {
        this.graph = graph;
        this.registry = registry;
        this.eventBus = eventBus;
        this.runExecutor = runExecutor;
        this.metrics = metrics;
    }

    /**
     * Starts a run in the background.
     *
     * @return the new run's id
     * @throws IllegalArgumentException if the goal is blank
     */
    public String start(String goal, RunConfig config) {
        String runId = create(goal, config);
        runExecutor.execute(() -> execute(runId, goal, config));
        return runId;
    }

    /**
     * Runs to completion on the caller's thread.
     *
     * @return the final graph state
     * @throws IllegalArgumentException if the goal is blank
     */
    public RunState runSync(String goal, RunConfig config) {
        String runId = create(goal, config);
        return execute(runId, goal, config);
    }

    /**
     * @return false if the run is unknown or already finished
     */
    public boolean stop(String runId) {
        return registry.requestStop(runId);
    }

    public Optional<RunSnapshot> getStatus(String runId) {
        return registry.snapshot(runId);
    }

    public List<RunSnapshot> listRuns() {
        return registry.snapshots();
    }

    /**
     * Generates a unique run ID in the format TWF-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("TWF-%d-%04d", year, count);
    }

    private String create(String goal, RunConfig config) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("goal must not be blank");
        }
        String runId = generateRunId();
        registry.register(runId, goal, config);
        eventBus.publish(RunEvent.of(RunEventType.RUN_CREATED, runId, "Run created",
                Map.of("goal", goal,
                        "maxIterations", config.maxIterations(),
                        "parallel", config.parallel())));
        return runId;
    }

    RunState execute(String runId, String goal, RunConfig config) {
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {} (max {} iteration(s), sub-iterations backend={} frontend={}, {}) - goal: {}",
                    runId, config.maxIterations(), config.backendMaxSubIterations(),
                    config.frontendMaxSubIterations(), config.parallel() ? "parallel" : "sequential", goal);

            var stateMap = new HashMap<String, Object>();
            stateMap.put("runId", runId);
            stateMap.put("goal", goal);
            stateMap.put("status", RunStatus.PLANNING.name());
            stateMap.put("runConfig", config);

            var runnableConfig = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            var state = graph.getCompiledGraph()
                    .invoke(Map.copyOf(stateMap), runnableConfig)
                    .orElseThrow(() -> new IllegalStateException("Graph execution returned empty state for run " + runId));

            log.info("Run {} finished: {} after {} iteration(s)", runId, state.status(), state.iteration());
            if (metrics != null) {
                metrics.recordRunResult(state.status().name());
                metrics.recordIterationDepth(state.iteration());
            }
            return state;
        } catch (Exception e) {
            log.error("Run {} failed unexpectedly: {}", runId, e.getMessage(), e);
            String reason = "Unexpected error: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            eventBus.publish(RunEvent.of(RunEventType.RUN_FAILED, runId, reason,
                    Map.of("reason", reason, "diagnostics", List.of(reason))));
            registry.markFailed(runId, reason);
            if (metrics != null) {
                metrics.recordRunResult(RunStatus.FAILED.name());
            }
            return new RunState(Map.of(
                    "runId", runId,
                    "goal", goal,
                    "status", RunStatus.FAILED.name(),
                    "runConfig", config,
                    "finalStatus", "failed",
                    "stopReason", reason,
                    "errors", List.of(reason)));
        } finally {
            MdcContext.clear();
        }
    }
}
