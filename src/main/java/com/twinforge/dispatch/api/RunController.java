package com.twinforge.dispatch.api;

import com.twinforge.core.config.TwinforgeProperties;
import com.twinforge.core.engine.RunEngine;
import com.twinforge.core.model.RunConfig;
import com.twinforge.core.model.RunSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for the run lifecycle.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final RunEngine runEngine;
    private final TwinforgeProperties properties;
    private final SseStreamingService sseStreamingService;

    public RunController(RunEngine runEngine, TwinforgeProperties properties,
                         SseStreamingService sseStreamingService) {
        this.runEngine = runEngine;
        this.properties = properties;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/runs: start a run in the background.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> startRun(@RequestBody RunRequest request) {
        if (request.goal() == null || request.goal().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "goal is required"));
        }
        RunConfig config;
        try {
            config = toRunConfig(request);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        String runId = runEngine.start(request.goal(), config);
        log.info("Accepted run {}", runId);
        return ResponseEntity.accepted().body(Map.of(
                "run_id", runId,
                "status", "CREATED"));
    }

    /**
     * GET /api/v1/runs: every known run, newest first.
     */
    @GetMapping
    public ResponseEntity<List<RunResponse>> listRuns() {
        return ResponseEntity.ok(runEngine.listRuns().stream().map(RunResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<RunResponse> getRun(@PathVariable String id) {
        return runEngine.getStatus(id)
                .map(s -> ResponseEntity.ok(RunResponse.from(s)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/runs/{id}/stop: request a stop. 409 if the run already finished.
     */
    @PostMapping("/{id}/stop")
    public ResponseEntity<Map<String, String>> stopRun(@PathVariable String id) {
        Optional<RunSnapshot> snapshot = runEngine.getStatus(id);
        if (snapshot.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (snapshot.get().status().isTerminal() || !runEngine.stop(id)) {
            return ResponseEntity.status(409).body(Map.of(
                    "error", "Run " + id + " already finished with status " + snapshot.get().status()));
        }
        log.info("Stop requested for run {}", id);
        return ResponseEntity.accepted().body(Map.of(
                "run_id", id,
                "status", "STOPPING"));
    }

    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (runEngine.getStatus(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    private RunConfig toRunConfig(RunRequest request) {
        RunConfig config = properties.toRunConfig();
        if (request.maxIterations() != null) {
            config = config.withMaxIterations(request.maxIterations());
        }
        if (request.backendMaxSubIterations() != null || request.frontendMaxSubIterations() != null) {
            config = config.withMaxSubIterations(
                    request.backendMaxSubIterations() != null
                            ? request.backendMaxSubIterations() : config.backendMaxSubIterations(),
                    request.frontendMaxSubIterations() != null
                            ? request.frontendMaxSubIterations() : config.frontendMaxSubIterations());
        }
        if (request.parallel() != null) {
            config = config.withParallel(request.parallel());
        }
        return config;
    }
}
