package com.twinforge.core.nodes;

import com.twinforge.core.events.EventBus;
import com.twinforge.core.events.RunEvent;
import com.twinforge.core.events.RunEventType;
import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.model.SubsystemOutcome;
import com.twinforge.core.model.Target;
import com.twinforge.core.output.ArtifactWriter;
import com.twinforge.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal success: collects the artifacts of every required target and writes them out.
 * A write failure is recorded but does not undo the delivery.
 */
@Component
public class DeliverRunNode {

    private static final Logger log = LoggerFactory.getLogger(DeliverRunNode.class);

    private final ArtifactWriter writer;
    private final EventBus eventBus;

    public DeliverRunNode(ArtifactWriter writer, EventBus eventBus) {
        this.writer = writer;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(RunState state) {
        String runId = state.runId();
        var artifacts = new EnumMap<Target, ArtifactSet>(Target.class);
        boolean allPassed = true;
        for (SubsystemOutcome outcome : state.outcomes().values()) {
            if (!outcome.required()) {
                continue;
            }
            artifacts.put(outcome.target(), outcome.artifacts());
            allPassed &= outcome.passed();
        }
        boolean compatible = state.judgment().map(j -> j.compatible()).orElse(false);
        String finalStatus = allPassed && compatible ? "success" : "partial";

        var updates = new HashMap<String, Object>();
        List<String> paths = List.of();
        try {
            paths = writer.write(runId, artifacts).stream().map(Path::toString).toList();
        } catch (IOException e) {
            log.error("Could not write delivered artifacts for {}: {}", runId, e.getMessage());
            finalStatus = "partial";
            updates.put("errors", List.of("Artifact write failed: " + e.getMessage()));
        }

        int fileCount = artifacts.values().stream().mapToInt(ArtifactSet::size).sum();
        log.info("Run {} delivered ({}) after {} iteration(s): {} file(s)", runId, finalStatus,
                state.iteration(), fileCount);
        eventBus.publish(RunEvent.of(RunEventType.RUN_DELIVERED, runId,
                "Delivered " + fileCount + " file(s) after " + state.iteration() + " iteration(s)",
                Map.of("iteration", state.iteration(),
                        "finalStatus", finalStatus,
                        "fileCount", fileCount,
                        "writtenFiles", paths.size())));

        updates.put("status", RunStatus.DELIVERED.name());
        updates.put("finalStatus", finalStatus);
        updates.put("deliveredPaths", paths);
        return updates;
    }
}
