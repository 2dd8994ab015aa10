package com.twinforge.core.output;

import com.twinforge.core.config.TwinforgeProperties;
import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes delivered artifacts to {@code <output-dir>/<runId>/<target>/}. Paths that would
 * escape the target directory are skipped.
 */
@Component
public class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    private final Path outputRoot;

    @Autowired
    public ArtifactWriter(TwinforgeProperties properties) {
        this(properties.getOutput().getDir());
    }

    ArtifactWriter(String outputDir) {
        this.outputRoot = outputDir == null || outputDir.isBlank()
                ? null
                : Path.of(outputDir).toAbsolutePath().normalize();
    }

    public boolean isEnabled() {
        return outputRoot != null;
    }

    /**
     * @return the written file paths
     * @throws IOException if a directory or file cannot be written
     */
    public List<Path> write(String runId, Map<Target, ArtifactSet> artifactsByTarget) throws IOException {
        if (outputRoot == null) {
            return List.of();
        }
        var written = new ArrayList<Path>();
        for (Map.Entry<Target, ArtifactSet> entry : artifactsByTarget.entrySet()) {
            Path targetDir = outputRoot.resolve(runId).resolve(entry.getKey().wireName());
            Files.createDirectories(targetDir);
            for (Map.Entry<String, String> file : entry.getValue().files().entrySet()) {
                Path path = targetDir.resolve(file.getKey()).normalize();
                if (!path.startsWith(targetDir)) {
                    log.warn("Refusing to write {} outside {}", file.getKey(), targetDir);
                    continue;
                }
                Files.createDirectories(path.getParent());
                Files.writeString(path, file.getValue(), StandardCharsets.UTF_8);
                written.add(path);
            }
        }
        log.info("Wrote {} file(s) under {}", written.size(), outputRoot.resolve(runId));
        return written;
    }
}
