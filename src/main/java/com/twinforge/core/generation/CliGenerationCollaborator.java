package com.twinforge.core.generation;

import com.twinforge.core.collaborator.CollaboratorException;
import com.twinforge.core.collaborator.GenerationCollaborator;
import com.twinforge.core.collaborator.GenerationRequest;
import com.twinforge.core.config.TwinforgeProperties;
import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Generates files by running a CLI coding assistant inside a per-run, per-target workspace.
 * <p>
 * The prior artifact set is written into the workspace first so the assistant edits it in
 * place. Afterwards the workspace is scanned for source files; when the assistant printed
 * files instead of writing them, its output is parsed as a fallback.
 */
public class CliGenerationCollaborator implements GenerationCollaborator {

    private static final Logger log = LoggerFactory.getLogger(CliGenerationCollaborator.class);

    private static final Set<String> EXCLUDED_DIRS = Set.of(
            ".git", "node_modules", "venv", ".venv", "env", "__pycache__", "dist", "build", "target");
    private static final int OUTPUT_TAIL_CHARS = 600;

    private final List<String> command;
    private final Path workspaceRoot;
    private final List<String> includeExtensions;
    private final ArtifactParser parser;

    public CliGenerationCollaborator(TwinforgeProperties.Cli cli, ArtifactParser parser) {
        this(cli.getCommand(), Path.of(cli.getWorkspaceDir()), cli.getIncludeExtensions(), parser);
    }

    CliGenerationCollaborator(List<String> command, Path workspaceRoot, List<String> includeExtensions,
                              ArtifactParser parser) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("twinforge.generation.cli.command must not be empty");
        }
        this.command = List.copyOf(command);
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        this.includeExtensions = List.copyOf(includeExtensions);
        this.parser = parser;
    }

    @Override
    public ArtifactSet generate(GenerationRequest request) {
        Target target = request.target();
        Path workspace = workspaceRoot.resolve(request.runId()).resolve(target.wireName());
        Path logFile = workspaceRoot.resolve(request.runId())
                .resolve(target.wireName() + "-" + request.iteration() + "-" + request.subIteration() + ".log");
        try {
            Files.createDirectories(workspace);
            materialize(workspace, request.priorArtifacts());
        } catch (IOException e) {
            throw new CollaboratorException("Cannot prepare workspace " + workspace + ": " + e.getMessage(), e);
        }

        var fullCommand = new ArrayList<>(command);
        fullCommand.add(GenerationPromptBuilder.systemPrompt(target) + "\n\n"
                + GenerationPromptBuilder.build(request)
                + "\nCreate all files in the current working directory: " + workspace + "\n");
        log.info("Running {} in {}", command.get(0), workspace);

        String output = run(fullCommand, workspace, logFile);

        Map<String, String> files = scan(workspace);
        if (files.isEmpty()) {
            files = parser.parse(output);
            if (!files.isEmpty()) {
                log.info("CLI printed {} file(s) instead of writing them; materializing", files.size());
                try {
                    materialize(workspace, new ArtifactSet(files));
                } catch (IOException e) {
                    throw new CollaboratorException("Cannot write parsed files to " + workspace + ": " + e.getMessage(), e);
                }
            }
        }
        if (files.isEmpty()) {
            throw new CollaboratorException("Missing files: " + command.get(0) + " produced no files for "
                    + target.wireName());
        }
        log.info("CLI generated {} file(s) for {}", files.size(), target.wireName());
        return new ArtifactSet(files);
    }

    @Override
    public String providerName() {
        return "cli";
    }

    private String run(List<String> fullCommand, Path workspace, Path logFile) {
        Process process;
        try {
            process = new ProcessBuilder(fullCommand)
                    .directory(workspace.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile())
                    .start();
        } catch (IOException e) {
            throw new CollaboratorException("Cannot start " + command.get(0) + ": " + e.getMessage(), e);
        }

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            // timeout or stop request from the invoker
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CollaboratorException(command.get(0) + " was interrupted", e);
        }

        String output = readQuietly(logFile);
        if (exitCode != 0) {
            throw new CollaboratorException(command.get(0) + " exited with code " + exitCode + ": " + tail(output));
        }
        return output;
    }

    private Map<String, String> scan(Path workspace) {
        var files = new LinkedHashMap<String, String>();
        try (Stream<Path> paths = Files.walk(workspace)) {
            paths.filter(Files::isRegularFile)
                    .filter(p -> !isExcluded(workspace.relativize(p)))
                    .filter(p -> includeExtensions.stream().anyMatch(ext -> p.getFileName().toString().endsWith(ext)))
                    .sorted()
                    .forEach(p -> files.put(workspace.relativize(p).toString().replace('\\', '/'), readQuietly(p)));
        } catch (IOException | UncheckedIOException e) {
            throw new CollaboratorException("Cannot scan workspace " + workspace + ": " + e.getMessage(), e);
        }
        return files;
    }

    private static boolean isExcluded(Path relative) {
        for (Path part : relative) {
            if (EXCLUDED_DIRS.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }

    private static void materialize(Path workspace, ArtifactSet artifacts) throws IOException {
        for (Map.Entry<String, String> file : artifacts.files().entrySet()) {
            Path path = workspace.resolve(file.getKey()).normalize();
            if (!path.startsWith(workspace)) {
                log.warn("Skipping artifact outside workspace: {}", file.getKey());
                continue;
            }
            Files.createDirectories(path.getParent());
            Files.writeString(path, file.getValue(), StandardCharsets.UTF_8);
        }
    }

    private static String readQuietly(Path path) {
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Could not read {}: {}", path, e.getMessage());
            return "";
        }
    }

    private static String tail(String output) {
        String trimmed = output.strip();
        return trimmed.length() <= OUTPUT_TAIL_CHARS ? trimmed : trimmed.substring(trimmed.length() - OUTPUT_TAIL_CHARS);
    }
}
