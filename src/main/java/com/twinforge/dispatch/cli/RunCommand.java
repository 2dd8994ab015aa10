package com.twinforge.dispatch.cli;

import com.twinforge.core.config.TwinforgeProperties;
import com.twinforge.core.engine.RunEngine;
import com.twinforge.core.model.RunConfig;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.state.RunState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: twinforge run "&lt;goal&gt;"
 * <p>
 * Runs the whole Plan, Build, Judge loop synchronously and prints each target's
 * outcome, the last judgment and the final status. Exits 0 only when the run is delivered.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Build an application from a goal")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language goal")
    private String goal;

    @Option(names = {"--max-iterations", "-n"}, description = "Top-level iteration budget")
    private Integer maxIterations;

    @Option(names = {"--max-sub-iterations", "-m"}, description = "Coding/Verifying budget for every target")
    private Integer maxSubIterations;

    @Option(names = "--sequential", description = "Run targets one after another instead of concurrently")
    private boolean sequential;

    private final RunEngine runEngine;
    private final TwinforgeProperties properties;

    public RunCommand(RunEngine runEngine, TwinforgeProperties properties) {
        this.runEngine = runEngine;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        RunConfig config;
        try {
            config = buildConfig();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid options: " + e.getMessage());
            return 1;
        }

        ConsoleOutput.info("Planning...");
        RunState finalState;
        try {
            finalState = runEngine.runSync(goal, config);
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + rootCauseMessage(e));
            return 1;
        }

        System.out.println();
        System.out.println("RUN " + finalState.runId());
        System.out.println("Goal: " + goal);
        System.out.println("Iterations: " + finalState.iteration() + "/" + finalState.maxIterations());
        if (!finalState.planSummary().isBlank()) {
            System.out.println("Plan: " + finalState.planSummary());
        }
        System.out.println();

        var outcomes = finalState.outcomes();
        if (!outcomes.isEmpty()) {
            System.out.println("TARGETS:");
            outcomes.values().forEach(ConsoleOutput::target);
        }
        finalState.judgment().ifPresent(judgment -> {
            System.out.println();
            ConsoleOutput.judgment(judgment);
        });

        for (String path : finalState.deliveredPaths()) {
            ConsoleOutput.success(path);
        }

        var errors = finalState.errors();
        if (!errors.isEmpty()) {
            System.out.println();
            ConsoleOutput.error("Errors (" + errors.size() + "):");
            for (var e : errors) {
                ConsoleOutput.error("  " + e);
            }
        }

        System.out.println();
        RunStatus status = finalState.status();
        if (status == RunStatus.DELIVERED) {
            ConsoleOutput.success("Run delivered (" + finalState.finalStatus() + ").");
            return 0;
        }
        if (status == RunStatus.STOPPED) {
            ConsoleOutput.info("Run stopped.");
        } else {
            ConsoleOutput.error("Run " + status.name().toLowerCase() + ": " + finalState.stopReason());
        }
        return 1;
    }

    RunConfig buildConfig() {
        RunConfig config = properties.toRunConfig();
        if (maxIterations != null) {
            config = config.withMaxIterations(maxIterations);
        }
        if (maxSubIterations != null) {
            config = config.withMaxSubIterations(maxSubIterations, maxSubIterations);
        }
        if (sequential) {
            config = config.withParallel(false);
        }
        return config;
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
