package com.twinforge.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.twinforge.core.config.TwinforgeProperties;
import com.twinforge.core.engine.RunEngine;
import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.JudgmentResult;
import com.twinforge.core.model.RunConfig;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.model.SubsystemOutcome;
import com.twinforge.core.model.Target;
import com.twinforge.core.model.TargetStatus;
import com.twinforge.core.model.VerificationResult;
import com.twinforge.core.state.RunState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Exercises the picocli command tree directly, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static RunState finalState(RunStatus status, String finalStatus, String stopReason) {
        var data = new HashMap<String, Object>();
        data.put("runId", "TF-2026-0001");
        data.put("goal", "Build a todo app");
        data.put("status", status.name());
        data.put("iteration", 1);
        data.put("planSummary", "Todo app");
        data.put("finalStatus", finalStatus);
        data.put("stopReason", stopReason);
        data.put(RunState.outcomeKey(Target.BACKEND), new SubsystemOutcome(Target.BACKEND, true,
                TargetStatus.PASSED, 1, 2, new ArtifactSet(Map.of("main.py", "x")), VerificationResult.pass(),
                List.of(VerificationResult.pass()), 1200L, false));
        data.put("judgment", JudgmentResult.compatible("Only backend was required"));
        return new RunState(data);
    }

    private CommandLine.IFactory createFactory(RunEngine engine) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(engine, new TwinforgeProperties());
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(new ObjectMapper());
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(RunEngine engine, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new TwinforgeCommand(), createFactory(engine));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private CliResult execute(String... args) {
        return execute(mock(RunEngine.class), args);
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("status"));
            assertTrue(result.output().contains("serve"));
            assertTrue(result.output().contains("help"));
        }

        @Test
        @DisplayName("--version shows the version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Twinforge 0.1.0"));
        }

        @Test
        @DisplayName("run --help shows the budget options")
        void runHelp() {
            CliResult result = execute("run", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--max-iterations"));
            assertTrue(result.output().contains("--max-sub-iterations"));
            assertTrue(result.output().contains("--sequential"));
        }

        @Test
        @DisplayName("status --help shows the watch option")
        void statusHelp() {
            CliResult result = execute("status", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Check run status"));
            assertTrue(result.output().contains("--watch"));
        }
    }

    @Nested
    @DisplayName("run command")
    class RunTests {

        @Test
        @DisplayName("a delivered run exits 0 and prints the outcome")
        void delivered() {
            RunEngine engine = mock(RunEngine.class);
            when(engine.runSync(eq("Build a todo app"), any(RunConfig.class)))
                    .thenReturn(finalState(RunStatus.DELIVERED, "success", ""));

            CliResult result = execute(engine, "run", "Build a todo app");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("RUN TF-2026-0001"));
            assertTrue(result.output().contains("Plan: Todo app"));
            assertTrue(result.output().contains("backend"));
            assertTrue(result.output().contains("Run delivered (success)."));
        }

        @Test
        @DisplayName("a failed run exits 1 with the reason")
        void failed() {
            RunEngine engine = mock(RunEngine.class);
            when(engine.runSync(anyString(), any(RunConfig.class)))
                    .thenReturn(finalState(RunStatus.FAILED, "failed", "Iteration budget exhausted"));

            CliResult result = execute(engine, "run", "Build a todo app");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Run failed: Iteration budget exhausted"));
        }

        @Test
        @DisplayName("budget options reach the run configuration")
        void options() {
            RunEngine engine = mock(RunEngine.class);
            when(engine.runSync(anyString(), any(RunConfig.class)))
                    .thenReturn(finalState(RunStatus.DELIVERED, "success", ""));

            execute(engine, "run", "-n", "3", "-m", "4", "--sequential", "Notes");

            ArgumentCaptor<RunConfig> captor = ArgumentCaptor.forClass(RunConfig.class);
            verify(engine).runSync(eq("Notes"), captor.capture());
            assertEquals(3, captor.getValue().maxIterations());
            assertEquals(4, captor.getValue().backendMaxSubIterations());
            assertEquals(4, captor.getValue().frontendMaxSubIterations());
            assertFalse(captor.getValue().parallel());
        }

        @Test
        @DisplayName("an out-of-range budget exits 1 without starting a run")
        void invalidBudget() {
            RunEngine engine = mock(RunEngine.class);

            CliResult result = execute(engine, "run", "--max-iterations", "99", "Notes");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Invalid options"));
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("an engine exception exits 1 with the root cause")
        void engineError() {
            RunEngine engine = mock(RunEngine.class);
            when(engine.runSync(anyString(), any(RunConfig.class)))
                    .thenThrow(new IllegalStateException("graph failed", new RuntimeException("out of threads")));

            CliResult result = execute(engine, "run", "Notes");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("out of threads"));
        }

        @Test
        @DisplayName("a missing goal is a usage error")
        void missingGoal() {
            CliResult result = execute("run");
            assertNotEquals(0, result.exitCode());
        }
    }

    @Nested
    @DisplayName("status command")
    class StatusTests {

        @Test
        @DisplayName("reports an unreachable server")
        void unreachable() {
            CliResult result = execute("status", "--port", "1", "TF-2026-0001");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Cannot connect to Twinforge server at localhost:1")
                    || result.output().contains("Status request failed"), result.output());
        }
    }

    @Test
    @DisplayName("formats durations for humans")
    void formatDuration() {
        assertEquals("850ms", ConsoleOutput.formatDuration(850));
        assertEquals("12s", ConsoleOutput.formatDuration(12_400));
        assertEquals("2m 5s", ConsoleOutput.formatDuration(125_000));
    }
}
