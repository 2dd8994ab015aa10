package com.twinforge.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.stream.Stream;

/**
 * CLI command: twinforge status &lt;run-id&gt;
 * <p>
 * Asks a running server for a run snapshot, or follows its event stream with {@code --watch}.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check run status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    private boolean watch;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})",
            defaultValue = "8080")
    private int port;

    private final ObjectMapper objectMapper;
    private final HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    public StatusCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            if (watch) {
                runWatchMode();
            } else {
                printSnapshot();
            }
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Twinforge server at localhost:" + port);
            ConsoleOutput.info("Start the server first: twinforge serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
        } catch (IOException e) {
            ConsoleOutput.error("Status request failed: " + e.getMessage());
        }
    }

    private void printSnapshot() throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(runUri(""))
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() == 404) {
            ConsoleOutput.error("Run not found: " + runId);
            return;
        }
        if (response.statusCode() != 200) {
            ConsoleOutput.error("Server returned HTTP " + response.statusCode());
            return;
        }

        JsonNode run = objectMapper.readTree(response.body());
        System.out.println();
        System.out.println("RUN " + run.path("run_id").asText());
        System.out.println("Goal: " + run.path("goal").asText());
        System.out.println("Iteration: " + run.path("iteration").asInt() + "/" + run.path("max_iterations").asInt());

        String status = run.path("status").asText();
        switch (status) {
            case "DELIVERED" -> ConsoleOutput.success("Status: " + status);
            case "FAILED" -> ConsoleOutput.error("Status: " + status);
            default -> ConsoleOutput.info("Status: " + status);
        }

        JsonNode targets = run.path("targets");
        if (targets.isArray() && !targets.isEmpty()) {
            System.out.println();
            System.out.printf("  %-10s %-9s %-18s %-8s %s%n", "TARGET", "REQUIRED", "STATUS", "SUB", "FILES");
            System.out.println("  " + "-".repeat(56));
            for (JsonNode t : targets) {
                System.out.printf("  %-10s %-9s %-18s %d/%-6d %d%n",
                        t.path("target").asText(), t.path("required").asBoolean(),
                        t.path("status").asText(), t.path("sub_iteration").asInt(),
                        t.path("max_sub_iterations").asInt(), t.path("file_count").asInt());
            }
        }

        JsonNode judgment = run.path("judgment");
        if (judgment.isObject()) {
            System.out.println();
            ConsoleOutput.info("Judgment: " + (judgment.path("compatible").asBoolean() ? "compatible" : "incompatible")
                    + " - " + judgment.path("summary").asText());
        }
        if (!run.path("stop_reason").isNull() && !run.path("stop_reason").asText().isBlank()) {
            ConsoleOutput.info("Stop reason: " + run.path("stop_reason").asText());
        }

        JsonNode errors = run.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            System.out.println();
            ConsoleOutput.error("Errors (" + errors.size() + "):");
            for (JsonNode e : errors) {
                ConsoleOutput.error("  " + e.asText());
            }
        }
    }

    private void runWatchMode() throws IOException, InterruptedException {
        ConsoleOutput.info("Watching run " + runId + " (connecting to localhost:" + port + ")...");
        System.out.println();

        HttpRequest request = HttpRequest.newBuilder()
                .uri(runUri("/events"))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        HttpResponse<Stream<String>> response = client.send(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() == 404) {
            ConsoleOutput.error("Run not found: " + runId);
            return;
        }
        if (response.statusCode() != 200) {
            ConsoleOutput.error("Server returned HTTP " + response.statusCode());
            return;
        }

        final String[] currentEventType = {""};
        response.body().forEach(line -> {
            if (line.startsWith("event:")) {
                currentEventType[0] = line.substring(6).trim();
            } else if (line.startsWith("data:")) {
                String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                ConsoleOutput.watchEvent(eventType, line.substring(5).trim());
                currentEventType[0] = "";
            }
        });

        System.out.println();
        ConsoleOutput.info("Stream ended.");
    }

    private URI runUri(String suffix) {
        return URI.create("http://localhost:" + port + "/api/v1/runs/" + runId + suffix);
    }
}
