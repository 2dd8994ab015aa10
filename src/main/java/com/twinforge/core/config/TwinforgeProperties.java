package com.twinforge.core.config;

import com.twinforge.core.model.RunConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "twinforge")
public class TwinforgeProperties {

    private Run run = new Run();
    private Collaborator collaborator = new Collaborator();
    private Planning planning = new Planning();
    private Generation generation = new Generation();
    private Output output = new Output();
    private Executor executor = new Executor();

    /**
     * Builds the default per-run configuration from these properties.
     *
     * @throws IllegalArgumentException if a configured budget is out of range
     */
    public RunConfig toRunConfig() {
        return new RunConfig(
                run.maxIterations,
                run.backendMaxSubIterations,
                run.frontendMaxSubIterations,
                run.parallel,
                Duration.ofSeconds(collaborator.timeoutSeconds),
                planning.maxAttempts,
                Duration.ofMillis(planning.backoffMs));
    }

    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }
    public Collaborator getCollaborator() { return collaborator; }
    public void setCollaborator(Collaborator collaborator) { this.collaborator = collaborator; }
    public Planning getPlanning() { return planning; }
    public void setPlanning(Planning planning) { this.planning = planning; }
    public Generation getGeneration() { return generation; }
    public void setGeneration(Generation generation) { this.generation = generation; }
    public Output getOutput() { return output; }
    public void setOutput(Output output) { this.output = output; }
    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }

    public static class Run {
        private int maxIterations = 10;
        private int backendMaxSubIterations = 2;
        private int frontendMaxSubIterations = 2;
        private boolean parallel = true;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public int getBackendMaxSubIterations() { return backendMaxSubIterations; }
        public void setBackendMaxSubIterations(int value) { this.backendMaxSubIterations = value; }
        public int getFrontendMaxSubIterations() { return frontendMaxSubIterations; }
        public void setFrontendMaxSubIterations(int value) { this.frontendMaxSubIterations = value; }
        public boolean isParallel() { return parallel; }
        public void setParallel(boolean parallel) { this.parallel = parallel; }
    }

    public static class Collaborator {
        private long timeoutSeconds = 180;

        public long getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Planning {
        private String provider = "llm";
        private int maxAttempts = 1;
        private long backoffMs = 2000;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getBackoffMs() { return backoffMs; }
        public void setBackoffMs(long backoffMs) { this.backoffMs = backoffMs; }
    }

    public static class Generation {
        private String provider = "llm";
        private Cli cli = new Cli();

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public Cli getCli() { return cli; }
        public void setCli(Cli cli) { this.cli = cli; }
    }

    public static class Cli {
        private List<String> command = new ArrayList<>(List.of("codex", "exec"));
        private String workspaceDir = "./workspace";
        private List<String> includeExtensions = new ArrayList<>(List.of(
                ".py", ".txt", ".json", ".yaml", ".yml", ".js", ".jsx", ".ts", ".tsx",
                ".html", ".css", ".java", ".xml", ".toml", ".md"));

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public String getWorkspaceDir() { return workspaceDir; }
        public void setWorkspaceDir(String workspaceDir) { this.workspaceDir = workspaceDir; }
        public List<String> getIncludeExtensions() { return includeExtensions; }
        public void setIncludeExtensions(List<String> includeExtensions) { this.includeExtensions = includeExtensions; }
    }

    public static class Output {
        private String dir = "./output";

        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }
    }

    public static class Executor {
        private int runThreads = 4;
        private int subsystemThreads = 4;

        public int getRunThreads() { return runThreads; }
        public void setRunThreads(int runThreads) { this.runThreads = runThreads; }
        public int getSubsystemThreads() { return subsystemThreads; }
        public void setSubsystemThreads(int subsystemThreads) { this.subsystemThreads = subsystemThreads; }
    }
}
