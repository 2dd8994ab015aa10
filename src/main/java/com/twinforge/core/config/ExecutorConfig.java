package com.twinforge.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for the three levels of concurrency: whole runs, subsystem runners
 * inside one iteration, and individual collaborator calls (which are awaited with a timeout).
 */
@Configuration
public class ExecutorConfig {

    public static final String RUN_EXECUTOR = "runExecutor";
    public static final String SUBSYSTEM_EXECUTOR = "subsystemExecutor";
    public static final String COLLABORATOR_EXECUTOR = "collaboratorExecutor";

    @Bean(name = RUN_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService runExecutor(TwinforgeProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecutor().getRunThreads(), named("twinforge-run-"));
    }

    @Bean(name = SUBSYSTEM_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService subsystemExecutor(TwinforgeProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecutor().getSubsystemThreads(), named("twinforge-subsystem-"));
    }

    @Bean(name = COLLABORATOR_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService collaboratorExecutor() {
        return Executors.newCachedThreadPool(named("twinforge-call-"));
    }

    static ThreadFactory named(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
