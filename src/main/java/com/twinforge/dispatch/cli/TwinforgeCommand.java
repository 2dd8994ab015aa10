package com.twinforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Twinforge.
 * Routes to subcommands: run, status, serve.
 */
@Command(
        name = "twinforge",
        mixinStandardHelpOptions = true,
        version = "Twinforge 0.1.0",
        description = "Plans, generates and judges two-tier applications",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TwinforgeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
