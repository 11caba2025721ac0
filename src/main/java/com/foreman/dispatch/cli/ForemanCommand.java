package com.foreman.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Foreman.
 */
@Command(
        name = "foreman",
        mixinStandardHelpOptions = true,
        version = "Foreman 0.1.0",
        description = "Coordinates planner, builder, checker, tester and documenter agents through a project",
        subcommands = {
                StartCommand.class,
                ResumeCommand.class,
                PauseCommand.class,
                DispatchCommand.class,
                CompleteCommand.class,
                AddTaskCommand.class,
                UnblockCommand.class,
                StatusCommand.class,
                ReportCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ForemanCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
