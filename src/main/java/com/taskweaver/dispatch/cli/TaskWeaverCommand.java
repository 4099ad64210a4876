package com.taskweaver.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for TaskWeaver.
 * Routes to subcommands: schedule, validate, stats, inspect, serve.
 */
@Command(
        name = "taskweaver",
        mixinStandardHelpOptions = true,
        version = "TaskWeaver 0.1.0",
        description = "Working-day project scheduler with critical path analysis",
        subcommands = {
                ScheduleCommand.class,
                ValidateCommand.class,
                StatsCommand.class,
                InspectCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskWeaverCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    /**
     * Command line for {@code root}, with plan failures that escape a subcommand mapped
     * through {@link ExitCodes#of}.
     */
    public static CommandLine commandLine(TaskWeaverCommand root, CommandLine.IFactory factory) {
        return new CommandLine(root, factory)
                .setExitCodeExceptionMapper(ExitCodes::of);
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
