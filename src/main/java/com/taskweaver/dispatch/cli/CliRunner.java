package com.taskweaver.dispatch.cli;

import com.taskweaver.TaskWeaverApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree inside the Spring context and hands its
 * {@link ExitCodes exit code} back to Spring Boot.
 * <p>
 * In serve mode nothing is executed: the embedded web server owns the process.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final TaskWeaverCommand taskWeaverCommand;
    private final IFactory factory;
    private int exitCode = ExitCodes.OK;

    public CliRunner(TaskWeaverCommand taskWeaverCommand, IFactory factory) {
        this.taskWeaverCommand = taskWeaverCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (TaskWeaverApplication.isServeMode(args)) {
            return;
        }
        exitCode = TaskWeaverCommand.commandLine(taskWeaverCommand, factory).execute(args);
        if (exitCode != ExitCodes.OK) {
            log.debug("Command {} finished with exit code {}", String.join(" ", args), exitCode);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
