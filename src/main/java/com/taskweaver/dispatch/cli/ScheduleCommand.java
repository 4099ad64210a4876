package com.taskweaver.dispatch.cli;

import com.taskweaver.core.engine.PlanningEngine;
import com.taskweaver.core.engine.ScheduleReport;
import com.taskweaver.core.io.PlanJson;
import com.taskweaver.core.io.PlanParseException;
import com.taskweaver.core.scheduler.CycleDetectedException;
import com.taskweaver.core.scheduler.MissingStartDateException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.concurrent.Callable;

/**
 * CLI command: taskweaver schedule &lt;plan.json&gt; [-o out.json]
 * <p>
 * Schedules the plan and prints the dated tasks, the critical path and the statistics.
 * The scheduled plan is written back as JSON when an output path is given.
 */
@Command(name = "schedule", mixinStandardHelpOptions = true, description = "Compute all task dates for a plan")
@Component
public class ScheduleCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan JSON file")
    private Path planFile;

    @Option(names = {"--output", "-o"}, description = "Write the scheduled plan to this JSON file")
    private Path output;

    private final PlanningEngine planningEngine;
    private final PlanJson planJson;

    public ScheduleCommand(PlanningEngine planningEngine, PlanJson planJson) {
        this.planningEngine = planningEngine;
        this.planJson = planJson;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ScheduleReport report;
        try {
            report = planningEngine.run(planJson.read(planFile));
        } catch (PlanParseException | MissingStartDateException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.of(e);
        } catch (CycleDetectedException e) {
            ConsoleOutput.error("Scheduling failed: " + e.getMessage());
            return ExitCodes.of(e);
        }

        var plan = report.plan();
        System.out.println();
        System.out.println("PLAN " + report.planId());
        System.out.println("Title: " + plan.title());
        System.out.println("Working days: " + plan.workingDays());
        System.out.println();

        ConsoleOutput.taskTable(plan.tasks(), new HashSet<>(report.criticalPathIds()));
        System.out.println();
        ConsoleOutput.criticalPath(report.criticalPath());

        if (!report.diagnostics().isEmpty()) {
            System.out.println();
            ConsoleOutput.diagnostics(report.diagnostics());
        }

        ConsoleOutput.statistics(report.statistics());

        if (output != null) {
            try {
                planJson.write(plan, output);
                ConsoleOutput.success("Scheduled plan written to " + output);
            } catch (PlanParseException e) {
                ConsoleOutput.error(e.getMessage());
                return ExitCodes.of(e);
            }
        }
        return ExitCodes.OK;
    }
}
