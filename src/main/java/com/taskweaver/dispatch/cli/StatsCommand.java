package com.taskweaver.dispatch.cli;

import com.taskweaver.core.engine.PlanningEngine;
import com.taskweaver.core.io.PlanJson;
import com.taskweaver.core.io.PlanParseException;
import com.taskweaver.core.scheduler.CycleDetectedException;
import com.taskweaver.core.scheduler.MissingStartDateException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: taskweaver stats &lt;plan.json&gt;
 * <p>
 * Schedules the plan and prints only the aggregate statistics.
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show plan statistics")
@Component
public class StatsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan JSON file")
    private Path planFile;

    private final PlanningEngine planningEngine;
    private final PlanJson planJson;

    public StatsCommand(PlanningEngine planningEngine, PlanJson planJson) {
        this.planningEngine = planningEngine;
        this.planJson = planJson;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            var report = planningEngine.run(planJson.read(planFile));
            ConsoleOutput.info("Plan " + report.planId() + ": " + report.plan().title());
            ConsoleOutput.statistics(report.statistics());
            var plan = report.plan();
            for (String section : plan.sections()) {
                System.out.printf("    %-24s %d tasks%n", section, plan.tasksInSection(section).size());
            }
            return ExitCodes.OK;
        } catch (PlanParseException | CycleDetectedException | MissingStartDateException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.of(e);
        }
    }
}
