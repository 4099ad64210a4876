package com.taskweaver.dispatch.cli;

import com.taskweaver.core.engine.PlanningEngine;
import com.taskweaver.core.io.PlanJson;
import com.taskweaver.core.io.PlanParseException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: taskweaver validate &lt;plan.json&gt;
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Check a plan for structural and date problems")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan JSON file")
    private Path planFile;

    private final PlanningEngine planningEngine;
    private final PlanJson planJson;

    public ValidateCommand(PlanningEngine planningEngine, PlanJson planJson) {
        this.planningEngine = planningEngine;
        this.planJson = planJson;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        try {
            var plan = planJson.read(planFile);
            var diagnostics = planningEngine.validate(plan);
            if (diagnostics.isEmpty()) {
                ConsoleOutput.success("Plan '" + plan.title() + "' is valid (" + plan.tasks().size() + " tasks)");
                return ExitCodes.OK;
            }
            ConsoleOutput.error("Found " + diagnostics.size() + " problem(s):");
            ConsoleOutput.diagnostics(diagnostics);
            return ExitCodes.FAILED;
        } catch (PlanParseException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.of(e);
        }
    }
}
