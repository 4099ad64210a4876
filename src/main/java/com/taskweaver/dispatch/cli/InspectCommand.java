package com.taskweaver.dispatch.cli;

import com.taskweaver.core.analysis.CriticalPathAnalyzer;
import com.taskweaver.core.analysis.TaskFloat;
import com.taskweaver.core.io.PlanJson;
import com.taskweaver.core.io.PlanParseException;
import com.taskweaver.core.model.ProjectPlan;
import com.taskweaver.core.model.Task;
import com.taskweaver.core.model.TaskStatus;
import com.taskweaver.core.scheduler.CycleDetectedException;
import com.taskweaver.core.scheduler.MissingStartDateException;
import com.taskweaver.core.scheduler.PlanScheduler;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: taskweaver inspect &lt;plan.json&gt; &lt;task-id&gt;
 * <p>
 * Shows one scheduled task: dates, float, status tags, predecessors and successors.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect a task within a plan")
@Component
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan JSON file")
    private Path planFile;

    @Parameters(index = "1", description = "Task ID")
    private String taskId;

    private final PlanScheduler scheduler;
    private final CriticalPathAnalyzer criticalPathAnalyzer;
    private final PlanJson planJson;

    public InspectCommand(PlanScheduler scheduler, CriticalPathAnalyzer criticalPathAnalyzer, PlanJson planJson) {
        this.scheduler = scheduler;
        this.criticalPathAnalyzer = criticalPathAnalyzer;
        this.planJson = planJson;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ProjectPlan plan;
        try {
            plan = scheduler.schedule(planJson.read(planFile));
        } catch (PlanParseException | CycleDetectedException | MissingStartDateException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.of(e);
        }

        var found = plan.findTask(taskId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Task " + taskId + " not found in plan '" + plan.title() + "'");
            return ExitCodes.TASK_NOT_FOUND;
        }
        Task task = found.get();
        TaskFloat taskFloat = criticalPathAnalyzer.analyze(plan).stream()
                .filter(f -> f.task().id().equals(taskId))
                .findFirst()
                .orElseThrow();

        System.out.println();
        System.out.println("TASK " + task.id());
        System.out.println("  Name:        " + task.name());
        System.out.println("  Section:     " + ConsoleOutput.orDash(task.section()));
        System.out.println("  Assignee:    " + ConsoleOutput.orDash(task.assignee()));
        System.out.println("  Start:       " + ConsoleOutput.orDash(task.startDate()));
        System.out.println("  End:         " + ConsoleOutput.orDash(task.endDate()));
        System.out.println("  Duration:    " + ConsoleOutput.orDash(task.duration()) + " working days"
                + (task.milestone() ? " (milestone)" : ""));
        System.out.println("  Status:      " + (task.status().isEmpty() ? "-"
                : task.status().stream().map(TaskStatus::label).collect(Collectors.joining(", "))));
        System.out.println("  Float:       " + taskFloat.slack() + " working days"
                + (taskFloat.critical() ? " (critical)" : ""));
        System.out.println("  Depends on:  " + ids(plan.predecessorsOf(task.id())));
        System.out.println("  Required by: " + ids(plan.successorsOf(task.id())));
        if (task.description() != null && !task.description().isBlank()) {
            System.out.println();
            System.out.println("  " + task.description());
        }
        return ExitCodes.OK;
    }

    private static String ids(List<Task> tasks) {
        return tasks.isEmpty() ? "-" : tasks.stream().map(Task::id).collect(Collectors.joining(", "));
    }
}
