package com.taskweaver.core.engine;

import com.taskweaver.core.model.ProjectPlan;
import com.taskweaver.core.model.ProjectStatistics;
import com.taskweaver.core.model.Task;
import com.taskweaver.core.validation.ValidationDiagnostic;

import java.io.Serializable;
import java.util.List;

/**
 * Everything one scheduling run produces.
 *
 * @param planId       run identifier (e.g. "TWV-2026-0001")
 * @param plan         the fully dated plan
 * @param diagnostics  validator findings on the input plan; may be non-empty for a successful run
 * @param criticalPath zero-float tasks in topological order
 * @param statistics   aggregate figures over the dated plan
 */
public record ScheduleReport(
    String planId,
    ProjectPlan plan,
    List<ValidationDiagnostic> diagnostics,
    List<Task> criticalPath,
    ProjectStatistics statistics
) implements Serializable {

    public ScheduleReport {
        diagnostics = List.copyOf(diagnostics);
        criticalPath = List.copyOf(criticalPath);
    }

    public List<String> criticalPathIds() {
        return criticalPath.stream().map(Task::id).toList();
    }
}
