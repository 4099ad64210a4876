package com.taskweaver.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.List;

/**
 * Aggregate figures over a scheduled plan.
 *
 * @param totalTasks         number of tasks in the plan
 * @param completedTasks     tasks tagged {@link TaskStatus#DONE}
 * @param activeTasks        tasks tagged {@link TaskStatus#ACTIVE}
 * @param milestoneCount     tasks flagged as milestones
 * @param taggedCritical     tasks tagged {@link TaskStatus#CRITICAL} by their author
 * @param totalDuration      working days between plan start and end, 0 when either is missing
 * @param startDate          plan start
 * @param endDate            plan end
 * @param completionRate     percentage of completed tasks, 0 for an empty plan
 * @param criticalPathLength number of zero-float tasks
 * @param sections           distinct section labels, sorted
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProjectStatistics(
    int totalTasks,
    int completedTasks,
    int activeTasks,
    int milestoneCount,
    int taggedCritical,
    int totalDuration,
    LocalDate startDate,
    LocalDate endDate,
    double completionRate,
    int criticalPathLength,
    List<String> sections
) implements Serializable {

    public ProjectStatistics {
        sections = sections != null ? List.copyOf(sections) : List.of();
    }
}
