package com.taskweaver.core.analysis;

import com.taskweaver.core.calendar.WorkingCalendar;
import com.taskweaver.core.model.ProjectPlan;
import com.taskweaver.core.model.ProjectStatistics;
import com.taskweaver.core.model.TaskStatus;
import org.springframework.stereotype.Service;

/**
 * Aggregates counts and rates over an already scheduled plan.
 */
@Service
public class StatisticsReporter {

    private final CriticalPathAnalyzer criticalPathAnalyzer;

    public StatisticsReporter(CriticalPathAnalyzer criticalPathAnalyzer) {
        this.criticalPathAnalyzer = criticalPathAnalyzer;
    }

    public ProjectStatistics report(ProjectPlan plan) {
        int total = plan.tasks().size();
        int completed = plan.countWithStatus(TaskStatus.DONE);

        int totalDuration = 0;
        if (plan.startDate() != null && plan.endDate() != null) {
            var calendar = new WorkingCalendar(plan.workingDays());
            totalDuration = calendar.countWorkingDays(plan.startDate(), plan.endDate()) + 1;
        }

        double completionRate = total == 0 ? 0.0 : completed * 100.0 / total;

        return new ProjectStatistics(
                total,
                completed,
                plan.countWithStatus(TaskStatus.ACTIVE),
                plan.milestoneCount(),
                plan.countWithStatus(TaskStatus.CRITICAL),
                totalDuration,
                plan.startDate(),
                plan.endDate(),
                completionRate,
                criticalPathAnalyzer.criticalPath(plan).size(),
                plan.sections());
    }
}
