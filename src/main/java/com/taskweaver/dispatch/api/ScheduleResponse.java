package com.taskweaver.dispatch.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskweaver.core.engine.ScheduleReport;
import com.taskweaver.core.model.ProjectPlan;
import com.taskweaver.core.model.ProjectStatistics;
import com.taskweaver.core.validation.ValidationDiagnostic;

import java.util.List;

/**
 * Response body for POST /api/v1/plans/schedule.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduleResponse(
    String planId,
    ProjectPlan plan,
    List<String> criticalPath,
    ProjectStatistics statistics,
    List<ValidationDiagnostic> diagnostics
) {
    public static ScheduleResponse from(ScheduleReport report) {
        return new ScheduleResponse(report.planId(), report.plan(), report.criticalPathIds(),
                report.statistics(), report.diagnostics());
    }
}
