package com.taskweaver.core.engine;

import com.taskweaver.core.analysis.CriticalPathAnalyzer;
import com.taskweaver.core.analysis.StatisticsReporter;
import com.taskweaver.core.logging.MdcContext;
import com.taskweaver.core.metrics.SchedulingMetrics;
import com.taskweaver.core.model.ProjectPlan;
import com.taskweaver.core.model.ProjectStatistics;
import com.taskweaver.core.model.Task;
import com.taskweaver.core.scheduler.CycleDetectedException;
import com.taskweaver.core.scheduler.MissingStartDateException;
import com.taskweaver.core.scheduler.PlanScheduler;
import com.taskweaver.core.validation.PlanValidator;
import com.taskweaver.core.validation.ValidationDiagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the full pipeline for one plan: validate, schedule, critical path, statistics.
 * <p>
 * Each run gets its own plan ID, which is put in the logging MDC for the run's duration.
 * Validation findings are reported, not enforced; a cycle fails the run.
 */
@Service
public class PlanningEngine {

    private static final Logger log = LoggerFactory.getLogger(PlanningEngine.class);
    private static final AtomicInteger PLAN_COUNTER = new AtomicInteger(0);

    private final PlanValidator validator;
    private final PlanScheduler scheduler;
    private final CriticalPathAnalyzer criticalPathAnalyzer;
    private final StatisticsReporter statisticsReporter;
    private final SchedulingMetrics metrics;
    private final Clock clock;

    public PlanningEngine(PlanValidator validator,
                          PlanScheduler scheduler,
                          CriticalPathAnalyzer criticalPathAnalyzer,
                          StatisticsReporter statisticsReporter,
                          SchedulingMetrics metrics,
                          Clock clock) {
        this.validator = validator;
        this.scheduler = scheduler;
        this.criticalPathAnalyzer = criticalPathAnalyzer;
        this.statisticsReporter = statisticsReporter;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs the pipeline with a newly generated plan ID.
     */
    public ScheduleReport run(ProjectPlan plan) {
        return run(generatePlanId(), plan);
    }

    /**
     * @param planId the ID to tag this run with
     * @param plan   input plan; not modified
     * @return the dated plan with its diagnostics, critical path and statistics
     * @throws CycleDetectedException    if the plan's dependencies contain a cycle
     * @throws MissingStartDateException in strict mode, if some task cannot be dated
     */
    public ScheduleReport run(String planId, ProjectPlan plan) {
        MdcContext.setPlan(planId);
        long startedAt = System.currentTimeMillis();
        try {
            log.info("Starting plan {} '{}' with {} tasks", planId, plan.title(), plan.tasks().size());

            List<ValidationDiagnostic> diagnostics = validate(plan);

            ProjectPlan scheduled;
            try {
                scheduled = scheduler.schedule(plan);
            } catch (CycleDetectedException e) {
                log.error("Plan {} failed: {}", planId, e.getMessage());
                metrics.recordRunResult("cycle");
                throw e;
            } catch (MissingStartDateException e) {
                log.error("Plan {} failed: {}", planId, e.getMessage());
                metrics.recordRunResult("missing_start");
                throw e;
            }

            List<Task> criticalPath = criticalPathAnalyzer.criticalPath(scheduled);
            ProjectStatistics statistics = statisticsReporter.report(scheduled);

            metrics.recordCriticalPathLength(criticalPath.size());
            metrics.recordRunResult("scheduled");
            log.info("Plan {} scheduled: {} .. {}, critical path {}", planId,
                    scheduled.startDate(), scheduled.endDate(),
                    criticalPath.stream().map(Task::id).toList());

            return new ScheduleReport(planId, scheduled, diagnostics, criticalPath, statistics);
        } finally {
            metrics.recordScheduleDuration(System.currentTimeMillis() - startedAt);
            MdcContext.clear();
        }
    }

    /**
     * Validates without scheduling. Findings are logged at WARN.
     */
    public List<ValidationDiagnostic> validate(ProjectPlan plan) {
        List<ValidationDiagnostic> diagnostics = validator.validate(plan);
        metrics.recordDiagnostics(diagnostics.size());
        for (var diagnostic : diagnostics) {
            log.warn("Validation [{}]: {}", diagnostic.code(), diagnostic.message());
        }
        return diagnostics;
    }

    /**
     * Generates a unique plan ID in the format TWV-YYYY-NNNN.
     */
    public String generatePlanId() {
        int count = PLAN_COUNTER.incrementAndGet();
        int year = LocalDate.now(clock).getYear();
        return String.format("TWV-%d-%04d", year, count);
    }
}
