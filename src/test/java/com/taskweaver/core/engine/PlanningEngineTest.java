package com.taskweaver.core.engine;

import com.taskweaver.TestPlans;
import com.taskweaver.core.analysis.CriticalPathAnalyzer;
import com.taskweaver.core.analysis.StatisticsReporter;
import com.taskweaver.core.graph.CycleDetector;
import com.taskweaver.core.metrics.SchedulingMetrics;
import com.taskweaver.core.model.ProjectPlan;
import com.taskweaver.core.scheduler.CycleDetectedException;
import com.taskweaver.core.scheduler.MissingStartDateException;
import com.taskweaver.core.scheduler.PlanScheduler;
import com.taskweaver.core.scheduler.SchedulingProperties;
import com.taskweaver.core.validation.DiagnosticCode;
import com.taskweaver.core.validation.PlanValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static com.taskweaver.TestPlans.task;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the PlanningEngine pipeline, wired with real collaborators.
 */
class PlanningEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-17T09:00:00Z"), ZoneOffset.UTC);

    private SimpleMeterRegistry registry;
    private SchedulingProperties properties;
    private PlanningEngine engine;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new SchedulingProperties();
        var analyzer = new CriticalPathAnalyzer();
        engine = new PlanningEngine(
                new PlanValidator(new CycleDetector()),
                new PlanScheduler(properties, CLOCK),
                analyzer,
                new StatisticsReporter(analyzer),
                new SchedulingMetrics(registry),
                CLOCK);
    }

    private double runs(String result) {
        var counter = registry.find("taskweaver.schedule.runs").tag("result", result).counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Test
    @DisplayName("run returns the dated plan, critical path and statistics")
    void runScenario() {
        var report = engine.run("TWV-2026-0042", TestPlans.release());

        assertEquals("TWV-2026-0042", report.planId());
        assertEquals(LocalDate.of(2024, 1, 11), report.plan().endDate());
        assertEquals(List.of("A", "B", "M"), report.criticalPathIds());
        assertEquals(3, report.statistics().totalTasks());
        assertTrue(report.diagnostics().isEmpty());
        assertEquals(1.0, runs("scheduled"));
        assertEquals(1, registry.find("taskweaver.schedule.duration").timer().count());
    }

    @Test
    @DisplayName("Diagnostics are reported but do not stop scheduling")
    void diagnosticsNonBlocking() {
        var plan = ProjectPlan.of("P", TestPlans.JAN_1, List.of(
                task("A", List.of(), TestPlans.JAN_1, 2),
                task("U", List.of(), null, null)));
        var report = engine.run(plan);

        assertEquals(1, report.diagnostics().size());
        assertEquals(DiagnosticCode.MISSING_TIME_INFO, report.diagnostics().get(0).code());
        assertEquals(TestPlans.JAN_1, report.plan().findTask("U").orElseThrow().startDate());
    }

    @Test
    @DisplayName("A cycle fails the run and is counted")
    void cycle() {
        var e = assertThrows(CycleDetectedException.class, () -> engine.run(TestPlans.cycle()));
        assertEquals("Dependency cycle detected among tasks: [A, B, C]", e.getMessage());
        assertEquals(1.0, runs("cycle"));
        assertEquals(0.0, runs("scheduled"));
    }

    @Test
    @DisplayName("Strict mode failure is counted as missing_start")
    void missingStart() {
        properties.setRequirePlanStart(true);
        var plan = ProjectPlan.of("P", null, List.of(task("A", List.of(), null, 1)));
        assertThrows(MissingStartDateException.class, () -> engine.run(plan));
        assertEquals(1.0, runs("missing_start"));
    }

    @Test
    @DisplayName("MDC is cleared after a run, failed or not")
    void mdcCleared() {
        engine.run(TestPlans.release());
        assertNull(MDC.get("planId"));

        assertThrows(CycleDetectedException.class, () -> engine.run(TestPlans.cycle()));
        assertNull(MDC.get("planId"));
        assertNull(MDC.get("taskId"));
    }

    @Test
    @DisplayName("Generated plan IDs follow TWV-YYYY-NNNN and are unique")
    void planIds() {
        String first = engine.generatePlanId();
        String second = engine.generatePlanId();
        assertTrue(first.matches("TWV-2026-\\d{4}"), first);
        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("validate alone never schedules")
    void validateOnly() {
        var scheduler = mock(PlanScheduler.class);
        var analyzer = mock(CriticalPathAnalyzer.class);
        var isolated = new PlanningEngine(new PlanValidator(new CycleDetector()), scheduler, analyzer,
                new StatisticsReporter(analyzer), new SchedulingMetrics(registry), CLOCK);

        var diagnostics = isolated.validate(TestPlans.cycle());

        assertEquals(1, diagnostics.size());
        verify(scheduler, never()).schedule(any());
        assertEquals(1, registry.find("taskweaver.validation.diagnostics").summary().count());
    }

    @Test
    @DisplayName("Scheduler failures skip the analysis stages")
    void schedulerFailureSkipsAnalysis() {
        var scheduler = mock(PlanScheduler.class);
        var analyzer = mock(CriticalPathAnalyzer.class);
        when(scheduler.schedule(any())).thenThrow(new CycleDetectedException(List.of("X")));
        var isolated = new PlanningEngine(new PlanValidator(new CycleDetector()), scheduler, analyzer,
                new StatisticsReporter(analyzer), new SchedulingMetrics(registry), CLOCK);

        assertThrows(CycleDetectedException.class, () -> isolated.run(TestPlans.release()));
        verify(analyzer, never()).criticalPath(any());
    }
}
