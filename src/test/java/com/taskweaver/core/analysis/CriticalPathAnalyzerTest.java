package com.taskweaver.core.analysis;

import com.taskweaver.TestPlans;
import com.taskweaver.core.model.ProjectPlan;
import com.taskweaver.core.model.Task;
import com.taskweaver.core.scheduler.CycleDetectedException;
import com.taskweaver.core.scheduler.PlanScheduler;
import com.taskweaver.core.scheduler.SchedulingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.taskweaver.TestPlans.JAN_1;
import static com.taskweaver.TestPlans.task;
import static org.junit.jupiter.api.Assertions.*;

class CriticalPathAnalyzerTest {

    private CriticalPathAnalyzer analyzer;
    private PlanScheduler scheduler;

    @BeforeEach
    void setUp() {
        analyzer = new CriticalPathAnalyzer();
        scheduler = new PlanScheduler(new SchedulingProperties(), Clock.systemUTC());
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }

    @Test
    @DisplayName("A linear chain ending in a milestone is entirely critical")
    void linearChain() {
        var plan = scheduler.schedule(TestPlans.release());
        assertEquals(List.of("A", "B", "M"), ids(analyzer.criticalPath(plan)));
    }

    @Test
    @DisplayName("Critical tasks have zero slack and every other task at least one working day")
    void zeroSlackIffCritical() {
        for (ProjectPlan input : List.of(TestPlans.fork(), TestPlans.release())) {
            var plan = scheduler.schedule(input);
            var floats = analyzer.analyze(plan);
            assertEquals(plan.tasks().size(), floats.size());

            for (TaskFloat f : floats) {
                String id = input.title() + "/" + f.task().id();
                assertNotNull(f.earliestStart(), id);
                assertNotNull(f.latestStart(), id);
                if (f.critical()) {
                    assertEquals(f.earliestStart(), f.latestStart(), id);
                    assertEquals(0, f.slack(), id);
                } else {
                    assertTrue(f.earliestStart().isBefore(f.latestStart()), id);
                    assertTrue(f.slack() >= 1, id);
                }
            }
            assertEquals(ids(analyzer.criticalPath(plan)),
                    floats.stream().filter(TaskFloat::critical).map(f -> f.task().id()).toList());
        }
    }

    @Test
    @DisplayName("The shorter branch of a fork has float and is not critical")
    void forkWithSlack() {
        var plan = scheduler.schedule(TestPlans.fork());
        Map<String, TaskFloat> floats = analyzer.analyze(plan).stream()
                .collect(Collectors.toMap(f -> f.task().id(), Function.identity()));

        assertEquals(List.of("A", "C", "D"), ids(analyzer.criticalPath(plan)));

        var b = floats.get("B");
        assertFalse(b.critical());
        assertEquals(LocalDate.of(2024, 1, 8), b.earliestStart());
        assertEquals(LocalDate.of(2024, 1, 10), b.latestStart());
        assertEquals(2, b.slack());

        assertEquals(0, floats.get("C").slack());
        assertTrue(floats.get("A").critical());
    }

    @Test
    @DisplayName("Results follow topological order, not plan order")
    void topologicalOrder() {
        var plan = scheduler.schedule(ProjectPlan.of("P", null, List.of(
                task("B", List.of("A"), null, 2),
                task("A", List.of(), JAN_1, 2))));
        assertEquals(List.of("A", "B"), analyzer.analyze(plan).stream().map(f -> f.task().id()).toList());
        assertEquals(List.of("A", "B"), ids(analyzer.criticalPath(plan)));
    }

    @Test
    @DisplayName("Independent terminal tasks are each critical on their own")
    void independentTasks() {
        var plan = scheduler.schedule(ProjectPlan.of("P", null, List.of(
                task("X", List.of(), JAN_1, 10),
                task("Y", List.of(), JAN_1, 1))));
        assertEquals(Set.of("X", "Y"), Set.copyOf(ids(analyzer.criticalPath(plan))));
    }

    @Test
    @DisplayName("An empty plan has an empty critical path")
    void emptyPlan() {
        assertTrue(analyzer.criticalPath(ProjectPlan.of("Empty", null, List.of())).isEmpty());
    }

    @Test
    @DisplayName("A cyclic plan cannot be analysed")
    void cycle() {
        assertThrows(CycleDetectedException.class, () -> analyzer.criticalPath(TestPlans.cycle()));
    }

    @Test
    @DisplayName("Tasks without dates are never critical")
    void undatedTask() {
        var plan = ProjectPlan.of("P", null, List.of(task("U", List.of(), null, null)));
        var floats = analyzer.analyze(plan);
        assertEquals(1, floats.size());
        assertNull(floats.get(0).earliestStart());
        assertFalse(floats.get(0).critical());
        assertEquals(0, floats.get(0).slack());
    }
}
