package com.taskweaver.core.graph;

import com.taskweaver.TestPlans;
import com.taskweaver.core.model.ProjectPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.taskweaver.TestPlans.task;
import static org.junit.jupiter.api.Assertions.*;

class CycleDetectorTest {

    private CycleDetector detector;

    @BeforeEach
    void setUp() {
        detector = new CycleDetector();
    }

    @Test
    @DisplayName("Acyclic plan has no cycle")
    void acyclic() {
        assertTrue(detector.detect(TestPlans.fork()).isEmpty());
        assertTrue(detector.detect(ProjectPlan.of("Empty", null, List.of())).isEmpty());
    }

    @Test
    @DisplayName("Three-task cycle names all three tasks, sorted")
    void threeTaskCycle() {
        var cycle = detector.detect(TestPlans.cycle()).orElseThrow();
        assertEquals(Set.of("A", "B", "C"), cycle.getTaskIds());
        assertEquals("Dependency cycle detected among tasks: [A, B, C]", cycle.getMessage());
    }

    @Test
    @DisplayName("Self-dependency is a cycle")
    void selfDependency() {
        var plan = ProjectPlan.of("P", null, List.of(task("A", List.of("A"), null, 1)));
        var cycle = detector.detect(plan).orElseThrow();
        assertEquals(Set.of("A"), cycle.getTaskIds());
    }

    @Test
    @DisplayName("The reported set does not depend on task order")
    void orderIndependent() {
        var reordered = ProjectPlan.of("P", null, List.of(
                task("C", List.of("B"), null, 1),
                task("A", List.of("C"), null, 1),
                task("B", List.of("A"), null, 1)));
        assertEquals(detector.detect(TestPlans.cycle()).orElseThrow().getTaskIds(),
                detector.detect(reordered).orElseThrow().getTaskIds());
    }
}
