package com.taskweaver.core.io;

import com.taskweaver.TestPlans;
import com.taskweaver.core.model.ProjectPlan;
import com.taskweaver.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PlanJsonTest {

    private PlanJson planJson;

    @BeforeEach
    void setUp() {
        planJson = new PlanJson();
    }

    @Test
    @DisplayName("Parses snake_case fields, milestones and status labels")
    void parse() {
        var plan = planJson.parse(TestPlans.releaseJson());

        assertEquals("Release", plan.title());
        assertEquals(3, plan.tasks().size());
        var a = plan.findTask("A").orElseThrow();
        assertEquals(LocalDate.of(2024, 1, 1), a.startDate());
        assertEquals(5, a.duration());
        assertEquals(Set.of(TaskStatus.DONE), a.status());
        assertEquals("ana", a.assignee());
        assertTrue(plan.findTask("M").orElseThrow().milestone());
        assertEquals(List.of("B"), plan.findTask("M").orElseThrow().dependencies());
        assertEquals(ProjectPlan.DEFAULT_WORKING_DAYS, plan.workingDays());
    }

    @Test
    @DisplayName("Working days accept indexes where 0 is Monday")
    void workingDayIndexes() {
        var plan = planJson.parse("""
                {"title": "Six", "working_days": [0, 1, 2, 3, 4, 5], "tasks": []}
                """);
        assertEquals(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.SATURDAY), plan.workingDays());
    }

    @Test
    @DisplayName("Unknown status labels and unknown fields are tolerated")
    void lenient() {
        var plan = planJson.parse("""
                {"title": "P", "owner": "someone",
                 "tasks": [{"id": "A", "duration": 1, "status": ["crit", "blocked"], "colour": "red"}]}
                """);
        assertEquals(EnumSet.of(TaskStatus.CRITICAL, TaskStatus.CUSTOM), plan.tasks().get(0).status());
    }

    @Test
    @DisplayName("Structural errors surface as PlanParseException with the model's message")
    void invalidPlan() {
        var e = assertThrows(PlanParseException.class, () -> planJson.parse("""
                {"tasks": [{"id": "A", "duration": 1}, {"id": "A", "duration": 2}]}
                """));
        assertTrue(e.getMessage().contains("Duplicate task id: A"), e.getMessage());

        var unknown = assertThrows(PlanParseException.class, () -> planJson.parse("""
                {"tasks": [{"id": "A", "dependencies": ["Z"]}]}
                """));
        assertTrue(unknown.getMessage().contains("unknown task Z"), unknown.getMessage());
    }

    @Test
    @DisplayName("Malformed JSON is reported")
    void malformed() {
        var e = assertThrows(PlanParseException.class, () -> planJson.parse("{\"tasks\": ["));
        assertTrue(e.getMessage().startsWith("Malformed plan JSON"), e.getMessage());
    }

    @Test
    @DisplayName("Serialized plans use snake_case, ISO dates and status labels")
    void serialize() {
        String json = planJson.toJson(TestPlans.release());
        assertTrue(json.contains("\"is_milestone\""), json);
        assertTrue(json.contains("\"start_date\""), json);
        assertTrue(json.contains("\"2024-01-01\""), json);
        assertTrue(json.contains("\"done\""), json);
        assertTrue(json.contains("\"working_days\""), json);
    }

    @Test
    @DisplayName("write then read gives back an equal plan")
    void writeAndRead(@TempDir Path dir) {
        Path file = dir.resolve("plan.json");
        var plan = TestPlans.release();
        planJson.write(plan, file);

        assertTrue(Files.exists(file));
        assertEquals(plan, planJson.read(file));
    }

    @Test
    @DisplayName("A missing file is reported, not thrown as IOException")
    void missingFile(@TempDir Path dir) {
        var e = assertThrows(PlanParseException.class, () -> planJson.read(dir.resolve("nope.json")));
        assertTrue(e.getMessage().startsWith("Cannot read plan file"), e.getMessage());
    }
}
