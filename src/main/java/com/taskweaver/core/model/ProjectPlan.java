package com.taskweaver.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.io.Serializable;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * A project plan: an ordered list of tasks plus the calendar they are scheduled on.
 * <p>
 * Task order is preserved for stable output. {@code startDate} and {@code endDate}
 * are derived by the scheduler; an input {@code startDate} only serves as the
 * fallback start for undated tasks.
 *
 * @param title       plan title
 * @param description optional free text
 * @param startDate   earliest task start (derived), or the fallback start on input
 * @param endDate     latest task end (derived)
 * @param workingDays weekdays that count as working days; Monday to Friday when absent
 * @param tasks       tasks in insertion order
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectPlan(
    String title,
    String description,
    LocalDate startDate,
    LocalDate endDate,
    Set<DayOfWeek> workingDays,
    List<Task> tasks
) implements Serializable {

    public static final Set<DayOfWeek> DEFAULT_WORKING_DAYS = Collections.unmodifiableSet(
            EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY));

    public ProjectPlan {
        title = title != null ? title : "Project Plan";
        workingDays = workingDays == null || workingDays.isEmpty()
                ? DEFAULT_WORKING_DAYS
                : Collections.unmodifiableSet(EnumSet.copyOf(workingDays));
        tasks = tasks != null ? List.copyOf(tasks) : List.of();

        Set<String> ids = new HashSet<>();
        for (Task task : tasks) {
            if (!ids.add(task.id())) {
                throw new InvalidPlanException("Duplicate task id: " + task.id());
            }
        }
        for (Task task : tasks) {
            for (String dep : task.dependencies()) {
                if (!ids.contains(dep)) {
                    throw new InvalidPlanException(
                            "Task " + task.id() + " depends on unknown task " + dep);
                }
            }
        }
    }

    public static ProjectPlan of(String title, LocalDate startDate, List<Task> tasks) {
        return new ProjectPlan(title, null, startDate, null, null, tasks);
    }

    public ProjectPlan withTasks(List<Task> newTasks) {
        return new ProjectPlan(title, description, startDate, endDate, workingDays, newTasks);
    }

    public ProjectPlan withDates(LocalDate newStart, LocalDate newEnd) {
        return new ProjectPlan(title, description, newStart, newEnd, workingDays, tasks);
    }

    public Optional<Task> findTask(String taskId) {
        return tasks.stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    public List<Task> tasksInSection(String section) {
        return tasks.stream().filter(t -> Objects.equals(t.section(), section)).toList();
    }

    /**
     * Distinct non-null section labels, sorted.
     */
    public List<String> sections() {
        var sections = new TreeSet<String>();
        for (Task task : tasks) {
            if (task.section() != null && !task.section().isBlank()) {
                sections.add(task.section());
            }
        }
        return List.copyOf(sections);
    }

    /**
     * Tasks the given task depends on, in declaration order.
     */
    public List<Task> predecessorsOf(String taskId) {
        var result = new ArrayList<Task>();
        findTask(taskId).ifPresent(task -> {
            for (String dep : task.dependencies()) {
                findTask(dep).ifPresent(result::add);
            }
        });
        return result;
    }

    /**
     * Tasks that depend on the given task, in plan order.
     */
    public List<Task> successorsOf(String taskId) {
        return tasks.stream().filter(t -> t.dependencies().contains(taskId)).toList();
    }

    public int countWithStatus(TaskStatus tag) {
        return (int) tasks.stream().filter(t -> t.hasStatus(tag)).count();
    }

    public int milestoneCount() {
        return (int) tasks.stream().filter(Task::milestone).count();
    }
}
