package com.taskweaver.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A single unit of work within a project plan.
 * <p>
 * At most two of {@code startDate}, {@code endDate} and {@code duration} are expected
 * before scheduling; the scheduler derives the rest and returns new instances.
 *
 * @param id           unique identifier within the plan (e.g. "design")
 * @param name         display name
 * @param dependencies IDs of tasks that must finish before this one starts
 * @param startDate    first working day of the task, if known
 * @param endDate      last working day of the task, if known
 * @param duration     length in working days; 0 denotes a milestone-like task
 * @param milestone    marker event; resolved with duration 0 and start == end
 * @param status       reporting tags
 * @param section      grouping label, not used by scheduling
 * @param description  free-text description
 * @param assignee     person responsible, free text
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Task(
    String id,
    String name,
    List<String> dependencies,
    LocalDate startDate,
    LocalDate endDate,
    Integer duration,
    @JsonProperty("is_milestone") boolean milestone,
    Set<TaskStatus> status,
    String section,
    String description,
    String assignee
) implements Serializable {

    public Task {
        if (id == null || id.isBlank()) {
            throw new InvalidPlanException("Task id must not be blank");
        }
        if (duration != null && duration < 0) {
            throw new InvalidPlanException("Task " + id + " has negative duration " + duration);
        }
        name = name != null ? name : id;
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        EnumSet<TaskStatus> tags = EnumSet.noneOf(TaskStatus.class);
        if (status != null) {
            status.stream().filter(Objects::nonNull).forEach(tags::add);
        }
        status = Collections.unmodifiableSet(tags);
    }

    /**
     * Shorthand for the common case of a task with no reporting metadata.
     */
    public static Task of(String id, List<String> dependencies, LocalDate startDate, Integer duration) {
        return new Task(id, id, dependencies, startDate, null, duration, false, Set.of(), null, null, null);
    }

    public boolean hasStatus(TaskStatus tag) {
        return status.contains(tag);
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    /**
     * Returns a copy with the three date fields replaced; everything else is kept.
     */
    public Task withSchedule(LocalDate newStart, LocalDate newEnd, Integer newDuration) {
        return new Task(id, name, dependencies, newStart, newEnd, newDuration, milestone,
                status, section, description, assignee);
    }
}
