package com.taskweaver.core.scheduler;

import com.taskweaver.core.calendar.WorkingCalendar;
import com.taskweaver.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Objects;

/**
 * Resolves one task's start, end and duration from whatever subset is known plus the
 * end dates of its (already dated) dependencies.
 * <p>
 * Rules, in order:
 * <ol>
 *   <li>a milestone always has duration 0;</li>
 *   <li>the working day after the latest dependency end replaces any input start;</li>
 *   <li>start+duration gives end, else start+end gives duration, else end+duration gives start;</li>
 *   <li>a task still without a start takes the plan start, or today's date as a last resort.</li>
 * </ol>
 */
public class DateDeriver {

    private static final Logger log = LoggerFactory.getLogger(DateDeriver.class);

    private final WorkingCalendar calendar;
    private final LocalDate planStart;
    private final Clock clock;
    private final boolean requirePlanStart;

    public DateDeriver(WorkingCalendar calendar, LocalDate planStart, Clock clock, boolean requirePlanStart) {
        this.calendar = Objects.requireNonNull(calendar, "calendar");
        this.planStart = planStart;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.requirePlanStart = requirePlanStart;
    }

    /**
     * @param task         the task to date
     * @param dependencies the task's dependencies, already dated by this run
     * @return a copy of {@code task} with every derivable date filled in
     * @throws MissingStartDateException in strict mode when no start can be found
     */
    public Task derive(Task task, Collection<Task> dependencies) {
        LocalDate start = task.startDate();
        LocalDate end = task.endDate();
        Integer duration = task.duration();

        if (task.milestone()) {
            duration = 0;
        }

        if (task.hasDependencies()) {
            LocalDate latestEnd = dependencies.stream()
                    .map(Task::endDate)
                    .filter(Objects::nonNull)
                    .max(LocalDate::compareTo)
                    .orElse(null);
            if (latestEnd != null) {
                LocalDate derivedStart = calendar.addWorkingDays(latestEnd, 1);
                if (start != null && !start.equals(derivedStart)) {
                    log.debug("{}: input start {} overridden by dependency-derived start {}",
                            task.id(), start, derivedStart);
                }
                start = derivedStart;
            }
        }

        if (start != null && duration != null) {
            end = calendar.endDateFor(start, duration);
        } else if (start != null && end != null) {
            duration = calendar.countWorkingDays(start, end) + 1;
        } else if (end != null && duration != null) {
            start = calendar.startDateFor(end, duration);
        }

        if (start == null) {
            start = fallbackStart(task);
            if (duration != null) {
                end = calendar.endDateFor(start, duration);
            }
        }

        log.debug("{}: start={} end={} duration={}", task.id(), start, end, duration);
        return task.withSchedule(start, end, duration);
    }

    private LocalDate fallbackStart(Task task) {
        if (planStart != null) {
            return planStart;
        }
        if (requirePlanStart) {
            throw new MissingStartDateException(task.id());
        }
        LocalDate today = LocalDate.now(clock);
        log.warn("{}: no start date available, falling back to today ({})", task.id(), today);
        return today;
    }
}
