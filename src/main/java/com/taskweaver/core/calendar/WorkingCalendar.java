package com.taskweaver.core.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Working-day arithmetic over a fixed weekly pattern.
 * <p>
 * Immutable; every method is a pure function of the working-day set and its arguments.
 */
public final class WorkingCalendar {

    private final Set<DayOfWeek> workingDays;

    public WorkingCalendar(Collection<DayOfWeek> workingDays) {
        if (workingDays == null || workingDays.isEmpty()) {
            throw new IllegalArgumentException("A calendar needs at least one working day");
        }
        this.workingDays = Collections.unmodifiableSet(EnumSet.copyOf(workingDays));
    }

    public Set<DayOfWeek> workingDays() {
        return workingDays;
    }

    public boolean isWorkingDay(LocalDate date) {
        return workingDays.contains(date.getDayOfWeek());
    }

    /**
     * Moves {@code days} working days forward from {@code date}. The start date itself is
     * never counted, so adding 0 returns {@code date} unchanged even on a non-working day.
     * A negative count moves backward.
     */
    public LocalDate addWorkingDays(LocalDate date, int days) {
        if (days < 0) {
            return subtractWorkingDays(date, -days);
        }
        LocalDate current = date;
        int remaining = days;
        while (remaining > 0) {
            current = current.plusDays(1);
            if (isWorkingDay(current)) {
                remaining--;
            }
        }
        return current;
    }

    /**
     * Moves {@code days} working days backward from {@code date}; mirror of {@link #addWorkingDays}.
     */
    public LocalDate subtractWorkingDays(LocalDate date, int days) {
        if (days < 0) {
            return addWorkingDays(date, -days);
        }
        LocalDate current = date;
        int remaining = days;
        while (remaining > 0) {
            current = current.minusDays(1);
            if (isWorkingDay(current)) {
                remaining--;
            }
        }
        return current;
    }

    /**
     * Counts working days in {@code [start, end]}, both ends inclusive; 0 when start is after end.
     */
    public int countWorkingDays(LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            return 0;
        }
        int count = 0;
        for (LocalDate current = start; !current.isAfter(end); current = current.plusDays(1)) {
            if (isWorkingDay(current)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Last working day of a task that starts on {@code start} and lasts {@code duration}
     * working days. Durations of 0 and 1 both end on the start date.
     */
    public LocalDate endDateFor(LocalDate start, int duration) {
        return addWorkingDays(start, Math.max(duration - 1, 0));
    }

    /**
     * First day of a task that ends on {@code end} and lasts {@code duration} working days.
     */
    public LocalDate startDateFor(LocalDate end, int duration) {
        return subtractWorkingDays(end, Math.max(duration - 1, 0));
    }

    @Override
    public String toString() {
        return "WorkingCalendar" + workingDays;
    }
}
