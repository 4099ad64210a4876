package com.taskweaver.core.analysis;

import com.taskweaver.core.model.Task;

import java.time.LocalDate;

/**
 * Earliest and latest start of one task.
 *
 * @param task          the scheduled task
 * @param earliestStart earliest start allowed by its dependencies
 * @param latestStart   latest start that does not delay its dependents
 * @param slack         working days between the two; 0 on the critical path
 */
public record TaskFloat(Task task, LocalDate earliestStart, LocalDate latestStart, int slack) {

    public boolean critical() {
        return earliestStart != null && earliestStart.equals(latestStart);
    }
}
