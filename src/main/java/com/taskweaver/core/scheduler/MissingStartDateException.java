package com.taskweaver.core.scheduler;

/**
 * Thrown in strict mode when a task has nothing to date it from and the plan has no start date.
 */
public class MissingStartDateException extends RuntimeException {

    private final String taskId;

    public MissingStartDateException(String taskId) {
        super("Task " + taskId + " has no start, end, duration or dependencies "
                + "and the plan has no start date");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
