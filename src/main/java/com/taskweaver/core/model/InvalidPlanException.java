package com.taskweaver.core.model;

/**
 * Thrown when a task or plan violates a construction-time invariant
 * (blank or duplicate ids, dangling dependencies, negative durations).
 */
public class InvalidPlanException extends IllegalArgumentException {
    public InvalidPlanException(String message) {
        super(message);
    }
}
