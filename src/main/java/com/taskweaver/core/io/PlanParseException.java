package com.taskweaver.core.io;

/**
 * Thrown when a plan document cannot be read, parsed or written.
 */
public class PlanParseException extends RuntimeException {
    public PlanParseException(String message) {
        super(message);
    }

    public PlanParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
