package com.taskweaver.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Status tag attached to a task. Tags only feed reporting; scheduling ignores them.
 * <p>
 * Labels that are not recognized map to {@link #CUSTOM} instead of failing.
 */
public enum TaskStatus {
    DONE("done"),
    ACTIVE("active"),
    CRITICAL("crit"),
    MILESTONE("milestone"),
    CUSTOM("custom");

    private static final Logger log = LoggerFactory.getLogger(TaskStatus.class);

    private final String label;

    TaskStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static TaskStatus fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return CUSTOM;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "done" -> DONE;
            case "active" -> ACTIVE;
            case "crit", "critical" -> CRITICAL;
            case "milestone" -> MILESTONE;
            case "custom" -> CUSTOM;
            default -> {
                log.debug("Unrecognized status label '{}', treating as custom", label);
                yield CUSTOM;
            }
        };
    }
}
