package com.taskweaver.core.validation;

/**
 * Kind of problem reported by {@link PlanValidator}.
 */
public enum DiagnosticCode {
    EMPTY_PLAN,
    MISSING_TIME_INFO,
    START_AFTER_END,
    DEPENDENCY_CYCLE
}
