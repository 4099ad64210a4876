package com.taskweaver.core.validation;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.io.Serializable;

/**
 * A non-fatal problem found in a plan. Reported as data, never thrown.
 *
 * @param code    what kind of problem
 * @param taskId  the offending task, or null for plan-level problems
 * @param message human-readable explanation
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationDiagnostic(
    DiagnosticCode code,
    String taskId,
    String message
) implements Serializable {

    public static ValidationDiagnostic planLevel(DiagnosticCode code, String message) {
        return new ValidationDiagnostic(code, null, message);
    }

    @Override
    public String toString() {
        return message;
    }
}
