package com.taskweaver.dispatch.api;

import com.taskweaver.core.validation.ValidationDiagnostic;

import java.util.List;

/**
 * Response body for POST /api/v1/plans/validate.
 */
public record ValidationResponse(boolean valid, List<ValidationDiagnostic> diagnostics) {

    public static ValidationResponse of(List<ValidationDiagnostic> diagnostics) {
        return new ValidationResponse(diagnostics.isEmpty(), diagnostics);
    }
}
