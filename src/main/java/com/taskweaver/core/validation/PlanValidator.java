package com.taskweaver.core.validation;

import com.taskweaver.core.graph.CycleDetector;
import com.taskweaver.core.model.ProjectPlan;
import com.taskweaver.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural and date-logic checks on a plan. Never modifies the plan and never throws
 * for plan content; every finding comes back as a {@link ValidationDiagnostic}.
 *
 * <p>An empty result means no blocking problems. It does not promise that every task of
 * an underspecified plan will end up fully dated.
 */
@Service
public class PlanValidator {

    private static final Logger log = LoggerFactory.getLogger(PlanValidator.class);

    private final CycleDetector cycleDetector;

    public PlanValidator(CycleDetector cycleDetector) {
        this.cycleDetector = cycleDetector;
    }

    public List<ValidationDiagnostic> validate(ProjectPlan plan) {
        var diagnostics = new ArrayList<ValidationDiagnostic>();

        if (plan.tasks().isEmpty()) {
            diagnostics.add(ValidationDiagnostic.planLevel(DiagnosticCode.EMPTY_PLAN, "Plan contains no tasks"));
            return diagnostics;
        }

        for (Task task : plan.tasks()) {
            if (task.startDate() == null && task.duration() == null && !task.hasDependencies()) {
                diagnostics.add(new ValidationDiagnostic(DiagnosticCode.MISSING_TIME_INFO, task.id(),
                        "Task '" + task.name() + "' (" + task.id() + ") is missing basic time information"));
            }
            if (task.startDate() != null && task.endDate() != null
                    && task.startDate().isAfter(task.endDate())) {
                diagnostics.add(new ValidationDiagnostic(DiagnosticCode.START_AFTER_END, task.id(),
                        "Task '" + task.name() + "' (" + task.id() + ") starts " + task.startDate()
                                + " after it ends " + task.endDate()));
            }
        }

        cycleDetector.detect(plan).ifPresent(cycle -> diagnostics.add(
                ValidationDiagnostic.planLevel(DiagnosticCode.DEPENDENCY_CYCLE, cycle.getMessage())));

        log.debug("validate: {} tasks, {} diagnostics", plan.tasks().size(), diagnostics.size());
        return diagnostics;
    }
}
