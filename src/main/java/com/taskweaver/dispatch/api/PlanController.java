package com.taskweaver.dispatch.api;

import com.taskweaver.core.engine.PlanningEngine;
import com.taskweaver.core.model.ProjectPlan;
import com.taskweaver.core.scheduler.CycleDetectedException;
import com.taskweaver.core.scheduler.MissingStartDateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for scheduling and validating plans.
 * Plans are sent in the request body; nothing is stored server-side.
 */
@RestController
@RequestMapping("/api/v1/plans")
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    private final PlanningEngine planningEngine;

    public PlanController(PlanningEngine planningEngine) {
        this.planningEngine = planningEngine;
    }

    /**
     * POST /api/v1/plans/schedule: schedule a plan and return it fully dated.
     */
    @PostMapping("/schedule")
    public ResponseEntity<?> schedule(@RequestBody ProjectPlan plan) {
        try {
            return ResponseEntity.ok(ScheduleResponse.from(planningEngine.run(plan)));
        } catch (CycleDetectedException e) {
            log.info("Rejected plan '{}': {}", plan.title(), e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of(
                    "error", e.getMessage(),
                    "tasks", e.getTaskIds()));
        } catch (MissingStartDateException e) {
            log.info("Rejected plan '{}': {}", plan.title(), e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of(
                    "error", e.getMessage(),
                    "task", e.getTaskId()));
        }
    }

    /**
     * POST /api/v1/plans/validate: report problems without scheduling.
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationResponse> validate(@RequestBody ProjectPlan plan) {
        return ResponseEntity.ok(ValidationResponse.of(planningEngine.validate(plan)));
    }
}
