package com.taskweaver.core.graph;

import com.taskweaver.core.model.ProjectPlan;
import com.taskweaver.core.scheduler.CycleDetectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Finds dependency cycles with an in-degree drain and no date derivation.
 */
@Component
public class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    /**
     * @return the cycle error the scheduler would raise for this plan, or empty if acyclic
     */
    public Optional<CycleDetectedException> detect(ProjectPlan plan) {
        TopologicalOrder order = TaskGraph.build(plan).topologicalOrder();
        if (order.complete()) {
            return Optional.empty();
        }
        log.debug("Cycle check: {} of {} tasks unresolved: {}",
                order.unresolved().size(), plan.tasks().size(), order.unresolved());
        return Optional.of(new CycleDetectedException(order.unresolved()));
    }
}
