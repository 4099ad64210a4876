package com.taskweaver.core.scheduler;

import com.taskweaver.core.calendar.WorkingCalendar;
import com.taskweaver.core.graph.TaskGraph;
import com.taskweaver.core.logging.MdcContext;
import com.taskweaver.core.model.ProjectPlan;
import com.taskweaver.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes a fully dated plan from a partially dated one.
 *
 * <p>Tasks are visited in dependency order (Kahn's algorithm, FIFO among ready tasks) and
 * each one is dated by a {@link DateDeriver} once all of its dependencies are dated.
 * The input plan is never modified; a new plan is returned.
 */
@Service
public class PlanScheduler {

    private static final Logger log = LoggerFactory.getLogger(PlanScheduler.class);

    private final SchedulingProperties properties;
    private final Clock clock;

    public PlanScheduler(SchedulingProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Schedule every task of {@code plan}.
     *
     * @param plan plan with unique ids and resolvable dependencies
     * @return a new plan with every task dated and the plan start/end recomputed
     * @throws CycleDetectedException    if some tasks can never be ordered
     * @throws MissingStartDateException in strict mode, if a task cannot be dated
     */
    public ProjectPlan schedule(ProjectPlan plan) {
        var calendar = new WorkingCalendar(plan.workingDays());
        var deriver = new DateDeriver(calendar, plan.startDate(), clock, properties.isRequirePlanStart());
        var graph = TaskGraph.build(plan);

        log.info("schedule: {} tasks, calendar={}, planStart={}",
                graph.size(), calendar.workingDays(), plan.startDate());

        Map<String, Integer> inDegree = graph.inDegreeSnapshot();
        var queue = new ArrayDeque<>(graph.roots());
        Map<String, Task> dated = new HashMap<>();
        Set<String> processed = new HashSet<>();

        while (!queue.isEmpty()) {
            String id = queue.removeFirst();
            if (!processed.add(id)) {
                continue;
            }

            Task task = graph.task(id);
            var deps = new ArrayList<Task>();
            for (String depId : graph.dependenciesOf(id)) {
                deps.add(dated.get(depId));
            }
            MdcContext.setTask(id);
            try {
                dated.put(id, deriver.derive(task, deps));
            } finally {
                MdcContext.clearTask();
            }

            for (String dependent : graph.dependentsOf(id)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    queue.addLast(dependent);
                }
            }
        }

        if (processed.size() < graph.size()) {
            var unprocessed = new TreeSet<>(graph.taskIds());
            unprocessed.removeAll(processed);
            log.warn("schedule: dependency cycle, {} of {} tasks unprocessed: {}",
                    unprocessed.size(), graph.size(), unprocessed);
            throw new CycleDetectedException(unprocessed);
        }

        List<Task> tasks = plan.tasks().stream().map(t -> dated.get(t.id())).toList();
        ProjectPlan result = withPlanDates(plan.withTasks(tasks));
        log.info("schedule: done, plan spans {} .. {}", result.startDate(), result.endDate());
        return result;
    }

    /**
     * Plan start is the earliest task start, plan end the latest task end.
     * A plan without tasks, or without any dated task, keeps its dates.
     */
    private ProjectPlan withPlanDates(ProjectPlan plan) {
        if (plan.tasks().isEmpty()) {
            return plan;
        }
        LocalDate start = plan.tasks().stream()
                .map(Task::startDate).filter(Objects::nonNull)
                .min(LocalDate::compareTo).orElse(plan.startDate());
        LocalDate end = plan.tasks().stream()
                .map(Task::endDate).filter(Objects::nonNull)
                .max(LocalDate::compareTo).orElse(plan.endDate());
        return plan.withDates(start, end);
    }
}
