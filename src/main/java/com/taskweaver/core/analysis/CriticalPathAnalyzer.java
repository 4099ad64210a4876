package com.taskweaver.core.analysis;

import com.taskweaver.core.calendar.WorkingCalendar;
import com.taskweaver.core.graph.TaskGraph;
import com.taskweaver.core.graph.TopologicalOrder;
import com.taskweaver.core.model.ProjectPlan;
import com.taskweaver.core.model.Task;
import com.taskweaver.core.scheduler.CycleDetectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Two-pass critical path analysis over an already scheduled plan.
 *
 * <p>The forward pass (topological order) sets each task's earliest start to its own start
 * when it has no dependencies, otherwise to the working day after the latest dependency end.
 * The backward pass (reverse order) sets the latest start of a terminal task to its earliest
 * start, otherwise to the minimum over its dependents of (dependent latest start minus this
 * task's duration). Zero-float tasks form the critical path.
 */
@Service
public class CriticalPathAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CriticalPathAnalyzer.class);

    /**
     * Zero-float tasks, in topological visitation order.
     *
     * @throws CycleDetectedException if the plan's dependencies contain a cycle
     */
    public List<Task> criticalPath(ProjectPlan plan) {
        List<Task> path = analyze(plan).stream()
                .filter(TaskFloat::critical)
                .map(TaskFloat::task)
                .toList();
        log.debug("Critical path: {}", path.stream().map(Task::id).toList());
        return path;
    }

    /**
     * Earliest/latest start and slack for every task, in topological visitation order.
     */
    public List<TaskFloat> analyze(ProjectPlan plan) {
        var graph = TaskGraph.build(plan);
        TopologicalOrder order = graph.topologicalOrder();
        if (!order.complete()) {
            throw new CycleDetectedException(order.unresolved());
        }
        var calendar = new WorkingCalendar(plan.workingDays());

        Map<String, LocalDate> earliest = new HashMap<>();
        for (String id : order.order()) {
            Task task = graph.task(id);
            LocalDate latestDepEnd = graph.dependenciesOf(id).stream()
                    .map(depId -> graph.task(depId).endDate())
                    .filter(Objects::nonNull)
                    .max(LocalDate::compareTo)
                    .orElse(null);
            earliest.put(id, latestDepEnd != null
                    ? calendar.addWorkingDays(latestDepEnd, 1)
                    : task.startDate());
        }

        Map<String, LocalDate> latest = new HashMap<>();
        for (String id : order.reversed()) {
            Task task = graph.task(id);
            int duration = task.duration() != null ? task.duration() : 0;
            LocalDate candidate = null;
            for (String dependent : graph.dependentsOf(id)) {
                LocalDate dependentLatest = latest.get(dependent);
                if (dependentLatest == null) {
                    continue;
                }
                LocalDate value = calendar.subtractWorkingDays(dependentLatest, duration);
                if (candidate == null || value.isBefore(candidate)) {
                    candidate = value;
                }
            }
            latest.put(id, candidate != null ? candidate : earliest.get(id));
        }

        var floats = new ArrayList<TaskFloat>(order.order().size());
        for (String id : order.order()) {
            LocalDate es = earliest.get(id);
            LocalDate ls = latest.get(id);
            floats.add(new TaskFloat(graph.task(id), es, ls, slack(calendar, es, ls)));
        }
        return floats;
    }

    private static int slack(WorkingCalendar calendar, LocalDate earliest, LocalDate latest) {
        if (earliest == null || latest == null || earliest.equals(latest)) {
            return 0;
        }
        if (latest.isAfter(earliest)) {
            return calendar.countWorkingDays(earliest.plusDays(1), latest);
        }
        return -calendar.countWorkingDays(latest.plusDays(1), earliest);
    }
}
