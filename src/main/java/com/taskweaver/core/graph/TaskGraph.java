package com.taskweaver.core.graph;

import com.taskweaver.core.model.ProjectPlan;
import com.taskweaver.core.model.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Dependency index over one plan: id lookup, forward and reverse edges, in-degrees.
 * <p>
 * Built fresh for every run and never mutated afterwards. Insertion order of the
 * plan is kept everywhere so traversals are deterministic.
 */
public final class TaskGraph {

    private final Map<String, Task> tasksById;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;
    private final Map<String, Integer> inDegree;

    private TaskGraph(Map<String, Task> tasksById,
                      Map<String, Set<String>> dependencies,
                      Map<String, Set<String>> dependents,
                      Map<String, Integer> inDegree) {
        this.tasksById = tasksById;
        this.dependencies = dependencies;
        this.dependents = dependents;
        this.inDegree = inDegree;
    }

    /**
     * Indexes the plan's current task list. Duplicate dependency entries collapse
     * to one edge. Does not modify the plan.
     */
    public static TaskGraph build(ProjectPlan plan) {
        var tasksById = new LinkedHashMap<String, Task>();
        var dependencies = new LinkedHashMap<String, Set<String>>();
        var dependents = new LinkedHashMap<String, Set<String>>();
        var inDegree = new LinkedHashMap<String, Integer>();

        for (Task task : plan.tasks()) {
            tasksById.put(task.id(), task);
            dependencies.put(task.id(), new LinkedHashSet<>(task.dependencies()));
            dependents.put(task.id(), new LinkedHashSet<>());
        }
        for (Task task : plan.tasks()) {
            Set<String> deps = dependencies.get(task.id());
            inDegree.put(task.id(), deps.size());
            for (String dep : deps) {
                dependents.computeIfAbsent(dep, key -> new LinkedHashSet<>()).add(task.id());
            }
        }

        return new TaskGraph(
                Collections.unmodifiableMap(tasksById),
                unmodifiable(dependencies),
                unmodifiable(dependents),
                Collections.unmodifiableMap(inDegree));
    }

    private static Map<String, Set<String>> unmodifiable(Map<String, Set<String>> edges) {
        var copy = new LinkedHashMap<String, Set<String>>();
        edges.forEach((id, set) -> copy.put(id, Collections.unmodifiableSet(set)));
        return Collections.unmodifiableMap(copy);
    }

    public int size() {
        return tasksById.size();
    }

    public Task task(String id) {
        return tasksById.get(id);
    }

    public Set<String> taskIds() {
        return tasksById.keySet();
    }

    public Set<String> dependenciesOf(String id) {
        return dependencies.getOrDefault(id, Set.of());
    }

    public Set<String> dependentsOf(String id) {
        return dependents.getOrDefault(id, Set.of());
    }

    /**
     * A mutable copy of the in-degree map for one traversal to drain.
     */
    public Map<String, Integer> inDegreeSnapshot() {
        return new HashMap<>(inDegree);
    }

    /**
     * Tasks with no dependencies, in plan order.
     */
    public List<String> roots() {
        var roots = new ArrayList<String>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                roots.add(id);
            }
        });
        return roots;
    }

    /**
     * Kahn's algorithm without any date work. Ties are broken FIFO in discovery order.
     * Tasks that can never reach in-degree 0 are returned as unresolved.
     */
    public TopologicalOrder topologicalOrder() {
        Map<String, Integer> remaining = inDegreeSnapshot();
        var queue = new ArrayDeque<>(roots());
        var order = new ArrayList<String>(size());
        var visited = new LinkedHashSet<String>();

        while (!queue.isEmpty()) {
            String id = queue.removeFirst();
            if (!visited.add(id)) {
                continue;
            }
            order.add(id);
            for (String next : dependentsOf(id)) {
                int degree = remaining.merge(next, -1, Integer::sum);
                if (degree == 0) {
                    queue.addLast(next);
                }
            }
        }

        var unresolved = new TreeSet<String>();
        for (String id : tasksById.keySet()) {
            if (!visited.contains(id)) {
                unresolved.add(id);
            }
        }
        return new TopologicalOrder(order, unresolved);
    }
}
