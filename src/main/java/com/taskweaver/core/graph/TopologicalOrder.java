package com.taskweaver.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Result of draining a {@link TaskGraph}: the ids visited in dependency order, and the
 * ids that could not be reached because they sit on or behind a cycle.
 *
 * @param order      task ids, every task after all of its dependencies
 * @param unresolved ids never released, sorted; empty for an acyclic graph
 */
public record TopologicalOrder(List<String> order, SortedSet<String> unresolved) {

    public TopologicalOrder {
        order = List.copyOf(order);
        unresolved = Collections.unmodifiableSortedSet(new TreeSet<>(unresolved));
    }

    public boolean complete() {
        return unresolved.isEmpty();
    }

    public List<String> reversed() {
        var copy = new ArrayList<>(order);
        Collections.reverse(copy);
        return copy;
    }
}
