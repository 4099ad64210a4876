package com.taskweaver.core.scheduler;

import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Thrown when a scheduling run cannot order every task because of a dependency cycle.
 * Any dates computed during the failed run must be discarded.
 */
public class CycleDetectedException extends RuntimeException {

    private final SortedSet<String> taskIds;

    public CycleDetectedException(Collection<String> taskIds) {
        super("Dependency cycle detected among tasks: " + new TreeSet<>(taskIds));
        this.taskIds = new TreeSet<>(taskIds);
    }

    /**
     * IDs of every task left unprocessed, sorted.
     */
    public SortedSet<String> getTaskIds() {
        return new TreeSet<>(taskIds);
    }
}
