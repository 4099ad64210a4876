package com.taskweaver.dispatch.cli;

import com.taskweaver.core.io.PlanParseException;
import com.taskweaver.core.scheduler.CycleDetectedException;
import com.taskweaver.core.scheduler.MissingStartDateException;
import picocli.CommandLine;

/**
 * Process exit codes of the TaskWeaver CLI. 2 stays reserved for picocli usage errors.
 */
public final class ExitCodes {

    public static final int OK = CommandLine.ExitCode.OK;
    public static final int FAILED = CommandLine.ExitCode.SOFTWARE;
    public static final int PLAN_UNREADABLE = 3;
    public static final int DEPENDENCY_CYCLE = 4;
    public static final int MISSING_START = 5;
    public static final int TASK_NOT_FOUND = 6;

    private ExitCodes() {}

    /**
     * Exit code for a failed plan run; also installed as picocli's exception mapper.
     */
    public static int of(Throwable failure) {
        if (failure instanceof CycleDetectedException) {
            return DEPENDENCY_CYCLE;
        }
        if (failure instanceof MissingStartDateException) {
            return MISSING_START;
        }
        if (failure instanceof PlanParseException) {
            return PLAN_UNREADABLE;
        }
        return FAILED;
    }
}
