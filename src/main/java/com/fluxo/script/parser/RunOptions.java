package com.fluxo.script.parser;

/** Evaluation limits and policies for one run. */
public final class RunOptions {

    /** Assignment to a name no scope declares: error, or create a global. */
    public enum UndeclaredAssignment { REJECT, CREATE_GLOBAL }

    public static final int DEFAULT_MAX_CALL_DEPTH = 256;
    public static final int DEFAULT_MAX_LOOP_ITERATIONS = 1_000_000;
    public static final int DEFAULT_MAX_DEFERRED_TASKS = 10_000;

    private final UndeclaredAssignment undeclaredAssignment;
    private final int maxCallDepth;
    private final int maxLoopIterations;
    private final int maxDeferredTasks;

    public RunOptions(UndeclaredAssignment undeclaredAssignment, int maxCallDepth,
                      int maxLoopIterations, int maxDeferredTasks) {
        this.undeclaredAssignment = (undeclaredAssignment == null) ? UndeclaredAssignment.REJECT : undeclaredAssignment;
        this.maxCallDepth = Math.max(1, maxCallDepth);
        this.maxLoopIterations = Math.max(1, maxLoopIterations);
        this.maxDeferredTasks = Math.max(0, maxDeferredTasks);
    }

    public static RunOptions defaults() {
        return new RunOptions(UndeclaredAssignment.REJECT, DEFAULT_MAX_CALL_DEPTH,
                DEFAULT_MAX_LOOP_ITERATIONS, DEFAULT_MAX_DEFERRED_TASKS);
    }

    public UndeclaredAssignment undeclaredAssignment() { return undeclaredAssignment; }
    public int maxCallDepth() { return maxCallDepth; }
    public int maxLoopIterations() { return maxLoopIterations; }
    public int maxDeferredTasks() { return maxDeferredTasks; }
}
