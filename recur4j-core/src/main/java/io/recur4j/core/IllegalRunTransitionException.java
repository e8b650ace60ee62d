package io.recur4j.core;

/**
 * Raised when an execution record is moved out of PLANNED -> STARTED -> FINISHED order.
 */
public class IllegalRunTransitionException extends IllegalStateException {

    private final String runId;
    private final RunState actual;

    public IllegalRunTransitionException(String runId, RunState expected, RunState actual) {
        super("run " + runId + " must be " + expected + " but was " + actual);
        this.runId = runId;
        this.actual = actual;
    }

    public IllegalRunTransitionException(String message) {
        super(message);
        this.runId = null;
        this.actual = null;
    }

    public String runId() {
        return runId;
    }

    public RunState actual() {
        return actual;
    }
}
