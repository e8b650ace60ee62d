package io.recur4j.core;

/**
 * Lifecycle position of an execution record, derived from which timestamps are set.
 */
public enum RunState {
    PLANNED,
    STARTED,
    FINISHED
}
