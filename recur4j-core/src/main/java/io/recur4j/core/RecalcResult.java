package io.recur4j.core;

/**
 * Result of a bulk next-run recalculation.
 *
 * updated : jobs whose next run was rewritten
 * failed  : jobs whose rule produced no occurrence or raised; their cached value is untouched
 * stale   : jobs edited concurrently; the edit already recomputed their next run
 */
public record RecalcResult(
        int updated,
        int failed,
        int stale
) {

    public static RecalcResult empty() {
        return new RecalcResult(0, 0, 0);
    }

    public int total() {
        return updated + failed + stale;
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
