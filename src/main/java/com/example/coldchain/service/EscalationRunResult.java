package com.example.coldchain.service;

/**
 * Counters for one driver run. {@code deferred} alerts were selected but not
 * started before the run budget ran out; they stay due for the next run.
 */
public record EscalationRunResult(int selected, int processed, int skipped, int errors, int deferred) {

    public static EscalationRunResult empty() {
        return new EscalationRunResult(0, 0, 0, 0, 0);
    }
}
