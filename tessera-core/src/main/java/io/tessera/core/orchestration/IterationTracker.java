package io.tessera.core.orchestration;

import java.util.Objects;

/// Counts outer (loop2) and inner (loop3) rounds for one phase.
///
/// A counter is incremented before the round runs; the returned {@link Tick}
/// reports whether the increment went past the limit, in which case the round
/// must not run.
///
/// @implNote Thread-safe via the instance monitor.
final class IterationTracker {

    /// Result of one increment.
    ///
    /// @param counter value after the increment
    /// @param max configured limit
    /// @param exceeded `true` if `counter > max`
    record Tick(int counter, int max, boolean exceeded) {}

    private final String phaseId;
    private final int maxLoop2;
    private final int maxLoop3;
    private int loop2;
    private int loop3;
    private int totalLoop3;

    IterationTracker(String phaseId, int maxLoop2, int maxLoop3) {
        this.phaseId = Objects.requireNonNull(phaseId, "phaseId must not be null");
        this.maxLoop2 = maxLoop2;
        this.maxLoop3 = maxLoop3;
    }

    synchronized Tick incrementLoop2() {
        loop2++;
        return new Tick(loop2, maxLoop2, loop2 > maxLoop2);
    }

    synchronized Tick incrementLoop3() {
        loop3++;
        totalLoop3++;
        return new Tick(loop3, maxLoop3, loop3 > maxLoop3);
    }

    synchronized void resetLoop3() {
        loop3 = 0;
    }

    synchronized int loop2() {
        return loop2;
    }

    synchronized IterationState state() {
        return new IterationState(phaseId, loop2, loop3, maxLoop2, maxLoop3, totalLoop3);
    }
}
