package io.tessera.core.orchestration;

/// Point-in-time view of a phase's iteration counters.
///
/// @param phaseId phase identifier, not null
/// @param loop2 completed or running outer rounds
/// @param loop3 inner rounds within the current outer round
/// @param maxLoop2 outer round limit
/// @param maxLoop3 inner round limit
/// @param totalLoop3 inner rounds across the whole phase
public record IterationState(
        String phaseId, int loop2, int loop3, int maxLoop2, int maxLoop3, int totalLoop3) {

    /// Outer rounds left before the phase escalates.
    public int remainingLoop2() {
        return Math.max(0, maxLoop2 - loop2);
    }
}
