package io.tessera.core.orchestration;

/// Terminal state of a phase run.
public enum PhaseOutcome {
    /// Consensus reached and the decision gate answered PROCEED or DEFER.
    SUCCEEDED,
    /// A limit, timeout or ESCALATE decision handed the phase to a human.
    ESCALATED
}
