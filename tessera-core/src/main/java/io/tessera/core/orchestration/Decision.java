package io.tessera.core.orchestration;

/// Answer of a {@link DecisionGate}.
public enum Decision {
    /// Work is accepted as is.
    PROCEED,
    /// Work is accepted; remaining non-critical items go to the backlog.
    DEFER,
    /// Work needs human judgement.
    ESCALATE
}
