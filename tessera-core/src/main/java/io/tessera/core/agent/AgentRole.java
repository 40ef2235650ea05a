package io.tessera.core.agent;

/// Role an agent plays in a phase.
public enum AgentRole {
    /// Produces the deliverable (inner loop).
    PRIMARY,
    /// Reviews the deliverable and votes (outer loop).
    VALIDATOR,
    /// Makes the final PROCEED / DEFER / ESCALATE call.
    PRODUCT_OWNER
}
