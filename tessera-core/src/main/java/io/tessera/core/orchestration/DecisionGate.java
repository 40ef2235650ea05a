package io.tessera.core.orchestration;

/// Last gate of a phase: turns a passing consensus into PROCEED, DEFER or ESCALATE.
///
/// @see ThresholdDecisionGate
/// @see ProductOwnerDecisionGate
@FunctionalInterface
public interface DecisionGate {

    /// Decides the phase outcome.
    ///
    /// @param context consensus and deliverables of the round, not null
    /// @return the decision, never null
    /// @throws Exception if the decision could not be obtained; the orchestrator
    ///         escalates the phase
    ProductOwnerDecision decide(DecisionContext context) throws Exception;
}
