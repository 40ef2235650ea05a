package io.tessera.core.consensus;

/// Observer for notable consensus events.
///
/// All methods default to no-ops. Exceptions thrown by a listener are logged
/// and ignored by the evaluator.
public interface ConsensusListener {

    ConsensusListener NOOP = new ConsensusListener() {};

    /// Called once per validator flagged as malicious.
    ///
    /// @param report the flagged validator and its violated criteria
    default void onMaliciousAgentDetected(MaliciousAgentReport report) {}

    /// Called when the Byzantine path failed and the round was scored in simple mode.
    ///
    /// @param cause the failure that triggered the fallback
    default void onFallbackToSimple(Exception cause) {}
}
