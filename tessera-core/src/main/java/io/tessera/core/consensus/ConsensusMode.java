package io.tessera.core.consensus;

/// Scoring mode used by {@link ConsensusEvaluator}.
public enum ConsensusMode {
    /// Mean confidence against the threshold.
    SIMPLE,
    /// Quorum-checked prepare/commit/reply phases with malicious-validator detection.
    BYZANTINE
}
