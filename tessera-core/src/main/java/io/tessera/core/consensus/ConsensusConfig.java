package io.tessera.core.consensus;

import java.util.Objects;

/// Configuration for {@link ConsensusEvaluator}.
///
/// ### Default Values
/// - `mode`: {@link ConsensusMode#SIMPLE}
/// - `threshold`: `0.90`
/// - `quorumSize`: `null`, meaning `ceil(2n/3)` of the votes in the round
/// - `outlierStdDevs`: `2.0`
/// - `minReasoningLength`: `10`
/// - `approvalConfidence`: `0.75`, split point for the approve/reject breakdown
///
/// @param mode scoring mode, not null
/// @param threshold minimum score for a pass, within `[0, 1]`
/// @param quorumSize fixed quorum for Byzantine phases, may be null
/// @param outlierStdDevs standard deviations from the mean beyond which a confidence
///        counts as an outlier
/// @param minReasoningLength reasoning shorter than this is suspicious
/// @param approvalConfidence confidence at or above which a vote counts as approval
///        in the voting breakdown
public record ConsensusConfig(
        ConsensusMode mode,
        double threshold,
        Integer quorumSize,
        double outlierStdDevs,
        int minReasoningLength,
        double approvalConfidence) {

    public static final double DEFAULT_THRESHOLD = 0.90;
    public static final double DEFAULT_OUTLIER_STD_DEVS = 2.0;
    public static final int DEFAULT_MIN_REASONING_LENGTH = 10;
    public static final double DEFAULT_APPROVAL_CONFIDENCE = 0.75;

    public ConsensusConfig {
        Objects.requireNonNull(mode, "mode must not be null");
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0, 1]: " + threshold);
        }
        if (quorumSize != null && quorumSize < 1) {
            throw new IllegalArgumentException("quorumSize must be positive");
        }
    }

    public static ConsensusConfig simple() {
        return simple(DEFAULT_THRESHOLD);
    }

    public static ConsensusConfig simple(double threshold) {
        return new ConsensusConfig(
                ConsensusMode.SIMPLE,
                threshold,
                null,
                DEFAULT_OUTLIER_STD_DEVS,
                DEFAULT_MIN_REASONING_LENGTH,
                DEFAULT_APPROVAL_CONFIDENCE);
    }

    public static ConsensusConfig byzantine() {
        return byzantine(DEFAULT_THRESHOLD);
    }

    public static ConsensusConfig byzantine(double threshold) {
        return new ConsensusConfig(
                ConsensusMode.BYZANTINE,
                threshold,
                null,
                DEFAULT_OUTLIER_STD_DEVS,
                DEFAULT_MIN_REASONING_LENGTH,
                DEFAULT_APPROVAL_CONFIDENCE);
    }

    /// Returns a copy with a fixed quorum size.
    public ConsensusConfig withQuorumSize(Integer newQuorumSize) {
        return new ConsensusConfig(
                mode,
                threshold,
                newQuorumSize,
                outlierStdDevs,
                minReasoningLength,
                approvalConfidence);
    }

    /// Returns the quorum for a round with `voteCount` votes.
    ///
    /// @param voteCount number of trusted votes in the round
    /// @return configured quorum, or `ceil(2 * voteCount / 3)`
    public int quorumFor(int voteCount) {
        if (quorumSize != null) {
            return quorumSize;
        }
        return (int) Math.ceil(2.0 * voteCount / 3.0);
    }
}
