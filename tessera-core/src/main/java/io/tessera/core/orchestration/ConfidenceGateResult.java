package io.tessera.core.orchestration;

import java.util.List;

/// Outcome of the self-assessment gate that closes an inner round.
///
/// @param passed `true` when at least one score was reported and every score met
///        the threshold
/// @param overallConfidence mean of the reported scores, `0` when none
/// @param threshold minimum per-agent confidence
/// @param scores every reported score, not null
/// @param lowConfidenceAgents ids of agents below the threshold, not null
public record ConfidenceGateResult(
        boolean passed,
        double overallConfidence,
        double threshold,
        List<ConfidenceScore> scores,
        List<String> lowConfidenceAgents) {

    public ConfidenceGateResult {
        scores = List.copyOf(scores);
        lowConfidenceAgents = List.copyOf(lowConfidenceAgents);
    }

    /// Evaluates the gate.
    ///
    /// @param scores reported scores, not null
    /// @param threshold minimum per-agent confidence
    /// @return gate outcome, never null
    public static ConfidenceGateResult evaluate(List<ConfidenceScore> scores, double threshold) {
        List<String> low =
                scores.stream()
                        .filter(s -> s.confidence() < threshold)
                        .map(ConfidenceScore::agentId)
                        .toList();
        double mean =
                scores.stream().mapToDouble(ConfidenceScore::confidence).average().orElse(0.0);
        return new ConfidenceGateResult(!scores.isEmpty() && low.isEmpty(), mean, threshold, scores, low);
    }

    /// Gate result for an inner round whose agents could not run.
    static ConfidenceGateResult failed(double threshold) {
        return new ConfidenceGateResult(false, 0.0, threshold, List.of(), List.of());
    }
}
