package io.tessera.core.orchestration;

import java.time.Duration;

/// Counters of one phase run.
///
/// @param primaryExecutions inner rounds that ran the primary agents
/// @param consensusExecutions validator rounds
/// @param averageConfidenceScore overall confidence of the latest inner round
/// @param finalConsensusScore score of the latest consensus round
/// @param gatePasses confidence gates passed
/// @param gateFails confidence or consensus gates failed
/// @param feedbackInjections failed consensus rounds whose feedback was captured
/// @param circuitBreakerTrips breaker trips caused by this phase's calls
/// @param timeouts agent calls or phase deadlines that timed out
/// @param totalDuration wall time of the run so far
public record PhaseStatistics(
        int primaryExecutions,
        int consensusExecutions,
        double averageConfidenceScore,
        double finalConsensusScore,
        int gatePasses,
        int gateFails,
        int feedbackInjections,
        long circuitBreakerTrips,
        int timeouts,
        Duration totalDuration) {}
