package io.tessera.core.orchestration;

import io.tessera.core.agent.AgentResponse;
import io.tessera.core.consensus.ConsensusResult;
import io.tessera.core.feedback.ConsensusFeedback;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Mutable state of one phase run.
///
/// Counters are written by the orchestrating thread and read by
/// {@link IterationOrchestrator#getStatistics(String)} from any thread.
///
/// @implNote Counters are guarded by the instance monitor; the references handed
/// to agent calls on executor threads are volatile.
final class PhaseRun {

    final String phaseId;
    final String task;
    final IterationTracker tracker;
    final Instant startedAt;

    volatile boolean running = true;
    volatile ConsensusFeedback currentFeedback;
    volatile List<AgentResponse.WorkResult> deliverables = List.of();
    volatile ConsensusResult lastConsensus;
    volatile ProductOwnerDecision decision;

    private int primaryExecutions;
    private int consensusExecutions;
    private double averageConfidenceScore;
    private double finalConsensusScore;
    private int gatePasses;
    private int gateFails;
    private int feedbackInjections;
    private long circuitBreakerTrips;
    private int timeouts;
    private Instant finishedAt;

    PhaseRun(String phaseId, String task, IterationTracker tracker, Instant startedAt) {
        this.phaseId = Objects.requireNonNull(phaseId, "phaseId must not be null");
        this.task = Objects.requireNonNull(task, "task must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
    }

    synchronized void primaryExecuted(double overallConfidence) {
        primaryExecutions++;
        averageConfidenceScore = overallConfidence;
    }

    synchronized void consensusExecuted(double score) {
        consensusExecutions++;
        finalConsensusScore = score;
    }

    synchronized void gatePassed() {
        gatePasses++;
    }

    synchronized void gateFailed() {
        gateFails++;
    }

    synchronized void feedbackInjected() {
        feedbackInjections++;
    }

    synchronized void tripped(long trips) {
        circuitBreakerTrips += Math.max(0, trips);
    }

    synchronized void timedOut() {
        timeouts++;
    }

    synchronized void finish(Instant at) {
        finishedAt = at;
        running = false;
    }

    synchronized PhaseStatistics statistics(Instant now) {
        Instant end = finishedAt != null ? finishedAt : now;
        return new PhaseStatistics(
                primaryExecutions,
                consensusExecutions,
                averageConfidenceScore,
                finalConsensusScore,
                gatePasses,
                gateFails,
                feedbackInjections,
                circuitBreakerTrips,
                timeouts,
                Duration.between(startedAt, end));
    }
}
