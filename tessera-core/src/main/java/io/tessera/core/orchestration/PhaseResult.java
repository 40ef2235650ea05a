package io.tessera.core.orchestration;

import io.tessera.core.agent.AgentResponse;
import io.tessera.core.consensus.ConsensusResult;
import io.tessera.core.feedback.ConsensusFeedback;
import java.util.List;
import java.util.Objects;

/// Outcome of {@link IterationOrchestrator#executePhase}.
///
/// @param phaseId phase identifier, not null
/// @param outcome terminal state, not null
/// @param loop2Iterations outer rounds used, capped at the configured maximum
/// @param totalLoop3Iterations inner rounds across the run
/// @param finalConsensus last consensus result, null if none was reached
/// @param decision decision gate answer, null if the gate was never reached
/// @param deliverables primary output of the last successful inner round, not null
/// @param feedbackHistory feedback of every failed consensus round, not null
/// @param escalationReason why the phase escalated, null when it succeeded
/// @param escalationPrompt hand-off text, null when it succeeded
/// @param statistics counters of the run, not null
public record PhaseResult(
        String phaseId,
        PhaseOutcome outcome,
        int loop2Iterations,
        int totalLoop3Iterations,
        ConsensusResult finalConsensus,
        ProductOwnerDecision decision,
        List<AgentResponse.WorkResult> deliverables,
        List<ConsensusFeedback> feedbackHistory,
        String escalationReason,
        String escalationPrompt,
        PhaseStatistics statistics) {

    public PhaseResult {
        Objects.requireNonNull(phaseId, "phaseId must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");
        deliverables = List.copyOf(deliverables);
        feedbackHistory = List.copyOf(feedbackHistory);
    }

    public boolean succeeded() {
        return outcome == PhaseOutcome.SUCCEEDED;
    }

    public boolean escalated() {
        return outcome == PhaseOutcome.ESCALATED;
    }

    /// Backlog items recorded by a DEFER decision.
    ///
    /// @return items, empty unless the decision was DEFER, never null
    public List<String> backlogItems() {
        return decision != null && decision.decision() == Decision.DEFER
                ? decision.backlogItems()
                : List.of();
    }
}
