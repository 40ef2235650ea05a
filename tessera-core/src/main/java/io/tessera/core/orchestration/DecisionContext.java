package io.tessera.core.orchestration;

import io.tessera.core.agent.AgentResponse;
import io.tessera.core.consensus.ConsensusResult;
import io.tessera.core.feedback.ValidatorFeedback;
import java.util.List;
import java.util.Objects;

/// Everything a {@link DecisionGate} sees about a phase whose consensus passed.
///
/// @param phaseId phase identifier, not null
/// @param task original task text, not null
/// @param iteration outer round that reached consensus
/// @param consensus the passing consensus result, not null
/// @param deliverables primary agent output of the round, not null
/// @param validatorFeedback issues and recommendations from the validators, not null
public record DecisionContext(
        String phaseId,
        String task,
        int iteration,
        ConsensusResult consensus,
        List<AgentResponse.WorkResult> deliverables,
        List<ValidatorFeedback> validatorFeedback) {

    public DecisionContext {
        Objects.requireNonNull(phaseId, "phaseId must not be null");
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(consensus, "consensus must not be null");
        deliverables = List.copyOf(deliverables);
        validatorFeedback = List.copyOf(validatorFeedback);
    }
}
