package io.tessera.core.orchestration;

import io.tessera.core.agent.AgentResponse;
import java.util.List;
import java.util.Objects;

/// Self-reported confidence of one primary agent.
///
/// @param agentId agent instance, not null
/// @param agentType agent type, not null
/// @param confidence value in `[0, 1]`
/// @param reasoning free-text justification, not null
/// @param blockers unresolved concerns, not null
public record ConfidenceScore(
        String agentId,
        String agentType,
        double confidence,
        String reasoning,
        List<String> blockers) {

    public ConfidenceScore {
        Objects.requireNonNull(agentId, "agentId must not be null");
        Objects.requireNonNull(agentType, "agentType must not be null");
        Objects.requireNonNull(reasoning, "reasoning must not be null");
        blockers = List.copyOf(blockers);
    }

    static ConfidenceScore from(AgentResponse.WorkResult result) {
        return new ConfidenceScore(
                result.agentId(),
                result.agentType(),
                result.confidence(),
                result.reasoning(),
                result.blockers());
    }
}
