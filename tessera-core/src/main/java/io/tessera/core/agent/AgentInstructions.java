package io.tessera.core.agent;

import java.util.Objects;

/// Task handed to one agent.
///
/// @param phaseId phase the task belongs to, not null
/// @param agentType agent type to run, e.g. `coder` or `reviewer`, not null
/// @param role the agent's role, not null
/// @param prompt full instructions including any injected feedback, not null
/// @param outerIteration current consensus round (loop 2), 1-based
/// @param innerIteration current primary round (loop 3), 1-based, 0 outside the inner loop
public record AgentInstructions(
        String phaseId,
        String agentType,
        AgentRole role,
        String prompt,
        int outerIteration,
        int innerIteration) {

    public AgentInstructions {
        Objects.requireNonNull(phaseId, "phaseId must not be null");
        Objects.requireNonNull(agentType, "agentType must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
    }
}
