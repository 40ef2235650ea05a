package io.tessera.core.agent;

/// Pluggable capability that runs one agent on one task.
///
/// The orchestrator treats every call as a slow, possibly failing remote call and
/// always wraps it in a {@link io.tessera.core.breaker.CircuitBreaker}. Swapping
/// the execution backend never touches orchestration logic.
@FunctionalInterface
public interface AgentExecutor {

    /// Runs an agent.
    ///
    /// @param instructions the task, not null
    /// @return the agent's typed response, never null
    /// @throws Exception if the agent could not be run
    AgentResponse execute(AgentInstructions instructions) throws Exception;
}
