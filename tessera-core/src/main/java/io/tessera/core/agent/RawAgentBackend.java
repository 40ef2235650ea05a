package io.tessera.core.agent;

/// Backend that runs an agent and returns its raw text output.
@FunctionalInterface
public interface RawAgentBackend {

    /// Runs an agent.
    ///
    /// @param instructions the task, not null
    /// @return the agent's identifier and raw output, never null
    /// @throws Exception if the agent could not be run
    RawOutput invoke(AgentInstructions instructions) throws Exception;

    /// Raw result of one agent run.
    ///
    /// @param agentId identifier of the agent instance that ran
    /// @param text raw output
    record RawOutput(String agentId, String text) {}
}
