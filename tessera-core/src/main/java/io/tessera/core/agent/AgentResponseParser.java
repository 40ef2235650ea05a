package io.tessera.core.agent;

/// Parse-or-reject step between raw agent output and the typed model.
///
/// @see ParsingAgentExecutor
public interface AgentResponseParser {

    /// Parses raw agent output.
    ///
    /// @param instructions the task that produced the output, not null
    /// @param agentId identifier of the agent that ran, not null
    /// @param rawOutput raw text returned by the agent, not null
    /// @return typed response matching the instructions' role, never null
    /// @throws ResponseParseException if the output has no valid response shape
    AgentResponse parse(AgentInstructions instructions, String agentId, String rawOutput);
}
