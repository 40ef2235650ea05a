package io.tessera.core.agent;

import java.util.Objects;
import java.util.logging.Logger;

/// {@link AgentExecutor} over a text-producing backend.
///
/// Every raw output goes through the parser; output that fails to parse surfaces
/// as a {@link ResponseParseException}, which the surrounding circuit breaker
/// counts as a failed call.
public final class ParsingAgentExecutor implements AgentExecutor {

    private static final Logger logger = Logger.getLogger(ParsingAgentExecutor.class.getName());

    private final RawAgentBackend backend;
    private final AgentResponseParser parser;

    public ParsingAgentExecutor(RawAgentBackend backend, AgentResponseParser parser) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    @Override
    public AgentResponse execute(AgentInstructions instructions) throws Exception {
        RawAgentBackend.RawOutput raw = backend.invoke(instructions);
        if (raw == null || raw.text() == null) {
            throw new ResponseParseException(
                    "Agent " + instructions.agentType() + " returned no output");
        }
        try {
            return parser.parse(instructions, raw.agentId(), raw.text());
        } catch (ResponseParseException e) {
            logger.warning(
                    "Rejected output of agent " + raw.agentId() + ": " + e.getMessage());
            throw e;
        }
    }
}
