package io.tessera.serialization.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tessera.core.agent.AgentInstructions;
import io.tessera.core.agent.AgentResponse;
import io.tessera.core.agent.AgentResponseParser;
import io.tessera.core.agent.AgentRole;
import io.tessera.core.agent.ResponseParseException;
import io.tessera.core.consensus.Vote;
import io.tessera.core.feedback.FeedbackIssue;
import io.tessera.core.feedback.IssueLocation;
import io.tessera.core.feedback.IssueType;
import io.tessera.core.feedback.Severity;
import io.tessera.serialization.CoordinationSerializer;
import io.tessera.serialization.JsonBlocks;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/// Jackson-based {@link AgentResponseParser}.
///
/// The expected JSON shape depends on the role in the instructions.
///
/// **Primary agent:**
/// ```json
/// {"deliverable": "...", "confidence": 0.85, "reasoning": "...", "blockers": []}
/// ```
///
/// **Validator:**
/// ```json
/// {"vote": "PASS", "confidence": 0.9, "reasoning": "...",
///  "issues": [{"type": "security", "severity": "high", "message": "...",
///              "location": {"file": "auth.js", "line": 42}, "suggestedFix": "..."}],
///  "recommendations": [], "failedChecks": [], "blockers": [], "signature": null}
/// ```
///
/// **Product owner:** the raw output is kept as the deliverable and read later by a
/// {@code DecisionParser}.
///
/// Anything else is rejected with {@link ResponseParseException}: missing or
/// out-of-range confidence, an unknown vote, issue type or severity.
///
/// @implNote Thread-safe if the supplied mapper is thread-safe.
public class JacksonAgentResponseParser implements AgentResponseParser {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JacksonAgentResponseParser() {
        this(CoordinationSerializer.createMapper(), Clock.systemUTC());
    }

    /// @param objectMapper mapper used for tree parsing, not null
    /// @param clock time source for response timestamps, not null
    public JacksonAgentResponseParser(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public AgentResponse parse(AgentInstructions instructions, String agentId, String rawOutput) {
        Objects.requireNonNull(instructions, "instructions must not be null");
        Objects.requireNonNull(agentId, "agentId must not be null");
        Objects.requireNonNull(rawOutput, "rawOutput must not be null");

        if (instructions.role() == AgentRole.PRODUCT_OWNER) {
            return new AgentResponse.WorkResult(
                    agentId,
                    instructions.agentType(),
                    rawOutput,
                    0.0,
                    "",
                    List.of(),
                    clock.instant());
        }

        JsonNode root = readObject(rawOutput, agentId);
        try {
            return instructions.role() == AgentRole.VALIDATOR
                    ? validation(root, agentId, instructions.agentType())
                    : work(root, agentId, instructions.agentType());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ResponseParseException(
                    "Invalid response from " + agentId + ": " + e.getMessage(), e);
        }
    }

    private AgentResponse.WorkResult work(JsonNode root, String agentId, String agentType) {
        String deliverable = text(root, "deliverable");
        if (deliverable == null) {
            deliverable = text(root, "output");
        }
        return new AgentResponse.WorkResult(
                agentId,
                agentType,
                deliverable,
                confidence(root, agentId),
                text(root, "reasoning"),
                strings(root, "blockers"),
                clock.instant());
    }

    private AgentResponse.ValidationResult validation(
            JsonNode root, String agentId, String agentType) {
        return new AgentResponse.ValidationResult(
                agentId,
                agentType,
                vote(root, agentId),
                confidence(root, agentId),
                text(root, "reasoning"),
                issues(root),
                strings(root, "recommendations"),
                strings(root, "failedChecks"),
                strings(root, "blockers"),
                text(root, "signature"),
                clock.instant());
    }

    // --- Field extraction ---

    private JsonNode readObject(String rawOutput, String agentId) {
        String json = JsonBlocks.extractObject(rawOutput);
        if (json == null) {
            throw new ResponseParseException("No JSON object in response from " + agentId);
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new ResponseParseException("Response from " + agentId + " is not an object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ResponseParseException(
                    "Malformed JSON from " + agentId + ": " + e.getOriginalMessage(), e);
        }
    }

    private static double confidence(JsonNode root, String agentId) {
        JsonNode node = root.get("confidence");
        if (node == null || !node.isNumber()) {
            throw new ResponseParseException("Response from " + agentId + " has no numeric confidence");
        }
        return node.asDouble();
    }

    private static Vote vote(JsonNode root, String agentId) {
        JsonNode node = root.get("vote");
        if (node == null || !node.isTextual()) {
            throw new ResponseParseException("Validator " + agentId + " did not vote");
        }
        return Vote.valueOf(node.asText().trim().toUpperCase(Locale.ROOT));
    }

    private static List<FeedbackIssue> issues(JsonNode root) {
        JsonNode array = root.get("issues");
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<FeedbackIssue> issues = new ArrayList<>();
        for (JsonNode node : array) {
            issues.add(
                    new FeedbackIssue(
                            IssueType.valueOf(required(node, "type").toUpperCase(Locale.ROOT)),
                            Severity.valueOf(required(node, "severity").toUpperCase(Locale.ROOT)),
                            required(node, "message"),
                            location(node.get("location")),
                            text(node, "suggestedFix")));
        }
        return issues;
    }

    private static IssueLocation location(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode line = node.get("line");
        return new IssueLocation(
                text(node, "file"),
                line != null && line.canConvertToInt() ? line.asInt() : null,
                text(node, "function"));
    }

    private static String required(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("issue field '" + field + "' is missing");
        }
        return value.trim();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static List<String> strings(JsonNode node, String field) {
        JsonNode array = node.get(field);
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        array.forEach(item -> values.add(item.asText()));
        return values;
    }
}
