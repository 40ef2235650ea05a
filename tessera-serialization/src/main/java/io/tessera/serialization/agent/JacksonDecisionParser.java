package io.tessera.serialization.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tessera.core.orchestration.Decision;
import io.tessera.core.orchestration.DecisionParser;
import io.tessera.core.orchestration.ProductOwnerDecision;
import io.tessera.serialization.CoordinationSerializer;
import io.tessera.serialization.JsonBlocks;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Jackson-based {@link DecisionParser}.
///
/// Reads
/// ```json
/// {"decision": "DEFER", "confidence": 0.92, "reasoning": "...",
///  "backlogItems": ["..."], "blockers": [], "recommendations": []}
/// ```
/// from a fenced block or the first `{...}` of the output. Missing JSON, malformed
/// JSON and unknown decisions all yield
/// {@link ProductOwnerDecision#parsingFailed(String)}. Confidence is clamped to
/// `[0, 1]` by the record.
public class JacksonDecisionParser implements DecisionParser {

    private static final Logger logger = Logger.getLogger(JacksonDecisionParser.class.getName());

    private final ObjectMapper objectMapper;

    public JacksonDecisionParser() {
        this(CoordinationSerializer.createMapper());
    }

    public JacksonDecisionParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public ProductOwnerDecision parse(String rawOutput) {
        if (rawOutput == null || rawOutput.isBlank()) {
            return ProductOwnerDecision.parsingFailed("empty output");
        }
        String json = JsonBlocks.extractObject(rawOutput);
        if (json == null) {
            return ProductOwnerDecision.parsingFailed("no JSON object found");
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode decision = root.get("decision");
            if (decision == null || !decision.isTextual()) {
                return ProductOwnerDecision.parsingFailed("missing decision field");
            }
            JsonNode confidence = root.get("confidence");
            JsonNode reasoning = root.get("reasoning");
            return new ProductOwnerDecision(
                    Decision.valueOf(decision.asText().trim().toUpperCase(Locale.ROOT)),
                    confidence != null && confidence.isNumber() ? confidence.asDouble() : 0.0,
                    reasoning != null && !reasoning.isNull() ? reasoning.asText() : "",
                    strings(root, "backlogItems"),
                    strings(root, "blockers"),
                    strings(root, "recommendations"));
        } catch (Exception e) {
            logger.log(Level.WARNING, "Failed to parse Product Owner decision", e);
            return ProductOwnerDecision.parsingFailed(e.getMessage());
        }
    }

    private static List<String> strings(JsonNode root, String field) {
        JsonNode array = root.get(field);
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        array.forEach(item -> values.add(item.asText()));
        return values;
    }
}
