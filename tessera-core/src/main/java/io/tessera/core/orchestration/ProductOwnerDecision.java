package io.tessera.core.orchestration;

import java.util.List;
import java.util.Objects;

/// Final verdict on a phase whose consensus gate passed.
///
/// @param decision the verdict, not null
/// @param confidence decision confidence, clamped to `[0, 1]`
/// @param reasoning explanation, not null
/// @param backlogItems deferred work, recorded when `decision` is DEFER, not null
/// @param blockers issues preventing PROCEED, not null
/// @param recommendations follow-up advice, not null
public record ProductOwnerDecision(
        Decision decision,
        double confidence,
        String reasoning,
        List<String> backlogItems,
        List<String> blockers,
        List<String> recommendations) {

    public static final String PARSE_FAILURE_BLOCKER = "Product Owner decision parsing failed";

    public ProductOwnerDecision {
        Objects.requireNonNull(decision, "decision must not be null");
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        reasoning = reasoning != null ? reasoning : "";
        backlogItems = backlogItems != null ? List.copyOf(backlogItems) : List.of();
        blockers = blockers != null ? List.copyOf(blockers) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    /// Fallback used when the decision text cannot be read.
    ///
    /// @param detail parser message, may be null
    /// @return an ESCALATE decision with zero confidence, never null
    public static ProductOwnerDecision parsingFailed(String detail) {
        String reasoning =
                detail == null || detail.isBlank()
                        ? "Failed to parse Product Owner decision"
                        : "Failed to parse Product Owner decision: " + detail;
        return new ProductOwnerDecision(
                Decision.ESCALATE,
                0.0,
                reasoning,
                List.of(),
                List.of(PARSE_FAILURE_BLOCKER),
                List.of());
    }

    /// ESCALATE decision carrying a single reason.
    static ProductOwnerDecision escalate(String reasoning) {
        return new ProductOwnerDecision(
                Decision.ESCALATE, 0.0, reasoning, List.of(), List.of(reasoning), List.of());
    }
}
