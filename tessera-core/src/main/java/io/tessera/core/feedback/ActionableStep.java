package io.tessera.core.feedback;

import java.util.Comparator;
import java.util.Objects;

/// A concrete instruction derived from validator feedback.
///
/// @param priority urgency, not null
/// @param category issue category or `improvement` / `validation`, not null
/// @param action what to do, not null
/// @param targetAgent agent type responsible, may be null when anyone may act
/// @param estimatedEffort expected effort, not null
public record ActionableStep(
        Severity priority,
        String category,
        String action,
        String targetAgent,
        Effort estimatedEffort) {

    /// Priority first (critical to low), then ascending effort so quick wins lead
    /// within a tier.
    public static final Comparator<ActionableStep> EXECUTION_ORDER =
            Comparator.comparing(ActionableStep::priority)
                    .thenComparing(ActionableStep::estimatedEffort);

    public ActionableStep {
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(estimatedEffort, "estimatedEffort must not be null");
    }
}
