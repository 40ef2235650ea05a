package io.tessera.core.feedback;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Feedback captured from a failed consensus round.
///
/// @param phaseId phase the round belongs to, not null
/// @param iteration outer iteration number
/// @param score consensus score reached
/// @param requiredScore score that was required
/// @param validatorFeedback per-validator detail after deduplication, not null
/// @param failedCriteria distinct failed acceptance criteria, not null
/// @param actionableSteps steps in {@link ActionableStep#EXECUTION_ORDER}, not null
/// @param previousIterations earlier rounds of the phase, oldest first, not null
/// @param timestamp capture time, not null
public record ConsensusFeedback(
        String phaseId,
        int iteration,
        double score,
        double requiredScore,
        List<ValidatorFeedback> validatorFeedback,
        List<String> failedCriteria,
        List<ActionableStep> actionableSteps,
        List<IterationHistory> previousIterations,
        Instant timestamp) {

    public ConsensusFeedback {
        Objects.requireNonNull(phaseId, "phaseId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        validatorFeedback = validatorFeedback != null ? List.copyOf(validatorFeedback) : List.of();
        failedCriteria = failedCriteria != null ? List.copyOf(failedCriteria) : List.of();
        actionableSteps = actionableSteps != null ? List.copyOf(actionableSteps) : List.of();
        previousIterations =
                previousIterations != null ? List.copyOf(previousIterations) : List.of();
    }

    public boolean consensusFailed() {
        return score < requiredScore;
    }

    /// Returns all issues across validators.
    public List<FeedbackIssue> allIssues() {
        return validatorFeedback.stream().flatMap(vf -> vf.issues().stream()).toList();
    }

    /// Returns the steps of the given priority, in execution order.
    public List<ActionableStep> stepsWithPriority(Severity priority) {
        return actionableSteps.stream().filter(s -> s.priority() == priority).toList();
    }
}
