package io.tessera.core.feedback;

import java.util.List;
import java.util.Objects;

/// Everything one validator reported in a consensus round.
///
/// @param validator validator agent ID, not null
/// @param validatorType validator role, not null
/// @param issues reported issues, not null
/// @param recommendations non-blocking suggestions, not null
/// @param failedChecks acceptance criteria the validator considers failed, not null
/// @param confidence validator confidence in `[0, 1]`
public record ValidatorFeedback(
        String validator,
        String validatorType,
        List<FeedbackIssue> issues,
        List<String> recommendations,
        List<String> failedChecks,
        double confidence) {

    public ValidatorFeedback {
        Objects.requireNonNull(validator, "validator must not be null");
        validatorType = validatorType != null ? validatorType : "reviewer";
        issues = issues != null ? List.copyOf(issues) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
        failedChecks = failedChecks != null ? List.copyOf(failedChecks) : List.of();
    }

    /// Returns a copy carrying a different issue list.
    public ValidatorFeedback withIssues(List<FeedbackIssue> newIssues) {
        return new ValidatorFeedback(
                validator, validatorType, newIssues, recommendations, failedChecks, confidence);
    }
}
