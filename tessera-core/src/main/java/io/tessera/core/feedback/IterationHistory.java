package io.tessera.core.feedback;

import java.util.List;

/// Summary of an earlier consensus round of the same phase.
///
/// @param iteration outer iteration number
/// @param score consensus score reached
/// @param issues issues raised that round
/// @param resolved whether the round reached its required score
public record IterationHistory(
        int iteration, double score, List<FeedbackIssue> issues, boolean resolved) {

    public IterationHistory {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }
}
