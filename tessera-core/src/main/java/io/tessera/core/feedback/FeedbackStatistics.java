package io.tessera.core.feedback;

import java.util.Map;

/// Aggregate view over captured feedback.
///
/// @param totalIterations number of captured rounds
/// @param totalIssues number of issues across those rounds
/// @param issuesByType issue count per category
/// @param issuesBySeverity issue count per severity
/// @param averageConsensusScore mean score of the captured rounds, `0` when none
public record FeedbackStatistics(
        int totalIterations,
        int totalIssues,
        Map<IssueType, Integer> issuesByType,
        Map<Severity, Integer> issuesBySeverity,
        double averageConsensusScore) {

    public FeedbackStatistics {
        issuesByType = issuesByType != null ? Map.copyOf(issuesByType) : Map.of();
        issuesBySeverity = issuesBySeverity != null ? Map.copyOf(issuesBySeverity) : Map.of();
    }

    public static FeedbackStatistics empty() {
        return new FeedbackStatistics(0, 0, Map.of(), Map.of(), 0.0);
    }
}
