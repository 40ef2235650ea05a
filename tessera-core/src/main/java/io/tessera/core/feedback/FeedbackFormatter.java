package io.tessera.core.feedback;

import static io.tessera.core.feedback.FeedbackSanitizer.sanitize;

import java.util.List;
import java.util.Locale;

/// Renders {@link ConsensusFeedback} as a markdown block for agent instructions.
///
/// Every free-text value coming from a validator passes through
/// {@link FeedbackSanitizer} before it is rendered.
public final class FeedbackFormatter {

    static final int MAX_ADDITIONAL_ITEMS = 5;

    private FeedbackFormatter() {}

    /// Formats feedback, marking the critical steps owned by `targetAgent`.
    ///
    /// @param feedback captured feedback, not null
    /// @param targetAgent agent type receiving the block, may be null
    /// @return markdown text, never null
    public static String format(ConsensusFeedback feedback, String targetAgent) {
        StringBuilder out = new StringBuilder();

        line(out, "## Self-Correcting Loop: Iteration " + feedback.iteration() + " Feedback");
        line(out, "");
        line(
                out,
                "**Consensus Status**: FAILED ("
                        + percent(feedback.score())
                        + " / "
                        + percent(feedback.requiredScore())
                        + " required)");
        line(
                out,
                "**Next Action**: relaunch the primary agents with this feedback integrated."
                        + " No human approval is needed.");
        line(out, "");

        List<ActionableStep> critical = feedback.stepsWithPriority(Severity.CRITICAL);
        if (!critical.isEmpty()) {
            line(out, "### CRITICAL ISSUES (Must Fix Immediately)");
            for (int i = 0; i < critical.size(); i++) {
                ActionableStep step = critical.get(i);
                line(out, numbered(i, step));
                if (step.targetAgent() != null && step.targetAgent().equals(targetAgent)) {
                    line(out, "   - This is your responsibility");
                }
            }
            line(out, "");
        }

        List<ActionableStep> high = feedback.stepsWithPriority(Severity.HIGH);
        if (!high.isEmpty()) {
            line(out, "### High Priority Issues");
            for (int i = 0; i < high.size(); i++) {
                line(out, numbered(i, high.get(i)));
            }
            line(out, "");
        }

        line(out, "### Validator Feedback");
        for (ValidatorFeedback vf : feedback.validatorFeedback()) {
            line(out, "**" + sanitize(vf.validator()) + "** (" + sanitize(vf.validatorType()) + "):");
            for (FeedbackIssue issue : vf.issues()) {
                line(
                        out,
                        "  ["
                                + issue.severity()
                                + "] ["
                                + issue.type().wireName()
                                + "] "
                                + sanitize(issue.message()));
                if (issue.location() != null) {
                    IssueLocation location = issue.location();
                    String file = location.file() != null ? sanitize(location.file()) : "N/A";
                    String lineNo = location.line() != null ? ":" + location.line() : "";
                    line(out, "     Location: " + file + lineNo);
                }
                if (issue.suggestedFix() != null) {
                    line(out, "     Fix: " + sanitize(issue.suggestedFix()));
                }
            }
            line(out, "");
        }

        if (!feedback.previousIterations().isEmpty()) {
            line(out, "### Learnings from Previous Iterations");
            for (IterationHistory history : feedback.previousIterations()) {
                line(
                        out,
                        "- Iteration "
                                + history.iteration()
                                + ": "
                                + (history.resolved() ? "Resolved" : "Unresolved")
                                + " (Score: "
                                + percent(history.score())
                                + ")");
            }
            line(out, "");
        }

        List<ActionableStep> additional =
                feedback.actionableSteps().stream()
                        .filter(
                                s ->
                                        s.priority() == Severity.MEDIUM
                                                || s.priority() == Severity.LOW)
                        .toList();
        if (!additional.isEmpty()) {
            line(out, "### Additional Improvements (" + additional.size() + " items)");
            int shown = Math.min(MAX_ADDITIONAL_ITEMS, additional.size());
            for (int i = 0; i < shown; i++) {
                ActionableStep step = additional.get(i);
                line(out, (i + 1) + ". [" + step.priority() + "] " + sanitize(step.action()));
            }
            if (additional.size() > MAX_ADDITIONAL_ITEMS) {
                line(out, "... and " + (additional.size() - MAX_ADDITIONAL_ITEMS) + " more");
            }
            line(out, "");
        }

        line(out, "---");
        line(out, "");
        line(
                out,
                "This feedback is for **Iteration "
                        + (feedback.iteration() + 1)
                        + "**. Address critical and high priority issues first, then report"
                        + " your confidence score for the next gate.");
        return out.toString();
    }

    private static String numbered(int index, ActionableStep step) {
        return (index + 1)
                + ". **["
                + sanitize(step.category())
                + "]** "
                + sanitize(step.action());
    }

    private static String percent(double score) {
        return String.format(Locale.ROOT, "%.1f%%", score * 100.0);
    }

    private static void line(StringBuilder out, String text) {
        out.append(text).append('\n');
    }
}
