package io.tessera.core.orchestration;

import io.tessera.core.agent.AgentResponse;
import io.tessera.core.consensus.ConsensusResult;
import io.tessera.core.consensus.ValidatorVote;
import io.tessera.core.feedback.ConsensusFeedback;
import io.tessera.core.feedback.Severity;
import java.util.Locale;

/// Renders the human- and agent-facing texts of the orchestration loop.
///
/// All methods are pure and return plain markdown.
public final class ContinuationPrompts {

    private ContinuationPrompts() {}

    /// Text emitted after a failed consensus round.
    ///
    /// @param feedback captured feedback of the round, not null
    /// @param iteration outer round that failed
    /// @param maxIterations outer round limit
    /// @return continuation text, never null
    public static String consensusFailure(
            ConsensusFeedback feedback, int iteration, int maxIterations) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Consensus Not Reached: Round ")
                .append(iteration)
                .append('/')
                .append(maxIterations)
                .append("\n\n");
        sb.append("Phase: ").append(feedback.phaseId()).append('\n');
        sb.append("Score: ")
                .append(percent(feedback.score()))
                .append(" (required ")
                .append(percent(feedback.requiredScore()))
                .append(")\n");
        sb.append("Critical issues: ")
                .append(feedback.stepsWithPriority(Severity.CRITICAL).size())
                .append('\n');
        sb.append("High-priority issues: ")
                .append(feedback.stepsWithPriority(Severity.HIGH).size())
                .append("\n\n");
        sb.append(
                "Validator feedback has been captured and will be injected into the next"
                        + " implementation round.\n");
        sb.append("Continuing with round ")
                .append(iteration + 1)
                .append(" of ")
                .append(maxIterations)
                .append(".\n");
        return sb.toString();
    }

    /// Hand-off text for an escalated phase.
    ///
    /// @param phaseId phase identifier, not null
    /// @param reason why the loop stopped, not null
    /// @param iteration outer rounds used
    /// @param maxIterations outer round limit
    /// @param lastFeedback feedback of the last failed round, may be null
    /// @return escalation text, never null
    public static String escalation(
            String phaseId,
            String reason,
            int iteration,
            int maxIterations,
            ConsensusFeedback lastFeedback) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Phase Escalated: ").append(phaseId).append("\n\n");
        sb.append("Reason: ").append(reason).append('\n');
        sb.append("Rounds used: ")
                .append(Math.min(iteration, maxIterations))
                .append(" of ")
                .append(maxIterations)
                .append('\n');
        if (lastFeedback != null) {
            sb.append("Last consensus score: ")
                    .append(percent(lastFeedback.score()))
                    .append(" (required ")
                    .append(percent(lastFeedback.requiredScore()))
                    .append(")\n");
            var critical = lastFeedback.stepsWithPriority(Severity.CRITICAL);
            if (!critical.isEmpty()) {
                sb.append("\nUnresolved critical issues:\n");
                critical.forEach(step -> sb.append("- ").append(step.action()).append('\n'));
            }
        }
        sb.append("\n### Options\n");
        sb.append("1. Extend the round limit and retry the phase\n");
        sb.append("2. Split the task into smaller phases\n");
        sb.append("3. Review and complete the work manually\n");
        return sb.toString();
    }

    /// Prompt asking a product-owner agent for the final decision.
    ///
    /// @param context consensus and deliverables of the round, not null
    /// @return prompt text, never null
    public static String productOwner(DecisionContext context) {
        ConsensusResult consensus = context.consensus();
        StringBuilder sb = new StringBuilder();
        sb.append("# Product Owner Decision: Phase ").append(context.phaseId()).append("\n\n");
        sb.append("## Task\n").append(context.task()).append("\n\n");

        sb.append("## Consensus Results\n");
        sb.append("- Score: ")
                .append(percent(consensus.score()))
                .append(" (threshold ")
                .append(percent(consensus.threshold()))
                .append(")\n");
        sb.append("- Mode: ").append(consensus.mode()).append('\n');
        sb.append("- Round: ").append(context.iteration()).append("\n\n");
        for (ValidatorVote vote : consensus.votes()) {
            sb.append("- ")
                    .append(vote.agentType())
                    .append(" (")
                    .append(vote.agentId())
                    .append("): ")
                    .append(vote.vote())
                    .append(", confidence ")
                    .append(percent(vote.confidence()));
            if (!vote.blockers().isEmpty()) {
                sb.append(", blockers: ").append(String.join("; ", vote.blockers()));
            }
            sb.append('\n');
        }

        sb.append("\n## Implementation Summary\n");
        for (AgentResponse.WorkResult deliverable : context.deliverables()) {
            sb.append("- ")
                    .append(deliverable.agentType())
                    .append(": confidence ")
                    .append(percent(deliverable.confidence()));
            if (!deliverable.reasoning().isBlank()) {
                sb.append(", ").append(deliverable.reasoning());
            }
            sb.append('\n');
        }

        sb.append("\n## Decision Criteria\n");
        sb.append("- PROCEED: score at least 90% and no critical issues\n");
        sb.append("- DEFER: score at least 90% with minor issues that can go to the backlog\n");
        sb.append("- ESCALATE: anything else\n\n");
        sb.append("Respond with JSON only:\n");
        sb.append("```json\n");
        sb.append("{\n");
        sb.append("  \"decision\": \"PROCEED | DEFER | ESCALATE\",\n");
        sb.append("  \"confidence\": 0.0,\n");
        sb.append("  \"reasoning\": \"...\",\n");
        sb.append("  \"backlogItems\": [],\n");
        sb.append("  \"blockers\": [],\n");
        sb.append("  \"recommendations\": []\n");
        sb.append("}\n");
        sb.append("```\n");
        return sb.toString();
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value * 100.0);
    }
}
