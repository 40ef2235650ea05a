package io.tessera.core.agent;

import io.tessera.core.consensus.Vote;
import io.tessera.core.feedback.FeedbackIssue;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Sealed hierarchy for what an agent returns.
///
/// - {@link WorkResult}: a primary agent's deliverable with self-reported confidence
/// - {@link ValidationResult}: a validator's vote with its criticism
///
/// Inbound payloads of unknown shape are normalized into one of these through an
/// {@link AgentResponseParser} before they reach the orchestrator. The compact
/// constructors reject out-of-range confidences so a malformed payload can never
/// enter the typed model.
///
/// @see AgentExecutor
public sealed interface AgentResponse
        permits AgentResponse.WorkResult, AgentResponse.ValidationResult {

    String agentId();

    String agentType();

    /// Self-reported confidence in `[0, 1]`.
    double confidence();

    String reasoning();

    List<String> blockers();

    Instant timestamp();

    /// Output of a primary agent.
    ///
    /// @param agentId agent identifier, not null
    /// @param agentType agent type, not null
    /// @param deliverable produced work, not null (may be empty)
    /// @param confidence confidence in `[0, 1]`
    /// @param reasoning explanation, not null
    /// @param blockers unresolved blockers, not null
    /// @param timestamp completion time, not null
    record WorkResult(
            String agentId,
            String agentType,
            String deliverable,
            double confidence,
            String reasoning,
            List<String> blockers,
            Instant timestamp)
            implements AgentResponse {

        public WorkResult {
            Objects.requireNonNull(agentId, "agentId must not be null");
            Objects.requireNonNull(agentType, "agentType must not be null");
            requireConfidence(confidence);
            deliverable = deliverable != null ? deliverable : "";
            reasoning = reasoning != null ? reasoning : "";
            blockers = blockers != null ? List.copyOf(blockers) : List.of();
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static WorkResult of(
                String agentId, String agentType, String deliverable, double confidence) {
            return new WorkResult(
                    agentId, agentType, deliverable, confidence, "", List.of(), Instant.now());
        }
    }

    /// Output of a validator.
    ///
    /// @param agentId validator identifier, not null
    /// @param agentType validator type, not null
    /// @param vote verdict, not null
    /// @param confidence confidence in `[0, 1]`
    /// @param reasoning explanation, not null
    /// @param issues reported issues, not null
    /// @param recommendations non-blocking suggestions, not null
    /// @param failedChecks acceptance criteria considered failed, not null
    /// @param blockers blocking concerns, not null
    /// @param signature vote hash supplied by the validator, null to have the orchestrator
    ///        sign the vote, see {@link io.tessera.core.consensus.VoteSigner}
    /// @param timestamp completion time, not null
    record ValidationResult(
            String agentId,
            String agentType,
            Vote vote,
            double confidence,
            String reasoning,
            List<FeedbackIssue> issues,
            List<String> recommendations,
            List<String> failedChecks,
            List<String> blockers,
            String signature,
            Instant timestamp)
            implements AgentResponse {

        public ValidationResult {
            Objects.requireNonNull(agentId, "agentId must not be null");
            Objects.requireNonNull(agentType, "agentType must not be null");
            Objects.requireNonNull(vote, "vote must not be null");
            requireConfidence(confidence);
            reasoning = reasoning != null ? reasoning : "";
            issues = issues != null ? List.copyOf(issues) : List.of();
            recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
            failedChecks = failedChecks != null ? List.copyOf(failedChecks) : List.of();
            blockers = blockers != null ? List.copyOf(blockers) : List.of();
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static ValidationResult of(
                String agentId, String agentType, Vote vote, double confidence, String reasoning) {
            return new ValidationResult(
                    agentId,
                    agentType,
                    vote,
                    confidence,
                    reasoning,
                    List.of(),
                    List.of(),
                    List.of(),
                    List.of(),
                    null,
                    Instant.now());
        }
    }

    private static void requireConfidence(double confidence) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
    }
}
