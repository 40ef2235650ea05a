package io.tessera.core.orchestration;

import io.tessera.core.consensus.ConsensusResult;
import io.tessera.core.consensus.MaliciousAgentReport;
import io.tessera.core.feedback.ConsensusFeedback;
import java.time.Instant;

/// Events emitted while a phase runs.
///
/// ### Event Flow
/// ```
/// PhaseStarted → IterationStarted(OUTER) → IterationStarted(INNER)
///     → ConfidenceGateEvaluated → ... → ConsensusGateEvaluated
///         ├─ passed → DecisionMade → PhaseCompleted | PhaseEscalated
///         └─ failed → FeedbackInjected → ContinuationRequired → IterationStarted(OUTER)
/// ```
///
/// @see OrchestrationListener
/// @see IterationOrchestrator
public sealed interface OrchestrationEvent {

    /// Returns the phase the event belongs to.
    ///
    /// @return phase identifier, never null
    String phaseId();

    /// Returns when the event occurred.
    ///
    /// @return event timestamp, never null
    Instant timestamp();

    /// Which loop an {@link IterationStarted} event belongs to.
    enum Loop {
        /// Consensus round (loop 2).
        OUTER,
        /// Implementation round (loop 3).
        INNER
    }

    /// Emitted once when a phase run begins.
    record PhaseStarted(String phaseId, String task, Instant timestamp)
            implements OrchestrationEvent {}

    /// Emitted before every round, including the one that exceeds its limit.
    ///
    /// @param phaseId phase identifier
    /// @param loop which loop the round belongs to
    /// @param iteration round number after increment
    /// @param maxIterations configured limit
    /// @param timestamp when the round started
    record IterationStarted(
            String phaseId, Loop loop, int iteration, int maxIterations, Instant timestamp)
            implements OrchestrationEvent {}

    /// Emitted after primary agents reported their confidence.
    record ConfidenceGateEvaluated(
            String phaseId, int iteration, ConfidenceGateResult result, Instant timestamp)
            implements OrchestrationEvent {}

    /// Emitted after validators voted.
    record ConsensusGateEvaluated(
            String phaseId, int iteration, ConsensusResult result, Instant timestamp)
            implements OrchestrationEvent {}

    /// Emitted for each agent flagged during a Byzantine evaluation.
    record MaliciousAgentDetected(String phaseId, MaliciousAgentReport report, Instant timestamp)
            implements OrchestrationEvent {}

    /// Emitted after validator feedback of a failed round was captured for the next one.
    record FeedbackInjected(String phaseId, ConsensusFeedback feedback, Instant timestamp)
            implements OrchestrationEvent {}

    /// Emitted after a failed consensus round when another round will follow.
    ///
    /// @param phaseId phase identifier
    /// @param prompt continuation text for humans or the calling agent
    /// @param iteration outer round that failed
    /// @param maxIterations outer round limit
    /// @param autonomous whether the loop continues without human input
    /// @param timestamp when the round ended
    record ContinuationRequired(
            String phaseId,
            String prompt,
            int iteration,
            int maxIterations,
            boolean autonomous,
            Instant timestamp)
            implements OrchestrationEvent {}

    /// Emitted when the decision gate answered.
    record DecisionMade(String phaseId, ProductOwnerDecision decision, Instant timestamp)
            implements OrchestrationEvent {}

    /// Emitted when a phase is handed to a human.
    ///
    /// @param phaseId phase identifier
    /// @param reason why the loop stopped
    /// @param prompt escalation text listing the options
    /// @param retryOption `true` when extending the round limit could help
    /// @param timestamp when the phase escalated
    record PhaseEscalated(
            String phaseId, String reason, String prompt, boolean retryOption, Instant timestamp)
            implements OrchestrationEvent {}

    /// Emitted last for every phase run, whatever its outcome.
    record PhaseCompleted(String phaseId, PhaseResult result, Instant timestamp)
            implements OrchestrationEvent {}
}
