package io.tessera.core.feedback;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.tessera.core.LogConfig;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Captures validator criticism from failed consensus rounds and turns it into
/// instructions for the next round.
///
/// ### Capture
/// 1. Issues already registered for the phase are dropped (key:
///    `type:severity:message:location`), see {@link FeedbackIssue#dedupKey()}.
/// 2. Remaining issues become {@link ActionableStep}s. Recommendations become
///    medium-priority `improvement` steps, failed criteria high-priority `validation`
///    steps.
/// 3. Steps are sorted by {@link ActionableStep#EXECUTION_ORDER}.
/// 4. The feedback is appended to the phase history.
///
/// ### Injection
/// {@link #injectIntoInstructions} prepends the rendered block from
/// {@link FeedbackFormatter} to the task instructions. The output is text only.
///
/// Phase state lives in a Caffeine cache bounded by phase count and idle time;
/// within a phase, the dedup registry and history are bounded as configured.
///
/// @implNote Thread-safe. Per-phase state is guarded by its own monitor.
///
/// @see FeedbackSanitizer
public class FeedbackInjector {

    private static final Logger logger = Logger.getLogger(FeedbackInjector.class.getName());

    static final String ORIGINAL_INSTRUCTIONS_HEADING = "## Original Task Instructions";

    private final FeedbackConfig config;
    private final Clock clock;
    private final LogConfig logConfig;
    private final Cache<String, PhaseFeedbackState> phases;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public FeedbackInjector() {
        this(FeedbackConfig.defaults(), Clock.systemUTC(), LogConfig.defaults());
    }

    /// Creates an injector.
    ///
    /// @param config registry bounds, not null
    /// @param clock time source for capture timestamps, not null
    /// @param logConfig logging behaviour, not null
    public FeedbackInjector(FeedbackConfig config, Clock clock, LogConfig logConfig) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.logConfig = Objects.requireNonNull(logConfig, "logConfig must not be null");
        this.phases =
                Caffeine.newBuilder()
                        .maximumSize(config.maxPhases())
                        .expireAfterAccess(config.phaseIdleTimeout())
                        .build();
    }

    /// Captures feedback from a failed consensus round.
    ///
    /// @param phaseId phase identifier, not null
    /// @param iteration outer iteration number
    /// @param score consensus score reached
    /// @param requiredScore score that was required
    /// @param validatorFeedback per-validator reports, not null
    /// @return captured feedback, never null
    /// @throws IllegalStateException if the injector was shut down
    public ConsensusFeedback captureFeedback(
            String phaseId,
            int iteration,
            double score,
            double requiredScore,
            List<ValidatorFeedback> validatorFeedback) {
        Objects.requireNonNull(phaseId, "phaseId must not be null");
        Objects.requireNonNull(validatorFeedback, "validatorFeedback must not be null");
        if (shutdown.get()) {
            throw new IllegalStateException("FeedbackInjector has been shut down");
        }

        PhaseFeedbackState state =
                phases.get(
                        phaseId,
                        k ->
                                new PhaseFeedbackState(
                                        config.maxEntriesPerPhase(), config.maxHistoryPerPhase()));

        ConsensusFeedback feedback;
        int suppressed = 0;
        synchronized (state) {
            List<IterationHistory> previous = state.previousIterations();

            List<ValidatorFeedback> unique = new ArrayList<>();
            for (ValidatorFeedback vf : validatorFeedback) {
                List<FeedbackIssue> kept = new ArrayList<>();
                for (FeedbackIssue issue : vf.issues()) {
                    String key = issue.dedupKey();
                    if (config.deduplicationEnabled() && state.isSeen(key)) {
                        suppressed++;
                        continue;
                    }
                    state.markSeen(key);
                    kept.add(issue);
                }
                unique.add(vf.withIssues(kept));
            }

            List<String> failedCriteria = failedCriteria(validatorFeedback);
            feedback =
                    new ConsensusFeedback(
                            phaseId,
                            iteration,
                            score,
                            requiredScore,
                            unique,
                            failedCriteria,
                            generateSteps(unique, failedCriteria),
                            previous,
                            clock.instant());
            state.record(feedback);
        }

        if (logConfig.isEnabled(Level.INFO)) {
            logger.info(
                    String.format(
                            "Captured feedback for phase %s iteration %d: score=%.3f/%.2f,"
                                    + " steps=%d, duplicates suppressed=%d",
                            phaseId,
                            iteration,
                            score,
                            requiredScore,
                            feedback.actionableSteps().size(),
                            suppressed));
        }
        return feedback;
    }

    /// Renders feedback for one agent type.
    ///
    /// @param feedback captured feedback, not null
    /// @param targetAgent agent type receiving the block, may be null
    /// @return markdown block, never null
    public String formatForInjection(ConsensusFeedback feedback, String targetAgent) {
        return FeedbackFormatter.format(feedback, targetAgent);
    }

    /// Prepends rendered feedback to an agent's task instructions.
    ///
    /// @param instructions original task instructions, not null
    /// @param feedback captured feedback, not null
    /// @param agentType agent type receiving the instructions, not null
    /// @return combined instructions, never null
    public String injectIntoInstructions(
            String instructions, ConsensusFeedback feedback, String agentType) {
        Objects.requireNonNull(instructions, "instructions must not be null");
        return formatForInjection(feedback, agentType)
                + "\n---\n\n"
                + ORIGINAL_INSTRUCTIONS_HEADING
                + "\n"
                + instructions
                + "\n\n---\n\n"
                + "**Execution protocol**: fix critical and high priority issues first, fix root"
                + " causes so they do not recur, and report a confidence score on completion.\n";
    }

    /// Returns the captured feedback of a phase, oldest first.
    ///
    /// @param phaseId phase identifier, not null
    /// @return history, empty if unknown, never null
    public List<ConsensusFeedback> getHistory(String phaseId) {
        PhaseFeedbackState state = phases.getIfPresent(phaseId);
        if (state == null) {
            return List.of();
        }
        synchronized (state) {
            return state.history();
        }
    }

    /// Drops the history and dedup registry of a phase.
    ///
    /// @param phaseId phase identifier, not null
    public void clearPhaseHistory(String phaseId) {
        phases.invalidate(phaseId);
        if (logConfig.isEnabled(Level.INFO)) {
            logger.info("Cleared feedback history for phase " + phaseId);
        }
    }

    /// Aggregates statistics for one phase, or all phases when `phaseId` is null.
    ///
    /// @param phaseId phase identifier, may be null
    /// @return statistics, never null
    public FeedbackStatistics getStatistics(String phaseId) {
        List<ConsensusFeedback> feedback = new ArrayList<>();
        if (phaseId != null) {
            feedback.addAll(getHistory(phaseId));
        } else {
            for (String id : Set.copyOf(phases.asMap().keySet())) {
                feedback.addAll(getHistory(id));
            }
        }
        if (feedback.isEmpty()) {
            return FeedbackStatistics.empty();
        }

        Map<IssueType, Integer> byType = new EnumMap<>(IssueType.class);
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        int totalIssues = 0;
        double totalScore = 0.0;
        for (ConsensusFeedback fb : feedback) {
            totalScore += fb.score();
            for (FeedbackIssue issue : fb.allIssues()) {
                totalIssues++;
                byType.merge(issue.type(), 1, Integer::sum);
                bySeverity.merge(issue.severity(), 1, Integer::sum);
            }
        }
        return new FeedbackStatistics(
                feedback.size(), totalIssues, byType, bySeverity, totalScore / feedback.size());
    }

    /// Releases all phase state. Further captures are rejected.
    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            phases.invalidateAll();
            phases.cleanUp();
            logger.info("FeedbackInjector shut down");
        }
    }

    // --- Step generation ---

    private static List<String> failedCriteria(List<ValidatorFeedback> validatorFeedback) {
        Set<String> criteria = new LinkedHashSet<>();
        validatorFeedback.forEach(vf -> criteria.addAll(vf.failedChecks()));
        return List.copyOf(criteria);
    }

    static List<ActionableStep> generateSteps(
            List<ValidatorFeedback> validatorFeedback, List<String> failedCriteria) {
        List<ActionableStep> steps = new ArrayList<>();
        for (ValidatorFeedback vf : validatorFeedback) {
            for (FeedbackIssue issue : vf.issues()) {
                String action =
                        issue.suggestedFix() != null
                                ? issue.suggestedFix()
                                : "Fix " + issue.type().wireName() + " issue: " + issue.message();
                steps.add(
                        new ActionableStep(
                                issue.severity(),
                                issue.type().wireName(),
                                action,
                                issue.type().responsibleAgent(),
                                estimateEffort(issue)));
            }
            for (String recommendation : vf.recommendations()) {
                steps.add(
                        new ActionableStep(
                                Severity.MEDIUM, "improvement", recommendation, null, Effort.MEDIUM));
            }
        }
        for (String criterion : failedCriteria) {
            steps.add(
                    new ActionableStep(
                            Severity.HIGH,
                            "validation",
                            "Address failed criterion: " + criterion,
                            null,
                            Effort.HIGH));
        }
        steps.sort(ActionableStep.EXECUTION_ORDER);
        return steps;
    }

    static Effort estimateEffort(FeedbackIssue issue) {
        if (issue.suggestedFix() != null) {
            return Effort.LOW;
        }
        return switch (issue.severity()) {
            case CRITICAL, HIGH -> Effort.HIGH;
            case MEDIUM -> Effort.MEDIUM;
            case LOW -> Effort.LOW;
        };
    }
}
