package io.tessera.core.orchestration;

import io.tessera.core.LogConfig;
import io.tessera.core.agent.AgentExecutor;
import io.tessera.core.agent.AgentInstructions;
import io.tessera.core.agent.AgentResponse;
import io.tessera.core.agent.AgentRole;
import io.tessera.core.agent.ResponseParseException;
import io.tessera.core.audit.AuditRecorder;
import io.tessera.core.audit.RiskLevel;
import io.tessera.core.audit.SafeAuditRecorder;
import io.tessera.core.breaker.CircuitBreaker;
import io.tessera.core.breaker.CircuitBreakerRegistry;
import io.tessera.core.breaker.CircuitOpenException;
import io.tessera.core.breaker.CircuitTimeoutException;
import io.tessera.core.consensus.ConsensusConfig;
import io.tessera.core.consensus.ConsensusEvaluator;
import io.tessera.core.consensus.ConsensusListener;
import io.tessera.core.consensus.ConsensusMode;
import io.tessera.core.consensus.ConsensusResult;
import io.tessera.core.consensus.MaliciousAgentReport;
import io.tessera.core.consensus.ValidatorVote;
import io.tessera.core.feedback.ActionableStep;
import io.tessera.core.feedback.ConsensusFeedback;
import io.tessera.core.feedback.FeedbackInjector;
import io.tessera.core.feedback.Severity;
import io.tessera.core.feedback.ValidatorFeedback;
import io.tessera.core.util.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Drives a phase through nested implementation and validation loops until the
/// work is accepted or handed to a human.
///
/// ### Loop structure
/// ```
/// outer round (loop 2, at most maxLoop2Iterations)
///   inner round (loop 3, at most maxLoop3Iterations)
///     primary agents  ── "primary-execution" breaker ──> confidence gate
///   validators        ── "consensus-validation" breaker ──> consensus gate
///     passed → decision gate → PROCEED | DEFER → SUCCEEDED, ESCALATE → ESCALATED
///     failed → capture feedback, inject it into the next outer round
/// ```
///
/// ### Contracts
/// - An outer or inner counter that goes past its limit never runs the round.
///   An exceeded outer counter escalates the phase; an exceeded inner counter fails
///   the confidence gate of the current outer round.
/// - The inner counter resets only when the confidence gate passes.
/// - Breaker rejections and timeouts fail the current inner round; they never
///   surface as exceptions from {@link #executePhase}.
/// - The phase deadline (`phaseTimeout`) is checked before every round and counted
///   as a timeout when exceeded.
/// - Feedback history of a phase is cleared when it succeeds.
///
/// @implNote Thread-safe. Distinct phases may run concurrently; a phase id can
/// only be run by one caller at a time. Listener callbacks run on the calling
/// thread.
///
/// @see OrchestratorConfig
/// @see DecisionGate
/// @see FeedbackInjector
public class IterationOrchestrator {

    private static final Logger logger = Logger.getLogger(IterationOrchestrator.class.getName());

    public static final String PRIMARY_CIRCUIT = "primary-execution";
    public static final String VALIDATION_CIRCUIT = "consensus-validation";

    private final OrchestratorConfig config;
    private final AgentExecutor agents;
    private final ConsensusEvaluator evaluator;
    private final FeedbackInjector feedbackInjector;
    private final DecisionGate decisionGate;
    private final CircuitBreakerRegistry breakers;
    private final AuditRecorder audit;
    private final Clock clock;
    private final Sleeper sleeper;
    private final LogConfig logConfig;
    private final List<OrchestrationListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, PhaseRun> phases = new ConcurrentHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private IterationOrchestrator(Builder builder) {
        this.config = builder.config;
        this.agents = builder.agents;
        this.breakers = builder.breakers;
        this.logConfig = builder.logConfig;
        this.clock = builder.clock;
        this.sleeper = builder.sleeper;
        this.audit = SafeAuditRecorder.wrap(builder.audit);
        this.feedbackInjector =
                builder.feedbackInjector != null ? builder.feedbackInjector : new FeedbackInjector();
        this.decisionGate =
                builder.decisionGate != null ? builder.decisionGate : new ThresholdDecisionGate();
        this.evaluator =
                builder.evaluator != null
                        ? builder.evaluator
                        : new ConsensusEvaluator(
                                consensusConfigFor(config),
                                audit,
                                ConsensusListener.NOOP,
                                logConfig);
    }

    public static Builder builder() {
        return new Builder();
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    /// Registers a listener for orchestration events.
    ///
    /// @param listener the listener, not null
    public void addListener(OrchestrationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(OrchestrationListener listener) {
        listeners.remove(listener);
    }

    // --- Phase execution ---

    /// Runs a phase to completion.
    ///
    /// @param phaseId phase identifier, not null
    /// @param task task text handed to the primary agents, not null
    /// @return the outcome, never null
    /// @throws IllegalStateException if the orchestrator was shut down or the phase is
    ///         already running
    public PhaseResult executePhase(String phaseId, String task) {
        Objects.requireNonNull(phaseId, "phaseId must not be null");
        Objects.requireNonNull(task, "task must not be null");
        if (shutdown.get()) {
            throw new IllegalStateException("IterationOrchestrator has been shut down");
        }

        PhaseRun run =
                new PhaseRun(
                        phaseId,
                        task,
                        new IterationTracker(
                                phaseId,
                                config.getMaxLoop2Iterations(),
                                config.getMaxLoop3Iterations()),
                        clock.instant());
        phases.compute(
                phaseId,
                (id, previous) -> {
                    if (previous != null && previous.running) {
                        throw new IllegalStateException("Phase '" + id + "' is already running");
                    }
                    return run;
                });

        if (logConfig.isEnabled(Level.INFO)) {
            logger.info(
                    "Starting phase "
                            + phaseId
                            + " (mode="
                            + config.getConsensusMode()
                            + ", maxLoop2="
                            + config.getMaxLoop2Iterations()
                            + ", maxLoop3="
                            + config.getMaxLoop3Iterations()
                            + ")");
        }
        emit(new OrchestrationEvent.PhaseStarted(phaseId, task, clock.instant()));
        audit.recordEvent("phase:started", Map.of("phaseId", phaseId), RiskLevel.LOW);

        PhaseResult result;
        try {
            result = runOuterLoop(run);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = escalate(run, "Phase execution was interrupted", false);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Phase " + phaseId + " failed", e);
            result = escalate(run, "Phase execution failed: " + e.getMessage(), false);
        } finally {
            // a collaborator failing inside escalate must not leave the phase locked
            if (run.running) {
                run.finish(clock.instant());
            }
        }
        emit(new OrchestrationEvent.PhaseCompleted(phaseId, result, clock.instant()));
        return result;
    }

    /// Runs a phase and throws when it escalates.
    ///
    /// @param phaseId phase identifier, not null
    /// @param task task text, not null
    /// @return the successful outcome, never null
    /// @throws EscalationException if the phase escalated
    public PhaseResult executePhaseOrThrow(String phaseId, String task) {
        PhaseResult result = executePhase(phaseId, task);
        if (result.escalated()) {
            throw new EscalationException(result);
        }
        return result;
    }

    private PhaseResult runOuterLoop(PhaseRun run) throws InterruptedException {
        Instant deadline = run.startedAt.plus(config.getPhaseTimeout());
        while (true) {
            IterationTracker.Tick outer = run.tracker.incrementLoop2();
            emit(
                    new OrchestrationEvent.IterationStarted(
                            run.phaseId,
                            OrchestrationEvent.Loop.OUTER,
                            outer.counter(),
                            outer.max(),
                            clock.instant()));
            if (outer.exceeded()) {
                return escalate(
                        run,
                        "Maximum Loop 2 iterations (" + outer.max() + ") exceeded without consensus",
                        true);
            }
            if (deadlinePassed(deadline)) {
                return timeoutEscalation(run);
            }

            InnerLoopResult inner = runInnerLoop(run, outer.counter(), deadline);
            if (inner.phaseTimedOut()) {
                return timeoutEscalation(run);
            }
            if (!inner.gatePassed()) {
                run.gateFailed();
                continue;
            }
            run.gatePassed();
            run.tracker.resetLoop3();
            run.deliverables = inner.deliverables();

            ValidationRound round = runValidators(run, outer.counter(), deadline);
            ConsensusResult consensus = evaluator.evaluate(round.votes());
            run.consensusExecuted(consensus.score());
            run.lastConsensus = consensus;
            for (MaliciousAgentReport report : consensus.maliciousAgents()) {
                emit(
                        new OrchestrationEvent.MaliciousAgentDetected(
                                run.phaseId, report, clock.instant()));
            }
            emit(
                    new OrchestrationEvent.ConsensusGateEvaluated(
                            run.phaseId, outer.counter(), consensus, clock.instant()));

            if (consensus.passed()) {
                ProductOwnerDecision decision =
                        decide(run, outer.counter(), consensus, round.feedback());
                run.decision = decision;
                emit(new OrchestrationEvent.DecisionMade(run.phaseId, decision, clock.instant()));
                return switch (decision.decision()) {
                    case PROCEED -> complete(run);
                    case DEFER -> {
                        recordBacklog(run, decision.backlogItems());
                        yield complete(run);
                    }
                    case ESCALATE -> escalate(
                            run,
                            decision.reasoning().isBlank()
                                    ? "Decision gate escalated the phase"
                                    : decision.reasoning(),
                            false);
                };
            }

            run.gateFailed();
            ConsensusFeedback captured =
                    feedbackInjector.captureFeedback(
                            run.phaseId,
                            outer.counter(),
                            consensus.score(),
                            consensus.threshold(),
                            round.feedback());
            run.currentFeedback = captured;
            run.feedbackInjected();
            emit(new OrchestrationEvent.FeedbackInjected(run.phaseId, captured, clock.instant()));

            if (outer.counter() < outer.max()) {
                emit(
                        new OrchestrationEvent.ContinuationRequired(
                                run.phaseId,
                                ContinuationPrompts.consensusFailure(
                                        captured, outer.counter(), outer.max()),
                                outer.counter(),
                                outer.max(),
                                config.isAutonomousContinuation(),
                                clock.instant()));
            }
        }
    }

    private record InnerLoopResult(
            boolean gatePassed,
            List<AgentResponse.WorkResult> deliverables,
            boolean phaseTimedOut) {

        static InnerLoopResult passed(List<AgentResponse.WorkResult> deliverables) {
            return new InnerLoopResult(true, deliverables, false);
        }

        static InnerLoopResult failed() {
            return new InnerLoopResult(false, List.of(), false);
        }

        static InnerLoopResult timedOut() {
            return new InnerLoopResult(false, List.of(), true);
        }
    }

    private InnerLoopResult runInnerLoop(PhaseRun run, int outerIteration, Instant deadline)
            throws InterruptedException {
        while (true) {
            if (deadlinePassed(deadline)) {
                return InnerLoopResult.timedOut();
            }
            IterationTracker.Tick inner = run.tracker.incrementLoop3();
            emit(
                    new OrchestrationEvent.IterationStarted(
                            run.phaseId,
                            OrchestrationEvent.Loop.INNER,
                            inner.counter(),
                            inner.max(),
                            clock.instant()));
            if (inner.exceeded()) {
                if (logConfig.isEnabled(Level.WARNING)) {
                    logger.warning(
                            "Phase "
                                    + run.phaseId
                                    + ": Loop 3 limit ("
                                    + inner.max()
                                    + ") exceeded in round "
                                    + outerIteration);
                }
                return InnerLoopResult.failed();
            }

            List<AgentResponse.WorkResult> responses =
                    executePrimary(run, outerIteration, inner.counter(), deadline);
            ConfidenceGateResult gate =
                    responses == null
                            ? ConfidenceGateResult.failed(config.getConfidenceThreshold())
                            : ConfidenceGateResult.evaluate(
                                    responses.stream().map(ConfidenceScore::from).toList(),
                                    config.getConfidenceThreshold());
            run.primaryExecuted(gate.overallConfidence());
            emit(
                    new OrchestrationEvent.ConfidenceGateEvaluated(
                            run.phaseId, inner.counter(), gate, clock.instant()));

            if (gate.passed()) {
                return InnerLoopResult.passed(responses);
            }
            if (responses != null && logConfig.isEnabled(Level.INFO)) {
                logger.info(
                        "Phase "
                                + run.phaseId
                                + ": confidence gate failed in inner round "
                                + inner.counter()
                                + ", low confidence: "
                                + gate.lowConfidenceAgents());
            }
        }
    }

    // --- Agent calls ---

    /// Runs every primary agent through the primary breaker.
    ///
    /// @return the deliverables, or null when the call failed
    private List<AgentResponse.WorkResult> executePrimary(
            PhaseRun run, int outerIteration, int innerIteration, Instant deadline)
            throws InterruptedException {
        return guardedCall(
                run,
                PRIMARY_CIRCUIT,
                deadline,
                () -> {
                    List<AgentResponse.WorkResult> results = new ArrayList<>();
                    for (String agentType : config.getPrimaryAgentTypes()) {
                        AgentResponse response =
                                agents.execute(
                                        new AgentInstructions(
                                                run.phaseId,
                                                agentType,
                                                AgentRole.PRIMARY,
                                                primaryPrompt(run, agentType),
                                                outerIteration,
                                                innerIteration));
                        if (!(response instanceof AgentResponse.WorkResult work)) {
                            throw new ResponseParseException(
                                    "Primary agent " + agentType + " returned a validation result");
                        }
                        results.add(work);
                    }
                    return results;
                });
    }

    private String primaryPrompt(PhaseRun run, String agentType) {
        ConsensusFeedback feedback = run.currentFeedback;
        return feedback == null
                ? run.task
                : feedbackInjector.injectIntoInstructions(run.task, feedback, agentType);
    }

    private record ValidationRound(List<ValidatorVote> votes, List<ValidatorFeedback> feedback) {}

    private ValidationRound runValidators(PhaseRun run, int outerIteration, Instant deadline)
            throws InterruptedException {
        String prompt = validatorPrompt(run);
        List<AgentResponse.ValidationResult> results =
                guardedCall(
                        run,
                        VALIDATION_CIRCUIT,
                        deadline,
                        () -> {
                            List<AgentResponse.ValidationResult> collected = new ArrayList<>();
                            for (String agentType : config.getValidatorAgentTypes()) {
                                AgentResponse response =
                                        agents.execute(
                                                new AgentInstructions(
                                                        run.phaseId,
                                                        agentType,
                                                        AgentRole.VALIDATOR,
                                                        prompt,
                                                        outerIteration,
                                                        0));
                                if (!(response
                                        instanceof AgentResponse.ValidationResult validation)) {
                                    throw new ResponseParseException(
                                            "Validator " + agentType + " returned a work result");
                                }
                                collected.add(validation);
                            }
                            return collected;
                        });
        if (results == null) {
            results = List.of();
        }

        List<ValidatorVote> votes = new ArrayList<>();
        List<ValidatorFeedback> feedback = new ArrayList<>();
        for (AgentResponse.ValidationResult result : results) {
            votes.add(toVote(result));
            feedback.add(
                    new ValidatorFeedback(
                            result.agentId(),
                            result.agentType(),
                            result.issues(),
                            result.recommendations(),
                            result.failedChecks(),
                            result.confidence()));
        }
        return new ValidationRound(votes, feedback);
    }

    private static String validatorPrompt(PhaseRun run) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Validate Phase ").append(run.phaseId).append("\n\n");
        sb.append("### Task\n").append(run.task).append("\n\n");
        sb.append("### Deliverables\n");
        for (AgentResponse.WorkResult deliverable : run.deliverables) {
            sb.append("#### ")
                    .append(deliverable.agentType())
                    .append(" (")
                    .append(deliverable.agentId())
                    .append(")\n")
                    .append(deliverable.deliverable())
                    .append("\n\n");
        }
        sb.append(
                "Vote PASS or FAIL with a confidence in [0, 1], list issues with severity and"
                        + " location, and name any failed acceptance criteria.\n");
        return sb.toString();
    }

    private static ValidatorVote toVote(AgentResponse.ValidationResult result) {
        if (result.signature() == null) {
            return ValidatorVote.signed(
                    result.agentId(),
                    result.agentType(),
                    result.confidence(),
                    result.vote(),
                    result.reasoning(),
                    result.blockers(),
                    result.timestamp());
        }
        return new ValidatorVote(
                result.agentId(),
                result.agentType(),
                result.confidence(),
                result.vote(),
                result.reasoning(),
                result.signature(),
                result.timestamp(),
                result.blockers());
    }

    /// Executes `call` through the named breaker, bounded by the phase deadline.
    ///
    /// @return the call's result, or null when the breaker rejected the call, it
    ///         timed out or it failed
    private <T> T guardedCall(PhaseRun run, String circuit, Instant deadline, Callable<T> call)
            throws InterruptedException {
        CircuitBreaker breaker = breakers.getOrCreate(circuit);
        long tripsBefore = breaker.getState().totalTrips();
        try {
            return breaker.execute(call, callTimeout(breaker, deadline));
        } catch (CircuitOpenException e) {
            if (logConfig.isEnabled(Level.WARNING)) {
                logger.warning("Phase " + run.phaseId + ": " + e.getMessage());
            }
            awaitCircuit(e, deadline);
            return null;
        } catch (CircuitTimeoutException e) {
            run.timedOut();
            if (logConfig.isEnabled(Level.WARNING)) {
                logger.warning("Phase " + run.phaseId + ": " + e.getMessage());
            }
            return null;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            logger.log(
                    Level.WARNING,
                    "Phase " + run.phaseId + ": call through circuit '" + circuit + "' failed",
                    e);
            return null;
        } finally {
            run.tripped(breaker.getState().totalTrips() - tripsBefore);
        }
    }

    private Duration callTimeout(CircuitBreaker breaker, Instant deadline) {
        Duration remaining = Duration.between(clock.instant(), deadline);
        Duration timeout = breaker.getConfig().timeout();
        if (remaining.compareTo(timeout) < 0) {
            timeout = remaining;
        }
        return timeout.toMillis() < 1 ? Duration.ofMillis(1) : timeout;
    }

    /// Waits out an open circuit when it reopens before the phase deadline.
    private void awaitCircuit(CircuitOpenException e, Instant deadline) throws InterruptedException {
        Instant nextAttempt = e.getNextAttemptTime();
        if (nextAttempt == null || !nextAttempt.isBefore(deadline)) {
            return;
        }
        Duration wait = Duration.between(clock.instant(), nextAttempt);
        if (!wait.isNegative() && !wait.isZero()) {
            sleeper.sleep(wait);
        }
    }

    private ProductOwnerDecision decide(
            PhaseRun run,
            int iteration,
            ConsensusResult consensus,
            List<ValidatorFeedback> validatorFeedback)
            throws InterruptedException {
        DecisionContext context =
                new DecisionContext(
                        run.phaseId,
                        run.task,
                        iteration,
                        consensus,
                        run.deliverables,
                        validatorFeedback);
        try {
            ProductOwnerDecision decision = decisionGate.decide(context);
            return decision != null
                    ? decision
                    : ProductOwnerDecision.escalate("Decision gate returned no decision");
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Decision gate failed for phase " + run.phaseId, e);
            return ProductOwnerDecision.escalate("Decision gate failed: " + e.getMessage());
        }
    }

    // --- Terminal states ---

    private PhaseResult complete(PhaseRun run) {
        PhaseResult result = buildResult(run, PhaseOutcome.SUCCEEDED, null, null);
        feedbackInjector.clearPhaseHistory(run.phaseId);
        audit.recordEvent(
                "phase:completed",
                Map.of(
                        "phaseId", run.phaseId,
                        "loop2", result.loop2Iterations(),
                        "decision", run.decision.decision().name()),
                RiskLevel.LOW);
        if (logConfig.isEnabled(Level.INFO)) {
            logger.info(
                    "Phase "
                            + run.phaseId
                            + " succeeded after "
                            + result.loop2Iterations()
                            + " round(s) with "
                            + run.decision.decision());
        }
        return result;
    }

    private PhaseResult escalate(PhaseRun run, String reason, boolean retryOption) {
        IterationState state = run.tracker.state();
        String prompt =
                ContinuationPrompts.escalation(
                        run.phaseId,
                        reason,
                        state.loop2(),
                        state.maxLoop2(),
                        run.currentFeedback);
        PhaseResult result = buildResult(run, PhaseOutcome.ESCALATED, reason, prompt);
        emit(
                new OrchestrationEvent.PhaseEscalated(
                        run.phaseId, reason, prompt, retryOption, clock.instant()));
        audit.recordEvent(
                "phase:escalated",
                Map.of("phaseId", run.phaseId, "reason", reason, "loop2", state.loop2()),
                RiskLevel.MEDIUM);
        if (logConfig.isEnabled(Level.WARNING)) {
            logger.warning("Phase " + run.phaseId + " escalated: " + reason);
        }
        return result;
    }

    private PhaseResult timeoutEscalation(PhaseRun run) {
        run.timedOut();
        return escalate(
                run, "Phase timeout of " + config.getPhaseTimeout() + " exceeded", true);
    }

    private void recordBacklog(PhaseRun run, List<String> items) {
        for (String item : items) {
            audit.recordEvent(
                    "backlog:deferred", Map.of("phaseId", run.phaseId, "item", item), RiskLevel.LOW);
        }
        if (logConfig.isEnabled(Level.INFO)) {
            logger.info("Phase " + run.phaseId + ": deferred " + items.size() + " backlog item(s)");
        }
    }

    private PhaseResult buildResult(
            PhaseRun run, PhaseOutcome outcome, String reason, String prompt) {
        Instant now = clock.instant();
        run.finish(now);
        IterationState state = run.tracker.state();
        return new PhaseResult(
                run.phaseId,
                outcome,
                Math.min(state.loop2(), state.maxLoop2()),
                state.totalLoop3(),
                run.lastConsensus,
                run.decision,
                run.deliverables,
                feedbackInjector.getHistory(run.phaseId),
                reason,
                prompt,
                run.statistics(now));
    }

    private boolean deadlinePassed(Instant deadline) {
        return !clock.instant().isBefore(deadline);
    }

    // --- Failure advice and inspection ---

    /// Advises how to continue after a failed consensus round.
    ///
    /// @param phaseId phase identifier, not null
    /// @param feedback feedback of the failed round, not null
    /// @return the advice, never null
    public RetryStrategy handleFailure(String phaseId, ConsensusFeedback feedback) {
        Objects.requireNonNull(feedback, "feedback must not be null");
        int loop2 = getIterationState(phaseId).map(IterationState::loop2).orElse(0);
        if (loop2 >= config.getMaxLoop2Iterations()) {
            return new RetryStrategy(
                    false, Duration.ZERO, List.of(), "Maximum Loop 2 iterations reached");
        }
        List<ActionableStep> critical = feedback.stepsWithPriority(Severity.CRITICAL);
        List<String> targets =
                critical.stream()
                        .map(ActionableStep::targetAgent)
                        .filter(Objects::nonNull)
                        .distinct()
                        .toList();
        return new RetryStrategy(
                true,
                config.getRetryDelay(),
                targets,
                "Addressing " + critical.size() + " critical issues");
    }

    /// Returns the counters of the latest run of a phase.
    ///
    /// @param phaseId phase identifier, not null
    /// @return statistics, empty if the phase never ran or was reset
    public Optional<PhaseStatistics> getStatistics(String phaseId) {
        PhaseRun run = phases.get(Objects.requireNonNull(phaseId, "phaseId must not be null"));
        return run == null ? Optional.empty() : Optional.of(run.statistics(clock.instant()));
    }

    /// Returns the iteration counters of the latest run of a phase.
    ///
    /// @param phaseId phase identifier, not null
    /// @return counters, empty if the phase never ran or was reset
    public Optional<IterationState> getIterationState(String phaseId) {
        PhaseRun run = phases.get(Objects.requireNonNull(phaseId, "phaseId must not be null"));
        return run == null ? Optional.empty() : Optional.of(run.tracker.state());
    }

    /// Forgets the counters and feedback of a phase.
    ///
    /// @param phaseId phase identifier, not null
    /// @throws IllegalStateException if the phase is running
    public void reset(String phaseId) {
        Objects.requireNonNull(phaseId, "phaseId must not be null");
        phases.computeIfPresent(
                phaseId,
                (id, run) -> {
                    if (run.running) {
                        throw new IllegalStateException("Phase '" + id + "' is running");
                    }
                    return null;
                });
        feedbackInjector.clearPhaseHistory(phaseId);
    }

    /// Releases feedback state, resets every breaker and drops listeners.
    ///
    /// Further calls to {@link #executePhase} are rejected.
    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            feedbackInjector.shutdown();
            breakers.resetAll();
            listeners.clear();
            phases.clear();
            logger.info("IterationOrchestrator shut down");
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    private void emit(OrchestrationEvent event) {
        for (OrchestrationListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                logger.log(
                        Level.WARNING,
                        "Orchestration listener failed on " + event.getClass().getSimpleName(),
                        e);
            }
        }
    }

    private static ConsensusConfig consensusConfigFor(OrchestratorConfig config) {
        return config.getConsensusMode() == ConsensusMode.BYZANTINE
                ? ConsensusConfig.byzantine(config.getConsensusThreshold())
                : ConsensusConfig.simple(config.getConsensusThreshold());
    }

    /// Fluent builder for {@link IterationOrchestrator}.
    ///
    /// `agents` and `breakers` are required. Defaults: {@link OrchestratorConfig#defaults()},
    /// a {@link ConsensusEvaluator} built from the config's mode and threshold, a new
    /// {@link FeedbackInjector}, a {@link ThresholdDecisionGate}, no audit, system
    /// clock and sleeper, {@link LogConfig#defaults()}.
    public static final class Builder {
        private OrchestratorConfig config = OrchestratorConfig.defaults();
        private AgentExecutor agents;
        private CircuitBreakerRegistry breakers;
        private ConsensusEvaluator evaluator;
        private FeedbackInjector feedbackInjector;
        private DecisionGate decisionGate;
        private AuditRecorder audit = AuditRecorder.NOOP;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.SYSTEM;
        private LogConfig logConfig = LogConfig.defaults();

        private Builder() {}

        public Builder config(OrchestratorConfig config) {
            this.config = config;
            return this;
        }

        public Builder agents(AgentExecutor agents) {
            this.agents = agents;
            return this;
        }

        public Builder breakers(CircuitBreakerRegistry breakers) {
            this.breakers = breakers;
            return this;
        }

        /// Overrides the evaluator; its own mode and threshold then apply.
        public Builder consensusEvaluator(ConsensusEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder feedbackInjector(FeedbackInjector feedbackInjector) {
            this.feedbackInjector = feedbackInjector;
            return this;
        }

        public Builder decisionGate(DecisionGate decisionGate) {
            this.decisionGate = decisionGate;
            return this;
        }

        public Builder audit(AuditRecorder audit) {
            this.audit = audit;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder logConfig(LogConfig logConfig) {
            this.logConfig = logConfig;
            return this;
        }

        /// Builds the orchestrator.
        ///
        /// @return the orchestrator, never null
        /// @throws NullPointerException if a required collaborator is missing
        public IterationOrchestrator build() {
            Objects.requireNonNull(config, "config must not be null");
            Objects.requireNonNull(agents, "agents must not be null");
            Objects.requireNonNull(breakers, "breakers must not be null");
            Objects.requireNonNull(audit, "audit must not be null");
            Objects.requireNonNull(clock, "clock must not be null");
            Objects.requireNonNull(sleeper, "sleeper must not be null");
            Objects.requireNonNull(logConfig, "logConfig must not be null");
            return new IterationOrchestrator(this);
        }
    }
}
