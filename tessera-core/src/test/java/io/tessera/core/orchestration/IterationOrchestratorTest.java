package io.tessera.core.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.tessera.core.LogConfig;
import io.tessera.core.MutableClock;
import io.tessera.core.agent.AgentExecutor;
import io.tessera.core.agent.AgentInstructions;
import io.tessera.core.agent.AgentResponse;
import io.tessera.core.agent.AgentRole;
import io.tessera.core.audit.AuditRecorder;
import io.tessera.core.audit.RiskLevel;
import io.tessera.core.breaker.CircuitBreakerConfig;
import io.tessera.core.breaker.CircuitBreakerRegistry;
import io.tessera.core.consensus.ConsensusConfig;
import io.tessera.core.consensus.ConsensusEvaluator;
import io.tessera.core.consensus.ConsensusResult;
import io.tessera.core.consensus.ValidatorVote;
import io.tessera.core.consensus.Vote;
import io.tessera.core.feedback.ActionableStep;
import io.tessera.core.feedback.ConsensusFeedback;
import io.tessera.core.feedback.Effort;
import io.tessera.core.feedback.FeedbackConfig;
import io.tessera.core.feedback.FeedbackInjector;
import io.tessera.core.feedback.FeedbackIssue;
import io.tessera.core.feedback.IssueType;
import io.tessera.core.feedback.Severity;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("IterationOrchestrator")
class IterationOrchestratorTest {

    private static final String TASK = "Implement JWT authentication";

    private ExecutorService executor;
    private MutableClock clock;
    private CircuitBreakerRegistry breakers;
    private FeedbackInjector feedbackInjector;
    private List<Duration> sleeps;
    private List<OrchestrationEvent> events;
    private List<AgentInstructions> calls;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        clock = MutableClock.at("2026-05-01T09:00:00Z");
        breakers =
                new CircuitBreakerRegistry(
                        CircuitBreakerConfig.defaults(), executor, clock, LogConfig.quiet());
        feedbackInjector = new FeedbackInjector(FeedbackConfig.defaults(), clock, LogConfig.quiet());
        sleeps = new CopyOnWriteArrayList<>();
        events = new CopyOnWriteArrayList<>();
        calls = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private OrchestratorConfig.Builder config() {
        return OrchestratorConfig.builder()
                .maxLoop2Iterations(3)
                .maxLoop3Iterations(3)
                .validatorAgentTypes(List.of("reviewer", "tester"));
    }

    private IterationOrchestrator.Builder orchestrator(OrchestratorConfig config, AgentExecutor agents) {
        return IterationOrchestrator.builder()
                .config(config)
                .agents(
                        instructions -> {
                            calls.add(instructions);
                            return agents.execute(instructions);
                        })
                .breakers(breakers)
                .feedbackInjector(feedbackInjector)
                .clock(clock)
                .sleeper(sleeps::add)
                .logConfig(LogConfig.quiet());
    }

    private IterationOrchestrator build(IterationOrchestrator.Builder builder) {
        IterationOrchestrator built = builder.build();
        built.addListener(events::add);
        return built;
    }

    private static AgentResponse work(AgentInstructions in, double confidence) {
        return new AgentResponse.WorkResult(
                in.agentType() + "-1",
                in.agentType(),
                "deliverable for " + in.phaseId(),
                confidence,
                "done",
                List.of(),
                Instant.parse("2026-05-01T09:00:00Z"));
    }

    private static AgentResponse validation(
            AgentInstructions in, Vote vote, double confidence, List<FeedbackIssue> issues) {
        return new AgentResponse.ValidationResult(
                in.agentType() + "-1",
                in.agentType(),
                vote,
                confidence,
                "Checked the implementation against the task",
                issues,
                List.of(),
                List.of(),
                List.of(),
                null,
                Instant.parse("2026-05-01T09:00:00Z"));
    }

    /// Primary agents answer with `primary`; validators vote with `validatorConfidence`.
    private static AgentExecutor scripted(double primary, double validatorConfidence) {
        return in ->
                in.role() == AgentRole.PRIMARY
                        ? work(in, primary)
                        : validation(
                                in,
                                validatorConfidence >= 0.9 ? Vote.PASS : Vote.FAIL,
                                validatorConfidence,
                                List.of());
    }

    private long count(Class<? extends OrchestrationEvent> type) {
        return events.stream().filter(type::isInstance).count();
    }

    private long calls(AgentRole role) {
        return calls.stream().filter(c -> c.role() == role).count();
    }

    @Nested
    @DisplayName("successful phase")
    class Success {

        @Test
        @DisplayName("proceeds after one round when both gates pass")
        void shouldProceedAfterOneRound() {
            IterationOrchestrator orchestrator =
                    build(orchestrator(config().build(), scripted(0.9, 0.95)));

            PhaseResult result = orchestrator.executePhase("auth", TASK);

            assertThat(result.succeeded()).isTrue();
            assertThat(result.decision().decision()).isEqualTo(Decision.PROCEED);
            assertThat(result.loop2Iterations()).isEqualTo(1);
            assertThat(result.totalLoop3Iterations()).isEqualTo(1);
            assertThat(result.finalConsensus().passed()).isTrue();
            assertThat(result.deliverables()).hasSize(1);
            assertThat(events.get(0)).isInstanceOf(OrchestrationEvent.PhaseStarted.class);
            assertThat(events.get(events.size() - 1))
                    .isInstanceOf(OrchestrationEvent.PhaseCompleted.class);
            assertThat(calls(AgentRole.VALIDATOR)).isEqualTo(2);
        }

        @Test
        @DisplayName("passes the raw task to primary agents in the first round")
        void shouldSendRawTaskFirst() {
            IterationOrchestrator orchestrator =
                    build(orchestrator(config().build(), scripted(0.9, 0.95)));

            orchestrator.executePhase("auth", TASK);

            assertThat(calls.get(0).prompt()).isEqualTo(TASK);
            assertThat(calls.get(0).outerIteration()).isEqualTo(1);
            assertThat(calls.get(0).innerIteration()).isEqualTo(1);
            assertThat(calls.get(1).prompt()).contains(TASK).contains("deliverable for auth");
        }

        @Test
        @DisplayName("retries the inner round until confidence passes")
        void shouldRetryInnerRound() {
            AtomicInteger attempt = new AtomicInteger();
            AgentExecutor agents =
                    in ->
                            in.role() == AgentRole.PRIMARY
                                    ? work(in, attempt.incrementAndGet() == 1 ? 0.5 : 0.8)
                                    : validation(in, Vote.PASS, 0.95, List.of());
            IterationOrchestrator orchestrator = build(orchestrator(config().build(), agents));

            PhaseResult result = orchestrator.executePhase("auth", TASK);

            assertThat(result.succeeded()).isTrue();
            assertThat(result.totalLoop3Iterations()).isEqualTo(2);
            assertThat(result.statistics().primaryExecutions()).isEqualTo(2);
            assertThat(events)
                    .filteredOn(OrchestrationEvent.ConfidenceGateEvaluated.class::isInstance)
                    .map(e -> ((OrchestrationEvent.ConfidenceGateEvaluated) e).result().passed())
                    .containsExactly(false, true);
        }

        @Test
        @DisplayName("injects feedback into the next round and clears it on success")
        void shouldInjectFeedbackIntoNextRound() {
            AgentExecutor agents =
                    in -> {
                        if (in.role() == AgentRole.PRIMARY) {
                            return work(in, 0.9);
                        }
                        boolean first = in.outerIteration() == 1;
                        return validation(
                                in,
                                first ? Vote.FAIL : Vote.PASS,
                                first ? 0.5 : 0.95,
                                first
                                        ? List.of(
                                                FeedbackIssue.of(
                                                        IssueType.SECURITY,
                                                        Severity.CRITICAL,
                                                        "Token secret is hard-coded"))
                                        : List.of());
                    };
            IterationOrchestrator orchestrator = build(orchestrator(config().build(), agents));

            PhaseResult result = orchestrator.executePhase("auth", TASK);

            assertThat(result.succeeded()).isTrue();
            assertThat(result.loop2Iterations()).isEqualTo(2);
            assertThat(result.feedbackHistory()).hasSize(1);
            AgentInstructions secondPrimary =
                    calls.stream()
                            .filter(c -> c.role() == AgentRole.PRIMARY && c.outerIteration() == 2)
                            .findFirst()
                            .orElseThrow();
            assertThat(secondPrimary.prompt())
                    .contains("Token secret is hard-coded")
                    .contains(TASK);
            assertThat(count(OrchestrationEvent.FeedbackInjected.class)).isEqualTo(1);
            assertThat(count(OrchestrationEvent.ContinuationRequired.class)).isEqualTo(1);
            assertThat(feedbackInjector.getHistory("auth")).isEmpty();
        }

        @Test
        @DisplayName("records backlog items when the gate defers")
        void shouldDeferWithBacklog() {
            AuditRecorder audit = mock(AuditRecorder.class);
            AgentExecutor agents =
                    in ->
                            in.role() == AgentRole.PRIMARY
                                    ? work(in, 0.9)
                                    : validation(
                                            in,
                                            Vote.PASS,
                                            0.95,
                                            List.of(
                                                    FeedbackIssue.of(
                                                            IssueType.DOCUMENTATION,
                                                            Severity.LOW,
                                                            "Document token expiry")));
            IterationOrchestrator orchestrator =
                    build(orchestrator(config().build(), agents).audit(audit));

            PhaseResult result = orchestrator.executePhase("auth", TASK);

            assertThat(result.succeeded()).isTrue();
            assertThat(result.decision().decision()).isEqualTo(Decision.DEFER);
            assertThat(result.backlogItems()).containsExactly("Document token expiry");
            verify(audit).recordEvent(eq("backlog:deferred"), anyMap(), eq(RiskLevel.LOW));
        }
    }

    @Nested
    @DisplayName("escalation")
    class Escalation {

        @Test
        @DisplayName("escalates after exactly the configured number of outer rounds")
        void shouldEscalateAfterMaxOuterRounds() {
            IterationOrchestrator orchestrator =
                    build(
                            orchestrator(
                                    config().maxLoop2Iterations(2).build(), scripted(0.9, 0.5)));

            PhaseResult result = orchestrator.executePhase("auth", TASK);

            assertThat(result.escalated()).isTrue();
            assertThat(result.loop2Iterations()).isEqualTo(2);
            assertThat(result.escalationReason())
                    .isEqualTo("Maximum Loop 2 iterations (2) exceeded without consensus");
            assertThat(result.escalationPrompt()).contains("### Options");
            assertThat(calls(AgentRole.VALIDATOR)).isEqualTo(4);
            assertThat(result.statistics().consensusExecutions()).isEqualTo(2);
            assertThat(result.statistics().gateFails()).isEqualTo(2);
            assertThat(count(OrchestrationEvent.ContinuationRequired.class)).isEqualTo(1);
            assertThat(events)
                    .filteredOn(OrchestrationEvent.PhaseEscalated.class::isInstance)
                    .singleElement()
                    .satisfies(
                            e ->
                                    assertThat(((OrchestrationEvent.PhaseEscalated) e).retryOption())
                                            .isTrue());
        }

        @Test
        @DisplayName("an exhausted inner loop fails the outer round without validation")
        void shouldFailOuterRoundWhenInnerLoopExhausted() {
            IterationOrchestrator orchestrator =
                    build(
                            orchestrator(
                                    config().maxLoop2Iterations(2).maxLoop3Iterations(2).build(),
                                    scripted(0.5, 0.95)));

            PhaseResult result = orchestrator.executePhase("auth", TASK);

            assertThat(result.escalated()).isTrue();
            assertThat(calls(AgentRole.PRIMARY)).isEqualTo(2);
            assertThat(calls(AgentRole.VALIDATOR)).isZero();
            assertThat(result.finalConsensus()).isNull();
        }

        @Test
        @DisplayName("escalates when validators report blockers")
        void shouldEscalateOnBlockers() {
            AgentExecutor agents =
                    in ->
                            in.role() == AgentRole.PRIMARY
                                    ? work(in, 0.9)
                                    : new AgentResponse.ValidationResult(
                                            "v-" + in.agentType(),
                                            in.agentType(),
                                            Vote.PASS,
                                            0.95,
                                            "Checked the implementation",
                                            List.of(),
                                            List.of(),
                                            List.of(),
                                            List.of("Secrets committed to the repository"),
                                            null,
                                            Instant.parse("2026-05-01T09:00:00Z"));
            IterationOrchestrator orchestrator = build(orchestrator(config().build(), agents));

            PhaseResult result = orchestrator.executePhase("auth", TASK);

            assertThat(result.escalated()).isTrue();
            assertThat(result.decision().decision()).isEqualTo(Decision.ESCALATE);
            assertThat(result.decision().blockers())
                    .containsExactly("Secrets committed to the repository");
        }

        @Test
        @DisplayName("escalates when the decision gate throws")
        void shouldEscalateWhenGateFails() {
            DecisionGate failing =
                    context -> {
                        throw new IOException("product owner offline");
                    };
            IterationOrchestrator orchestrator =
                    build(orchestrator(config().build(), scripted(0.9, 0.95)).decisionGate(failing));

            PhaseResult result = orchestrator.executePhase("auth", TASK);

            assertThat(result.escalated()).isTrue();
            assertThat(result.escalationReason()).contains("product owner offline");
        }

        @Test
        @DisplayName("escalates when a collaborator fails and releases the phase")
        void shouldEscalateOnCollaboratorFailure() {
            AtomicInteger evaluations = new AtomicInteger();
            ConsensusEvaluator flaky =
                    new ConsensusEvaluator(ConsensusConfig.simple(0.9)) {
                        @Override
                        public ConsensusResult evaluate(List<ValidatorVote> votes) {
                            if (evaluations.getAndIncrement() == 0) {
                                throw new IllegalStateException("vote store corrupted");
                            }
                            return super.evaluate(votes);
                        }
                    };
            IterationOrchestrator orchestrator =
                    build(
                            orchestrator(config().build(), scripted(0.9, 0.95))
                                    .consensusEvaluator(flaky));

            PhaseResult failed = orchestrator.executePhase("auth", TASK);

            assertThat(failed.escalated()).isTrue();
            assertThat(failed.escalationReason())
                    .isEqualTo("Phase execution failed: vote store corrupted");
            assertThat(count(OrchestrationEvent.PhaseCompleted.class)).isEqualTo(1);

            PhaseResult retried = orchestrator.executePhase("auth", TASK);

            assertThat(retried.outcome()).isEqualTo(PhaseOutcome.SUCCEEDED);
        }

        @Test
        @DisplayName("throws from executePhaseOrThrow when the phase escalates")
        void shouldThrowOnEscalation() {
            IterationOrchestrator orchestrator =
                    build(
                            orchestrator(
                                    config().maxLoop2Iterations(1).build(), scripted(0.9, 0.5)));

            assertThatThrownBy(() -> orchestrator.executePhaseOrThrow("auth", TASK))
                    .isInstanceOf(EscalationException.class)
                    .satisfies(
                            e ->
                                    assertThat(((EscalationException) e).getResult().escalated())
                                            .isTrue());
        }

        @Test
        @DisplayName("escalates once the phase deadline passes")
        void shouldEscalateOnPhaseTimeout() {
            AgentExecutor slow =
                    in -> {
                        clock.advance(Duration.ofSeconds(2));
                        return work(in, 0.5);
                    };
            IterationOrchestrator orchestrator =
                    build(orchestrator(config().phaseTimeout(Duration.ofSeconds(1)).build(), slow));

            PhaseResult result = orchestrator.executePhase("auth", TASK);

            assertThat(result.escalated()).isTrue();
            assertThat(result.escalationReason()).startsWith("Phase timeout");
            assertThat(result.statistics().timeouts()).isEqualTo(1);
            assertThat(calls(AgentRole.PRIMARY)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("circuit breaker")
    class Breaker {

        @Test
        @DisplayName("treats failures and rejections as failed rounds and waits out the backoff")
        void shouldWaitForOpenCircuit() {
            AgentExecutor failing =
                    in -> {
                        throw new IOException("agent backend unavailable");
                    };
            IterationOrchestrator orchestrator =
                    build(
                            orchestrator(
                                    config().maxLoop2Iterations(1).maxLoop3Iterations(4).build(),
                                    failing));

            PhaseResult result = orchestrator.executePhase("auth", TASK);

            assertThat(result.escalated()).isTrue();
            assertThat(calls(AgentRole.PRIMARY)).isEqualTo(3);
            assertThat(result.statistics().circuitBreakerTrips()).isEqualTo(1);
            assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
        }
    }

    @Nested
    @DisplayName("handleFailure")
    class HandleFailure {

        private ConsensusFeedback feedback() {
            return new ConsensusFeedback(
                    "auth",
                    1,
                    0.6,
                    0.9,
                    List.of(),
                    List.of(),
                    List.of(
                            new ActionableStep(
                                    Severity.CRITICAL,
                                    "security",
                                    "Remove hard-coded secret",
                                    "security-specialist",
                                    Effort.HIGH),
                            new ActionableStep(
                                    Severity.LOW, "quality", "Rename variable", "reviewer", Effort.LOW)),
                    List.of(),
                    clock.instant());
        }

        @Test
        @DisplayName("targets the owners of critical steps")
        void shouldTargetCriticalOwners() {
            IterationOrchestrator orchestrator =
                    build(orchestrator(config().retryDelay(Duration.ofSeconds(3)).build(), scripted(0.9, 0.95)));

            RetryStrategy strategy = orchestrator.handleFailure("auth", feedback());

            assertThat(strategy.shouldRetry()).isTrue();
            assertThat(strategy.delay()).isEqualTo(Duration.ofSeconds(3));
            assertThat(strategy.targetAgents()).containsExactly("security-specialist");
            assertThat(strategy.reason()).isEqualTo("Addressing 1 critical issues");
        }

        @Test
        @DisplayName("stops retrying once the outer limit is reached")
        void shouldStopAtLimit() {
            IterationOrchestrator orchestrator =
                    build(
                            orchestrator(
                                    config().maxLoop2Iterations(1).build(), scripted(0.9, 0.5)));
            orchestrator.executePhase("auth", TASK);

            RetryStrategy strategy = orchestrator.handleFailure("auth", feedback());

            assertThat(strategy.shouldRetry()).isFalse();
            assertThat(strategy.delay()).isEqualTo(Duration.ZERO);
            assertThat(strategy.reason()).isEqualTo("Maximum Loop 2 iterations reached");
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("exposes and resets per-phase state")
        void shouldExposeAndResetState() {
            IterationOrchestrator orchestrator =
                    build(orchestrator(config().build(), scripted(0.9, 0.95)));
            orchestrator.executePhase("auth", TASK);

            assertThat(orchestrator.getIterationState("auth"))
                    .hasValueSatisfying(s -> assertThat(s.loop2()).isEqualTo(1));
            assertThat(orchestrator.getStatistics("auth"))
                    .hasValueSatisfying(s -> assertThat(s.gatePasses()).isEqualTo(1));

            orchestrator.reset("auth");

            assertThat(orchestrator.getIterationState("auth")).isEmpty();
            assertThat(orchestrator.getStatistics("auth")).isEmpty();
        }

        @Test
        @DisplayName("rejects phases after shutdown")
        void shouldRejectAfterShutdown() {
            IterationOrchestrator orchestrator =
                    build(orchestrator(config().build(), scripted(0.9, 0.95)));

            orchestrator.shutdown();

            assertThat(orchestrator.isShutdown()).isTrue();
            assertThatThrownBy(() -> orchestrator.executePhase("auth", TASK))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("a failing listener does not stop the phase")
        void shouldIsolateListenerFailures() {
            IterationOrchestrator orchestrator =
                    build(orchestrator(config().build(), scripted(0.9, 0.95)));
            orchestrator.addListener(
                    event -> {
                        throw new IllegalStateException("listener failed");
                    });

            assertThat(orchestrator.executePhase("auth", TASK).succeeded()).isTrue();
        }

        @Test
        @DisplayName("requires agents and breakers")
        void shouldRequireCollaborators() {
            assertThatThrownBy(() -> IterationOrchestrator.builder().breakers(breakers).build())
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("agents");
        }
    }

    @Test
    @DisplayName("phases are independent across ids")
    void shouldKeepPhasesIndependent() {
        IterationOrchestrator orchestrator =
                build(orchestrator(config().build(), scripted(0.9, 0.95)));

        orchestrator.executePhase("auth", TASK);
        orchestrator.executePhase("billing", TASK);

        assertThat(calls).extracting(AgentInstructions::phaseId).contains("auth", "billing");
        assertThat(orchestrator.getIterationState("auth"))
                .hasValueSatisfying(s -> assertThat(s.loop2()).isEqualTo(1));
        assertThat(orchestrator.getIterationState("billing"))
                .hasValueSatisfying(s -> assertThat(s.loop2()).isEqualTo(1));
    }
}
