package io.tessera.core.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.tessera.core.LogConfig;
import io.tessera.core.MutableClock;
import io.tessera.core.agent.AgentExecutor;
import io.tessera.core.agent.AgentInstructions;
import io.tessera.core.agent.AgentResponse;
import io.tessera.core.agent.AgentRole;
import io.tessera.core.breaker.CircuitBreaker;
import io.tessera.core.breaker.CircuitBreakerConfig;
import io.tessera.core.consensus.ConsensusConfig;
import io.tessera.core.consensus.ConsensusEvaluator;
import io.tessera.core.consensus.ValidatorVote;
import io.tessera.core.consensus.Vote;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProductOwnerDecisionGate")
class ProductOwnerDecisionGateTest {

    private static final Instant NOW = Instant.parse("2026-05-01T09:00:00Z");

    @Mock private AgentExecutor executor;
    @Mock private DecisionParser parser;

    private ExecutorService pool;
    private CircuitBreaker breaker;
    private ProductOwnerDecisionGate gate;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        breaker =
                new CircuitBreaker(
                        ProductOwnerDecisionGate.AGENT_TYPE,
                        CircuitBreakerConfig.defaults(),
                        pool,
                        MutableClock.at("2026-05-01T09:00:00Z"),
                        LogConfig.quiet());
        gate = new ProductOwnerDecisionGate(executor, parser, breaker, LogConfig.quiet());
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static DecisionContext context() {
        return new DecisionContext(
                "auth",
                "Implement JWT authentication",
                2,
                new ConsensusEvaluator(ConsensusConfig.simple())
                        .evaluate(
                                List.of(
                                        ValidatorVote.signed(
                                                "r-1", "reviewer", 0.95, Vote.PASS,
                                                "Reviewed every changed file", List.of(), NOW))),
                List.of(AgentResponse.WorkResult.of("coder-1", "coder", "JWT filter added", 0.9)),
                List.of());
    }

    @Test
    @DisplayName("asks the product owner and parses its deliverable")
    void shouldParseProductOwnerAnswer() throws Exception {
        ProductOwnerDecision proceed =
                new ProductOwnerDecision(
                        Decision.PROCEED, 0.9, "Ship it", List.of(), List.of(), List.of());
        when(executor.execute(any()))
                .thenReturn(AgentResponse.WorkResult.of("po-1", "product-owner", "{\"decision\":\"PROCEED\"}", 0.9));
        when(parser.parse("{\"decision\":\"PROCEED\"}")).thenReturn(proceed);

        ProductOwnerDecision decision = gate.decide(context());

        assertThat(decision).isSameAs(proceed);
        ArgumentCaptor<AgentInstructions> sent = ArgumentCaptor.forClass(AgentInstructions.class);
        verify(executor).execute(sent.capture());
        assertThat(sent.getValue().role()).isEqualTo(AgentRole.PRODUCT_OWNER);
        assertThat(sent.getValue().agentType()).isEqualTo("product-owner");
        assertThat(sent.getValue().outerIteration()).isEqualTo(2);
        assertThat(sent.getValue().prompt()).contains("auth");
    }

    @Test
    @DisplayName("escalates when the agent fails")
    void shouldEscalateOnAgentFailure() throws Exception {
        when(executor.execute(any())).thenThrow(new IOException("model quota exceeded"));

        ProductOwnerDecision decision = gate.decide(context());

        assertThat(decision.decision()).isEqualTo(Decision.ESCALATE);
        assertThat(decision.reasoning()).contains("model quota exceeded");
        verifyNoInteractions(parser);
    }

    @Test
    @DisplayName("escalates without calling the agent while the circuit is open")
    void shouldEscalateWhenCircuitOpen() throws Exception {
        for (int i = 0; i < CircuitBreakerConfig.defaults().failureThreshold(); i++) {
            assertThatThrownBy(
                            () ->
                                    breaker.execute(
                                            () -> {
                                                throw new IOException("down");
                                            }))
                    .isInstanceOf(IOException.class);
        }

        ProductOwnerDecision decision = gate.decide(context());

        assertThat(decision.decision()).isEqualTo(Decision.ESCALATE);
        assertThat(decision.reasoning()).startsWith("Product Owner unavailable");
        verify(executor, never()).execute(any());
    }

    @Test
    @DisplayName("treats a validation result as a parse failure")
    void shouldRejectValidationResult() throws Exception {
        when(executor.execute(any()))
                .thenReturn(
                        AgentResponse.ValidationResult.of(
                                "po-1", "product-owner", Vote.PASS, 0.9, "looks fine"));

        ProductOwnerDecision decision = gate.decide(context());

        assertThat(decision.decision()).isEqualTo(Decision.ESCALATE);
        assertThat(decision.blockers()).containsExactly(ProductOwnerDecision.PARSE_FAILURE_BLOCKER);
        verifyNoInteractions(parser);
    }
}
