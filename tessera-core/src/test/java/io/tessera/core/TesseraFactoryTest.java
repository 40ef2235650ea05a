package io.tessera.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tessera.core.agent.AgentExecutor;
import io.tessera.core.agent.AgentResponse;
import io.tessera.core.consensus.Vote;
import io.tessera.core.orchestration.Decision;
import io.tessera.core.orchestration.OrchestrationEvent;
import io.tessera.core.orchestration.OrchestratorConfig;
import io.tessera.core.orchestration.PhaseResult;
import io.tessera.core.orchestration.ProductOwnerDecision;
import io.tessera.core.orchestration.ProductOwnerDecisionGate;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TesseraFactory")
class TesseraFactoryTest {

    private TesseraEnvironment environment;

    private final AgentExecutor agents =
            in ->
                    switch (in.role()) {
                        case PRIMARY -> AgentResponse.WorkResult.of(
                                "coder-1", in.agentType(), "Login endpoint implemented", 0.9);
                        case VALIDATOR -> AgentResponse.ValidationResult.of(
                                in.agentType() + "-1",
                                in.agentType(),
                                Vote.PASS,
                                0.95,
                                "Endpoint covered by integration tests");
                        case PRODUCT_OWNER -> AgentResponse.WorkResult.of(
                                "po-1", in.agentType(), "PROCEED", 0.9);
                    };

    @AfterEach
    void tearDown() {
        if (environment != null) {
            environment.close();
        }
    }

    @Nested
    @DisplayName("builder")
    class Builder {

        @Test
        @DisplayName("wires an environment that completes a phase")
        void shouldRunPhaseEndToEnd() {
            List<OrchestrationEvent> events = new CopyOnWriteArrayList<>();
            environment =
                    TesseraFactory.builder()
                            .config(
                                    TesseraConfig.builder()
                                            .threadPoolSize(2)
                                            .logConfig(LogConfig.quiet())
                                            .build())
                            .agents(agents)
                            .listener(events::add)
                            .build();

            PhaseResult result = environment.getOrchestrator().executePhase("login", "Add login");

            assertThat(result.succeeded()).isTrue();
            assertThat(result.decision().decision()).isEqualTo(Decision.PROCEED);
            assertThat(events).isNotEmpty();
            assertThat(environment.getCircuitBreakers().snapshot())
                    .containsKeys("primary-execution", "consensus-validation");
        }

        @Test
        @DisplayName("routes the decision through a product-owner agent")
        void shouldUseProductOwnerGate() {
            List<String> parsed = new CopyOnWriteArrayList<>();
            environment =
                    TesseraFactory.builder()
                            .config(TesseraConfig.builder().logConfig(LogConfig.quiet()).build())
                            .agents(agents)
                            .productOwner(
                                    raw -> {
                                        parsed.add(raw);
                                        return new ProductOwnerDecision(
                                                Decision.DEFER,
                                                0.8,
                                                "Ship, polish later",
                                                List.of("Add remember-me"),
                                                List.of(),
                                                List.of());
                                    })
                            .build();

            PhaseResult result = environment.getOrchestrator().executePhase("login", "Add login");

            assertThat(parsed).containsExactly("PROCEED");
            assertThat(result.backlogItems()).containsExactly("Add remember-me");
            assertThat(environment.getCircuitBreakers().snapshot())
                    .containsKey(ProductOwnerDecisionGate.AGENT_TYPE);
        }

        @Test
        @DisplayName("applies the orchestrator configuration")
        void shouldApplyOrchestratorConfig() {
            OrchestratorConfig orchestrator =
                    OrchestratorConfig.builder().maxLoop2Iterations(4).build();
            environment =
                    TesseraFactory.builder()
                            .config(TesseraConfig.builder().orchestrator(orchestrator).build())
                            .agents(agents)
                            .build();

            assertThat(environment.getOrchestrator().getConfig().getMaxLoop2Iterations())
                    .isEqualTo(4);
        }

        @Test
        @DisplayName("requires an agent backend")
        void shouldRequireAgents() {
            assertThatThrownBy(() -> TesseraFactory.builder().build())
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("agents");
        }
    }

    @Test
    @DisplayName("close shuts down the orchestrator and the executor")
    void shouldShutDownOnClose() {
        ExecutorService executor = Executors.newFixedThreadPool(1);
        environment =
                TesseraFactory.builder().agents(agents).executorService(executor).build();

        environment.close();

        assertThat(environment.getOrchestrator().isShutdown()).isTrue();
        assertThat(executor.isShutdown()).isTrue();
        assertThat(environment.getExecutorService()).isSameAs(executor);
    }
}
