package io.tessera.core;

import io.tessera.core.agent.AgentExecutor;
import io.tessera.core.audit.AuditRecorder;
import io.tessera.core.breaker.CircuitBreakerRegistry;
import io.tessera.core.feedback.FeedbackInjector;
import io.tessera.core.orchestration.DecisionGate;
import io.tessera.core.orchestration.DecisionParser;
import io.tessera.core.orchestration.IterationOrchestrator;
import io.tessera.core.orchestration.OrchestrationListener;
import io.tessera.core.orchestration.ProductOwnerDecisionGate;
import io.tessera.core.orchestration.ThresholdDecisionGate;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/// Wires a {@link TesseraEnvironment}.
///
/// ### Usage
/// {@snippet :
/// try (TesseraEnvironment env = TesseraFactory.builder()
///         .config(TesseraConfig.builder().threadPoolSize(4).build())
///         .agents(agentExecutor)
///         .productOwner(new JacksonDecisionParser())
///         .build()) {
///     PhaseResult result = env.getOrchestrator().executePhase("auth", task);
/// }
/// }
///
/// @see TesseraEnvironment
/// @see TesseraConfig
public final class TesseraFactory {

    private TesseraFactory() {}

    /// Creates an environment with the default decision gate and no audit.
    ///
    /// @param config configuration, not null
    /// @param agents agent backend, not null
    /// @return a wired environment, never null
    public static TesseraEnvironment createEnvironment(TesseraConfig config, AgentExecutor agents) {
        return builder().config(config).agents(agents).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for environments with custom collaborators.
    public static final class Builder {
        private TesseraConfig config = new TesseraConfig();
        private AgentExecutor agents;
        private DecisionGate decisionGate;
        private DecisionParser productOwnerParser;
        private AuditRecorder audit = AuditRecorder.NOOP;
        private Clock clock = Clock.systemUTC();
        private ExecutorService executorService;
        private final List<OrchestrationListener> listeners = new ArrayList<>();

        private Builder() {}

        public Builder config(TesseraConfig config) {
            this.config = config;
            return this;
        }

        public Builder agents(AgentExecutor agents) {
            this.agents = agents;
            return this;
        }

        /// Sets the decision gate; defaults to {@link ThresholdDecisionGate}.
        public Builder decisionGate(DecisionGate decisionGate) {
            this.decisionGate = decisionGate;
            return this;
        }

        /// Routes the final decision to a `product-owner` agent run through the same
        /// agent backend and read with `parser`. Takes precedence over
        /// {@link #decisionGate(DecisionGate)}.
        public Builder productOwner(DecisionParser parser) {
            this.productOwnerParser = parser;
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

        /// Supplies the executor; the environment still shuts it down on close.
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        public Builder listener(OrchestrationListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        /// @return a wired environment, never null
        /// @throws NullPointerException if `config` or `agents` is missing
        public TesseraEnvironment build() {
            Objects.requireNonNull(config, "config must not be null");
            Objects.requireNonNull(agents, "agents must not be null");

            ExecutorService executor =
                    executorService != null
                            ? executorService
                            : Executors.newFixedThreadPool(config.getThreadPoolSize());
            CircuitBreakerRegistry breakers =
                    new CircuitBreakerRegistry(
                            config.getCircuitBreaker(), executor, clock, config.getLogConfig());
            FeedbackInjector feedbackInjector =
                    new FeedbackInjector(config.getFeedback(), clock, config.getLogConfig());

            IterationOrchestrator orchestrator =
                    IterationOrchestrator.builder()
                            .config(config.getOrchestrator())
                            .agents(agents)
                            .breakers(breakers)
                            .feedbackInjector(feedbackInjector)
                            .decisionGate(resolveDecisionGate(breakers))
                            .audit(audit)
                            .clock(clock)
                            .logConfig(config.getLogConfig())
                            .build();
            listeners.forEach(orchestrator::addListener);

            return new TesseraEnvironment(
                    config, orchestrator, breakers, feedbackInjector, executor);
        }

        private DecisionGate resolveDecisionGate(CircuitBreakerRegistry breakers) {
            if (productOwnerParser != null) {
                return new ProductOwnerDecisionGate(
                        agents,
                        productOwnerParser,
                        breakers.getOrCreate(ProductOwnerDecisionGate.AGENT_TYPE),
                        config.getLogConfig());
            }
            return decisionGate != null ? decisionGate : new ThresholdDecisionGate();
        }
    }
}
