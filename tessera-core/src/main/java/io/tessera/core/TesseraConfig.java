package io.tessera.core;

import io.tessera.core.breaker.CircuitBreakerConfig;
import io.tessera.core.feedback.FeedbackConfig;
import io.tessera.core.orchestration.OrchestratorConfig;

/// Configuration of a {@link TesseraEnvironment}.
///
/// Aggregates the per-component configs and the executor sizing.
///
/// ### Default Values
/// - `threadPoolSize`: `10`, threads running protected agent calls
/// - `orchestrator`: {@link OrchestratorConfig#defaults()}
/// - `circuitBreaker`: {@link CircuitBreakerConfig#defaults()}
/// - `feedback`: {@link FeedbackConfig#defaults()}
/// - `logConfig`: {@link LogConfig#defaults()}
///
/// @implNote **Not thread-safe**. Configure before passing to {@link TesseraFactory}
/// and do not modify afterwards.
///
/// @see TesseraFactory#createEnvironment(TesseraConfig, io.tessera.core.agent.AgentExecutor)
public class TesseraConfig {
    private int threadPoolSize = 10;
    private OrchestratorConfig orchestrator = OrchestratorConfig.defaults();
    private CircuitBreakerConfig circuitBreaker = CircuitBreakerConfig.defaults();
    private FeedbackConfig feedback = FeedbackConfig.defaults();
    private LogConfig logConfig = LogConfig.defaults();

    public TesseraConfig() {}

    /// Returns the size of the fixed pool that runs protected calls.
    ///
    /// @return pool size, positive
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// ### Contracts
    /// - **Precondition**: `threadPoolSize` should be positive
    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    public OrchestratorConfig getOrchestrator() {
        return orchestrator;
    }

    public void setOrchestrator(OrchestratorConfig orchestrator) {
        this.orchestrator = orchestrator;
    }

    public CircuitBreakerConfig getCircuitBreaker() {
        return circuitBreaker;
    }

    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    public FeedbackConfig getFeedback() {
        return feedback;
    }

    public void setFeedback(FeedbackConfig feedback) {
        this.feedback = feedback;
    }

    public LogConfig getLogConfig() {
        return logConfig;
    }

    public void setLogConfig(LogConfig logConfig) {
        this.logConfig = logConfig;
    }

    /// Creates a new builder.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link TesseraConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final TesseraConfig config = new TesseraConfig();

        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder orchestrator(OrchestratorConfig orchestrator) {
            config.orchestrator = orchestrator;
            return this;
        }

        public Builder circuitBreaker(CircuitBreakerConfig circuitBreaker) {
            config.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder feedback(FeedbackConfig feedback) {
            config.feedback = feedback;
            return this;
        }

        public Builder logConfig(LogConfig logConfig) {
            config.logConfig = logConfig;
            return this;
        }

        /// @return the configured instance, never null
        public TesseraConfig build() {
            return config;
        }
    }
}
