package io.tessera.core.orchestration;

import io.tessera.core.consensus.ConsensusMode;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/// Tuning parameters for {@link IterationOrchestrator}.
///
/// ### Default Values
/// - `maxLoop2Iterations`: `10` (outer consensus rounds)
/// - `maxLoop3Iterations`: `10` (inner implementation rounds, per outer round)
/// - `confidenceThreshold`: `0.75`
/// - `consensusThreshold`: `0.90`
/// - `phaseTimeout`: 30 minutes
/// - `consensusMode`: {@link ConsensusMode#SIMPLE}
/// - `primaryAgentTypes`: `coder`
/// - `validatorAgentTypes`: `reviewer`, `security-specialist`, `tester`, `analyst`
/// - `retryDelay`: 1 second, reported by {@link IterationOrchestrator#handleFailure}
/// - `autonomousContinuation`: `true`
///
/// Instances are immutable; obtain one through {@link #builder()}.
///
/// @see IterationOrchestrator
public final class OrchestratorConfig {

    public static final List<String> DEFAULT_PRIMARY_AGENTS = List.of("coder");
    public static final List<String> DEFAULT_VALIDATORS =
            List.of("reviewer", "security-specialist", "tester", "analyst");

    private final int maxLoop2Iterations;
    private final int maxLoop3Iterations;
    private final double confidenceThreshold;
    private final double consensusThreshold;
    private final Duration phaseTimeout;
    private final ConsensusMode consensusMode;
    private final List<String> primaryAgentTypes;
    private final List<String> validatorAgentTypes;
    private final Duration retryDelay;
    private final boolean autonomousContinuation;

    private OrchestratorConfig(Builder builder) {
        this.maxLoop2Iterations = builder.maxLoop2Iterations;
        this.maxLoop3Iterations = builder.maxLoop3Iterations;
        this.confidenceThreshold = builder.confidenceThreshold;
        this.consensusThreshold = builder.consensusThreshold;
        this.phaseTimeout = builder.phaseTimeout;
        this.consensusMode = builder.consensusMode;
        this.primaryAgentTypes = List.copyOf(builder.primaryAgentTypes);
        this.validatorAgentTypes = List.copyOf(builder.validatorAgentTypes);
        this.retryDelay = builder.retryDelay;
        this.autonomousContinuation = builder.autonomousContinuation;
    }

    /// Returns a configuration with every default applied.
    public static OrchestratorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxLoop2Iterations() {
        return maxLoop2Iterations;
    }

    public int getMaxLoop3Iterations() {
        return maxLoop3Iterations;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public double getConsensusThreshold() {
        return consensusThreshold;
    }

    public Duration getPhaseTimeout() {
        return phaseTimeout;
    }

    public ConsensusMode getConsensusMode() {
        return consensusMode;
    }

    public List<String> getPrimaryAgentTypes() {
        return primaryAgentTypes;
    }

    public List<String> getValidatorAgentTypes() {
        return validatorAgentTypes;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    /// Whether a failed consensus round continues without waiting for a human.
    ///
    /// Reported on {@link OrchestrationEvent.ContinuationRequired}; the loop itself
    /// always continues until a limit is hit.
    public boolean isAutonomousContinuation() {
        return autonomousContinuation;
    }

    /// Fluent builder for {@link OrchestratorConfig}.
    ///
    /// Values are validated in {@link #build()}.
    public static final class Builder {
        private int maxLoop2Iterations = 10;
        private int maxLoop3Iterations = 10;
        private double confidenceThreshold = 0.75;
        private double consensusThreshold = 0.90;
        private Duration phaseTimeout = Duration.ofMinutes(30);
        private ConsensusMode consensusMode = ConsensusMode.SIMPLE;
        private List<String> primaryAgentTypes = DEFAULT_PRIMARY_AGENTS;
        private List<String> validatorAgentTypes = DEFAULT_VALIDATORS;
        private Duration retryDelay = Duration.ofSeconds(1);
        private boolean autonomousContinuation = true;

        private Builder() {}

        public Builder maxLoop2Iterations(int maxLoop2Iterations) {
            this.maxLoop2Iterations = maxLoop2Iterations;
            return this;
        }

        public Builder maxLoop3Iterations(int maxLoop3Iterations) {
            this.maxLoop3Iterations = maxLoop3Iterations;
            return this;
        }

        /// Sets the minimum confidence every primary agent must report.
        ///
        /// @param confidenceThreshold value in `[0, 1]`
        /// @return this builder for chaining, never null
        public Builder confidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        /// Sets the consensus score a validator round must reach.
        ///
        /// @param consensusThreshold value in `[0, 1]`
        /// @return this builder for chaining, never null
        public Builder consensusThreshold(double consensusThreshold) {
            this.consensusThreshold = consensusThreshold;
            return this;
        }

        public Builder phaseTimeout(Duration phaseTimeout) {
            this.phaseTimeout = phaseTimeout;
            return this;
        }

        public Builder consensusMode(ConsensusMode consensusMode) {
            this.consensusMode = consensusMode;
            return this;
        }

        public Builder primaryAgentTypes(List<String> primaryAgentTypes) {
            this.primaryAgentTypes = primaryAgentTypes;
            return this;
        }

        public Builder validatorAgentTypes(List<String> validatorAgentTypes) {
            this.validatorAgentTypes = validatorAgentTypes;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder autonomousContinuation(boolean autonomousContinuation) {
            this.autonomousContinuation = autonomousContinuation;
            return this;
        }

        /// Validates and builds the configuration.
        ///
        /// @return the configuration, never null
        /// @throws IllegalArgumentException if a maximum is below 1, a threshold is
        ///         outside `[0, 1]`, an agent list is empty or a duration is not positive
        public OrchestratorConfig build() {
            if (maxLoop2Iterations < 1 || maxLoop3Iterations < 1) {
                throw new IllegalArgumentException("iteration maxima must be at least 1");
            }
            requireUnitInterval(confidenceThreshold, "confidenceThreshold");
            requireUnitInterval(consensusThreshold, "consensusThreshold");
            Objects.requireNonNull(phaseTimeout, "phaseTimeout must not be null");
            Objects.requireNonNull(retryDelay, "retryDelay must not be null");
            Objects.requireNonNull(consensusMode, "consensusMode must not be null");
            if (phaseTimeout.isNegative() || phaseTimeout.isZero()) {
                throw new IllegalArgumentException("phaseTimeout must be positive");
            }
            if (retryDelay.isNegative()) {
                throw new IllegalArgumentException("retryDelay must not be negative");
            }
            requireAgents(primaryAgentTypes, "primaryAgentTypes");
            requireAgents(validatorAgentTypes, "validatorAgentTypes");
            return new OrchestratorConfig(this);
        }

        private static void requireUnitInterval(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be within [0, 1]: " + value);
            }
        }

        private static void requireAgents(List<String> agents, String name) {
            Objects.requireNonNull(agents, name + " must not be null");
            if (agents.isEmpty()) {
                throw new IllegalArgumentException(name + " must not be empty");
            }
        }
    }
}
