package io.tessera.core.orchestration;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/// Advice returned by {@link IterationOrchestrator#handleFailure}.
///
/// @param shouldRetry `false` once the outer round budget is spent
/// @param delay pause before the next round, zero when not retrying
/// @param targetAgents agent types owning critical steps, empty for all agents
/// @param reason human-readable explanation, not null
public record RetryStrategy(
        boolean shouldRetry, Duration delay, List<String> targetAgents, String reason) {

    public RetryStrategy {
        Objects.requireNonNull(delay, "delay must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        targetAgents = List.copyOf(targetAgents);
    }
}
