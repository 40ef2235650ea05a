package io.tessera.core.feedback;

import java.time.Duration;
import java.util.Objects;

/// Bounds for the feedback registries.
///
/// @param maxEntriesPerPhase issue keys remembered per phase for deduplication
/// @param maxHistoryPerPhase captured rounds kept per phase
/// @param maxPhases phases tracked at once, least recently used evicted beyond
/// @param phaseIdleTimeout phase state dropped after this long without access
/// @param deduplicationEnabled whether repeated issues are suppressed
public record FeedbackConfig(
        int maxEntriesPerPhase,
        int maxHistoryPerPhase,
        long maxPhases,
        Duration phaseIdleTimeout,
        boolean deduplicationEnabled) {

    public FeedbackConfig {
        Objects.requireNonNull(phaseIdleTimeout, "phaseIdleTimeout must not be null");
        if (maxEntriesPerPhase < 1 || maxHistoryPerPhase < 1 || maxPhases < 1) {
            throw new IllegalArgumentException("feedback bounds must be positive");
        }
    }

    public static FeedbackConfig defaults() {
        return new FeedbackConfig(100, 100, 1_000, Duration.ofHours(24), true);
    }
}
