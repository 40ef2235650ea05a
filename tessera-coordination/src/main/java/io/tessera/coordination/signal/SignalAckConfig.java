package io.tessera.coordination.signal;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/// Timing parameters of {@link SignalAckProtocol}.
///
/// @param ackTtl lifetime of an acknowledgment, default 1 hour
/// @param signalTtl lifetime of a signal and its idempotency record, default 24 hours
/// @param pollInterval pause between store reads while waiting, default 100ms
/// @param retryDelays pause before each acknowledgment retry, default `[1s, 2s, 4s]`
/// @param retryRecordTtl lifetime of retry audit records, default 24 hours
public record SignalAckConfig(
        Duration ackTtl,
        Duration signalTtl,
        Duration pollInterval,
        List<Duration> retryDelays,
        Duration retryRecordTtl) {

    public SignalAckConfig {
        requirePositive(ackTtl, "ackTtl");
        requirePositive(signalTtl, "signalTtl");
        requirePositive(pollInterval, "pollInterval");
        requirePositive(retryRecordTtl, "retryRecordTtl");
        retryDelays = List.copyOf(Objects.requireNonNull(retryDelays, "retryDelays must not be null"));
        if (retryDelays.isEmpty()) {
            throw new IllegalArgumentException("retryDelays must not be empty");
        }
    }

    public static SignalAckConfig defaults() {
        return new SignalAckConfig(
                Duration.ofHours(1),
                Duration.ofHours(24),
                Duration.ofMillis(100),
                List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)),
                Duration.ofHours(24));
    }

    /// Returns a copy with different retry delays.
    public SignalAckConfig withRetryDelays(List<Duration> delays) {
        return new SignalAckConfig(ackTtl, signalTtl, pollInterval, delays, retryRecordTtl);
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
