package io.tessera.core.signal;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A coordination signal written once by a sender to `signal:{receiverId}`.
///
/// @param signalId logical signal identifier, stable across retried sends of the same
///        `(sender, receiver, type, iteration)`, not null
/// @param messageId per-send identifier used for duplicate detection, not null
/// @param type signal kind, not null
/// @param source sending coordinator, not null
/// @param targets receiving coordinators, not null
/// @param iteration iteration number the signal refers to, non-negative
/// @param payload free-form body, not null
/// @param timestamp when the signal was created, not null
public record Signal(
        String signalId,
        String messageId,
        SignalType type,
        String source,
        List<String> targets,
        int iteration,
        Map<String, Object> payload,
        Instant timestamp) {

    public Signal {
        Objects.requireNonNull(signalId, "signalId must not be null");
        Objects.requireNonNull(messageId, "messageId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (iteration < 0) {
            throw new IllegalArgumentException("iteration must not be negative");
        }
        targets = targets != null ? List.copyOf(targets) : List.of();
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }
}
