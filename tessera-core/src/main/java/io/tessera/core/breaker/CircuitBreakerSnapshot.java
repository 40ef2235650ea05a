package io.tessera.core.breaker;

import java.time.Instant;
import java.util.Objects;

/// Point-in-time view of a circuit breaker's counters.
///
/// @param name circuit name, not null
/// @param state current state, not null
/// @param failureCount consecutive failures counted while CLOSED
/// @param successCount successful trial calls while HALF_OPEN
/// @param currentAttempt index into the backoff table, 0 when never opened
/// @param halfOpenCalls trial calls admitted in the current HALF_OPEN window
/// @param nextAttemptTime earliest time the next probe is allowed, null unless OPEN
///        or HALF_OPEN
/// @param totalTrips number of CLOSED/HALF_OPEN to OPEN transitions since creation
public record CircuitBreakerSnapshot(
        String name,
        CircuitState state,
        int failureCount,
        int successCount,
        int currentAttempt,
        int halfOpenCalls,
        Instant nextAttemptTime,
        long totalTrips) {

    public CircuitBreakerSnapshot {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }
}
