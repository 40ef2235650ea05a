package io.tessera.core.breaker;

import java.io.Serial;
import java.time.Instant;

/// Thrown when a call is rejected because its circuit is OPEN, or HALF_OPEN with
/// all trial slots taken.
///
/// The protected operation was not invoked. The exception carries the breaker
/// snapshot at rejection time so callers can decide when to retry.
public class CircuitOpenException extends RuntimeException {

    @Serial private static final long serialVersionUID = 2901775438014593176L;

    private final transient CircuitBreakerSnapshot snapshot;

    /// Creates an exception for a rejected call.
    ///
    /// @param snapshot breaker state at rejection time, not null
    public CircuitOpenException(CircuitBreakerSnapshot snapshot) {
        super(
                String.format(
                        "Circuit '%s' is %s, next attempt at %s",
                        snapshot.name(), snapshot.state(), snapshot.nextAttemptTime()));
        this.snapshot = snapshot;
    }

    /// Returns the breaker state captured when the call was rejected.
    ///
    /// @return snapshot, never null
    public CircuitBreakerSnapshot getSnapshot() {
        return snapshot;
    }

    /// Returns the earliest time a probe call will be admitted.
    ///
    /// @return next attempt time, may be null when rejected for a full HALF_OPEN window
    public Instant getNextAttemptTime() {
        return snapshot.nextAttemptTime();
    }
}
