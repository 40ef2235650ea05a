package io.tessera.core.breaker;

import java.time.Duration;
import java.time.Instant;

/// Events emitted by a {@link CircuitBreaker} for metrics and logging.
///
/// Events carry no business logic. Subscribers react to them but can never
/// influence the breaker's state machine.
///
/// ### Event Flow
/// ```
/// CallSucceeded | CallFailed ──> StateChanged (when a threshold is crossed)
/// CallRejected (while OPEN)
/// ```
///
/// @see CircuitBreakerListener
public sealed interface CircuitBreakerEvent {

    /// Returns the name of the circuit that emitted the event.
    String circuitName();

    /// Returns when the event occurred.
    Instant timestamp();

    /// Emitted on every state transition.
    ///
    /// @param circuitName circuit that changed state
    /// @param from previous state
    /// @param to new state
    /// @param snapshot counters after the transition
    /// @param timestamp when the transition happened
    record StateChanged(
            String circuitName,
            CircuitState from,
            CircuitState to,
            CircuitBreakerSnapshot snapshot,
            Instant timestamp)
            implements CircuitBreakerEvent {}

    /// Emitted when a protected call completes normally.
    ///
    /// @param circuitName circuit that admitted the call
    /// @param duration wall-clock time of the call
    /// @param timestamp completion time
    record CallSucceeded(String circuitName, Duration duration, Instant timestamp)
            implements CircuitBreakerEvent {}

    /// Emitted when a protected call throws or times out.
    ///
    /// @param circuitName circuit that admitted the call
    /// @param error failure description
    /// @param timedOut whether the failure was a deadline overrun
    /// @param timestamp failure time
    record CallFailed(String circuitName, String error, boolean timedOut, Instant timestamp)
            implements CircuitBreakerEvent {}

    /// Emitted when a call is refused without invoking the protected operation.
    ///
    /// @param circuitName circuit that refused the call
    /// @param snapshot breaker state at refusal time
    /// @param timestamp refusal time
    record CallRejected(String circuitName, CircuitBreakerSnapshot snapshot, Instant timestamp)
            implements CircuitBreakerEvent {}
}
