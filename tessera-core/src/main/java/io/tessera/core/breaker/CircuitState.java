package io.tessera.core.breaker;

/// Lifecycle state of a {@link CircuitBreaker}.
///
/// ```
/// CLOSED ──(failureThreshold reached)──> OPEN
/// OPEN ──(nextAttemptTime elapsed)──> HALF_OPEN
/// HALF_OPEN ──(successThreshold reached)──> CLOSED
/// HALF_OPEN ──(any failure)──> OPEN (backoff advanced)
/// ```
public enum CircuitState {
    /// Calls pass through, failures are counted.
    CLOSED,
    /// Calls are rejected without invoking the protected operation.
    OPEN,
    /// A limited number of trial calls probe whether the dependency recovered.
    HALF_OPEN
}
