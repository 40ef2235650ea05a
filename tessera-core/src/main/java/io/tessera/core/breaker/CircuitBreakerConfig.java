package io.tessera.core.breaker;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/// Tuning parameters for a {@link CircuitBreaker}.
///
/// ### Default Values
/// - `failureThreshold`: `3` consecutive failures open the circuit
/// - `timeout`: `30 min` per call
/// - `delays`: `[1s, 2s, 4s, 8s]`, the last entry is reused once exhausted
/// - `successThreshold`: `2` trial successes close the circuit
/// - `halfOpenLimit`: `3` trial calls admitted while HALF_OPEN
///
/// @param failureThreshold failures before CLOSED turns OPEN, positive
/// @param timeout default per-call deadline, positive
/// @param delays backoff table indexed by attempt, not empty
/// @param successThreshold trial successes before HALF_OPEN turns CLOSED, positive
/// @param halfOpenLimit maximum trial calls per HALF_OPEN window, positive
public record CircuitBreakerConfig(
        int failureThreshold,
        Duration timeout,
        List<Duration> delays,
        int successThreshold,
        int halfOpenLimit) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(30);
    public static final List<Duration> DEFAULT_DELAYS =
            List.of(
                    Duration.ofSeconds(1),
                    Duration.ofSeconds(2),
                    Duration.ofSeconds(4),
                    Duration.ofSeconds(8));
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
    public static final int DEFAULT_HALF_OPEN_LIMIT = 3;

    public CircuitBreakerConfig {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(delays, "delays must not be null");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be positive");
        }
        if (halfOpenLimit < 1) {
            throw new IllegalArgumentException("halfOpenLimit must be positive");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (delays.isEmpty()) {
            throw new IllegalArgumentException("delays must not be empty");
        }
        delays = List.copyOf(delays);
    }

    /// Returns the default configuration.
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(
                DEFAULT_FAILURE_THRESHOLD,
                DEFAULT_TIMEOUT,
                DEFAULT_DELAYS,
                DEFAULT_SUCCESS_THRESHOLD,
                DEFAULT_HALF_OPEN_LIMIT);
    }

    /// Returns a copy with a different per-call timeout.
    public CircuitBreakerConfig withTimeout(Duration newTimeout) {
        return new CircuitBreakerConfig(
                failureThreshold, newTimeout, delays, successThreshold, halfOpenLimit);
    }

    /// Returns the backoff delay for the given 1-based attempt number.
    ///
    /// Attempts beyond the table length reuse the last entry.
    ///
    /// @param attempt 1-based attempt number
    /// @return delay before the next probe, never null
    public Duration delayFor(int attempt) {
        int index = Math.max(0, Math.min(attempt - 1, delays.size() - 1));
        return delays.get(index);
    }
}
