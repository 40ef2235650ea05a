package io.tessera.core.breaker;

import java.io.Serial;
import java.time.Duration;

/// Thrown when a protected call exceeds its deadline.
///
/// The timeout is counted as a failure by the breaker that raised it.
public class CircuitTimeoutException extends RuntimeException {

    @Serial private static final long serialVersionUID = -4417023319882150431L;

    private final String circuitName;
    private final Duration timeout;

    /// Creates a timeout exception.
    ///
    /// @param circuitName the circuit whose call timed out, not null
    /// @param timeout the deadline that was exceeded, not null
    public CircuitTimeoutException(String circuitName, Duration timeout) {
        super(
                String.format(
                        "Operation on circuit '%s' timed out after %dms",
                        circuitName, timeout.toMillis()));
        this.circuitName = circuitName;
        this.timeout = timeout;
    }

    public String getCircuitName() {
        return circuitName;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
