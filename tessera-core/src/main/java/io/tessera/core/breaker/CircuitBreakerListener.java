package io.tessera.core.breaker;

/// Receives {@link CircuitBreakerEvent}s.
///
/// Listeners are called synchronously on the thread that drove the transition,
/// after the breaker's lock has been released. Exceptions are logged and ignored.
@FunctionalInterface
public interface CircuitBreakerListener {

    /// No-op listener.
    CircuitBreakerListener NOOP = event -> {};

    /// Handles a breaker event.
    ///
    /// @param event the event, not null
    void onEvent(CircuitBreakerEvent event);
}
