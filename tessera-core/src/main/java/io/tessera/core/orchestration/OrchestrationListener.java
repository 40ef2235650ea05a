package io.tessera.core.orchestration;

/// Consumer of {@link OrchestrationEvent}s.
///
/// Listeners run on the orchestrating thread and must return quickly. Exceptions
/// thrown by a listener are logged and ignored.
@FunctionalInterface
public interface OrchestrationListener {

    /// Listener that ignores every event.
    OrchestrationListener NOOP = event -> {};

    /// Handles one event.
    ///
    /// @param event the event, not null
    void onEvent(OrchestrationEvent event);
}
