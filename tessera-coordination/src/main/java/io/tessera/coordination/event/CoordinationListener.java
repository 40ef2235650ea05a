package io.tessera.coordination.event;

/// Consumer of {@link CoordinationEvent}s.
///
/// Called on the thread that produced the event. Exceptions are logged and ignored.
@FunctionalInterface
public interface CoordinationListener {

    CoordinationListener NOOP = event -> {};

    void onEvent(CoordinationEvent event);
}
