package io.tessera.coordination.event;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.jboss.logging.Logger;

/// Listener list with failure-isolated fan-out.
///
/// @implNote Thread-safe. Backed by a {@link CopyOnWriteArrayList}.
public final class CoordinationListeners {

    private static final Logger LOG = Logger.getLogger(CoordinationListeners.class);

    private final List<CoordinationListener> listeners = new CopyOnWriteArrayList<>();

    public void add(CoordinationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void remove(CoordinationListener listener) {
        listeners.remove(listener);
    }

    public void clear() {
        listeners.clear();
    }

    /// Delivers an event to every listener; a failing listener does not stop the others.
    ///
    /// @param event the event, not null
    public void publish(CoordinationEvent event) {
        for (CoordinationListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOG.warnv(e, "Coordination listener failed on {0}", event.getClass().getSimpleName());
            }
        }
    }
}
