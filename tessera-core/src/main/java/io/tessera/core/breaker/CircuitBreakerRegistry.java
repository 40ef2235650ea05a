package io.tessera.core.breaker;

import io.tessera.core.LogConfig;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;

/// Owns one {@link CircuitBreaker} per logical operation name.
///
/// Breakers are created lazily with the registry's shared config, executor and
/// clock. Listeners registered on the registry are attached to every breaker,
/// including those created later.
///
/// @implNote Thread-safe. Backed by a {@link ConcurrentHashMap}.
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final List<CircuitBreakerListener> listeners = new CopyOnWriteArrayList<>();
    private final CircuitBreakerConfig config;
    private final ExecutorService executor;
    private final Clock clock;
    private final LogConfig logConfig;

    public CircuitBreakerRegistry(
            CircuitBreakerConfig config,
            ExecutorService executor,
            Clock clock,
            LogConfig logConfig) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.logConfig = Objects.requireNonNull(logConfig, "logConfig must not be null");
    }

    /// Returns the breaker for `name`, creating it on first use.
    ///
    /// @param name circuit name, not null
    /// @return the breaker, never null
    public CircuitBreaker getOrCreate(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return breakers.computeIfAbsent(name, this::create);
    }

    /// Attaches a listener to all current and future breakers.
    ///
    /// @param listener the listener, not null
    public void addListener(CircuitBreakerListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        breakers.values().forEach(b -> b.addListener(listener));
    }

    /// Resets every breaker to CLOSED.
    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    /// Returns a snapshot of every breaker keyed by name.
    ///
    /// @return immutable map, never null
    public Map<String, CircuitBreakerSnapshot> snapshot() {
        Map<String, CircuitBreakerSnapshot> result = new ConcurrentHashMap<>();
        breakers.forEach((name, breaker) -> result.put(name, breaker.getState()));
        return Map.copyOf(result);
    }

    private CircuitBreaker create(String name) {
        CircuitBreaker breaker = new CircuitBreaker(name, config, executor, clock, logConfig);
        listeners.forEach(breaker::addListener);
        return breaker;
    }
}
