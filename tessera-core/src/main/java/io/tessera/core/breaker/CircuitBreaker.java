package io.tessera.core.breaker;

import io.tessera.core.LogConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Call-protection wrapper combining a per-call deadline with a failure-threshold
/// state machine.
///
/// Every call is submitted to the supplied executor and awaited with
/// `Future.get(timeout)`. The outcome feeds the state machine:
///
/// - **CLOSED**: failures increment `failureCount`; reaching the threshold opens the
///   circuit and schedules `nextAttemptTime = now + delays[currentAttempt - 1]`.
///   A success resets `failureCount`.
/// - **OPEN**: calls are rejected with {@link CircuitOpenException} without invoking
///   the operation until `nextAttemptTime`, at which point the circuit turns
///   HALF_OPEN and the call is admitted.
/// - **HALF_OPEN**: at most `halfOpenLimit` trial calls are admitted. Reaching
///   `successThreshold` closes the circuit and resets every counter. Any failure
///   reopens it with the backoff advanced one step.
///
/// ### Usage
/// {@snippet :
/// CircuitBreaker breaker = new CircuitBreaker("primary-execution", config, executor);
/// AgentResponse response = breaker.execute(() -> agents.execute(instructions));
/// }
///
/// @implNote Thread-safe. State transitions are guarded by the instance monitor;
/// the protected operation itself runs outside the lock. Listener callbacks are
/// delivered after the lock is released.
///
/// @see CircuitBreakerConfig
/// @see CircuitBreakerRegistry
public class CircuitBreaker {

    private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

    private final String name;
    private final CircuitBreakerConfig config;
    private final ExecutorService executor;
    private final Clock clock;
    private final LogConfig logConfig;
    private final List<CircuitBreakerListener> listeners = new CopyOnWriteArrayList<>();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private int currentAttempt;
    private int halfOpenCalls;
    private Instant nextAttemptTime;
    private long totalTrips;

    /// Creates a breaker using the system clock and default logging.
    ///
    /// @param name circuit name used in events and errors, not null
    /// @param config tuning parameters, not null
    /// @param executor executor that runs protected calls, not null
    public CircuitBreaker(String name, CircuitBreakerConfig config, ExecutorService executor) {
        this(name, config, executor, Clock.systemUTC(), LogConfig.defaults());
    }

    /// Creates a breaker.
    ///
    /// @param name circuit name used in events and errors, not null
    /// @param config tuning parameters, not null
    /// @param executor executor that runs protected calls, not null
    /// @param clock time source for backoff scheduling, not null
    /// @param logConfig logging behaviour, not null
    public CircuitBreaker(
            String name,
            CircuitBreakerConfig config,
            ExecutorService executor,
            Clock clock,
            LogConfig logConfig) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.logConfig = Objects.requireNonNull(logConfig, "logConfig must not be null");
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    /// Registers a listener for breaker events.
    ///
    /// @param listener the listener, not null
    public void addListener(CircuitBreakerListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /// Removes a previously registered listener.
    ///
    /// @param listener the listener to remove
    public void removeListener(CircuitBreakerListener listener) {
        listeners.remove(listener);
    }

    /// Executes an operation with the configured default timeout.
    ///
    /// @see #execute(Callable, Duration)
    public <T> T execute(Callable<T> operation) throws Exception {
        return execute(operation, config.timeout());
    }

    /// Executes an operation through the breaker.
    ///
    /// @param operation the protected call, not null
    /// @param timeout deadline for this call, not null and positive
    /// @param <T> result type
    /// @return the operation's result
    /// @throws CircuitOpenException if the circuit refuses the call; the operation is
    ///         not invoked
    /// @throws CircuitTimeoutException if the operation exceeds `timeout`
    /// @throws Exception whatever the operation itself throws
    public <T> T execute(Callable<T> operation, Duration timeout) throws Exception {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        acquirePermission();

        Instant started = clock.instant();
        Future<T> future = executor.submit(operation);
        try {
            T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            recordSuccess(Duration.between(started, clock.instant()));
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            CircuitTimeoutException timeoutError = new CircuitTimeoutException(name, timeout);
            recordFailure(timeoutError.getMessage(), true);
            throw timeoutError;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            recordFailure(describe(cause), false);
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            recordFailure("interrupted", false);
            throw e;
        }
    }

    /// Returns the current counters.
    ///
    /// @return snapshot, never null
    public synchronized CircuitBreakerSnapshot getState() {
        return snapshot();
    }

    /// Forces the circuit back to CLOSED with every counter cleared.
    public void reset() {
        List<CircuitBreakerEvent> events = new ArrayList<>();
        synchronized (this) {
            CircuitState previous = state;
            clearCounters();
            state = CircuitState.CLOSED;
            if (previous != CircuitState.CLOSED) {
                events.add(stateChanged(previous));
            }
        }
        publish(events);
    }

    // --- State machine ---

    private void acquirePermission() {
        List<CircuitBreakerEvent> events = new ArrayList<>();
        CircuitBreakerSnapshot rejected = null;
        synchronized (this) {
            Instant now = clock.instant();
            if (state == CircuitState.OPEN) {
                if (now.isBefore(nextAttemptTime)) {
                    rejected = snapshot();
                } else {
                    state = CircuitState.HALF_OPEN;
                    successCount = 0;
                    halfOpenCalls = 0;
                    events.add(stateChanged(CircuitState.OPEN));
                }
            }
            if (rejected == null && state == CircuitState.HALF_OPEN) {
                if (halfOpenCalls >= config.halfOpenLimit()) {
                    rejected = snapshot();
                } else {
                    halfOpenCalls++;
                }
            }
            if (rejected != null) {
                events.add(new CircuitBreakerEvent.CallRejected(name, rejected, now));
            }
        }
        publish(events);
        if (rejected != null) {
            throw new CircuitOpenException(rejected);
        }
    }

    private void recordSuccess(Duration duration) {
        List<CircuitBreakerEvent> events = new ArrayList<>();
        synchronized (this) {
            events.add(new CircuitBreakerEvent.CallSucceeded(name, duration, clock.instant()));
            if (state == CircuitState.HALF_OPEN) {
                successCount++;
                if (successCount >= config.successThreshold()) {
                    clearCounters();
                    state = CircuitState.CLOSED;
                    events.add(stateChanged(CircuitState.HALF_OPEN));
                }
            } else if (state == CircuitState.CLOSED) {
                failureCount = 0;
            }
        }
        publish(events);
    }

    private void recordFailure(String error, boolean timedOut) {
        List<CircuitBreakerEvent> events = new ArrayList<>();
        synchronized (this) {
            events.add(new CircuitBreakerEvent.CallFailed(name, error, timedOut, clock.instant()));
            switch (state) {
                case CLOSED -> {
                    failureCount++;
                    if (failureCount >= config.failureThreshold()) {
                        trip(events);
                    }
                }
                case HALF_OPEN -> trip(events);
                case OPEN -> {
                    // a straggler admitted before the circuit reopened
                }
            }
        }
        publish(events);
    }

    private void trip(List<CircuitBreakerEvent> events) {
        CircuitState previous = state;
        currentAttempt++;
        Duration delay = config.delayFor(currentAttempt);
        nextAttemptTime = clock.instant().plus(delay);
        state = CircuitState.OPEN;
        successCount = 0;
        halfOpenCalls = 0;
        totalTrips++;
        if (logConfig.isEnabled(Level.WARNING)) {
            logger.warning(
                    "Circuit '"
                            + name
                            + "' opened after "
                            + failureCount
                            + " failure(s), retry in "
                            + delay.toMillis()
                            + "ms");
        }
        events.add(stateChanged(previous));
    }

    private void clearCounters() {
        failureCount = 0;
        successCount = 0;
        currentAttempt = 0;
        halfOpenCalls = 0;
        nextAttemptTime = null;
    }

    private CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(
                name,
                state,
                failureCount,
                successCount,
                currentAttempt,
                halfOpenCalls,
                nextAttemptTime,
                totalTrips);
    }

    private CircuitBreakerEvent stateChanged(CircuitState from) {
        if (logConfig.isEnabled(Level.INFO)) {
            logger.info("Circuit '" + name + "' " + from + " -> " + state);
        }
        return new CircuitBreakerEvent.StateChanged(name, from, state, snapshot(), clock.instant());
    }

    // --- Listener fan-out ---

    private void publish(List<CircuitBreakerEvent> events) {
        for (CircuitBreakerEvent event : events) {
            for (CircuitBreakerListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Circuit breaker listener failed", e);
                }
            }
        }
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
