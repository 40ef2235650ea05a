package io.tessera.coordination.signal;

import io.tessera.coordination.monitor.CoordinatorActivityMonitor;
import io.tessera.core.hooks.LifecycleHooks;
import io.tessera.core.signal.SafeIds;
import io.tessera.core.signal.Signal;
import io.tessera.core.signal.SignatureVerificationException;
import io.tessera.core.util.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/// Blocks a coordinator until a new signal addressed to it arrives.
///
/// A stored signal counts as new when no verified acknowledgment exists for
/// `(coordinatorId, signalId)`. A new signal is acknowledged before it is returned,
/// so the caller processes each signal at most once per acknowledgment lifetime.
///
/// ```
/// onBlockingStart ─> poll receiveSignal ─┬─ new signal ─> acknowledge ─> onSignalReceived
///                                        └─ deadline ───────────────────> onBlockingTimeout
/// ```
///
/// Hook failures are logged and never interrupt the wait.
public class BlockingCoordinator {

    private static final Logger LOG = Logger.getLogger(BlockingCoordinator.class);

    private final SignalAckProtocol protocol;
    private final CoordinatorActivityMonitor monitor;
    private final LifecycleHooks hooks;
    private final Clock clock;
    private final Sleeper sleeper;

    public BlockingCoordinator(SignalAckProtocol protocol, CoordinatorActivityMonitor monitor) {
        this(protocol, monitor, LifecycleHooks.NOOP, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    /// Creates a coordinator.
    ///
    /// @param protocol signal transport, not null
    /// @param monitor receives activity records while waiting, may be null
    /// @param hooks lifecycle callbacks, not null
    /// @param clock time source, not null
    /// @param sleeper pause between polls, not null
    public BlockingCoordinator(
            SignalAckProtocol protocol,
            CoordinatorActivityMonitor monitor,
            LifecycleHooks hooks,
            Clock clock,
            Sleeper sleeper) {
        this.protocol = Objects.requireNonNull(protocol, "protocol must not be null");
        this.monitor = monitor;
        this.hooks = Objects.requireNonNull(hooks, "hooks must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /// Waits for a new signal.
    ///
    /// @param coordinatorId the waiting coordinator, safe id
    /// @param phaseId phase the wait belongs to, may be null
    /// @param iteration iteration reported to the activity monitor
    /// @param timeout upper bound on the wait, not null
    /// @return the acknowledged signal, or empty on timeout
    /// @throws InterruptedException if interrupted while waiting
    public Optional<Signal> awaitSignal(
            String coordinatorId, String phaseId, int iteration, Duration timeout)
            throws InterruptedException {
        SafeIds.requireSafe(coordinatorId, "coordinatorId");
        Objects.requireNonNull(timeout, "timeout must not be null");
        String phase = phaseId != null ? phaseId : "";
        Duration pollInterval = protocol.getConfig().pollInterval();

        Instant started = clock.instant();
        Instant deadline = started.plus(timeout);
        runHook("onBlockingStart", () -> hooks.onBlockingStart(coordinatorId, phase));
        LOG.debugv("Coordinator {0} waiting for signal, timeout={1}ms", coordinatorId, timeout.toMillis());

        while (true) {
            recordActivity(coordinatorId, iteration, phaseId);
            Optional<Signal> signal = protocol.receiveSignal(coordinatorId);
            if (signal.isPresent() && isNew(coordinatorId, signal.get())) {
                Signal received = signal.get();
                protocol.acknowledgeSignal(received, coordinatorId);
                LOG.infov(
                        "Coordinator {0} received signal {1} ({2})",
                        coordinatorId,
                        received.signalId(),
                        received.type().wireName());
                runHook(
                        "onSignalReceived",
                        () ->
                                hooks.onSignalReceived(
                                        coordinatorId,
                                        received.signalId(),
                                        received.type().wireName()));
                return signal;
            }

            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isZero() || remaining.isNegative()) {
                break;
            }
            sleeper.sleep(remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval);
        }

        long elapsed = Duration.between(started, clock.instant()).toMillis();
        LOG.warnv("Coordinator {0} timed out waiting for a signal after {1}ms", coordinatorId, elapsed);
        runHook(
                "onBlockingTimeout",
                () -> hooks.onBlockingTimeout(coordinatorId, phase, Long.toString(elapsed)));
        return Optional.empty();
    }

    private boolean isNew(String coordinatorId, Signal signal) {
        try {
            return protocol.getAck(coordinatorId, signal.signalId()).isEmpty();
        } catch (SignatureVerificationException e) {
            // a forged acknowledgment does not count; acknowledging replaces it
            LOG.warnv("Ignoring invalid acknowledgment for signal {0}", signal.signalId());
            return true;
        }
    }

    private void recordActivity(String coordinatorId, int iteration, String phaseId) {
        if (monitor == null) {
            return;
        }
        try {
            monitor.recordActivity(coordinatorId, iteration, phaseId);
        } catch (RuntimeException e) {
            LOG.warnv(e, "Could not record activity for {0}", coordinatorId);
        }
    }

    private void runHook(String name, Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            LOG.warnv(e, "Lifecycle hook {0} failed", name);
        }
    }
}
