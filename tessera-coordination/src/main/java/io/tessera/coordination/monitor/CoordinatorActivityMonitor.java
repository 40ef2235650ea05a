package io.tessera.coordination.monitor;

import io.tessera.coordination.event.CoordinationEvent;
import io.tessera.coordination.event.CoordinationListener;
import io.tessera.coordination.event.CoordinationListeners;
import io.tessera.core.signal.SafeIds;
import io.tessera.core.store.SharedStore;
import io.tessera.serialization.CoordinationSerializer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.jboss.logging.Logger;

/// Detects coordinators that stopped reporting activity and removes their state.
///
/// Coordinators call {@link #recordActivity} while they work. A coordinator whose
/// last activity is older than the configured threshold is timed out: a
/// {@link CoordinationEvent.CoordinatorTimedOut} is published and, with auto cleanup
/// on, its activity record, acknowledgments (`ack:{id}:*`) and pending signal
/// (`signal:{id}`) are deleted.
///
/// Checks run on demand or periodically through {@link #startMonitoring()}.
///
/// @implNote Thread-safe. Metrics are atomic counters; the scheduled sweep and
/// on-demand checks may run concurrently.
public class CoordinatorActivityMonitor implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(CoordinatorActivityMonitor.class);

    static final String ACTIVITY_PREFIX = "coordinator:activity:";

    private final SharedStore store;
    private final ActivityMonitorConfig config;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final CoordinationListeners listeners = new CoordinationListeners();

    private final AtomicLong totalChecks = new AtomicLong();
    private final AtomicLong timeoutEvents = new AtomicLong();
    private final AtomicLong cleanups = new AtomicLong();
    private final AtomicLong cleanupFailures = new AtomicLong();

    private ScheduledFuture<?> sweep;

    public CoordinatorActivityMonitor(SharedStore store) {
        this(store, ActivityMonitorConfig.defaults(), Clock.systemUTC());
    }

    public CoordinatorActivityMonitor(
            SharedStore store, ActivityMonitorConfig config, Clock clock) {
        this(store, config, clock, null);
    }

    /// Creates a monitor.
    ///
    /// @param store shared store, not null
    /// @param config thresholds, not null
    /// @param clock time source, not null
    /// @param scheduler runs the periodic sweep; when null, the monitor creates and owns
    ///        a single-thread scheduler
    public CoordinatorActivityMonitor(
            SharedStore store,
            ActivityMonitorConfig config,
            Clock clock,
            ScheduledExecutorService scheduler) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ownsScheduler = scheduler == null;
        this.scheduler =
                scheduler != null
                        ? scheduler
                        : Executors.newSingleThreadScheduledExecutor(
                                r -> {
                                    Thread thread = new Thread(r, "tessera-activity-monitor");
                                    thread.setDaemon(true);
                                    return thread;
                                });
    }

    public void addListener(CoordinationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(CoordinationListener listener) {
        listeners.remove(listener);
    }

    /// Records that a coordinator is alive, replacing any earlier record.
    ///
    /// @param coordinatorId the coordinator, safe id
    /// @param iteration current iteration
    /// @param phase current phase, may be null
    public void recordActivity(String coordinatorId, int iteration, String phase) {
        SafeIds.requireSafe(coordinatorId, "coordinatorId");
        CoordinatorActivity activity =
                new CoordinatorActivity(coordinatorId, clock.instant(), iteration, phase);
        store.set(
                ACTIVITY_PREFIX + coordinatorId,
                CoordinationSerializer.toJson(activity),
                config.activityTtl());
        LOG.debugv("Activity recorded: {0}, iteration={1}, phase={2}", coordinatorId, iteration, phase);
    }

    /// Reads a coordinator's last activity.
    ///
    /// @param coordinatorId the coordinator, safe id
    /// @return the activity, or empty if none is recorded or the record is unreadable
    public Optional<CoordinatorActivity> getActivity(String coordinatorId) {
        SafeIds.requireSafe(coordinatorId, "coordinatorId");
        Optional<String> raw = store.get(ACTIVITY_PREFIX + coordinatorId);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(
                    CoordinationSerializer.fromJson(raw.get(), CoordinatorActivity.class));
        } catch (IllegalArgumentException e) {
            LOG.warnv("Unreadable activity record for {0}: {1}", coordinatorId, e.getMessage());
            return Optional.empty();
        }
    }

    /// Checks one coordinator for inactivity.
    ///
    /// A coordinator without an activity record is not timed out.
    ///
    /// @param coordinatorId the coordinator, safe id
    /// @return the check outcome, never null
    public TimeoutCheck checkTimeout(String coordinatorId) {
        SafeIds.requireSafe(coordinatorId, "coordinatorId");
        totalChecks.incrementAndGet();

        Optional<CoordinatorActivity> activity = getActivity(coordinatorId);
        if (activity.isEmpty()) {
            return TimeoutCheck.active(coordinatorId, Duration.ZERO);
        }
        Instant now = clock.instant();
        Duration inactive = Duration.between(activity.get().lastActivity(), now);
        if (inactive.compareTo(config.timeoutThreshold()) <= 0) {
            return TimeoutCheck.active(coordinatorId, inactive);
        }

        timeoutEvents.incrementAndGet();
        String reason =
                "Coordinator inactive for "
                        + inactive.toMillis()
                        + "ms (threshold "
                        + config.timeoutThreshold().toMillis()
                        + "ms)";
        LOG.warnv(
                "Coordinator timed out: {0}, iteration={1}, phase={2}, inactive={3}ms",
                coordinatorId,
                activity.get().iteration(),
                activity.get().phase(),
                inactive.toMillis());
        listeners.publish(
                new CoordinationEvent.CoordinatorTimedOut(
                        coordinatorId,
                        inactive,
                        activity.get().iteration(),
                        activity.get().phase(),
                        reason,
                        now));

        boolean cleaned = config.autoCleanup() && cleanup(coordinatorId);
        return new TimeoutCheck(coordinatorId, true, inactive, cleaned);
    }

    /// Checks every coordinator that has an activity record.
    ///
    /// @return outcomes of the coordinators found timed out, never null
    public List<TimeoutCheck> checkAll() {
        List<TimeoutCheck> timedOut = new ArrayList<>();
        for (String key : store.keysMatching(ACTIVITY_PREFIX + "*")) {
            String coordinatorId = key.substring(ACTIVITY_PREFIX.length());
            if (!SafeIds.isSafe(coordinatorId)) {
                continue;
            }
            TimeoutCheck check = checkTimeout(coordinatorId);
            if (check.timedOut()) {
                timedOut.add(check);
            }
        }
        return timedOut;
    }

    /// Deletes a coordinator's activity record, acknowledgments and pending signal.
    ///
    /// @param coordinatorId the coordinator, safe id
    /// @return `true` if cleanup completed, `false` if the store failed
    public boolean cleanup(String coordinatorId) {
        SafeIds.requireSafe(coordinatorId, "coordinatorId");
        try {
            List<String> keys = new ArrayList<>(store.keysMatching("ack:" + coordinatorId + ":*"));
            keys.add("signal:" + coordinatorId);
            keys.add(ACTIVITY_PREFIX + coordinatorId);
            int removed = 0;
            for (String key : keys) {
                if (store.delete(key)) {
                    removed++;
                }
            }
            cleanups.incrementAndGet();
            LOG.infov("Cleaned up coordinator {0}: {1} key(s) removed", coordinatorId, removed);
            listeners.publish(
                    new CoordinationEvent.CleanupCompleted(coordinatorId, removed, clock.instant()));
            return true;
        } catch (RuntimeException e) {
            cleanupFailures.incrementAndGet();
            LOG.errorv(e, "Cleanup of coordinator {0} failed", coordinatorId);
            listeners.publish(
                    new CoordinationEvent.CleanupFailed(
                            coordinatorId, String.valueOf(e.getMessage()), clock.instant()));
            return false;
        }
    }

    /// Starts the periodic sweep. A second call while running only logs a warning.
    public synchronized void startMonitoring() {
        if (sweep != null) {
            LOG.warn("Coordinator activity monitoring already running");
            return;
        }
        long period = config.checkInterval().toMillis();
        sweep = scheduler.scheduleAtFixedRate(this::sweepOnce, period, period, TimeUnit.MILLISECONDS);
        LOG.infov("Coordinator activity monitoring started, interval={0}ms", period);
    }

    /// Stops the periodic sweep. Does nothing when not running.
    public synchronized void stopMonitoring() {
        if (sweep == null) {
            return;
        }
        sweep.cancel(false);
        sweep = null;
        LOG.infov("Coordinator activity monitoring stopped, metrics={0}", getMetrics());
    }

    public synchronized boolean isMonitoring() {
        return sweep != null;
    }

    public MonitorMetrics getMetrics() {
        return new MonitorMetrics(
                totalChecks.get(), timeoutEvents.get(), cleanups.get(), cleanupFailures.get());
    }

    public void resetMetrics() {
        totalChecks.set(0);
        timeoutEvents.set(0);
        cleanups.set(0);
        cleanupFailures.set(0);
    }

    /// Stops monitoring and releases the scheduler if the monitor created it.
    @Override
    public void close() {
        stopMonitoring();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    private void sweepOnce() {
        try {
            checkAll();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the fixed-rate task
            LOG.errorv(e, "Coordinator activity sweep failed");
        }
    }
}
