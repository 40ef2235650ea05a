package io.tessera.coordination.monitor;

import java.time.Duration;
import java.util.Objects;

/// Settings of {@link CoordinatorActivityMonitor}.
///
/// @param timeoutThreshold inactivity after which a coordinator counts as timed out,
///        default 5 minutes
/// @param checkInterval period of the background sweep, default 30 seconds
/// @param activityTtl lifetime of an activity record, default 1 hour
/// @param autoCleanup whether a timed-out coordinator's keys are deleted, default true
public record ActivityMonitorConfig(
        Duration timeoutThreshold, Duration checkInterval, Duration activityTtl, boolean autoCleanup) {

    public ActivityMonitorConfig {
        requirePositive(timeoutThreshold, "timeoutThreshold");
        requirePositive(checkInterval, "checkInterval");
        requirePositive(activityTtl, "activityTtl");
    }

    public static ActivityMonitorConfig defaults() {
        return new ActivityMonitorConfig(
                Duration.ofMinutes(5), Duration.ofSeconds(30), Duration.ofHours(1), true);
    }

    public ActivityMonitorConfig withTimeoutThreshold(Duration threshold) {
        return new ActivityMonitorConfig(threshold, checkInterval, activityTtl, autoCleanup);
    }

    public ActivityMonitorConfig withCheckInterval(Duration interval) {
        return new ActivityMonitorConfig(timeoutThreshold, interval, activityTtl, autoCleanup);
    }

    public ActivityMonitorConfig withAutoCleanup(boolean enabled) {
        return new ActivityMonitorConfig(timeoutThreshold, checkInterval, activityTtl, enabled);
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
