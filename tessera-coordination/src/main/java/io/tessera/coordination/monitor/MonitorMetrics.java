package io.tessera.coordination.monitor;

/// Counters of a {@link CoordinatorActivityMonitor}.
///
/// @param totalChecks timeout checks performed
/// @param timeoutEventsTotal coordinators found timed out
/// @param cleanupsPerformed cleanups that completed
/// @param cleanupFailures cleanups that failed
public record MonitorMetrics(
        long totalChecks, long timeoutEventsTotal, long cleanupsPerformed, long cleanupFailures) {

    public static MonitorMetrics empty() {
        return new MonitorMetrics(0, 0, 0, 0);
    }
}
