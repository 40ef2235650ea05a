package io.tessera.coordination.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import io.tessera.coordination.ManualClock;
import io.tessera.coordination.event.CoordinationEvent;
import io.tessera.coordination.store.InMemorySharedStore;
import io.tessera.core.store.SharedStore;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("CoordinatorActivityMonitor")
class CoordinatorActivityMonitorTest {

    private ManualClock clock;
    private InMemorySharedStore store;
    private CoordinatorActivityMonitor monitor;
    private List<CoordinationEvent> events;

    @BeforeEach
    void setUp() {
        clock = ManualClock.at("2026-06-01T10:00:00Z");
        store = new InMemorySharedStore();
        monitor = new CoordinatorActivityMonitor(store, ActivityMonitorConfig.defaults(), clock);
        events = new CopyOnWriteArrayList<>();
        monitor.addListener(events::add);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    private void seedCoordinatorState(String coordinatorId) {
        store.set("ack:" + coordinatorId + ":sig-1", "{}", Duration.ofHours(1));
        store.set("ack:" + coordinatorId + ":sig-2", "{}", Duration.ofHours(1));
        store.set("signal:" + coordinatorId, "{}", Duration.ofHours(1));
    }

    @Nested
    @DisplayName("checkTimeout")
    class CheckTimeout {

        @Test
        @DisplayName("keeps a recently active coordinator")
        void shouldKeepActiveCoordinator() {
            monitor.recordActivity("loop2", 3, "auth");
            clock.advance(Duration.ofMinutes(4));

            TimeoutCheck check = monitor.checkTimeout("loop2");

            assertThat(check.timedOut()).isFalse();
            assertThat(check.inactiveFor()).isEqualTo(Duration.ofMinutes(4));
            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("does not time out a coordinator that never reported")
        void shouldIgnoreUnknownCoordinator() {
            TimeoutCheck check = monitor.checkTimeout("loop9");

            assertThat(check.timedOut()).isFalse();
            assertThat(check.inactiveFor()).isEqualTo(Duration.ZERO);
            assertThat(monitor.getMetrics().totalChecks()).isEqualTo(1);
        }

        @Test
        @DisplayName("times out and cleans up an inactive coordinator")
        void shouldTimeOutAndCleanUp() {
            monitor.recordActivity("loop2", 3, "auth");
            seedCoordinatorState("loop2");
            store.set("ack:loop3:sig-1", "{}", Duration.ofHours(1));
            clock.advance(Duration.ofMinutes(6));

            TimeoutCheck check = monitor.checkTimeout("loop2");

            assertThat(check.timedOut()).isTrue();
            assertThat(check.cleanedUp()).isTrue();
            assertThat(store.keysMatching("ack:loop2:*")).isEmpty();
            assertThat(store.exists("signal:loop2")).isFalse();
            assertThat(monitor.getActivity("loop2")).isEmpty();
            assertThat(store.exists("ack:loop3:sig-1")).isTrue();

            assertThat(events).hasSize(2);
            CoordinationEvent.CoordinatorTimedOut timedOut =
                    (CoordinationEvent.CoordinatorTimedOut) events.get(0);
            assertThat(timedOut.iteration()).isEqualTo(3);
            assertThat(timedOut.phase()).isEqualTo("auth");
            assertThat(timedOut.reason())
                    .isEqualTo("Coordinator inactive for 360000ms (threshold 300000ms)");
            assertThat(events.get(1))
                    .isInstanceOfSatisfying(
                            CoordinationEvent.CleanupCompleted.class,
                            e -> assertThat(e.keysRemoved()).isEqualTo(4));

            assertThat(monitor.getMetrics())
                    .isEqualTo(new MonitorMetrics(1, 1, 1, 0));
        }

        @Test
        @DisplayName("leaves state in place when auto cleanup is off")
        void shouldSkipCleanupWhenDisabled() {
            CoordinatorActivityMonitor manual =
                    new CoordinatorActivityMonitor(
                            store, ActivityMonitorConfig.defaults().withAutoCleanup(false), clock);
            manual.recordActivity("loop2", 1, null);
            seedCoordinatorState("loop2");
            clock.advance(Duration.ofMinutes(6));

            TimeoutCheck check = manual.checkTimeout("loop2");

            assertThat(check.timedOut()).isTrue();
            assertThat(check.cleanedUp()).isFalse();
            assertThat(store.exists("signal:loop2")).isTrue();
            manual.close();
        }
    }

    @Test
    @DisplayName("checkAll reports only the coordinators that timed out")
    void shouldCheckAllCoordinators() {
        monitor.recordActivity("loop2", 1, "auth");
        clock.advance(Duration.ofMinutes(4));
        monitor.recordActivity("loop3", 1, "auth");
        clock.advance(Duration.ofMinutes(2));

        List<TimeoutCheck> timedOut = monitor.checkAll();

        assertThat(timedOut).extracting(TimeoutCheck::coordinatorId).containsExactly("loop2");
        assertThat(monitor.getActivity("loop3")).isPresent();
        assertThat(monitor.getMetrics().totalChecks()).isEqualTo(2);
    }

    @Test
    @DisplayName("resetMetrics zeroes every counter")
    void shouldResetMetrics() {
        monitor.checkTimeout("loop2");

        monitor.resetMetrics();

        assertThat(monitor.getMetrics()).isEqualTo(MonitorMetrics.empty());
    }

    @Nested
    @DisplayName("periodic monitoring")
    class Periodic {

        @Test
        @DisplayName("sweeps on the configured interval")
        void shouldSweepPeriodically() {
            CoordinatorActivityMonitor periodic =
                    new CoordinatorActivityMonitor(
                            store,
                            ActivityMonitorConfig.defaults().withCheckInterval(Duration.ofMillis(20)),
                            clock);
            periodic.recordActivity("loop2", 2, "auth");
            clock.advance(Duration.ofMinutes(10));

            periodic.startMonitoring();

            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(periodic.getActivity("loop2")).isEmpty());
            assertThat(periodic.isMonitoring()).isTrue();
            periodic.close();
            assertThat(periodic.isMonitoring()).isFalse();
        }

        @Test
        @DisplayName("a second start keeps the running sweep")
        void shouldIgnoreSecondStart() {
            monitor.startMonitoring();
            monitor.startMonitoring();

            assertThat(monitor.isMonitoring()).isTrue();

            monitor.stopMonitoring();
            monitor.stopMonitoring();

            assertThat(monitor.isMonitoring()).isFalse();
        }
    }

    @Nested
    @DisplayName("with a failing store")
    @ExtendWith(MockitoExtension.class)
    class FailingStore {

        @Mock private SharedStore failingStore;

        @Test
        @DisplayName("reports a failed cleanup")
        void shouldReportCleanupFailure() {
            when(failingStore.keysMatching(anyString()))
                    .thenThrow(new IllegalStateException("connection reset"));
            CoordinatorActivityMonitor failing =
                    new CoordinatorActivityMonitor(
                            failingStore, ActivityMonitorConfig.defaults(), clock);
            List<CoordinationEvent> seen = new CopyOnWriteArrayList<>();
            failing.addListener(seen::add);

            boolean cleaned = failing.cleanup("loop2");

            assertThat(cleaned).isFalse();
            assertThat(failing.getMetrics().cleanupFailures()).isEqualTo(1);
            assertThat(seen)
                    .singleElement()
                    .isInstanceOfSatisfying(
                            CoordinationEvent.CleanupFailed.class,
                            e -> assertThat(e.error()).isEqualTo("connection reset"));
            failing.close();
        }

        @Test
        @DisplayName("treats an unreadable activity record as absent")
        void shouldIgnoreUnreadableActivity() {
            when(failingStore.get("coordinator:activity:loop2")).thenReturn(Optional.of("{oops"));
            CoordinatorActivityMonitor reading =
                    new CoordinatorActivityMonitor(
                            failingStore, ActivityMonitorConfig.defaults(), clock);

            assertThat(reading.getActivity("loop2")).isEmpty();
            assertThat(reading.checkTimeout("loop2").timedOut()).isFalse();
            reading.close();
        }
    }

    @Test
    @DisplayName("sweep survives a store failure")
    void shouldSurviveSweepFailure() {
        AtomicInteger scans = new AtomicInteger();
        SharedStore broken =
                new InMemorySharedStore() {
                    @Override
                    public Set<String> keysMatching(String pattern) {
                        scans.incrementAndGet();
                        throw new IllegalStateException("scan failed");
                    }
                };
        CoordinatorActivityMonitor sweeping =
                new CoordinatorActivityMonitor(
                        broken,
                        ActivityMonitorConfig.defaults().withCheckInterval(Duration.ofMillis(10)),
                        clock);

        sweeping.startMonitoring();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(scans).hasValueGreaterThan(2));
        sweeping.close();
    }
}
