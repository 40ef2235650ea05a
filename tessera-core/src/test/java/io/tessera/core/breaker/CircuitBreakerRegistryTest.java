package io.tessera.core.breaker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tessera.core.LogConfig;
import io.tessera.core.MutableClock;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CircuitBreakerRegistry")
class CircuitBreakerRegistryTest {

    private ExecutorService executor;
    private CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        registry =
                new CircuitBreakerRegistry(
                        CircuitBreakerConfig.defaults(),
                        executor,
                        MutableClock.at("2026-01-01T00:00:00Z"),
                        LogConfig.quiet());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static void trip(CircuitBreaker breaker) {
        for (int i = 0; i < breaker.getConfig().failureThreshold(); i++) {
            assertThatThrownBy(
                            () ->
                                    breaker.execute(
                                            () -> {
                                                throw new IOException("unreachable");
                                            }))
                    .isInstanceOf(IOException.class);
        }
    }

    @Test
    @DisplayName("returns the same breaker for the same name")
    void shouldReuseBreakerByName() {
        CircuitBreaker first = registry.getOrCreate("primary-execution");

        assertThat(registry.getOrCreate("primary-execution")).isSameAs(first);
        assertThat(registry.getOrCreate("consensus-validation")).isNotSameAs(first);
    }

    @Test
    @DisplayName("attaches registry listeners to breakers created before and after")
    void shouldAttachListenersToAllBreakers() {
        CircuitBreaker early = registry.getOrCreate("early");
        List<String> opened = new ArrayList<>();
        registry.addListener(
                event -> {
                    if (event instanceof CircuitBreakerEvent.StateChanged changed
                            && changed.to() == CircuitState.OPEN) {
                        opened.add(changed.circuitName());
                    }
                });
        CircuitBreaker late = registry.getOrCreate("late");

        trip(early);
        trip(late);

        assertThat(opened).containsExactly("early", "late");
    }

    @Test
    @DisplayName("snapshots and resets every breaker")
    void shouldSnapshotAndResetAll() {
        trip(registry.getOrCreate("primary-execution"));
        registry.getOrCreate("consensus-validation");

        assertThat(registry.snapshot())
                .containsOnlyKeys("primary-execution", "consensus-validation")
                .hasEntrySatisfying(
                        "primary-execution", s -> assertThat(s.state()).isEqualTo(CircuitState.OPEN));

        registry.resetAll();

        assertThat(registry.snapshot().values())
                .allSatisfy(s -> assertThat(s.state()).isEqualTo(CircuitState.CLOSED));
    }
}
