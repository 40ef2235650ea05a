package io.tessera.coordination.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemorySharedStore")
class InMemorySharedStoreTest {

    private AtomicLong nanos;
    private InMemorySharedStore store;

    @BeforeEach
    void setUp() {
        nanos = new AtomicLong();
        store = new InMemorySharedStore(nanos::get, 1_000);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    @Test
    @DisplayName("reads back what was written")
    void shouldReadBackValue() {
        store.set("signal:loop2", "{}", Duration.ofMinutes(1));

        assertThat(store.get("signal:loop2")).contains("{}");
        assertThat(store.exists("signal:loop2")).isTrue();
        assertThat(store.get("signal:loop3")).isEmpty();
    }

    @Test
    @DisplayName("expires entries after their own ttl")
    void shouldExpirePerEntry() {
        store.set("ack:loop2:sig-1", "short", Duration.ofSeconds(10));
        store.set("ack:loop2:sig-2", "long", Duration.ofHours(1));

        advance(Duration.ofSeconds(11));

        assertThat(store.get("ack:loop2:sig-1")).isEmpty();
        assertThat(store.exists("ack:loop2:sig-1")).isFalse();
        assertThat(store.get("ack:loop2:sig-2")).contains("long");
        assertThat(store.keysMatching("ack:loop2:*")).containsExactly("ack:loop2:sig-2");
    }

    @Test
    @DisplayName("an overwrite restarts the ttl")
    void shouldRestartTtlOnOverwrite() {
        store.set("coordinator:activity:loop2", "a", Duration.ofSeconds(10));
        advance(Duration.ofSeconds(8));
        store.set("coordinator:activity:loop2", "b", Duration.ofSeconds(10));
        advance(Duration.ofSeconds(8));

        assertThat(store.get("coordinator:activity:loop2")).contains("b");
    }

    @Test
    @DisplayName("matches glob patterns literally apart from wildcards")
    void shouldMatchGlob() {
        store.set("ack:loop2:sig-1", "x", Duration.ofMinutes(1));
        store.set("ack:loop2:sig-2", "x", Duration.ofMinutes(1));
        store.set("ack:loop3:sig-1", "x", Duration.ofMinutes(1));
        store.set("ack.loop2.sig-9", "x", Duration.ofMinutes(1));

        assertThat(store.keysMatching("ack:loop2:*"))
                .containsExactlyInAnyOrder("ack:loop2:sig-1", "ack:loop2:sig-2");
        assertThat(store.keysMatching("ack:loop?:sig-1"))
                .containsExactlyInAnyOrder("ack:loop2:sig-1", "ack:loop3:sig-1");
    }

    @Test
    @DisplayName("delete reports whether a live entry was removed")
    void shouldReportDelete() {
        store.set("signal:loop2", "x", Duration.ofSeconds(1));

        assertThat(store.delete("signal:loop2")).isTrue();
        assertThat(store.delete("signal:loop2")).isFalse();
    }

    @Test
    @DisplayName("rejects non-positive ttl")
    void shouldRejectNonPositiveTtl() {
        assertThatThrownBy(() -> store.set("k", "v", Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
