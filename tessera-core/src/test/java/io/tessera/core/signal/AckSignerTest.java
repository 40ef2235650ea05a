package io.tessera.core.signal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("AckSigner")
class AckSignerTest {

    private static final Instant NOW = Instant.parse("2026-04-01T10:15:30.123456Z");

    private final AckSigner signer = new AckSigner("shared-secret");

    @Test
    @DisplayName("verifies acknowledgments it created")
    void shouldVerifyOwnAck() {
        SignalAck ack = signer.createAck("coordinator-a", "sig-1", NOW, 3);

        assertThat(signer.verify(ack)).isTrue();
        assertThat(ack.status()).isEqualTo(SignalAck.STATUS_RECEIVED);
        assertThat(ack.timestamp()).isEqualTo(Instant.parse("2026-04-01T10:15:30.123Z"));
        assertThat(ack.signature()).hasSize(64);
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"coordinatorId", "signalId", "timestamp", "iteration"})
    @DisplayName("rejects a change to any signed field")
    void shouldRejectTamperedField(String field) {
        SignalAck ack = signer.createAck("coordinator-a", "sig-1", NOW, 3);
        SignalAck tampered =
                switch (field) {
                    case "coordinatorId" -> new SignalAck(
                            "coordinator-b", ack.signalId(), ack.timestamp(), 3, ack.signature(), null);
                    case "signalId" -> new SignalAck(
                            ack.coordinatorId(), "sig-2", ack.timestamp(), 3, ack.signature(), null);
                    case "timestamp" -> new SignalAck(
                            ack.coordinatorId(),
                            ack.signalId(),
                            ack.timestamp().plusMillis(1),
                            3,
                            ack.signature(),
                            null);
                    default -> new SignalAck(
                            ack.coordinatorId(), ack.signalId(), ack.timestamp(), 4, ack.signature(), null);
                };

        assertThat(signer.verify(tampered)).isFalse();
    }

    @Test
    @DisplayName("rejects acknowledgments signed with another secret")
    void shouldRejectForeignSecret() {
        SignalAck forged = new AckSigner("attacker").createAck("coordinator-a", "sig-1", NOW, 3);

        assertThat(signer.verify(forged)).isFalse();
    }

    @Test
    void shouldRejectNull() {
        assertThat(signer.verify(null)).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    @DisplayName("requires a secret")
    void shouldRequireSecret(String secret) {
        assertThatThrownBy(() -> new AckSigner(secret))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("secret");
    }
}
