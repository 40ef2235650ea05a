package io.tessera.core.signal;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/// HMAC-SHA256 signer for {@link SignalAck}s.
///
/// The secret must be distributed out-of-band to every coordinator; construction
/// fails when it is missing. The signed message is
/// `coordinatorId:signalId:timestampMillis:iteration`.
///
/// @implNote Thread-safe. A fresh {@link Mac} is created per operation.
public final class AckSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    /// Creates a signer.
    ///
    /// @param secret shared secret, not null or blank
    /// @throws IllegalArgumentException if the secret is missing
    public AckSigner(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException(
                    "ACK signing secret is required: configure the shared coordination secret");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    /// Computes the signature for the given acknowledgment fields.
    ///
    /// @return lowercase hex signature, never null
    public String sign(String coordinatorId, String signalId, Instant timestamp, int iteration) {
        Objects.requireNonNull(coordinatorId, "coordinatorId must not be null");
        Objects.requireNonNull(signalId, "signalId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        String message =
                coordinatorId + ":" + signalId + ":" + timestamp.toEpochMilli() + ":" + iteration;
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    /// Creates a signed acknowledgment.
    ///
    /// @param coordinatorId acknowledging coordinator, not null
    /// @param signalId acknowledged signal, not null
    /// @param timestamp acknowledgment time, truncated to milliseconds
    /// @param iteration iteration of the acknowledged signal
    /// @return signed acknowledgment, never null
    public SignalAck createAck(
            String coordinatorId, String signalId, Instant timestamp, int iteration) {
        Instant millis = Instant.ofEpochMilli(timestamp.toEpochMilli());
        return new SignalAck(
                coordinatorId,
                signalId,
                millis,
                iteration,
                sign(coordinatorId, signalId, millis, iteration),
                SignalAck.STATUS_RECEIVED);
    }

    /// Re-computes and compares an acknowledgment's signature in constant time.
    ///
    /// @param ack acknowledgment to check, may be null
    /// @return `true` only when the signature matches
    public boolean verify(SignalAck ack) {
        if (ack == null) {
            return false;
        }
        String expected = sign(ack.coordinatorId(), ack.signalId(), ack.timestamp(), ack.iteration());
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                ack.signature().getBytes(StandardCharsets.UTF_8));
    }
}
