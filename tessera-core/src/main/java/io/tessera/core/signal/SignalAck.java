package io.tessera.core.signal;

import java.time.Instant;
import java.util.Objects;

/// Signed acknowledgment stored at `ack:{coordinatorId}:{signalId}`.
///
/// The signature is an HMAC over `coordinatorId`, `signalId`, `timestamp` and
/// `iteration`; see {@link AckSigner}. Any change to those fields invalidates it.
///
/// @param coordinatorId acknowledging coordinator, not null
/// @param signalId acknowledged signal, not null
/// @param timestamp acknowledgment time, millisecond precision, not null
/// @param iteration iteration carried by the acknowledged signal
/// @param signature lowercase hex HMAC-SHA256, not null
/// @param status always `"received"` for acknowledgments written by the protocol
public record SignalAck(
        String coordinatorId,
        String signalId,
        Instant timestamp,
        int iteration,
        String signature,
        String status) {

    /// Status written by the protocol.
    public static final String STATUS_RECEIVED = "received";

    public SignalAck {
        Objects.requireNonNull(coordinatorId, "coordinatorId must not be null");
        Objects.requireNonNull(signalId, "signalId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(signature, "signature must not be null");
        status = status != null ? status : STATUS_RECEIVED;
    }
}
