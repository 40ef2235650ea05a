package io.tessera.core.signal;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/// Deterministic identifiers for signals.
///
/// Both identifiers are SHA-256 based and pass {@link SafeIds}, so they can be
/// used directly in store keys.
///
/// - `signalId` covers `(sender, receiver, type, iteration)`: every retry of the same
///   logical signal shares one acknowledgment slot.
/// - `messageId` additionally covers the send timestamp: re-submitting the exact same
///   send is recognised through the idempotency record.
public final class SignalIds {

    private static final int HASH_CHARS = 40;

    private SignalIds() {}

    public static String signalId(
            String senderId, String receiverId, SignalType type, int iteration) {
        return "sig-" + hash(senderId + ":" + receiverId + ":" + type.wireName() + ":" + iteration);
    }

    public static String messageId(
            String senderId,
            String receiverId,
            SignalType type,
            int iteration,
            Instant timestamp) {
        return "msg-"
                + hash(
                        senderId
                                + ":"
                                + receiverId
                                + ":"
                                + type.wireName()
                                + ":"
                                + iteration
                                + ":"
                                + timestamp.toEpochMilli());
    }

    private static String hash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
