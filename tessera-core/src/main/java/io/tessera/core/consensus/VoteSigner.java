package io.tessera.core.consensus;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/// Integrity hash for {@link ValidatorVote}s.
///
/// The hash is SHA-256 over `agentId:confidence:vote:timestampMillis`. It carries
/// no secret: anyone who knows the vote fields can produce a matching value. It
/// detects accidental or careless tampering between parties that can recompute
/// it, nothing more. Acknowledgments between coordinators use a keyed HMAC
/// instead, see {@link io.tessera.core.signal.AckSigner}.
public final class VoteSigner {

    private VoteSigner() {}

    /// Computes the hash for the given vote fields.
    ///
    /// @return lowercase hex digest, never null
    public static String sign(String agentId, double confidence, Vote vote, Instant timestamp) {
        String canonical =
                agentId + ":" + confidence + ":" + vote.name() + ":" + timestamp.toEpochMilli();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /// Checks a vote's hash against its fields.
    ///
    /// @param vote vote to check, not null
    /// @return `true` if the stored signature matches a fresh computation
    public static boolean verify(ValidatorVote vote) {
        if (vote.signature() == null || vote.signature().isEmpty()) {
            return false;
        }
        String expected = sign(vote.agentId(), vote.confidence(), vote.vote(), vote.timestamp());
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                vote.signature().getBytes(StandardCharsets.UTF_8));
    }
}
