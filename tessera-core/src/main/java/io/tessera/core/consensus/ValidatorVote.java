package io.tessera.core.consensus;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// One validator's vote for one consensus round.
///
/// @param agentId validator identifier, not null
/// @param agentType validator role, e.g. `reviewer`, not null
/// @param confidence confidence in `[0, 1]`
/// @param vote verdict, not null
/// @param reasoning free-text justification, not null (may be empty)
/// @param signature integrity hash, see {@link VoteSigner}; may be empty for unsigned votes
/// @param timestamp when the vote was cast, not null
/// @param blockers issues the validator considers blocking, not null
public record ValidatorVote(
        String agentId,
        String agentType,
        double confidence,
        Vote vote,
        String reasoning,
        String signature,
        Instant timestamp,
        List<String> blockers) {

    public ValidatorVote {
        Objects.requireNonNull(agentId, "agentId must not be null");
        Objects.requireNonNull(agentType, "agentType must not be null");
        Objects.requireNonNull(vote, "vote must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        reasoning = reasoning != null ? reasoning : "";
        signature = signature != null ? signature : "";
        blockers = blockers != null ? List.copyOf(blockers) : List.of();
    }

    /// Creates a vote with a freshly computed signature.
    public static ValidatorVote signed(
            String agentId,
            String agentType,
            double confidence,
            Vote vote,
            String reasoning,
            List<String> blockers,
            Instant timestamp) {
        Instant millis = Instant.ofEpochMilli(timestamp.toEpochMilli());
        return new ValidatorVote(
                agentId,
                agentType,
                confidence,
                vote,
                reasoning,
                VoteSigner.sign(agentId, confidence, vote, millis),
                millis,
                blockers);
    }

    public boolean isPass() {
        return vote == Vote.PASS;
    }
}
