package io.tessera.core.consensus;

import java.util.List;
import java.util.Objects;

/// Result of one consensus round. Immutable once produced.
///
/// Byzantine-only fields (`quorumSize`, `pbftPhases`) are null for simple-mode
/// results, except for fallback results which carry a zero quorum and
/// {@link PbftPhases#NONE}.
///
/// @param score consensus score in `[0, 1]`
/// @param threshold score required to pass
/// @param passed whether the consensus gate passed
/// @param votes the trusted votes the score was computed from, not null
/// @param mode the mode that produced the score, not null
/// @param quorumSize quorum used by the Byzantine phases, may be null
/// @param maliciousAgents validators flagged this round, not null
/// @param pbftPhases per-phase outcome, may be null
/// @param fallback `true` if the Byzantine path failed and simple mode was used instead
/// @param breakdown approve/reject split of the votes, not null
///
/// @see ConsensusEvaluator
public record ConsensusResult(
        double score,
        double threshold,
        boolean passed,
        List<ValidatorVote> votes,
        ConsensusMode mode,
        Integer quorumSize,
        List<MaliciousAgentReport> maliciousAgents,
        PbftPhases pbftPhases,
        boolean fallback,
        VotingBreakdown breakdown) {

    public ConsensusResult {
        Objects.requireNonNull(mode, "mode must not be null");
        votes = votes != null ? List.copyOf(votes) : List.of();
        maliciousAgents = maliciousAgents != null ? List.copyOf(maliciousAgents) : List.of();
        breakdown = breakdown != null ? breakdown : new VotingBreakdown(0, 0);
    }

    /// Approve/reject split used for reporting.
    ///
    /// @param approve votes at or above the approval confidence
    /// @param reject the remaining votes
    public record VotingBreakdown(int approve, int reject) {}

    /// Returns the identifiers of the validators flagged this round.
    ///
    /// @return agent IDs in detection order, never null
    public List<String> maliciousAgentIds() {
        return maliciousAgents.stream().map(MaliciousAgentReport::agentId).toList();
    }

    /// Collects the blockers reported by all voters, without duplicates.
    ///
    /// @return blockers in vote order, never null
    public List<String> blockers() {
        return votes.stream().flatMap(v -> v.blockers().stream()).distinct().toList();
    }
}
